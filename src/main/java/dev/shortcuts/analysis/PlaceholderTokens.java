package dev.shortcuts.analysis;

import dev.shortcuts.model.Action;
import dev.shortcuts.model.ParameterValue;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds {@code {name}} placeholders in string parameters.
 */
final class PlaceholderTokens {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}]+)}");

    private PlaceholderTokens() {}

    /** Tokens referenced by the action's own string parameters, in order of appearance. */
    static Set<String> consumedBy(Action action) {
        var tokens = new LinkedHashSet<String>();
        for (ParameterValue value : action.parameters().values()) {
            if (value instanceof ParameterValue.Text text) {
                tokens.addAll(in(text.value()));
            }
        }
        return tokens;
    }

    static Set<String> in(String text) {
        var tokens = new LinkedHashSet<String>();
        if (text == null) {
            return tokens;
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        while (matcher.find()) {
            String token = matcher.group(1).trim();
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    static boolean containsPlaceholder(String text) {
        return text != null && PLACEHOLDER.matcher(text).find();
    }

    static String stripPlaceholders(String text) {
        return text == null ? "" : PLACEHOLDER.matcher(text).replaceAll(" ");
    }
}
