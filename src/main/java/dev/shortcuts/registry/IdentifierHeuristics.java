package dev.shortcuts.registry;

import dev.shortcuts.model.Confidence;
import dev.shortcuts.model.Permission;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Lowest-priority fallback: guesses category, permission and value kinds from substrings
 * of the identifier. Rules are checked in order, so an earlier keyword wins. A keyword hit
 * is {@link Confidence#MEDIUM}; the generic fallback is {@link Confidence#LOW}.
 */
public final class IdentifierHeuristics implements ActionInference {

    private record Rule(List<String> keywords, String category, Permission permission,
                        Set<String> accepted, Set<String> produced) {}

    private static final List<Rule> RULES = List.of(
        new Rule(List.of("text"), "text", Permission.NONE, Set.of(), Set.of("text")),
        new Rule(List.of("notification", "alert"), "notification", Permission.NOTIFICATION, Set.of("text"), Set.of()),
        new Rule(List.of("url", "web", "safari"), "web", Permission.NONE, Set.of("url"), Set.of()),
        new Rule(List.of("speak"), "media", Permission.MEDIA, Set.of("text"), Set.of()),
        new Rule(List.of("copy", "clipboard"), "clipboard", Permission.NONE, Set.of("any"), Set.of()),
        new Rule(List.of("variable"), "scripting", Permission.NONE, Set.of("any"), Set.of("any")),
        new Rule(List.of("conditional"), "scripting", Permission.NONE, Set.of("any"), Set.of("any")),
        new Rule(List.of("repeat", "loop"), "scripting", Permission.NONE, Set.of("any"), Set.of("any")),
        new Rule(List.of("wait", "delay"), "scripting", Permission.NONE, Set.of(), Set.of()),
        new Rule(List.of("ask"), "scripting", Permission.NONE, Set.of(), Set.of("text")),
        new Rule(List.of("comment", "exit", "nothing"), "scripting", Permission.NONE, Set.of(), Set.of()),
        new Rule(List.of("location", "direction", "map"), "location", Permission.LOCATION, Set.of(), Set.of("location")),
        new Rule(List.of("photo", "camera"), "camera", Permission.CAMERA, Set.of(), Set.of("image")),
        new Rule(List.of("sound", "audio", "music", "volume"), "media", Permission.MEDIA, Set.of(), Set.of("audio")),
        new Rule(List.of("file", "document"), "documents", Permission.FILES, Set.of("file"), Set.of("file")),
        new Rule(List.of("calendar", "event", "reminder"), "calendar", Permission.CALENDAR, Set.of(), Set.of("date")),
        new Rule(List.of("contact"), "contacts", Permission.CONTACTS, Set.of(), Set.of("contact")),
        new Rule(List.of("health"), "health", Permission.HEALTH, Set.of(), Set.of("number")),
        new Rule(List.of("homekit", "home"), "home", Permission.HOME, Set.of(), Set.of("any")),
        new Rule(List.of("brightness", "dnd", "wifi", "bluetooth"), "device", Permission.DEVICE, Set.of(), Set.of())
    );

    @Override
    public Optional<InferredAction> infer(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        String type = lastSegment(identifier);
        String id = identifier.toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            for (String keyword : rule.keywords()) {
                if (id.contains(keyword)) {
                    return Optional.of(new InferredAction(type, rule.category(), rule.permission(),
                        rule.accepted(), rule.produced(), Confidence.MEDIUM,
                        "Identifier mentions '%s'".formatted(keyword)));
                }
            }
        }
        return Optional.of(new InferredAction(type, "general", Permission.NONE,
            Set.of("any"), Set.of("any"), Confidence.LOW, "No keyword matched"));
    }

    /** Last dot-separated segment, or the whole identifier when it has none. */
    public static String lastSegment(String identifier) {
        int dot = identifier.lastIndexOf('.');
        if (dot < 0 || dot == identifier.length() - 1) {
            return identifier;
        }
        return identifier.substring(dot + 1);
    }
}
