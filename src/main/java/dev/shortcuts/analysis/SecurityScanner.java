package dev.shortcuts.analysis;

import dev.shortcuts.model.Action;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Flags actions that touch the network, the file system, or show dynamic content.
 */
final class SecurityScanner {

    private SecurityScanner() {}

    static List<SecurityFinding> scan(List<LocatedAction> actions) {
        var findings = new ArrayList<SecurityFinding>();
        for (LocatedAction located : actions) {
            Action action = located.action();
            if (action.type() == null) {
                continue;
            }
            switch (action.type()) {
                case "url" -> {
                    String url = action.text("url").orElse("");
                    boolean secure = url.toLowerCase(Locale.ROOT).startsWith("https://");
                    findings.add(new SecurityFinding(located.flatIndex(), action.type(), "network",
                        secure ? Severity.LOW : Severity.HIGH,
                        secure ? "Network request over HTTPS" : "Network request over an insecure scheme: " + url,
                        "Use HTTPS for all network requests",
                        "CWE-319"));
                }
                case "files" -> findings.add(new SecurityFinding(located.flatIndex(), action.type(), "filesystem",
                    Severity.MEDIUM,
                    "File system access",
                    "Validate file paths and limit access to necessary directories",
                    "CWE-22"));
                case "notification" -> {
                    boolean dynamic = action.text("title").map(PlaceholderTokens::containsPlaceholder).orElse(false)
                        || action.text("body").map(PlaceholderTokens::containsPlaceholder).orElse(false);
                    if (dynamic) {
                        findings.add(new SecurityFinding(located.flatIndex(), action.type(), "notification",
                            Severity.MEDIUM,
                            "Notification shows unsanitized dynamic content",
                            "Sanitize or truncate user-provided values before displaying them",
                            "CWE-116"));
                    }
                }
                default -> {
                }
            }
        }
        return findings;
    }
}
