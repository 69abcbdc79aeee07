package dev.shortcuts.target;

import java.util.Arrays;

/** Who may import a signed shortcut. */
public enum SigningMode {
    ANYONE("anyone"),
    CONTACTS_ONLY("people-who-know-me");

    private final String wireName;

    SigningMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Accepts the tool's own names plus {@code contacts-only}. */
    public static SigningMode fromWire(String value) {
        if ("contacts-only".equalsIgnoreCase(value)) {
            return CONTACTS_ONLY;
        }
        return Arrays.stream(values())
            .filter(m -> m.wireName.equalsIgnoreCase(value) || m.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown signing mode: " + value));
    }
}
