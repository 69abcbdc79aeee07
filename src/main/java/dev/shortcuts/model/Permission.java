package dev.shortcuts.model;

import java.util.Locale;

/**
 * Device permission an action needs at run time.
 */
public enum Permission {
    NONE("none", "No permission required", null),
    MEDIA("media", "Required for audio playback or recording", null),
    CAMERA("camera", "Required for taking photos",
        "Consider allowing photo upload instead of direct camera access"),
    PHOTO_LIBRARY("photo-library", "Required for accessing photos", null),
    LOCATION("location", "Required for location services",
        "Consider using manual input if precise location is not required"),
    HEALTH("health", "Required for health data access",
        "Consider using manual tracking for non-critical data"),
    HOME("home", "Required for HomeKit device control", null),
    NOTIFICATION("notification", "Required for sending notifications",
        "Consider using in-app alerts instead"),
    CALENDAR("calendar", "Required for calendar access", null),
    CONTACTS("contacts", "Required for contacts access", null),
    DEVICE("device", "Required for changing device settings", null),
    FILES("files", "Required for file system access", null);

    private final String wireName;
    private final String reason;
    private final String alternative;

    Permission(String wireName, String reason, String alternative) {
        this.wireName = wireName;
        this.reason = reason;
        this.alternative = alternative;
    }

    public String wireName() {
        return wireName;
    }

    public String reason() {
        return reason;
    }

    /** A less intrusive alternative, or null when there is none worth suggesting. */
    public String alternative() {
        return alternative;
    }

    public static Permission fromWire(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Permission permission : values()) {
            if (permission.wireName.equals(normalized)) {
                return permission;
            }
        }
        throw new IllegalArgumentException("Unknown permission: " + value);
    }
}
