package dev.shortcuts.analysis;

import dev.shortcuts.model.Permission;

/**
 * A permission the shortcut needs, why, and a less intrusive alternative when one exists.
 */
public record PermissionCheck(Permission permission, boolean required, String reason, String alternative) {}
