package dev.shortcuts.model;

import java.util.List;

/**
 * Root of the shortcut tree. A null {@code actions} list means the source had no list at
 * all; the validator reports it.
 */
public record Shortcut(String name, List<Action> actions) {

    public static final String UNTITLED = "Untitled Shortcut";

    public Shortcut {
        actions = actions == null ? null : List.copyOf(actions);
    }
}
