package dev.shortcuts.analysis;

import java.util.List;

/**
 * Structural view of a shortcut.
 *
 * @param entryPoints actions that ask the user for input
 * @param exitPoints  actions that present output to the user
 */
public record Decomposition(
    List<Component> components,
    List<ComponentFlow> flows,
    List<LocatedAction> entryPoints,
    List<LocatedAction> exitPoints
) {}
