package dev.shortcuts.analysis;

/**
 * Data passed from one component to a later one.
 */
public record ComponentFlow(int fromComponent, int toComponent, String token) {}
