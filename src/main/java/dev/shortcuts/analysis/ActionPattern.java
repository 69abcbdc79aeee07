package dev.shortcuts.analysis;

/**
 * How often an action type occurs, with the neighbours of its first occurrence,
 * e.g. {@code "start -> ask -> text"}.
 */
public record ActionPattern(String type, int frequency, String context) {}
