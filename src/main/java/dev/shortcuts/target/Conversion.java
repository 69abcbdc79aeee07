package dev.shortcuts.target;

/**
 * Outcome of asking a native tool to reframe bytes.
 */
public sealed interface Conversion {

    record Converted(byte[] data) implements Conversion {}

    /** The tool is missing or failed; callers decide whether to fall back. */
    record Unavailable(String reason) implements Conversion {}
}
