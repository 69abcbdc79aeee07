package dev.shortcuts.engine;

/**
 * Why a JSON document could not be read as a shortcut. Line and column are 1-based,
 * or -1 when the problem is not tied to a position.
 */
public record ParseError(String message, int line, int column) {

    public static ParseError of(String message) {
        return new ParseError(message, -1, -1);
    }
}
