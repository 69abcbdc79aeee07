package dev.shortcuts.engine;

import dev.shortcuts.model.Shortcut;

/**
 * Result of reading the JSON interchange form.
 */
public sealed interface ParseResult {

    record Parsed(Shortcut shortcut) implements ParseResult {}

    record Failed(ParseError error) implements ParseResult {}
}
