package dev.shortcuts.target;

import dev.shortcuts.model.Confidence;

/**
 * How one external record was mapped back to an internal action type.
 */
public record TypeResolution(int index, String externalIdentifier, String type, Confidence confidence) {}
