package dev.shortcuts.target;

import dev.shortcuts.model.Confidence;
import dev.shortcuts.model.Shortcut;

import java.util.List;

/**
 * A lifted shortcut plus the confidence of every type resolution behind it.
 */
public record Decompilation(Shortcut shortcut, List<TypeResolution> resolutions) {

    public Decompilation {
        resolutions = List.copyOf(resolutions);
    }

    public List<TypeResolution> lowConfidence() {
        return resolutions.stream().filter(r -> r.confidence() == Confidence.LOW).toList();
    }
}
