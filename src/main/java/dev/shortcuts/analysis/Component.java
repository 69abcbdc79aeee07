package dev.shortcuts.analysis;

import dev.shortcuts.model.Action;

import java.util.List;
import java.util.Set;

/**
 * A logical part of the top-level action list.
 *
 * @param startIndex first top-level index covered
 * @param endIndex   last top-level index covered
 * @param inputs     tokens consumed here but produced elsewhere (or nowhere)
 * @param outputs    tokens produced here
 */
public record Component(
    int id,
    ComponentKind kind,
    List<Action> actions,
    int startIndex,
    int endIndex,
    String purpose,
    boolean reusable,
    Set<String> inputs,
    Set<String> outputs
) {}
