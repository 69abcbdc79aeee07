package dev.shortcuts.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import dev.shortcuts.model.Action;

import java.util.List;

/**
 * An action together with where it sits in the tree.
 *
 * @param flatIndex     position in a pre-order walk of the whole tree
 * @param topLevelIndex index of the top-level action this one belongs to
 * @param path          breadcrumb of enclosing {@code type:index} tokens and branch labels
 * @param siblings      the list that contains the action
 * @param siblingIndex  index within {@code siblings}
 * @param controlDepth  number of control-flow actions on the path, this one included
 */
public record LocatedAction(
    int flatIndex,
    Action action,
    int topLevelIndex,
    List<String> path,
    @JsonIgnore List<Action> siblings,
    int siblingIndex,
    int controlDepth
) {
    public String type() {
        return action.type();
    }
}
