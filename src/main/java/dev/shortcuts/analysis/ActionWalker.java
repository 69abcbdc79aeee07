package dev.shortcuts.analysis;

import dev.shortcuts.model.Action;
import dev.shortcuts.model.NestedList;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Pre-order walk over a shortcut tree with an explicit stack. Every analysis pass works on
 * the flat list this produces.
 */
final class ActionWalker {

    private record Pending(Action action, int topLevelIndex, List<String> path,
                           List<Action> siblings, int siblingIndex, int parentDepth) {}

    private ActionWalker() {}

    static List<LocatedAction> walk(List<Action> actions) {
        var located = new ArrayList<LocatedAction>();
        Deque<Pending> stack = new ArrayDeque<>();
        for (int i = actions.size() - 1; i >= 0; i--) {
            stack.push(new Pending(actions.get(i), i, List.of(), actions, i, 0));
        }
        while (!stack.isEmpty()) {
            Pending next = stack.pop();
            Action action = next.action();
            int depth = next.parentDepth() + (action.controlFlow().isPresent() ? 1 : 0);
            located.add(new LocatedAction(located.size(), action, next.topLevelIndex(), next.path(),
                next.siblings(), next.siblingIndex(), depth));

            List<NestedList> nested = action.nestedLists();
            String token = action.type() + ":" + next.siblingIndex();
            for (int n = nested.size() - 1; n >= 0; n--) {
                NestedList list = nested.get(n);
                var path = new ArrayList<>(next.path());
                path.add(token);
                path.add(list.label());
                List<String> childPath = List.copyOf(path);
                for (int i = list.actions().size() - 1; i >= 0; i--) {
                    stack.push(new Pending(list.actions().get(i), next.topLevelIndex(), childPath,
                        list.actions(), i, depth));
                }
            }
        }
        return located;
    }
}
