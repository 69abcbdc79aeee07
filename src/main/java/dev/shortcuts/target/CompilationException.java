package dev.shortcuts.target;

/**
 * The shortcut cannot be expressed in the target format. Compilation stops at the first
 * such action.
 */
public class CompilationException extends RuntimeException {

    private final String actionType;

    public CompilationException(String actionType, String message) {
        super(message);
        this.actionType = actionType;
    }

    /** The offending action type; null when the action had none. */
    public String actionType() {
        return actionType;
    }
}
