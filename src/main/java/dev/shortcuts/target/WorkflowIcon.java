package dev.shortcuts.target;

/**
 * Icon descriptor of a workflow. Colors are packed RGBA values and exceed the int range.
 */
public record WorkflowIcon(long startColor, long glyphNumber) {

    public static final long DEFAULT_START_COLOR = 431817727L;
    public static final long DEFAULT_GLYPH = 59511L;

    public static WorkflowIcon defaults() {
        return new WorkflowIcon(DEFAULT_START_COLOR, DEFAULT_GLYPH);
    }
}
