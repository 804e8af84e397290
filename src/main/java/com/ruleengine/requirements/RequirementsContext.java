package com.ruleengine.requirements;

/**
 * Accumulator for one requirements traversal.
 *
 * The output buffer is shared by every frame of the traversal. The nesting
 * level belongs to a single frame: {@link #nested()} hands children a copy
 * one level deeper that still writes into the same buffer.
 */
public class RequirementsContext {

    private static final String INDENT = "  ";
    private static final String MARKER = "- ";

    private final StringBuilder output;
    private final int level;

    public RequirementsContext() {
        this(new StringBuilder(), 0);
    }

    private RequirementsContext(StringBuilder output, int level) {
        this.output = output;
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    public RequirementsContext nested() {
        return new RequirementsContext(output, level + 1);
    }

    /**
     * Append one line. Level 0 is flush left; level {@code n > 0} gets
     * {@code n - 1} indent units and a list marker, so the root's children
     * start with {@code "- "}.
     */
    void appendLine(String text) {
        if (level > 0) {
            for (int i = 1; i < level; i++) {
                output.append(INDENT);
            }
            output.append(MARKER);
        }
        output.append(text).append('\n');
    }

    @Override
    public String toString() {
        return output.toString();
    }
}
