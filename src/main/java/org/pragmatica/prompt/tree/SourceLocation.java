package org.pragmatica.prompt.tree;

/**
 * A position in prompt text (line and column, both 1-based).
 */
public record SourceLocation(int line, int column, int offset) {

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
