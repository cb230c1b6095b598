package org.pragmatica.prompt.error;

import org.pragmatica.prompt.tree.SourceLocation;

/**
 * Structural contract violated while building or flattening a prompt tree.
 */
public sealed interface ParseError {

    String message();

    /**
     * Prompt and weight counts of a blend or conjunction differ.
     */
    record MismatchedWeights(
    String construct,
    int promptCount,
    int weightCount) implements ParseError {
        @Override
        public String message() {
            return "while parsing " + construct + ": mismatched prompts/weights counts "
                   + promptCount + " and " + weightCount;
        }
    }

    /**
     * Node of the wrong kind passed into a container.
     */
    record IllegalChild(
    String container,
    Object child) implements ParseError {
        @Override
        public String message() {
            var kind = child == null ? "null" : child.getClass().getSimpleName();
            return container + " cannot contain " + kind + " (" + child + ")";
        }
    }

    /**
     * Node kind the flattener cannot place at this position.
     */
    record UnhandledNode(Object node) implements ParseError {
        @Override
        public String message() {
            return "unhandled node type " + node.getClass().getSimpleName() + " when flattening " + node;
        }
    }

    /**
     * Attention bodies nested deeper than the configured limit.
     */
    record NestingTooDeep(
    SourceLocation location,
    int limit) implements ParseError {
        @Override
        public String message() {
            return "nesting deeper than " + limit + " levels at " + location;
        }
    }
}
