package org.pragmatica.prompt.parser;

import org.pragmatica.prompt.tree.SourceLocation;

/**
 * Outcome of applying one grammar rule at the current position.
 * A failed rule leaves the cursor where the rule started.
 */
public sealed interface ParseResult<T> {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Rule matched and produced a value.
     */
    record Success<T>(
        T value,
        SourceLocation endLocation
    ) implements ParseResult<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        public static <T> Success<T> of(T value, SourceLocation endLocation) {
            return new Success<>(value, endLocation);
        }
    }

    /**
     * Rule did not match here. Never surfaced to callers of the parser.
     */
    record Failure<T>(
        SourceLocation location,
        String expected
    ) implements ParseResult<T> {

        @Override
        public boolean isSuccess() {
            return false;
        }

        public static <T> Failure<T> at(SourceLocation location, String expected) {
            return new Failure<>(location, expected);
        }
    }
}
