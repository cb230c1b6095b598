package org.pragmatica.prompt.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.prompt.tree.SourceLocation;

import static org.junit.jupiter.api.Assertions.*;

class ParseResultTest {

    private static final SourceLocation LOC = SourceLocation.at(1, 1, 0);
    private static final SourceLocation END_LOC = SourceLocation.at(1, 5, 4);

    @Test
    void success_isSuccess_returnsTrue() {
        var result = ParseResult.Success.of(2.0, END_LOC);

        assertTrue(result.isSuccess());
        assertFalse(result.isFailure());
        assertEquals(2.0, result.value());
        assertEquals(END_LOC, result.endLocation());
    }

    @Test
    void failure_preservesExpected() {
        var result = ParseResult.Failure.<Double>at(LOC, "number");

        assertTrue(result.isFailure());
        assertEquals("number", result.expected());
        assertEquals(LOC, result.location());
    }
}
