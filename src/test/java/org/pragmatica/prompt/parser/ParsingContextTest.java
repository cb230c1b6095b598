package org.pragmatica.prompt.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.prompt.tree.PromptNode;
import org.pragmatica.prompt.tree.SourceLocation;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParsingContextTest {

    // === Cursor ===

    @Test
    void advance_tracksLineAndColumn() {
        var ctx = ParsingContext.create("ab\ncd", ParserConfig.DEFAULT);

        ctx.advance();
        ctx.advance();
        assertEquals(SourceLocation.at(1, 3, 2), ctx.location());

        ctx.advance();
        assertEquals(SourceLocation.at(2, 1, 3), ctx.location());
    }

    @Test
    void restoreLocation_rewindsCursor() {
        var ctx = ParsingContext.create("fire flames", ParserConfig.DEFAULT);
        var start = ctx.location();

        assertTrue(ctx.consume("fire"));
        ctx.restoreLocation(start);

        assertEquals(0, ctx.pos());
        assertEquals('f', ctx.peek());
    }

    @Test
    void consume_mismatch_leavesCursor() {
        var ctx = ParsingContext.create(".blend(1)", ParserConfig.DEFAULT);

        assertFalse(ctx.consume(".and"));
        assertEquals(0, ctx.pos());
        assertTrue(ctx.consume(".blend"));
        assertTrue(ctx.at('('));
    }

    @Test
    void skipWhitespace_stopsAtText() {
        var ctx = ParsingContext.create(" \t\n x", ParserConfig.DEFAULT);

        ctx.skipWhitespace();

        assertEquals('x', ctx.peek());
        assertEquals(1, ctx.remaining());
        assertFalse(ctx.atWhitespace());
    }

    @Test
    void at_atEnd_returnsFalse() {
        var ctx = ParsingContext.create("", ParserConfig.DEFAULT);

        assertTrue(ctx.isAtEnd());
        assertFalse(ctx.at('('));
        assertFalse(ctx.atWhitespace());
    }

    // === Nesting Guard ===

    @Test
    void tryEnterNesting_atLimit_refuses() {
        var ctx = ParsingContext.create("x", new ParserConfig(1.1, 0.9, 1));

        assertTrue(ctx.tryEnterNesting());
        assertFalse(ctx.tryEnterNesting());

        ctx.exitNesting();
        assertTrue(ctx.tryEnterNesting());
    }

    @Test
    void nested_carriesDepth() {
        var ctx = ParsingContext.create("outer", new ParserConfig(1.1, 0.9, 1));
        assertTrue(ctx.tryEnterNesting());

        var nested = ctx.nested("inner");

        assertFalse(nested.tryEnterNesting());
        assertSame(ctx.config(), nested.config());
    }

    @Test
    void groupCloses_findsMatchingParen() {
        var ctx = ParsingContext.create("(a (b) c) d", ParserConfig.DEFAULT);
        ctx.consume("(");

        assertTrue(ctx.groupCloses());
    }

    @Test
    void groupCloses_unbalancedOrEscaped_returnsFalse() {
        var unbalanced = ParsingContext.create("(a (b c", ParserConfig.DEFAULT);
        unbalanced.consume("(");
        var escaped = ParsingContext.create("(a \\)", ParserConfig.DEFAULT);
        escaped.consume("(");

        assertFalse(unbalanced.groupCloses());
        assertFalse(escaped.groupCloses());
    }

    // === Attention Body Cache ===

    @Test
    void cacheBodyAt_storesResultPerPosition() {
        var ctx = ParsingContext.create("+(x", ParserConfig.DEFAULT);
        ParseResult<List<PromptNode>> failure = ParseResult.Failure.at(SourceLocation.at(1, 2, 1), "')'");

        assertNull(ctx.cachedBodyAt(1));

        ctx.cacheBodyAt(1, failure);

        assertSame(failure, ctx.cachedBodyAt(1));
        assertNull(ctx.cachedBodyAt(0));
        assertNull(ctx.nested("+(x").cachedBodyAt(1));
    }
}
