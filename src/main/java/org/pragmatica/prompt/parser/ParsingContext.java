package org.pragmatica.prompt.parser;

import org.pragmatica.prompt.tree.PromptNode;
import org.pragmatica.prompt.tree.SourceLocation;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable cursor over prompt text. One context per parsed text; quoted and parenthesized
 * bodies are re-parsed through {@link #nested(String)} contexts, each with its own body cache.
 */
public final class ParsingContext {

    private final String input;
    private final ParserConfig config;
    private final Map<Integer, ParseResult<List<PromptNode>>> bodyCache = new HashMap<>();

    private int pos;
    private int line;
    private int column;
    private int depth;

    private ParsingContext(String input, ParserConfig config, int depth) {
        this.input = input;
        this.config = config;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
        this.depth = depth;
    }

    public static ParsingContext create(String input, ParserConfig config) {
        return new ParsingContext(input, config, 0);
    }

    /**
     * Context over a body extracted from this input. Nesting depth carries over.
     */
    public ParsingContext nested(String body) {
        return new ParsingContext(body, config, depth);
    }

    // === Position Management ===

    public int pos() {
        return pos;
    }

    public SourceLocation location() {
        return SourceLocation.at(line, column, pos);
    }

    public void restoreLocation(SourceLocation loc) {
        this.pos = loc.offset();
        this.line = loc.line();
        this.column = loc.column();
    }

    public boolean isAtEnd() {
        return pos >= input.length();
    }

    public int remaining() {
        return input.length() - pos;
    }

    // === Character Access ===

    public char peek() {
        return input.charAt(pos);
    }

    public char peek(int offset) {
        return input.charAt(pos + offset);
    }

    public char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    public String substring(int start, int end) {
        return input.substring(start, end);
    }

    /**
     * Check whether the current character is {@code c}, without consuming it.
     */
    public boolean at(char c) {
        return !isAtEnd() && peek() == c;
    }

    public boolean atWhitespace() {
        return !isAtEnd() && Character.isWhitespace(peek());
    }

    /**
     * Consume {@code text} if the input continues with it.
     */
    public boolean consume(String text) {
        if (!input.startsWith(text, pos)) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            advance();
        }
        return true;
    }

    public void skipWhitespace() {
        while (atWhitespace()) {
            advance();
        }
    }

    // === Nesting Guard ===

    /**
     * Enter one more attention body. Returns {@code false}, leaving the depth unchanged,
     * when the configured limit is already reached.
     */
    public boolean tryEnterNesting() {
        if (depth >= config.maxNestingDepth()) {
            return false;
        }
        depth++;
        return true;
    }

    public void exitNesting() {
        depth--;
    }

    /**
     * Whether the group opened just before the cursor is closed by a matching {@code )}.
     * Escaped parentheses are skipped; quotes are not interpreted.
     */
    public boolean groupCloses() {
        int open = 1;
        for (int i = pos; i < input.length(); i++) {
            char c = input.charAt(i);
            if (c == '\\' && i + 1 < input.length() && (input.charAt(i + 1) == '(' || input.charAt(i + 1) == ')')) {
                i++;
            } else if (c == '(') {
                open++;
            } else if (c == ')' && --open == 0) {
                return true;
            }
        }
        return false;
    }

    // === Attention Body Cache ===

    /**
     * Result of an attention body that opened at {@code position}, or {@code null} if not parsed yet.
     */
    public ParseResult<List<PromptNode>> cachedBodyAt(int position) {
        return bodyCache.get(position);
    }

    public void cacheBodyAt(int position, ParseResult<List<PromptNode>> result) {
        bodyCache.put(position, result);
    }

    public ParserConfig config() {
        return config;
    }
}
