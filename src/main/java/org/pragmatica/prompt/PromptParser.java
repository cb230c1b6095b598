package org.pragmatica.prompt;

import org.pragmatica.prompt.parser.Parser;
import org.pragmatica.prompt.parser.ParserConfig;
import org.pragmatica.prompt.parser.PromptEngine;
import org.pragmatica.prompt.tree.PromptNode.Conjunction;

/**
 * Entry point for parsing weighted prompts.
 *
 * <p>Example usage:
 * <pre>{@code
 * var conjunction = PromptParser.parse("a forest 1.5(in winter) \"snow\".swap(rain)");
 *
 * var parser = PromptParser.builder()
 *                          .attentionPlusBase(1.2)
 *                          .build();
 * var tuned = parser.parse("++(mountain) lake");
 * }</pre>
 */
public final class PromptParser {
    private static final Parser DEFAULT_PARSER = PromptEngine.create(ParserConfig.DEFAULT);

    private PromptParser() {}

    /**
     * Parse and flatten text with the default configuration.
     *
     * @throws org.pragmatica.prompt.error.ParsingException if a structural contract is violated
     */
    public static Conjunction parse(String text) {
        return DEFAULT_PARSER.parse(text);
    }

    /**
     * Create a parser with the default configuration.
     */
    public static Parser create() {
        return DEFAULT_PARSER;
    }

    /**
     * Create a parser with custom configuration.
     */
    public static Parser create(ParserConfig config) {
        return PromptEngine.create(config);
    }

    /**
     * Create a builder for parser configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private double attentionPlusBase = ParserConfig.DEFAULT.attentionPlusBase();
        private double attentionMinusBase = ParserConfig.DEFAULT.attentionMinusBase();
        private int maxNestingDepth = ParserConfig.DEFAULT.maxNestingDepth();

        private Builder() {}

        public Builder attentionPlusBase(double base) {
            this.attentionPlusBase = base;
            return this;
        }

        public Builder attentionMinusBase(double base) {
            this.attentionMinusBase = base;
            return this;
        }

        public Builder maxNestingDepth(int depth) {
            this.maxNestingDepth = depth;
            return this;
        }

        public Parser build() {
            return create(new ParserConfig(attentionPlusBase, attentionMinusBase, maxNestingDepth));
        }
    }
}
