package org.pragmatica.prompt.parser;

/**
 * Parser configuration options.
 *
 * @param attentionPlusBase  weight multiplier applied once per {@code +} in an attention head
 * @param attentionMinusBase weight multiplier applied once per {@code -} in an attention head
 * @param maxNestingDepth    deepest allowed nesting of attention bodies
 */
public record ParserConfig(
    double attentionPlusBase,
    double attentionMinusBase,
    int maxNestingDepth
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        1.1,
        0.9,
        100
    );
}
