package org.pragmatica.prompt.parser;

import org.pragmatica.prompt.tree.PromptNode.Conjunction;

/**
 * Parser interface - turns weighted prompt text into a prompt tree.
 * Implementations hold no per-call state and may be shared between threads.
 */
public interface Parser {

    /**
     * Parse text and flatten it: the result holds only flattened prompts and blends
     * whose prompts contain fragments and cross-attention substitutes.
     *
     * @throws org.pragmatica.prompt.error.ParsingException if a structural contract is violated
     */
    Conjunction parse(String text);

    /**
     * Parse text without flattening. Attention scopes are kept as parsed.
     *
     * @throws org.pragmatica.prompt.error.ParsingException if a structural contract is violated
     */
    Conjunction parseRaw(String text);
}
