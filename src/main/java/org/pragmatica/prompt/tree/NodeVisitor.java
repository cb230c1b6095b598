package org.pragmatica.prompt.tree;

/**
 * Visitor over every {@link PromptNode} kind. Adding a node kind breaks every implementation
 * until it handles the new kind.
 */
public interface NodeVisitor<R> {

    R visitFragment(PromptNode.Fragment fragment);

    R visitAttention(PromptNode.Attention attention);

    R visitSubstitute(PromptNode.CrossAttentionControlSubstitute substitute);

    R visitAppend(PromptNode.CrossAttentionControlAppend append);

    R visitPrompt(PromptNode.Prompt prompt);

    R visitFlattenedPrompt(PromptNode.FlattenedPrompt prompt);

    R visitBlend(PromptNode.Blend blend);

    R visitConjunction(PromptNode.Conjunction conjunction);
}
