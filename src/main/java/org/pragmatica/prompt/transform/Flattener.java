package org.pragmatica.prompt.transform;

import org.pragmatica.prompt.error.ParseError;
import org.pragmatica.prompt.error.ParsingException;
import org.pragmatica.prompt.tree.NodeVisitor;
import org.pragmatica.prompt.tree.PromptNode;
import org.pragmatica.prompt.tree.PromptNode.Attention;
import org.pragmatica.prompt.tree.PromptNode.BaseFragment;
import org.pragmatica.prompt.tree.PromptNode.Blend;
import org.pragmatica.prompt.tree.PromptNode.Conjunction;
import org.pragmatica.prompt.tree.PromptNode.CrossAttentionControlAppend;
import org.pragmatica.prompt.tree.PromptNode.CrossAttentionControlSubstitute;
import org.pragmatica.prompt.tree.PromptNode.FlattenedPrompt;
import org.pragmatica.prompt.tree.PromptNode.Fragment;
import org.pragmatica.prompt.tree.PromptNode.Prompt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves nested attention weights into fragment weights and removes attention scopes.
 *
 * <p>A weight scale, starting at 1.0, is multiplied by every enclosing attention weight and
 * applied to each fragment. Each prompt becomes a {@link FlattenedPrompt} whose adjacent
 * equal-weight fragments are fused, see {@link FragmentFusion}. Blends keep their weights.
 * Flattening a flattened tree returns an equal tree.
 */
public final class Flattener {
    private static final Logger log = LoggerFactory.getLogger(Flattener.class);

    private Flattener() {}

    public static Conjunction flatten(Conjunction root) {
        log.debug("Flattening {}", root);
        var branches = new ArrayList<PromptNode>(root.prompts().size());
        for (var prompt : root.prompts()) {
            branches.addAll(flatten(prompt, 1.0));
        }
        var flattened = new Conjunction(branches, root.weights());
        log.debug("Flattened to {}", flattened);
        return flattened;
    }

    static List<PromptNode> flatten(PromptNode node, double weightScale) {
        return node.accept(new ScaledFlattening(weightScale));
    }

    private static List<PromptNode> flattenAll(List<? extends PromptNode> nodes, double weightScale) {
        var result = new ArrayList<PromptNode>();
        for (var node : nodes) {
            result.addAll(flatten(node, weightScale));
        }
        return result;
    }

    private static FlattenedPrompt toFlattenedPrompt(List<PromptNode> nodes) {
        var fragments = new ArrayList<BaseFragment>(nodes.size());
        for (var node : nodes) {
            if (!(node instanceof BaseFragment fragment)) {
                throw new ParsingException(new ParseError.UnhandledNode(node));
            }
            fragments.add(fragment);
        }
        return new FlattenedPrompt(FragmentFusion.fuse(fragments));
    }

    private record ScaledFlattening(double weightScale) implements NodeVisitor<List<PromptNode>> {

        @Override
        public List<PromptNode> visitFragment(Fragment fragment) {
            return List.of(new Fragment(fragment.text(), fragment.weight() * weightScale));
        }

        @Override
        public List<PromptNode> visitAttention(Attention attention) {
            return flattenAll(attention.children(), weightScale * attention.weight());
        }

        @Override
        public List<PromptNode> visitSubstitute(CrossAttentionControlSubstitute substitute) {
            var original = flattenAll(substitute.original(), weightScale);
            var edited = flattenAll(substitute.edited(), weightScale);
            return List.of(new CrossAttentionControlSubstitute(original, edited));
        }

        @Override
        public List<PromptNode> visitAppend(CrossAttentionControlAppend append) {
            return List.of(append);
        }

        @Override
        public List<PromptNode> visitPrompt(Prompt prompt) {
            return List.of(toFlattenedPrompt(flattenAll(prompt.children(), weightScale)));
        }

        @Override
        public List<PromptNode> visitFlattenedPrompt(FlattenedPrompt prompt) {
            return List.of(toFlattenedPrompt(flattenAll(prompt.children(), weightScale)));
        }

        @Override
        public List<PromptNode> visitBlend(Blend blend) {
            var prompts = flattenAll(blend.prompts(), weightScale);
            return List.of(new Blend(prompts, blend.weights(), blend.normalizeWeights()));
        }

        @Override
        public List<PromptNode> visitConjunction(Conjunction conjunction) {
            throw new ParsingException(new ParseError.UnhandledNode(conjunction));
        }
    }
}
