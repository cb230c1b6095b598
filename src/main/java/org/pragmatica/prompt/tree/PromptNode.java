package org.pragmatica.prompt.tree;

import org.pragmatica.prompt.error.ParseError;
import org.pragmatica.prompt.error.ParsingException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Node of a weighted prompt tree.
 *
 * <p>The parser produces a raw tree ({@link Conjunction} of {@link Prompt} and {@link Blend},
 * holding {@link Attention} and fragment nodes). Flattening turns it into a result tree whose
 * prompts are {@link FlattenedPrompt}s holding only base fragments.
 *
 * <p>All nodes are immutable and compared structurally.
 */
public sealed interface PromptNode {

    <R> R accept(NodeVisitor<R> visitor);

    /**
     * Leaf-level material that may appear in a flattened prompt.
     */
    sealed interface BaseFragment extends PromptNode {}

    /**
     * Text with a resolved weight.
     */
    record Fragment(String text, double weight) implements BaseFragment {
        public Fragment {
            Objects.requireNonNull(text, "text");
        }

        public Fragment(String text) {
            this(text, 1.0);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitFragment(this);
        }

        @Override
        public String toString() {
            return "Fragment:'" + text + "'@" + weight;
        }
    }

    /**
     * Weighting scope over a sequence of nodes. Exists only in raw trees.
     */
    record Attention(double weight, List<PromptNode> children) implements PromptNode {
        public Attention {
            children = List.copyOf(children);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitAttention(this);
        }
    }

    /**
     * Use the cross-attention pattern learned for {@code edited} at the position of {@code original}.
     * Each side holds fragments, or attentions over fragments before flattening.
     */
    record CrossAttentionControlSubstitute(List<PromptNode> original, List<PromptNode> edited) implements BaseFragment {
        public CrossAttentionControlSubstitute {
            original = sideOf(original);
            edited = sideOf(edited);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitSubstitute(this);
        }

        private static List<PromptNode> sideOf(List<PromptNode> nodes) {
            for (var node : nodes) {
                if (!(node instanceof Fragment) && !(node instanceof Attention)) {
                    throw new ParsingException(new ParseError.IllegalChild("CrossAttentionControlSubstitute", node));
                }
            }
            return List.copyOf(nodes);
        }
    }

    /**
     * Append-style cross-attention control. Never produced by the grammar; carried through flattening as is.
     */
    record CrossAttentionControlAppend(Fragment fragment) implements BaseFragment {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitAppend(this);
        }
    }

    /**
     * Raw prompt: attentions and base fragments in source order.
     */
    record Prompt(List<PromptNode> children) implements PromptNode {
        public Prompt {
            for (var child : children) {
                if (!(child instanceof Attention) && !(child instanceof BaseFragment)) {
                    throw new ParsingException(new ParseError.IllegalChild("Prompt", child));
                }
            }
            children = List.copyOf(children);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitPrompt(this);
        }
    }

    /**
     * Prompt with all weights resolved and adjacent equal-weight fragments fused.
     */
    record FlattenedPrompt(List<BaseFragment> children) implements PromptNode {
        public FlattenedPrompt {
            children = List.copyOf(children);
        }

        /**
         * Build from base fragments and {@code (text, weight)} pairs given as {@link Map.Entry}.
         */
        public static FlattenedPrompt of(Object... parts) {
            var converted = new ArrayList<BaseFragment>(parts.length);
            for (var part : parts) {
                if (part instanceof BaseFragment fragment) {
                    converted.add(fragment);
                } else if (part instanceof Map.Entry<?, ?> pair
                           && pair.getKey() instanceof String text
                           && pair.getValue() instanceof Number weight) {
                    converted.add(new Fragment(text, weight.doubleValue()));
                } else {
                    throw new ParsingException(new ParseError.IllegalChild("FlattenedPrompt", part));
                }
            }
            return new FlattenedPrompt(converted);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitFlattenedPrompt(this);
        }
    }

    /**
     * Weighted interpolation of independently parsed prompts.
     */
    record Blend(List<PromptNode> prompts, List<Double> weights, boolean normalizeWeights) implements PromptNode {
        public Blend {
            if (prompts.size() != weights.size()) {
                throw new ParsingException(new ParseError.MismatchedWeights("Blend", prompts.size(), weights.size()));
            }
            for (var prompt : prompts) {
                if (!(prompt instanceof Prompt) && !(prompt instanceof FlattenedPrompt)) {
                    throw new ParsingException(new ParseError.IllegalChild("Blend", prompt));
                }
            }
            prompts = List.copyOf(prompts);
            weights = List.copyOf(weights);
        }

        public Blend(List<PromptNode> prompts, List<Double> weights) {
            this(prompts, weights, true);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitBlend(this);
        }
    }

    /**
     * Independent prompt branches, generated separately and combined downstream.
     * Entries that are not prompts or blends are wrapped into single-element prompts.
     */
    record Conjunction(List<PromptNode> prompts, List<Double> weights) implements PromptNode {
        public static final String TYPE = "AND";

        public Conjunction {
            if (prompts.size() != weights.size()) {
                throw new ParsingException(new ParseError.MismatchedWeights("Conjunction", prompts.size(), weights.size()));
            }
            prompts = coerce(prompts);
            weights = List.copyOf(weights);
        }

        /**
         * Conjunction with every branch weighted 1.0.
         */
        public static Conjunction of(List<? extends PromptNode> prompts) {
            return new Conjunction(List.copyOf(prompts), Collections.nCopies(prompts.size(), 1.0));
        }

        public static Conjunction of(List<? extends PromptNode> prompts, List<Double> weights) {
            return new Conjunction(List.copyOf(prompts), weights);
        }

        public static Conjunction of(PromptNode... prompts) {
            return of(List.of(prompts));
        }

        public String type() {
            return TYPE;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitConjunction(this);
        }

        private static List<PromptNode> coerce(List<? extends PromptNode> prompts) {
            var result = new ArrayList<PromptNode>(prompts.size());
            for (var prompt : prompts) {
                var isBranch = prompt instanceof Prompt || prompt instanceof Blend || prompt instanceof FlattenedPrompt;
                result.add(isBranch ? prompt : new Prompt(List.of(prompt)));
            }
            return List.copyOf(result);
        }
    }
}
