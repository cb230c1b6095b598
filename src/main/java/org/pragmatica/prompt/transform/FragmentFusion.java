package org.pragmatica.prompt.transform;

import org.pragmatica.prompt.tree.PromptNode;
import org.pragmatica.prompt.tree.PromptNode.BaseFragment;
import org.pragmatica.prompt.tree.PromptNode.CrossAttentionControlSubstitute;
import org.pragmatica.prompt.tree.PromptNode.Fragment;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges adjacent plain fragments of equal weight into one fragment, joining texts with a space.
 * Any other node ends the run; fusion restarts after it.
 */
public final class FragmentFusion {
    private FragmentFusion() {}

    public static List<BaseFragment> fuse(List<BaseFragment> items) {
        var fused = new ArrayList<BaseFragment>(items.size());
        for (var item : items) {
            var merged = merge(last(fused), item);
            if (merged != null) {
                fused.set(fused.size() - 1, merged);
            } else if (item instanceof CrossAttentionControlSubstitute substitute) {
                fused.add(new CrossAttentionControlSubstitute(fuseSide(substitute.original()),
                                                              fuseSide(substitute.edited())));
            } else {
                fused.add(item);
            }
        }
        return List.copyOf(fused);
    }

    private static List<PromptNode> fuseSide(List<PromptNode> items) {
        var fused = new ArrayList<PromptNode>(items.size());
        for (var item : items) {
            var merged = merge(last(fused), item);
            if (merged != null) {
                fused.set(fused.size() - 1, merged);
            } else {
                fused.add(item);
            }
        }
        return fused;
    }

    private static PromptNode last(List<? extends PromptNode> items) {
        return items.isEmpty() ? null : items.get(items.size() - 1);
    }

    private static Fragment merge(PromptNode previous, PromptNode current) {
        if (previous instanceof Fragment left
            && current instanceof Fragment right
            && left.weight() == right.weight()) {
            return new Fragment(left.text() + " " + right.text(), left.weight());
        }
        return null;
    }
}
