package com.gtree.engine.util;

import com.gtree.engine.grammar.Grammar;
import com.gtree.engine.grammar.Grammar.NonTerminal;
import com.gtree.engine.tree.LocationException;
import com.gtree.engine.tree.NodeLoc;
import com.gtree.engine.tree.RuleNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Structural queries and location-based edits over derivation trees.
 */
public final class TreeOps {

    private TreeOps() {}

    /** One step of a pre-order walk: a node's distance from the root and its rule index. */
    public record Visit(int depth, int ruleIndex) {}

    public static RuleNode get(RuleNode root, NodeLoc loc) {
        Objects.requireNonNull(root, "root");
        return Objects.requireNonNull(loc, "loc").get();
    }

    /**
     * Replaces the subtree at {@code loc} with {@code subtree} in place. Locations pointing into the
     * replaced region are invalid afterwards. A {@code subtree} that is already part of {@code root}
     * is attached as a deep copy, so no node ends up in two places.
     *
     * @throws LocationException if {@code loc} does not address a node of {@code root}
     */
    public static void replace(RuleNode root, NodeLoc loc, RuleNode subtree) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(loc, "loc");
        Objects.requireNonNull(subtree, "subtree");
        if (loc.isRoot()) {
            if (loc.parent() != root) {
                throw new LocationException(loc + " is the root of another tree");
            }
        } else if (!root.contains(loc.parent())) {
            throw new LocationException(loc + " does not point into this tree");
        }
        loc.insert(root.contains(subtree) ? subtree.deepCopy() : subtree);
    }

    /** Depth counted in edges: a single node has depth 0, like the min-depth of a terminal rule. */
    public static int depth(RuleNode root) {
        int deepest = 0;
        for (RuleNode child : root.children()) {
            deepest = Math.max(deepest, depth(child) + 1);
        }
        return deepest;
    }

    public static int size(RuleNode root) {
        int count = 1;
        for (RuleNode child : root.children()) {
            count += size(child);
        }
        return count;
    }

    /**
     * Distance from {@code root} down to {@code node}, matched by identity.
     *
     * @throws LocationException if {@code node} is not part of the tree
     */
    public static int nodeDepth(RuleNode root, RuleNode node) {
        int found = nodeDepth(root, node, 0);
        if (found < 0) {
            throw new LocationException("Node " + node + " is not part of the tree");
        }
        return found;
    }

    private static int nodeDepth(RuleNode current, RuleNode target, int depth) {
        if (current == target) {
            return depth;
        }
        for (RuleNode child : current.children()) {
            int found = nodeDepth(child, target, depth + 1);
            if (found >= 0) {
                return found;
            }
        }
        return -1;
    }

    /** Rule indices met when following the child positions in {@code path} from the root. */
    public static List<Integer> ruleSequence(RuleNode root, List<Integer> path) {
        List<Integer> sequence = new ArrayList<>(path.size() + 1);
        RuleNode current = root;
        sequence.add(current.ruleIndex());
        for (int position : path) {
            if (position < 0 || position >= current.childCount()) {
                throw new LocationException(
                        "Path " + path + " leaves the tree at position " + position);
            }
            current = current.child(position);
            sequence.add(current.ruleIndex());
        }
        return sequence;
    }

    /** Distinct indices of the rules in the tree that return {@code nt}, ascending. */
    public static Set<Integer> rulesOfType(RuleNode root, Grammar grammar, NonTerminal nt) {
        Set<Integer> result = new TreeSet<>();
        for (RuleNode node : root.preOrder()) {
            if (grammar.returnType(node.ruleIndex()).equals(nt)) {
                result.add(node.ruleIndex());
            }
        }
        return result;
    }

    /** Whether some node at most {@code maxDepth} below the root returns {@code nt}. */
    public static boolean containsReturnType(
            RuleNode root, Grammar grammar, NonTerminal nt, int maxDepth) {
        if (maxDepth < 0) {
            return false;
        }
        if (grammar.returnType(root.ruleIndex()).equals(nt)) {
            return true;
        }
        for (RuleNode child : root.children()) {
            if (containsReturnType(child, grammar, nt, maxDepth - 1)) {
                return true;
            }
        }
        return false;
    }

    /** Pre-order walk yielding {@code (depth, ruleIndex)} pairs, e.g. for external renderers. */
    public static List<Visit> walk(RuleNode root) {
        List<Visit> visits = new ArrayList<>();
        Deque<RuleNode> nodes = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        nodes.push(root);
        depths.push(0);
        while (!nodes.isEmpty()) {
            RuleNode current = nodes.pop();
            int depth = depths.pop();
            visits.add(new Visit(depth, current.ruleIndex()));
            for (int i = current.childCount() - 1; i >= 0; i--) {
                nodes.push(current.child(i));
                depths.push(depth + 1);
            }
        }
        return visits;
    }
}
