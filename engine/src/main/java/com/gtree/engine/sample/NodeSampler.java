package com.gtree.engine.sample;

import com.gtree.engine.grammar.Grammar;
import com.gtree.engine.grammar.Grammar.NonTerminal;
import com.gtree.engine.tree.NodeLoc;
import com.gtree.engine.tree.RuleNode;
import java.util.Objects;
import java.util.Random;

/**
 * Uniform selection of nodes or node locations from a derivation tree.
 *
 * <p>All variants use single-pass reservoir sampling over a pre-order walk: the {@code k}-th
 * eligible candidate replaces the current pick with probability {@code 1/k}, so every eligible
 * node ends up selected with probability {@code 1/n} without counting the nodes first.
 */
public final class NodeSampler {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private NodeSampler() {}

    public static RuleNode sampleNode(RuleNode root, Random random) {
        return sampleLocation(root, random).get();
    }

    /**
     * @throws NoMatchingNodeException if no node of the tree returns {@code nt}
     */
    public static RuleNode sampleNode(RuleNode root, Grammar grammar, NonTerminal nt, Random random) {
        return sampleLocation(root, grammar, nt, UNBOUNDED, random).get();
    }

    public static RuleNode sampleNode(
            RuleNode root, Grammar grammar, NonTerminal nt, int maxDepth, Random random) {
        return sampleLocation(root, grammar, nt, maxDepth, random).get();
    }

    public static NodeLoc sampleLocation(RuleNode root, Random random) {
        return sampleLocation(root, UNBOUNDED, random);
    }

    /** Samples among the nodes at most {@code maxDepth} below the root. */
    public static NodeLoc sampleLocation(RuleNode root, int maxDepth, Random random) {
        Objects.requireNonNull(root, "root");
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
        Reservoir reservoir = new Reservoir(random);
        visit(root, null, NodeLoc.SELF, 0, maxDepth, null, null, reservoir);
        return reservoir.location();
    }

    public static NodeLoc sampleLocation(
            RuleNode root, Grammar grammar, NonTerminal nt, Random random) {
        return sampleLocation(root, grammar, nt, UNBOUNDED, random);
    }

    /**
     * @throws NoMatchingNodeException if no node within {@code maxDepth} of the root returns
     *     {@code nt}
     */
    public static NodeLoc sampleLocation(
            RuleNode root, Grammar grammar, NonTerminal nt, int maxDepth, Random random) {
        Objects.requireNonNull(grammar, "grammar");
        Objects.requireNonNull(nt, "nt");
        Reservoir reservoir = new Reservoir(random);
        visit(root, null, NodeLoc.SELF, 0, maxDepth, grammar, nt, reservoir);
        if (reservoir.seen == 0) {
            throw new NoMatchingNodeException("No node of type " + nt + " in tree " + root);
        }
        return reservoir.location();
    }

    private static void visit(
            RuleNode node,
            RuleNode parent,
            int position,
            int depth,
            int maxDepth,
            Grammar grammar,
            NonTerminal nt,
            Reservoir reservoir) {
        if (depth > maxDepth) {
            return;
        }
        if (grammar == null || grammar.returnType(node.ruleIndex()).equals(nt)) {
            reservoir.offer(parent == null ? node : parent, position);
        }
        for (int i = 0; i < node.childCount(); i++) {
            visit(node.child(i), node, i, depth + 1, maxDepth, grammar, nt, reservoir);
        }
    }

    private static final class Reservoir {
        private final Random random;
        private int seen;
        private RuleNode parent;
        private int position;

        Reservoir(Random random) {
            this.random = Objects.requireNonNull(random, "random");
        }

        void offer(RuleNode candidateParent, int candidatePosition) {
            seen++;
            if (random.nextInt(seen) == 0) {
                parent = candidateParent;
                position = candidatePosition;
            }
        }

        NodeLoc location() {
            return position == NodeLoc.SELF ? NodeLoc.root(parent) : NodeLoc.child(parent, position);
        }
    }
}
