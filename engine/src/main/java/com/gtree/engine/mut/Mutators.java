package com.gtree.engine.mut;

import com.gtree.engine.grammar.Grammar;
import com.gtree.engine.grammar.Grammar.NonTerminal;
import com.gtree.engine.gen.TreeGenerators;
import com.gtree.engine.sample.NodeSampler;
import com.gtree.engine.tree.NodeLoc;
import com.gtree.engine.tree.RuleNode;
import com.gtree.engine.util.TreeOps;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Grammar-aware mutations of derivation trees. Every mutator works on a copy and leaves its input
 * untouched; the result always respects the grammar and the configured depth limit.
 */
public final class Mutators {

    private Mutators() {}

    public interface Mutator {
        /** Mutated copy of {@code tree}, or {@code null} when this mutator cannot apply. */
        RuleNode mutate(RuleNode tree, Random random);
    }

    /** Replaces a random subtree with a freshly generated one of the same return type. */
    public static final class RandomSubtreeReplacement implements Mutator {
        private final Grammar grammar;
        private final TreeGenerators.TreeGenerator generator;
        private final int maxDepth;

        public RandomSubtreeReplacement(
                Grammar grammar, TreeGenerators.TreeGenerator generator, int maxDepth) {
            this.grammar = Objects.requireNonNull(grammar, "grammar");
            this.generator = Objects.requireNonNull(generator, "generator");
            this.maxDepth = maxDepth;
        }

        @Override
        public RuleNode mutate(RuleNode tree, Random random) {
            RuleNode copy = tree.deepCopy();
            NodeLoc loc = NodeSampler.sampleLocation(copy, random);
            RuleNode target = loc.get();
            NonTerminal type = grammar.returnType(target.ruleIndex());
            int budget = maxDepth - TreeOps.nodeDepth(copy, target);
            if (grammar.minDepths().ofNonTerminal(type) > budget) {
                return null;
            }
            TreeOps.replace(copy, loc, generator.generate(type, budget));
            return copy;
        }
    }

    /** Grafts a copy of a donor subtree onto a node of the same return type. */
    public static final class SplicingMutation implements Mutator {
        private final Grammar grammar;
        private final Supplier<RuleNode> donorSupplier;
        private final int maxDepth;

        public SplicingMutation(Grammar grammar, Supplier<RuleNode> donorSupplier, int maxDepth) {
            this.grammar = Objects.requireNonNull(grammar, "grammar");
            this.donorSupplier = Objects.requireNonNull(donorSupplier, "donorSupplier");
            this.maxDepth = maxDepth;
        }

        @Override
        public RuleNode mutate(RuleNode tree, Random random) {
            RuleNode donor = donorSupplier.get();
            if (donor == null) {
                return null;
            }
            RuleNode copy = tree.deepCopy();
            NodeLoc loc = NodeSampler.sampleLocation(copy, random);
            RuleNode target = loc.get();
            NonTerminal type = grammar.returnType(target.ruleIndex());
            int budget = maxDepth - TreeOps.nodeDepth(copy, target);

            List<RuleNode> candidates = new ArrayList<>();
            for (RuleNode node : donor.preOrder()) {
                if (grammar.returnType(node.ruleIndex()).equals(type)
                        && TreeOps.depth(node) <= budget) {
                    candidates.add(node);
                }
            }
            if (candidates.isEmpty()) {
                return null;
            }
            RuleNode graft = candidates.get(random.nextInt(candidates.size())).deepCopy();
            TreeOps.replace(copy, loc, graft);
            return copy;
        }
    }
}
