package com.gtree.engine.gen;

import com.gtree.engine.depth.MinDepthMap;
import com.gtree.engine.grammar.Grammar;
import com.gtree.engine.grammar.Grammar.NonTerminal;
import com.gtree.engine.tree.RuleNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Random derivation tree generators.
 */
public final class TreeGenerators {

    private TreeGenerators() {}

    public interface TreeGenerator {
        /**
         * Builds a tree rooted at {@code start} whose depth is at most {@code maxDepth}.
         *
         * @throws DepthBudgetExceededException if no such tree exists
         */
        RuleNode generate(NonTerminal start, int maxDepth);
    }

    /**
     * Picks uniformly among the rules of a non-terminal whose min-depth fits the remaining budget,
     * then recurses into the child slots with one level less. Filtering by min-depth guarantees
     * every recursion can still terminate, so the result never exceeds the requested depth.
     */
    public static final class RandomGenerator implements TreeGenerator {
        private final Grammar grammar;
        private final MinDepthMap minDepths;
        private final Random random;

        public RandomGenerator(Grammar grammar, Random random) {
            this(grammar, grammar.minDepths(), random);
        }

        public RandomGenerator(Grammar grammar, MinDepthMap minDepths, Random random) {
            this.grammar = Objects.requireNonNull(grammar, "grammar");
            this.minDepths = Objects.requireNonNull(minDepths, "minDepths");
            this.random = Objects.requireNonNull(random, "random");
        }

        @Override
        public RuleNode generate(NonTerminal start, int maxDepth) {
            int needed = minDepths.ofNonTerminal(start);
            if (needed > maxDepth) {
                throw new DepthBudgetExceededException(
                        "Shallowest derivation of " + start + " needs depth "
                                + (needed == MinDepthMap.INFINITE ? "infinity" : needed)
                                + ", budget is " + maxDepth);
            }
            return expand(start, maxDepth);
        }

        private RuleNode expand(NonTerminal nt, int budget) {
            List<Integer> feasible = new ArrayList<>();
            for (int ruleIndex : grammar.rulesFor(nt)) {
                if (minDepths.ofRule(ruleIndex) <= budget) {
                    feasible.add(ruleIndex);
                }
            }
            int ruleIndex = feasible.get(random.nextInt(feasible.size()));
            List<RuleNode> children = new ArrayList<>();
            for (NonTerminal child : grammar.childTypes(ruleIndex)) {
                children.add(expand(child, budget - 1));
            }
            return RuleNode.of(grammar, ruleIndex, children);
        }
    }
}
