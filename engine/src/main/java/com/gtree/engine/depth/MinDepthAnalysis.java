package com.gtree.engine.depth;

import com.gtree.engine.grammar.Grammar;
import com.gtree.engine.grammar.Grammar.NonTerminal;
import com.gtree.engine.grammar.Grammar.Rule;
import java.util.Arrays;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes, for every rule, the minimum depth of a finite derivation tree rooted at it.
 *
 * <p>Rules without child slots have depth 0. A rule with child types {@code t1..tk} has depth
 * {@code 1 + max_j min{d[r] : lhs(r) = tj}}. Grammars are usually recursive, so the values are found
 * by Bellman-Ford style relaxation: start from {@link MinDepthMap#INFINITE} everywhere except the
 * leaves and re-apply the recurrence until a pass changes nothing. Depths only decrease, so at most
 * one pass per rule plus a final confirming pass is needed.
 */
public final class MinDepthAnalysis {
    private static final Logger LOG = LoggerFactory.getLogger(MinDepthAnalysis.class);

    private MinDepthAnalysis() {}

    public static MinDepthMap compute(Grammar grammar) {
        int[] depths = initial(grammar);
        int passes = 0;
        for (int iter = 0; iter <= grammar.size(); iter++) {
            passes++;
            if (!relax(grammar, depths)) {
                break;
            }
        }
        MinDepthMap map = new MinDepthMap(grammar, depths);
        LOG.debug("Min-depth analysis converged after {} passes: {}", passes, map);
        Set<NonTerminal> unbounded = map.infiniteNonTerminals();
        if (!unbounded.isEmpty()) {
            LOG.warn("Non-terminals without a finite derivation: {}", unbounded);
        }
        return map;
    }

    /** Starting point of the relaxation, indexed by rule index. */
    public static int[] initial(Grammar grammar) {
        int[] depths = new int[grammar.size() + 1];
        Arrays.fill(depths, MinDepthMap.INFINITE);
        for (Rule rule : grammar.rules()) {
            if (rule.arity == 0) {
                depths[rule.index] = 0;
            }
        }
        return depths;
    }

    /**
     * Applies the recurrence once to every rule, updating {@code depths} in place.
     *
     * @return whether any depth changed
     */
    public static boolean relax(Grammar grammar, int[] depths) {
        boolean changed = false;
        for (Rule rule : grammar.rules()) {
            if (rule.arity == 0) {
                continue;
            }
            int deepest = 0;
            for (NonTerminal child : rule.childTypes) {
                int cheapest = cheapest(grammar, child, depths);
                if (cheapest == MinDepthMap.INFINITE) {
                    deepest = MinDepthMap.INFINITE;
                    break;
                }
                deepest = Math.max(deepest, cheapest);
            }
            int candidate = deepest == MinDepthMap.INFINITE ? MinDepthMap.INFINITE : deepest + 1;
            if (candidate < depths[rule.index]) {
                depths[rule.index] = candidate;
                changed = true;
            }
        }
        return changed;
    }

    private static int cheapest(Grammar grammar, NonTerminal nt, int[] depths) {
        int best = MinDepthMap.INFINITE;
        for (int ruleIndex : grammar.rulesFor(nt)) {
            best = Math.min(best, depths[ruleIndex]);
        }
        return best;
    }
}
