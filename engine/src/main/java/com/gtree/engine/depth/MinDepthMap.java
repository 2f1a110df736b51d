package com.gtree.engine.depth;

import com.gtree.engine.grammar.Grammar;
import com.gtree.engine.grammar.Grammar.NonTerminal;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Minimum derivation depth of every rule of one grammar. A depth of {@link #INFINITE} means the
 * rule (or non-terminal) has no finite derivation; that is a regular outcome callers must test for
 * before bounded generation.
 */
public final class MinDepthMap {
    public static final int INFINITE = Integer.MAX_VALUE;

    private final Grammar grammar;
    private final int[] byRule;

    MinDepthMap(Grammar grammar, int[] byRule) {
        this.grammar = Objects.requireNonNull(grammar, "grammar");
        this.byRule = byRule.clone();
    }

    public Grammar grammar() {
        return grammar;
    }

    public int ofRule(int ruleIndex) {
        grammar.rule(ruleIndex);
        return byRule[ruleIndex];
    }

    /** Smallest depth of any tree rooted at {@code nt}; {@link #INFINITE} if it has no rules. */
    public int ofNonTerminal(NonTerminal nt) {
        int best = INFINITE;
        for (int ruleIndex : grammar.rulesFor(nt)) {
            best = Math.min(best, byRule[ruleIndex]);
        }
        return best;
    }

    public boolean isFinite(NonTerminal nt) {
        return ofNonTerminal(nt) != INFINITE;
    }

    public Set<NonTerminal> infiniteNonTerminals() {
        Set<NonTerminal> result = new LinkedHashSet<>();
        for (NonTerminal nt : grammar.nonTerminals()) {
            if (!isFinite(nt)) {
                result.add(nt);
            }
        }
        return result;
    }

    /** Copy of the per-rule depths, indexed by rule index (slot 0 is unused). */
    public int[] toArray() {
        return byRule.clone();
    }

    @Override
    public String toString() {
        return "MinDepthMap" + Arrays.toString(Arrays.copyOfRange(byRule, 1, byRule.length));
    }
}
