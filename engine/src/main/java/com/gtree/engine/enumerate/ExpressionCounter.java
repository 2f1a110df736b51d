package com.gtree.engine.enumerate;

import com.gtree.engine.depth.MinDepthMap;
import com.gtree.engine.grammar.Grammar;
import com.gtree.engine.grammar.Grammar.NonTerminal;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Counts the trees {@link ExpressionIterator} would produce without building any of them: the
 * sum over eligible rules of the product of their children's counts one level down.
 */
public final class ExpressionCounter {
    private final Grammar grammar;
    private final MinDepthMap minDepths;
    private final Map<Key, BigInteger> memo = new HashMap<>();

    private record Key(NonTerminal nt, int depth) {}

    public ExpressionCounter(Grammar grammar) {
        this(grammar, grammar.minDepths());
    }

    public ExpressionCounter(Grammar grammar, MinDepthMap minDepths) {
        this.grammar = Objects.requireNonNull(grammar, "grammar");
        this.minDepths = Objects.requireNonNull(minDepths, "minDepths");
    }

    public static BigInteger count(Grammar grammar, NonTerminal nt, int maxDepth) {
        return new ExpressionCounter(grammar).count(nt, maxDepth);
    }

    public BigInteger count(NonTerminal nt, int maxDepth) {
        if (maxDepth < 1) {
            return BigInteger.ZERO;
        }
        Key key = new Key(nt, maxDepth);
        BigInteger cached = memo.get(key);
        if (cached != null) {
            return cached;
        }
        BigInteger total = BigInteger.ZERO;
        for (int ruleIndex : grammar.rulesFor(nt)) {
            if (minDepths.ofRule(ruleIndex) >= maxDepth) {
                continue;
            }
            BigInteger product = BigInteger.ONE;
            for (NonTerminal child : grammar.childTypes(ruleIndex)) {
                product = product.multiply(count(child, maxDepth - 1));
                if (product.signum() == 0) {
                    break;
                }
            }
            total = total.add(product);
        }
        memo.put(key, total);
        return total;
    }
}
