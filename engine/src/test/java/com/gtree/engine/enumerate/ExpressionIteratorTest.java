package com.gtree.engine.enumerate;

import static com.gtree.engine.grammar.GrammarBuilder.call;
import static com.gtree.engine.grammar.GrammarBuilder.lit;
import static com.gtree.engine.grammar.GrammarBuilder.nt;
import static org.junit.jupiter.api.Assertions.*;

import com.gtree.engine.grammar.Grammar;
import com.gtree.engine.grammar.Grammar.NonTerminal;
import com.gtree.engine.grammar.GrammarBuilder;
import com.gtree.engine.testing.TestGrammars;
import com.gtree.engine.tree.RuleNode;
import com.gtree.engine.util.TreeOps;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Random;
import org.junit.jupiter.api.Test;

final class ExpressionIteratorTest {

    @Test
    void additionGrammarHasSixExpressionsInTwoLevels() {
        Grammar grammar = TestGrammars.addition();
        List<RuleNode> all = new ExpressionIterator(grammar, TestGrammars.REAL, 2).toList();

        assertEquals(6, all.size());
        assertEquals(6, new HashSet<>(all).size(), "no duplicates");
        for (RuleNode tree : all) {
            assertTrue(TreeOps.depth(tree) <= 2);
        }
        assertEquals(BigInteger.valueOf(6), ExpressionCounter.count(grammar, TestGrammars.REAL, 2));
    }

    @Test
    void ordersByRuleIndexThenRightmostChildFastest() {
        List<String> order = new ArrayList<>();
        for (RuleNode tree : new ExpressionIterator(TestGrammars.addition(), TestGrammars.REAL, 2)) {
            order.add(tree.toString());
        }
        assertEquals(List.of("1{2,2}", "1{2,3}", "1{3,2}", "1{3,3}", "2", "3"), order);
    }

    @Test
    void iteratingAgainRestartsFromTheBeginning() {
        ExpressionIterator expressions =
                new ExpressionIterator(TestGrammars.symbolic(), TestGrammars.REAL, 3);
        List<RuleNode> first = expressions.toList();
        List<RuleNode> second = expressions.toList();
        assertEquals(first, second);

        Iterator<RuleNode> partial = expressions.iterator();
        partial.next();
        partial.next();
        assertEquals(first.get(0), expressions.iterator().next());
    }

    @Test
    void countMatchesEnumerationAcrossDepths() {
        for (Grammar grammar :
                new Grammar[] {
                    TestGrammars.addition(), TestGrammars.symbolic(), TestGrammars.counter()
                }) {
            NonTerminal start = grammar.rules().get(0).lhs;
            for (int depth = 0; depth <= 3; depth++) {
                List<RuleNode> all = new ExpressionIterator(grammar, start, depth).toList();
                assertEquals(
                        BigInteger.valueOf(all.size()),
                        ExpressionCounter.count(grammar, start, depth),
                        "depth " + depth + " of\n" + grammar);
                assertEquals(all.size(), new HashSet<>(all).size());
            }
        }
    }

    @Test
    void additionCountsGrowAsSquaresPlusLeaves() {
        Grammar grammar = TestGrammars.addition();
        assertEquals(
                List.of(0, 2, 6, 38, 1446),
                List.of(
                        count(grammar, 0), count(grammar, 1), count(grammar, 2), count(grammar, 3),
                        new ExpressionIterator(grammar, TestGrammars.REAL, 4).toList().size()));
    }

    private static int count(Grammar grammar, int depth) {
        return ExpressionCounter.count(grammar, TestGrammars.REAL, depth).intValueExact();
    }

    @Test
    void emptyWhenNoLevelsOrNoRules() {
        Grammar grammar = TestGrammars.addition();
        assertFalse(new ExpressionIterator(grammar, TestGrammars.REAL, 0).iterator().hasNext());
        Iterator<RuleNode> none = new ExpressionIterator(grammar, new NonTerminal("X"), 5).iterator();
        assertFalse(none.hasNext());
        assertThrows(NoSuchElementException.class, none::next);
    }

    @Test
    void infeasibleRulesAreSkipped() {
        // 1: S = pair(A, A)   2: A = wrap(A)   3: A = a   4: S = s
        Grammar grammar =
                new GrammarBuilder()
                        .rule("S", call("pair", nt("A"), nt("A")))
                        .rule("A", call("wrap", nt("A")))
                        .literals("A", "a")
                        .literals("S", "s")
                        .build();
        List<RuleNode> one = new ExpressionIterator(grammar, new NonTerminal("S"), 1).toList();
        assertEquals(1, one.size());
        assertEquals(4, one.get(0).ruleIndex());

        List<RuleNode> two = new ExpressionIterator(grammar, new NonTerminal("S"), 2).toList();
        assertEquals(List.of("1{3,3}", "4"), two.stream().map(RuleNode::toString).toList());
    }

    @Test
    void literalSlotsKeepChildOdometerAligned() {
        // 1: P = f(Q, 0, Q)   2: Q = x   3: Q = y   4: Q = z
        Grammar grammar =
                new GrammarBuilder()
                        .rule("P", call("f", nt("Q"), lit(0L), nt("Q")))
                        .literals("Q", "x", "y", "z")
                        .build();
        List<RuleNode> all = new ExpressionIterator(grammar, new NonTerminal("P"), 2).toList();
        assertEquals(9, all.size());
        assertEquals("1{2,2}", all.get(0).toString());
        assertEquals("1{2,3}", all.get(1).toString());
        assertEquals("1{3,2}", all.get(3).toString());
        assertEquals("1{4,4}", all.get(8).toString());
    }

    @Test
    void emittedTreesShareNoNodes() {
        List<RuleNode> all = new ExpressionIterator(TestGrammars.addition(), TestGrammars.REAL, 3).toList();
        Map<RuleNode, Boolean> seen = new IdentityHashMap<>();
        for (RuleNode tree : all) {
            for (RuleNode node : tree.preOrder()) {
                assertNull(seen.put(node, Boolean.TRUE), "node shared between trees");
            }
        }
    }

    @Test
    void evalLeavesAreBuiltWithValues() {
        Grammar grammar = TestGrammars.comparison(new Random(6));
        for (RuleNode tree : new ExpressionIterator(grammar, new NonTerminal("Bool"), 3)) {
            for (RuleNode node : tree.preOrder()) {
                assertEquals(grammar.isEval(node.ruleIndex()), node.hasValue());
            }
        }
    }
}
