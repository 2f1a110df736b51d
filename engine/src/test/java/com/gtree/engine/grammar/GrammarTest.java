package com.gtree.engine.grammar;

import static com.gtree.engine.grammar.GrammarBuilder.call;
import static com.gtree.engine.grammar.GrammarBuilder.eval;
import static com.gtree.engine.grammar.GrammarBuilder.lit;
import static com.gtree.engine.grammar.GrammarBuilder.literal;
import static com.gtree.engine.grammar.GrammarBuilder.nt;
import static com.gtree.engine.grammar.GrammarBuilder.var;
import static org.junit.jupiter.api.Assertions.*;

import com.gtree.engine.grammar.Grammar.NonTerminal;
import com.gtree.engine.testing.TestGrammars;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class GrammarTest {
    private static final NonTerminal BOOL = new NonTerminal("Bool");

    @Test
    void indexesRulesFromOneInDeclarationOrder() {
        Grammar grammar = TestGrammars.addition();

        assertEquals(3, grammar.size());
        assertEquals(List.of(1, 2, 3), grammar.rulesFor(TestGrammars.REAL));
        assertEquals(Set.of(TestGrammars.REAL), grammar.nonTerminals());
        assertEquals("Real = Real + Real", grammar.rule(1).toString());
        assertEquals(TestGrammars.REAL, grammar.returnType(2));
    }

    @Test
    void answersStructuralQueries() {
        Grammar grammar = TestGrammars.comparison(new Random(0));

        assertEquals(List.of(TestGrammars.REAL, TestGrammars.REAL), grammar.childTypes(1));
        assertEquals(List.of(BOOL), grammar.childTypes(2));
        assertEquals(List.of(), grammar.childTypes(5));
        assertEquals(2, grammar.arity(1));
        assertEquals(1, grammar.arity(2));
        assertEquals(0, grammar.arity(4));
        assertEquals(2, grammar.maxArity());

        assertFalse(grammar.isTerminal(1));
        assertFalse(grammar.isTerminal(4), "eval rules are not terminals");
        assertTrue(grammar.isEval(4));
        assertTrue(grammar.isTerminal(5));
        assertFalse(grammar.isEval(5));

        assertFalse(grammar.isRecursive(1));
        assertTrue(grammar.isRecursive(2));
        assertTrue(grammar.isRecursive(3));
    }

    @Test
    void literalAndVariableSlotsDoNotCountTowardsArity() {
        Grammar grammar = TestGrammars.symbolic();

        assertEquals(1, grammar.arity(3));
        assertEquals(List.of(TestGrammars.REAL), grammar.childTypes(3));
        assertEquals("Real = x * Real", grammar.rule(3).toString());
        assertEquals("Real = sin(Real)", grammar.rule(4).toString());
    }

    @Test
    void unknownNonTerminalHasNoRules() {
        assertEquals(List.of(), TestGrammars.addition().rulesFor(new NonTerminal("Missing")));
        assertFalse(TestGrammars.addition().contains(new NonTerminal("Missing")));
    }

    @Test
    void rejectsEmptyGrammar() {
        assertThrows(GrammarException.class, () -> new GrammarBuilder().build());
    }

    @Test
    void rejectsReferenceToUndefinedNonTerminal() {
        GrammarException e =
                assertThrows(
                        GrammarException.class,
                        () -> new GrammarBuilder()
                                .rule("Real", call("+", nt("Real"), nt("Int")))
                                .literals("Real", 1L)
                                .build());
        assertTrue(e.getMessage().contains("Int"));
    }

    @Test
    void rejectsDeclaredArityThatDisagreesWithForm() {
        assertThrows(
                GrammarException.class,
                () -> new GrammarBuilder()
                        .rule("Real", call("+", nt("Real"), lit(1L)), 2)
                        .literals("Real", 1L)
                        .build());

        Grammar ok =
                new GrammarBuilder()
                        .rule("Real", call("+", nt("Real"), lit(1L)), 1)
                        .rule("Real", literal(1L), 0)
                        .build();
        assertEquals(1, ok.arity(1));
    }

    @Test
    void rejectsBlankSymbols() {
        assertThrows(
                GrammarException.class,
                () -> new GrammarBuilder().rule("Real", call(" ", var("x"))).build());
        assertThrows(GrammarException.class, () -> new GrammarBuilder().symbols("Real", "").build());
        assertThrows(GrammarException.class, () -> new GrammarBuilder().literals(" ", 1L).build());
    }

    @Test
    void minDepthsAreComputedOnce() {
        Grammar grammar = TestGrammars.addition();
        assertSame(grammar.minDepths(), grammar.minDepths());
    }

    @Test
    void toStringListsNumberedRules() {
        Grammar grammar =
                new GrammarBuilder().literals("A", 7L).rule("A", eval(() -> 1.0)).build();
        assertEquals("1: A = 7\n2: A = eval()\n", grammar.toString());
    }
}
