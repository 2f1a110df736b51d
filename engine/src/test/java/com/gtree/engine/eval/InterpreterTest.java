package com.gtree.engine.eval;

import static com.gtree.engine.grammar.GrammarBuilder.call;
import static com.gtree.engine.grammar.GrammarBuilder.lit;
import static com.gtree.engine.grammar.GrammarBuilder.nt;
import static org.junit.jupiter.api.Assertions.*;

import com.gtree.engine.grammar.Grammar;
import com.gtree.engine.grammar.GrammarBuilder;
import com.gtree.engine.testing.TestGrammars;
import com.gtree.engine.tree.RuleNode;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

final class InterpreterTest {

    @Test
    void evaluatesLiteralsAndCalls() {
        Grammar grammar = TestGrammars.addition();
        Interpreter interpreter = new Interpreter(grammar, SymbolTable.forGrammar(grammar));
        RuleNode tree =
                RuleNode.of(
                        grammar,
                        1,
                        RuleNode.of(grammar, 1, RuleNode.of(grammar, 2), RuleNode.of(grammar, 3)),
                        RuleNode.of(grammar, 3));

        assertEquals(5L, interpreter.evaluate(tree));
        assertEquals(1L, interpreter.evaluate(RuleNode.of(grammar, 2)));
    }

    @Test
    void evaluatesFreeVariablesOnceBound() {
        Grammar grammar = TestGrammars.symbolic();
        SymbolTable table = SymbolTable.forGrammar(grammar);
        Interpreter interpreter = new Interpreter(grammar, table);
        // x * (x + 2)
        RuleNode tree =
                RuleNode.of(
                        grammar,
                        3,
                        RuleNode.of(grammar, 1, RuleNode.of(grammar, 5), RuleNode.of(grammar, 7)));

        UnboundSymbolException missing =
                assertThrows(UnboundSymbolException.class, () -> interpreter.evaluate(tree));
        assertEquals("x", missing.symbol());

        table.bind("x", 3L);
        assertEquals(15L, interpreter.evaluate(tree));
        table.bind("x", 0.5);
        assertEquals(1.25, (Double) interpreter.evaluate(tree), 1e-12);
    }

    @Test
    void mathFunctionsProduceDoubles() {
        Grammar grammar = TestGrammars.symbolic();
        Interpreter interpreter =
                new Interpreter(grammar, SymbolTable.forGrammar(grammar).bind("x", 0L));
        RuleNode tree = RuleNode.of(grammar, 4, RuleNode.of(grammar, 5));
        assertEquals(0.0, interpreter.evaluate(tree));
    }

    @Test
    void evalNodeReturnsSameValueEveryTime() {
        Grammar grammar = TestGrammars.comparison(new Random(12));
        Interpreter interpreter = new Interpreter(grammar, SymbolTable.forGrammar(grammar));
        RuleNode tree =
                RuleNode.of(grammar, 3, RuleNode.of(grammar, 4), RuleNode.of(grammar, 5));

        Object first = interpreter.evaluate(tree);
        Object second = interpreter.evaluate(tree);
        assertEquals(first, second);
        assertEquals(3.0 + (Double) tree.child(0).value(), (Double) first, 1e-12);
    }

    @Test
    void failingOperationReportsRuleIndex() {
        Namespace namespace =
                Namespace.of(
                                Map.of(
                                        "check",
                                        (Operation) args -> {
                                            throw new ArithmeticException("negative input");
                                        }))
                        .orElse(Builtins.standard());
        Grammar grammar =
                new GrammarBuilder()
                        .rule("Real", call("+", nt("Real"), nt("Real")))
                        .rule("Real", call("check", lit(-1L)))
                        .literals("Real", 1L)
                        .build();
        Interpreter interpreter = new Interpreter(grammar, SymbolTable.forGrammar(grammar, namespace));
        RuleNode tree = RuleNode.of(grammar, 1, RuleNode.of(grammar, 3), RuleNode.of(grammar, 2));

        EvaluationException e = assertThrows(EvaluationException.class, () -> interpreter.evaluate(tree));
        assertEquals(2, e.ruleIndex());
        assertInstanceOf(ArithmeticException.class, e.getCause());
    }

    @Test
    void typeErrorsInBuiltinsAreEvaluationErrors() {
        Grammar grammar =
                new GrammarBuilder()
                        .rule("Real", call("+", nt("Real"), nt("Real")))
                        .literals("Real", 1L, "one")
                        .build();
        Interpreter interpreter = new Interpreter(grammar, SymbolTable.forGrammar(grammar));
        RuleNode tree = RuleNode.of(grammar, 1, RuleNode.of(grammar, 2), RuleNode.of(grammar, 3));

        EvaluationException e = assertThrows(EvaluationException.class, () -> interpreter.evaluate(tree));
        assertEquals(1, e.ruleIndex());
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }

    @Test
    void valueBoundToCallSymbolIsRejected() {
        Grammar grammar =
                new GrammarBuilder().rule("Real", call("k", lit(1L))).build();
        SymbolTable table = SymbolTable.forGrammar(grammar).bind("k", 4L);
        EvaluationException e =
                assertThrows(
                        EvaluationException.class,
                        () -> new Interpreter(grammar, table).evaluate(RuleNode.of(grammar, 1)));
        assertEquals(1, e.ruleIndex());
    }

    @Test
    void callerSuppliedOperationForFreeCallSymbol() {
        Grammar grammar =
                new GrammarBuilder()
                        .rule("Real", call("twice", nt("Real")))
                        .literals("Real", 21L)
                        .build();
        SymbolTable table = SymbolTable.forGrammar(grammar);
        assertEquals(java.util.Set.of("twice"), table.unbound());
        table.bind("twice", (Operation) args -> 2 * (Long) args.get(0));

        RuleNode tree = RuleNode.of(grammar, 1, RuleNode.of(grammar, 2));
        assertEquals(42L, new Interpreter(grammar, table).evaluate(tree));
    }

    @Test
    void booleanGrammarEvaluates() {
        Grammar grammar = TestGrammars.comparison(new Random(0));
        Interpreter interpreter = new Interpreter(grammar, SymbolTable.forGrammar(grammar));
        // !(3 < 3 + 3)
        RuleNode tree =
                RuleNode.of(
                        grammar,
                        2,
                        RuleNode.of(
                                grammar,
                                1,
                                RuleNode.of(grammar, 5),
                                RuleNode.of(grammar, 3, RuleNode.of(grammar, 5), RuleNode.of(grammar, 5))));
        assertEquals(false, interpreter.evaluate(tree));
    }
}
