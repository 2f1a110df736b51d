package com.gtree.engine.eval;

import com.gtree.engine.grammar.ArgSlot;
import com.gtree.engine.grammar.ArgSlot.LiteralArg;
import com.gtree.engine.grammar.ArgSlot.NonTerminalRef;
import com.gtree.engine.grammar.ArgSlot.VariableArg;
import com.gtree.engine.grammar.Grammar;
import com.gtree.engine.grammar.Grammar.Rule;
import com.gtree.engine.grammar.RuleForm;
import com.gtree.engine.grammar.RuleForm.Call;
import com.gtree.engine.grammar.RuleForm.EvalThunk;
import com.gtree.engine.grammar.RuleForm.LiteralTerminal;
import com.gtree.engine.grammar.RuleForm.SymbolTerminal;
import com.gtree.engine.tree.RuleNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates derivation trees directly from the rule forms, without building an intermediate
 * {@link Expression}. This is the path to use when scoring many candidate trees.
 */
public final class Interpreter {
    private final Grammar grammar;
    private final SymbolTable table;

    public Interpreter(Grammar grammar, SymbolTable table) {
        this.grammar = Objects.requireNonNull(grammar, "grammar");
        this.table = Objects.requireNonNull(table, "table");
    }

    public SymbolTable table() {
        return table;
    }

    /**
     * @throws UnboundSymbolException if the tree uses a symbol that is not bound
     * @throws EvaluationException if an operation fails, tagged with the rule that applied it
     */
    public Object evaluate(RuleNode node) {
        Rule rule = grammar.rule(node.ruleIndex());
        RuleForm form = rule.form;
        if (form instanceof LiteralTerminal literal) {
            return literal.value();
        }
        if (form instanceof SymbolTerminal symbol) {
            return table.lookup(symbol.name());
        }
        if (form instanceof EvalThunk) {
            return node.value();
        }
        if (form instanceof Call call) {
            return apply(node, rule, call);
        }
        throw new IllegalStateException("Unknown rule form " + form.getClass().getName());
    }

    private Object apply(RuleNode node, Rule rule, Call call) {
        Operation operation = Calls.resolve(table, call.symbol(), rule.index);
        List<Object> args = new ArrayList<>(call.args().size());
        int child = 0;
        for (ArgSlot slot : call.args()) {
            if (slot instanceof NonTerminalRef) {
                args.add(evaluate(node.child(child++)));
            } else if (slot instanceof LiteralArg literal) {
                args.add(literal.value());
            } else if (slot instanceof VariableArg variable) {
                args.add(table.lookup(variable.name()));
            }
        }
        return Calls.invoke(operation, call.symbol(), args, rule.index);
    }
}
