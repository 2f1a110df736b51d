package com.gtree.engine.eval;

import com.gtree.engine.grammar.ArgSlot;
import com.gtree.engine.grammar.ArgSlot.LiteralArg;
import com.gtree.engine.grammar.ArgSlot.NonTerminalRef;
import com.gtree.engine.grammar.ArgSlot.VariableArg;
import com.gtree.engine.grammar.Grammar;
import com.gtree.engine.grammar.RuleForm;
import com.gtree.engine.grammar.RuleForm.Call;
import com.gtree.engine.grammar.RuleForm.EvalThunk;
import com.gtree.engine.grammar.RuleForm.LiteralTerminal;
import com.gtree.engine.grammar.RuleForm.SymbolTerminal;
import com.gtree.engine.tree.RuleNode;
import java.util.ArrayList;
import java.util.List;

/** Turns a derivation tree into the {@link Expression} it denotes. */
public final class ExpressionCompiler {

    private ExpressionCompiler() {}

    /** Eval-thunk nodes compile to a literal of the value cached on the node. */
    public static Expression compile(RuleNode node, Grammar grammar) {
        RuleForm form = grammar.rule(node.ruleIndex()).form;
        if (form instanceof LiteralTerminal literal) {
            return new Expression.Literal(literal.value());
        }
        if (form instanceof SymbolTerminal symbol) {
            return new Expression.Variable(symbol.name());
        }
        if (form instanceof EvalThunk) {
            return new Expression.Literal(node.value());
        }
        if (form instanceof Call call) {
            List<Expression> args = new ArrayList<>(call.args().size());
            int child = 0;
            for (ArgSlot slot : call.args()) {
                if (slot instanceof NonTerminalRef) {
                    args.add(compile(node.child(child++), grammar));
                } else if (slot instanceof LiteralArg literal) {
                    args.add(new Expression.Literal(literal.value()));
                } else if (slot instanceof VariableArg variable) {
                    args.add(new Expression.Variable(variable.name()));
                }
            }
            return new Expression.Call(call.symbol(), args);
        }
        throw new IllegalStateException("Unknown rule form " + form.getClass().getName());
    }
}
