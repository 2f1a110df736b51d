package com.gtree.engine.eval;

import java.util.ArrayList;
import java.util.List;

/**
 * Reference evaluator for compiled {@link Expression}s. Slower than the {@link Interpreter} since
 * it needs the compiled form first, but gives the same results for every tree.
 */
public final class ExpressionEvaluator {

    private ExpressionEvaluator() {}

    public static Object evaluate(Expression expression, SymbolTable table) {
        if (expression instanceof Expression.Literal literal) {
            return literal.value();
        }
        if (expression instanceof Expression.Variable variable) {
            return table.lookup(variable.name());
        }
        if (expression instanceof Expression.Call call) {
            Operation operation = Calls.resolve(table, call.symbol(), EvaluationException.NO_RULE);
            List<Object> args = new ArrayList<>(call.args().size());
            for (Expression arg : call.args()) {
                args.add(evaluate(arg, table));
            }
            return Calls.invoke(operation, call.symbol(), args, EvaluationException.NO_RULE);
        }
        throw new IllegalStateException("Unknown expression " + expression.getClass().getName());
    }
}
