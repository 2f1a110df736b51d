package com.gtree.engine.eval;

import java.util.List;

/** Operation lookup and invocation shared by {@link Interpreter} and {@link ExpressionEvaluator}. */
final class Calls {

    private Calls() {}

    /**
     * @throws UnboundSymbolException if {@code symbol} is unbound
     * @throws EvaluationException if {@code symbol} is bound to a plain value
     */
    static Operation resolve(SymbolTable table, String symbol, int ruleIndex) {
        Object bound = table.lookup(symbol);
        if (!(bound instanceof Operation operation)) {
            throw new EvaluationException(
                    ruleIndex, "'" + symbol + "' is bound to a value, not an operation");
        }
        return operation;
    }

    /** Applies {@code operation}, wrapping whatever it throws with {@code ruleIndex}. */
    static Object invoke(Operation operation, String symbol, List<Object> args, int ruleIndex) {
        try {
            return operation.apply(args);
        } catch (Exception e) {
            throw new EvaluationException(
                    ruleIndex, "'" + symbol + "' failed on " + args + ": " + e.getMessage(), e);
        }
    }
}
