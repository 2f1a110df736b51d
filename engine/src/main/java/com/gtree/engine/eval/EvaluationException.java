package com.gtree.engine.eval;

import com.gtree.engine.EngineException;

/** Wraps a failure raised while applying an operation during evaluation. */
public final class EvaluationException extends EngineException {

    /** Rule index reported when the failing expression is not tied to a grammar rule. */
    public static final int NO_RULE = 0;

    private final int ruleIndex;

    public EvaluationException(int ruleIndex, String message, Throwable cause) {
        super(ruleIndex == NO_RULE ? message : "rule " + ruleIndex + ": " + message, cause);
        this.ruleIndex = ruleIndex;
    }

    public EvaluationException(int ruleIndex, String message) {
        this(ruleIndex, message, null);
    }

    public int ruleIndex() {
        return ruleIndex;
    }
}
