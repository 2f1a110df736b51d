package com.gtree.engine.gen;

import com.gtree.engine.EngineException;

/** Raised when no derivation of the requested non-terminal fits in the depth budget. */
public final class DepthBudgetExceededException extends EngineException {

    public DepthBudgetExceededException(String message) {
        super(message);
    }
}
