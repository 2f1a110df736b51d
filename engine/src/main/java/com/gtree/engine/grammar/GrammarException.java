package com.gtree.engine.grammar;

import com.gtree.engine.EngineException;

/** Raised while building a {@link Grammar} from malformed rule specifications. */
public final class GrammarException extends EngineException {

    public GrammarException(String message) {
        super(message);
    }
}
