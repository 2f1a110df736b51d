package com.gtree.engine.tree;

import com.gtree.engine.EngineException;

/** Raised when a node is built with a child count that does not match its rule. */
public final class ArityException extends EngineException {

    public ArityException(String message) {
        super(message);
    }
}
