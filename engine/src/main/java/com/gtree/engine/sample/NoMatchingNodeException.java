package com.gtree.engine.sample;

import com.gtree.engine.EngineException;

/** Raised when a tree holds no node of the requested return type. */
public final class NoMatchingNodeException extends EngineException {

    public NoMatchingNodeException(String message) {
        super(message);
    }
}
