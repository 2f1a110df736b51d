package com.gtree.engine;

/** Base class of every failure raised by the expression-tree engine. */
public class EngineException extends RuntimeException {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
