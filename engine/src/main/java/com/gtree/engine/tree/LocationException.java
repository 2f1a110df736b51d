package com.gtree.engine.tree;

import com.gtree.engine.EngineException;

/** Raised when a {@link NodeLoc} does not address a node of the tree it is used with. */
public final class LocationException extends EngineException {

    public LocationException(String message) {
        super(message);
    }
}
