package com.gtree.engine.eval;

import com.gtree.engine.EngineException;

/**
 * Raised when evaluation reaches a symbol that has no binding in the {@link SymbolTable}. The
 * caller can bind the symbol and evaluate again.
 */
public final class UnboundSymbolException extends EngineException {
    private final String symbol;

    public UnboundSymbolException(String symbol) {
        super("Symbol '" + symbol + "' is not bound");
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
