package com.gtree.engine.eval;

import java.util.List;

/** Callable bound to a call symbol. Receives the evaluated arguments in slot order. */
@FunctionalInterface
public interface Operation {
    Object apply(List<Object> args) throws Exception;
}
