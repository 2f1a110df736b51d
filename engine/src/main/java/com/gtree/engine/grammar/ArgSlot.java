package com.gtree.engine.grammar;

import com.gtree.engine.grammar.Grammar.NonTerminal;
import java.util.Objects;

/** One argument position of a {@link RuleForm.Call}. */
public sealed interface ArgSlot {

    /** Slot filled by a child derivation of the given non-terminal. */
    record NonTerminalRef(NonTerminal nt) implements ArgSlot {
        public NonTerminalRef {
            Objects.requireNonNull(nt, "nt");
        }

        @Override
        public String toString() {
            return nt.toString();
        }
    }

    /** Constant embedded directly in the call. */
    record LiteralArg(Object value) implements ArgSlot {
        public LiteralArg {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    /** Named value resolved through the symbol table at evaluation time, e.g. an input {@code x}. */
    record VariableArg(String name) implements ArgSlot {
        public VariableArg {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
