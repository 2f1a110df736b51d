package com.gtree.engine.grammar;

import com.gtree.engine.grammar.ArgSlot.NonTerminalRef;
import com.gtree.engine.grammar.Grammar.NonTerminal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Right-hand side of a production rule. The set of forms is closed: a bare symbol, a literal, a
 * call of an operation over argument slots, or a zero-argument computation evaluated once per
 * node.
 */
public sealed interface RuleForm {

    /** Number of non-terminal argument slots. */
    default int arity() {
        return 0;
    }

    /** Terminal that evaluates to whatever the symbol table binds {@code name} to. */
    record SymbolTerminal(String name) implements RuleForm {
        public SymbolTerminal {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /** Terminal that evaluates to a constant. */
    record LiteralTerminal(Object value) implements RuleForm {
        public LiteralTerminal {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    /** Application of the operation bound to {@code symbol} to the evaluated argument slots. */
    record Call(String symbol, List<ArgSlot> args) implements RuleForm {
        public Call {
            Objects.requireNonNull(symbol, "symbol");
            args = List.copyOf(Objects.requireNonNull(args, "args"));
        }

        @Override
        public int arity() {
            int count = 0;
            for (ArgSlot slot : args) {
                if (slot instanceof NonTerminalRef) {
                    count++;
                }
            }
            return count;
        }

        /** Non-terminal of every {@link NonTerminalRef} slot, in slot order. */
        public List<NonTerminal> childTypes() {
            List<NonTerminal> types = new ArrayList<>();
            for (ArgSlot slot : args) {
                if (slot instanceof NonTerminalRef ref) {
                    types.add(ref.nt());
                }
            }
            return types;
        }

        /** Operators such as {@code +} or {@code <=} print infix when they take two arguments. */
        public static boolean isInfix(String symbol, int argCount) {
            return argCount == 2 && !symbol.isEmpty() && !Character.isLetter(symbol.charAt(0));
        }

        @Override
        public String toString() {
            if (isInfix(symbol, args.size())) {
                return args.get(0) + " " + symbol + " " + args.get(1);
            }
            StringBuilder sb = new StringBuilder(symbol).append('(');
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(args.get(i));
            }
            return sb.append(')').toString();
        }
    }

    /**
     * Terminal whose value is produced by {@code thunk} when a node is built and kept for the
     * lifetime of that node. The thunk may be random.
     */
    record EvalThunk(Supplier<?> thunk) implements RuleForm {
        public EvalThunk {
            Objects.requireNonNull(thunk, "thunk");
        }

        @Override
        public String toString() {
            return "eval()";
        }
    }
}
