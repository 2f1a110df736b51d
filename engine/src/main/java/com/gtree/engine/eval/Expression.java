package com.gtree.engine.eval;

import com.gtree.engine.grammar.RuleForm;
import java.util.List;
import java.util.Objects;

/** Explicit, grammar-independent form of an evaluable expression. */
public sealed interface Expression {

    record Literal(Object value) implements Expression {
        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record Variable(String name) implements Expression {
        public Variable {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Call(String symbol, List<Expression> args) implements Expression {
        public Call {
            Objects.requireNonNull(symbol, "symbol");
            args = List.copyOf(args);
        }

        @Override
        public String toString() {
            if (RuleForm.Call.isInfix(symbol, args.size())) {
                return "(" + args.get(0) + " " + symbol + " " + args.get(1) + ")";
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
}
