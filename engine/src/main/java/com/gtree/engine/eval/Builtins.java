package com.gtree.engine.eval;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;
import java.util.function.LongBinaryOperator;

/**
 * Default ambient namespace: arithmetic, comparison, boolean and common math operations plus the
 * constants {@code pi} and {@code e}.
 *
 * <p>Arithmetic stays in {@code long} while every operand is an integral number and switches to
 * {@code double} otherwise. Division always yields a {@code double}.
 */
public final class Builtins {
    private static final Namespace STANDARD = Namespace.of(standardEntries());

    private Builtins() {}

    public static Namespace standard() {
        return STANDARD;
    }

    private static Map<String, Object> standardEntries() {
        Map<String, Object> entries = new HashMap<>();
        entries.put("pi", Math.PI);
        entries.put("e", Math.E);

        entries.put("+", (Operation) args -> fold(args, Long::sum, Double::sum));
        entries.put("*", (Operation) args -> fold(args, (a, b) -> a * b, (a, b) -> a * b));
        entries.put("-", (Operation) Builtins::subtract);
        entries.put("/", (Operation) args -> {
            expectArgs("/", args, 2);
            return number(args.get(0)).doubleValue() / number(args.get(1)).doubleValue();
        });
        entries.put("%", (Operation) args -> {
            expectArgs("%", args, 2);
            return binary(args, (a, b) -> a % b, (a, b) -> a % b);
        });
        entries.put("^", (Operation) args -> {
            expectArgs("^", args, 2);
            return Math.pow(number(args.get(0)).doubleValue(), number(args.get(1)).doubleValue());
        });

        entries.put("<", (Operation) args -> compare("<", args) < 0);
        entries.put("<=", (Operation) args -> compare("<=", args) <= 0);
        entries.put(">", (Operation) args -> compare(">", args) > 0);
        entries.put(">=", (Operation) args -> compare(">=", args) >= 0);
        entries.put("==", (Operation) args -> equal("==", args));
        entries.put("!=", (Operation) args -> !equal("!=", args));

        Operation and = args -> {
            for (Object arg : args) {
                if (!bool(arg)) {
                    return false;
                }
            }
            return true;
        };
        Operation or = args -> {
            for (Object arg : args) {
                if (bool(arg)) {
                    return true;
                }
            }
            return false;
        };
        Operation not = args -> {
            expectArgs("!", args, 1);
            return !bool(args.get(0));
        };
        Operation ifElse = args -> {
            expectArgs("if", args, 3);
            return bool(args.get(0)) ? args.get(1) : args.get(2);
        };
        entries.put("&&", and);
        entries.put("and", and);
        entries.put("||", or);
        entries.put("or", or);
        entries.put("!", not);
        entries.put("not", not);
        entries.put("if", ifElse);
        entries.put("ifelse", ifElse);

        entries.put("sin", unary("sin", Math::sin));
        entries.put("cos", unary("cos", Math::cos));
        entries.put("tan", unary("tan", Math::tan));
        entries.put("exp", unary("exp", Math::exp));
        entries.put("log", unary("log", Math::log));
        entries.put("sqrt", unary("sqrt", Math::sqrt));
        entries.put("abs", (Operation) args -> {
            expectArgs("abs", args, 1);
            Number n = number(args.get(0));
            return isIntegral(n) ? (Object) Math.abs(n.longValue()) : (Object) Math.abs(n.doubleValue());
        });
        entries.put("min", (Operation) args -> fold(args, Math::min, Math::min));
        entries.put("max", (Operation) args -> fold(args, Math::max, Math::max));
        return entries;
    }

    private static Operation unary(String name, DoubleUnaryOperator op) {
        return args -> {
            expectArgs(name, args, 1);
            return op.applyAsDouble(number(args.get(0)).doubleValue());
        };
    }

    private static Object subtract(List<Object> args) {
        if (args.size() == 1) {
            Number n = number(args.get(0));
            return isIntegral(n) ? (Object) (-n.longValue()) : (Object) (-n.doubleValue());
        }
        expectArgs("-", args, 2);
        return binary(args, (a, b) -> a - b, (a, b) -> a - b);
    }

    private static Object binary(List<Object> args, LongBinaryOperator ints, DoubleBinaryOperator reals) {
        Number a = number(args.get(0));
        Number b = number(args.get(1));
        if (isIntegral(a) && isIntegral(b)) {
            return ints.applyAsLong(a.longValue(), b.longValue());
        }
        return reals.applyAsDouble(a.doubleValue(), b.doubleValue());
    }

    private static Object fold(List<Object> args, LongBinaryOperator ints, DoubleBinaryOperator reals) {
        if (args.isEmpty()) {
            throw new IllegalArgumentException("Operation needs at least one argument");
        }
        boolean integral = true;
        for (Object arg : args) {
            integral &= isIntegral(number(arg));
        }
        if (integral) {
            long acc = number(args.get(0)).longValue();
            for (int i = 1; i < args.size(); i++) {
                acc = ints.applyAsLong(acc, number(args.get(i)).longValue());
            }
            return acc;
        }
        double acc = number(args.get(0)).doubleValue();
        for (int i = 1; i < args.size(); i++) {
            acc = reals.applyAsDouble(acc, number(args.get(i)).doubleValue());
        }
        return acc;
    }

    private static int compare(String name, List<Object> args) {
        expectArgs(name, args, 2);
        Number a = number(args.get(0));
        Number b = number(args.get(1));
        if (isIntegral(a) && isIntegral(b)) {
            return Long.compare(a.longValue(), b.longValue());
        }
        return Double.compare(a.doubleValue(), b.doubleValue());
    }

    private static boolean equal(String name, List<Object> args) {
        expectArgs(name, args, 2);
        Object a = args.get(0);
        Object b = args.get(1);
        if (a instanceof Number && b instanceof Number) {
            return compare(name, args) == 0;
        }
        return Objects.equals(a, b);
    }

    private static void expectArgs(String name, List<Object> args, int count) {
        if (args.size() != count) {
            throw new IllegalArgumentException(
                    "'" + name + "' takes " + count + " arguments, got " + args.size());
        }
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }

    private static Number number(Object value) {
        if (value instanceof Number n) {
            return n;
        }
        throw new IllegalArgumentException("Expected a number, got " + describe(value));
    }

    private static boolean bool(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw new IllegalArgumentException("Expected a boolean, got " + describe(value));
    }

    private static String describe(Object value) {
        return value == null ? "null" : value + " (" + value.getClass().getSimpleName() + ")";
    }
}
