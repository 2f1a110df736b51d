package com.gtree.engine.grammar;

import com.gtree.engine.grammar.ArgSlot.LiteralArg;
import com.gtree.engine.grammar.ArgSlot.NonTerminalRef;
import com.gtree.engine.grammar.ArgSlot.VariableArg;
import com.gtree.engine.grammar.Grammar.NonTerminal;
import com.gtree.engine.grammar.Grammar.RuleSpec;
import com.gtree.engine.grammar.RuleForm.Call;
import com.gtree.engine.grammar.RuleForm.EvalThunk;
import com.gtree.engine.grammar.RuleForm.LiteralTerminal;
import com.gtree.engine.grammar.RuleForm.SymbolTerminal;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Fluent construction of a {@link Grammar} from the structured rule list.
 *
 * <pre>{@code
 * Grammar grammar = new GrammarBuilder()
 *         .rule("Real", call("+", nt("Real"), nt("Real")))
 *         .literals("Real", 1, 2)
 *         .build();
 * }</pre>
 */
public final class GrammarBuilder {
    private final List<RuleSpec> specs = new ArrayList<>();

    public GrammarBuilder rule(String lhs, RuleForm form) {
        specs.add(new RuleSpec(new NonTerminal(lhs), form));
        return this;
    }

    /** Adds a rule whose form must have exactly {@code arity} child slots. */
    public GrammarBuilder rule(String lhs, RuleForm form, int arity) {
        specs.add(new RuleSpec(new NonTerminal(lhs), form, arity));
        return this;
    }

    /** Adds one literal terminal rule per value, in order. */
    public GrammarBuilder literals(String lhs, Object... values) {
        for (Object value : values) {
            rule(lhs, literal(value));
        }
        return this;
    }

    /** Adds one symbol terminal rule per name, in order. */
    public GrammarBuilder symbols(String lhs, String... names) {
        for (String name : names) {
            rule(lhs, symbol(name));
        }
        return this;
    }

    public Grammar build() {
        return Grammar.of(specs);
    }

    public static RuleForm symbol(String name) {
        return new SymbolTerminal(name);
    }

    public static RuleForm literal(Object value) {
        return new LiteralTerminal(value);
    }

    public static RuleForm call(String symbol, ArgSlot... args) {
        return new Call(symbol, List.of(args));
    }

    public static RuleForm eval(Supplier<?> thunk) {
        return new EvalThunk(thunk);
    }

    public static ArgSlot nt(String name) {
        return new NonTerminalRef(new NonTerminal(name));
    }

    public static ArgSlot lit(Object value) {
        return new LiteralArg(value);
    }

    public static ArgSlot var(String name) {
        return new VariableArg(name);
    }
}
