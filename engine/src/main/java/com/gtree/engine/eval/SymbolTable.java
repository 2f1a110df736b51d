package com.gtree.engine.eval;

import com.gtree.engine.grammar.ArgSlot;
import com.gtree.engine.grammar.ArgSlot.VariableArg;
import com.gtree.engine.grammar.Grammar;
import com.gtree.engine.grammar.Grammar.Rule;
import com.gtree.engine.grammar.RuleForm.Call;
import com.gtree.engine.grammar.RuleForm.SymbolTerminal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Values and operations that grammar symbols evaluate to.
 *
 * <p>{@link #forGrammar} collects every symbol the rules mention and binds the ones the ambient
 * {@link Namespace} knows. The rest are free symbols, typically input variables, which the caller
 * binds before evaluating.
 */
public final class SymbolTable {
    private static final Logger LOG = LoggerFactory.getLogger(SymbolTable.class);

    private final Map<String, Object> bindings;
    private final Set<String> free;

    private SymbolTable(Map<String, Object> bindings, Set<String> free) {
        this.bindings = bindings;
        this.free = free;
    }

    public static SymbolTable empty() {
        return new SymbolTable(new LinkedHashMap<>(), new LinkedHashSet<>());
    }

    public static SymbolTable forGrammar(Grammar grammar) {
        return forGrammar(grammar, Builtins.standard());
    }

    public static SymbolTable forGrammar(Grammar grammar, Namespace namespace) {
        Objects.requireNonNull(grammar, "grammar");
        Objects.requireNonNull(namespace, "namespace");
        SymbolTable table = empty();
        for (Rule rule : grammar.rules()) {
            if (rule.form instanceof SymbolTerminal symbol) {
                table.register(symbol.name(), namespace);
            } else if (rule.form instanceof Call call) {
                table.register(call.symbol(), namespace);
                for (ArgSlot slot : call.args()) {
                    if (slot instanceof VariableArg variable) {
                        table.register(variable.name(), namespace);
                    }
                }
            }
        }
        if (!table.free.isEmpty()) {
            LOG.debug("Free symbols to bind before evaluation: {}", table.free);
        }
        return table;
    }

    private void register(String name, Namespace namespace) {
        if (bindings.containsKey(name) || free.contains(name)) {
            return;
        }
        Optional<Object> resolved = namespace.resolve(name);
        if (resolved.isPresent()) {
            bindings.put(name, resolved.get());
        } else {
            free.add(name);
        }
    }

    public SymbolTable bind(String name, Object value) {
        Objects.requireNonNull(name, "name");
        bindings.put(name, Objects.requireNonNull(value, "value"));
        return this;
    }

    public SymbolTable bindAll(Map<String, ?> values) {
        values.forEach(this::bind);
        return this;
    }

    public SymbolTable unbind(String name) {
        bindings.remove(name);
        return this;
    }

    public boolean isBound(String name) {
        return bindings.containsKey(name);
    }

    /**
     * @throws UnboundSymbolException if nothing is bound to {@code name}
     */
    public Object lookup(String name) {
        Object value = bindings.get(name);
        if (value == null) {
            throw new UnboundSymbolException(name);
        }
        return value;
    }

    /** Symbols the grammar uses that the ambient namespace could not resolve. */
    public Set<String> freeSymbols() {
        return Collections.unmodifiableSet(free);
    }

    /** Free symbols that are still unbound. */
    public Set<String> unbound() {
        Set<String> missing = new LinkedHashSet<>();
        for (String name : free) {
            if (!bindings.containsKey(name)) {
                missing.add(name);
            }
        }
        return missing;
    }

    /** Independent table with the same bindings, e.g. one per input when evaluating in parallel. */
    public SymbolTable copy() {
        return new SymbolTable(new LinkedHashMap<>(bindings), new LinkedHashSet<>(free));
    }
}
