package com.gtree.engine.grammar;

import com.gtree.engine.depth.MinDepthAnalysis;
import com.gtree.engine.depth.MinDepthMap;
import com.gtree.engine.grammar.ArgSlot.NonTerminalRef;
import com.gtree.engine.grammar.RuleForm.Call;
import com.gtree.engine.grammar.RuleForm.EvalThunk;
import com.gtree.engine.grammar.RuleForm.SymbolTerminal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable, indexed context-free grammar whose productions build executable expressions.
 *
 * <p>Rules are identified by their 1-based position in the list the grammar was built from. All
 * structural queries are answered from indices computed once at construction; non-terminals refer
 * to rules by index only, so recursive grammars need no object cycles.
 */
public final class Grammar {
    private static final Logger LOG = LoggerFactory.getLogger(Grammar.class);

    public record NonTerminal(String name) {
        public NonTerminal {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Structured input for one rule. {@code declaredArity} is the child count the front-end
     * expects, or {@link #UNDECLARED} when it leaves the arity to be derived from the form.
     */
    public record RuleSpec(NonTerminal lhs, RuleForm form, int declaredArity) {
        public static final int UNDECLARED = -1;

        public RuleSpec(NonTerminal lhs, RuleForm form) {
            this(lhs, form, UNDECLARED);
        }
    }

    public static final class Rule {
        public final int index;
        public final NonTerminal lhs;
        public final RuleForm form;
        public final int arity;
        public final List<NonTerminal> childTypes;

        Rule(int index, NonTerminal lhs, RuleForm form) {
            this.index = index;
            this.lhs = lhs;
            this.form = form;
            this.childTypes = form instanceof Call call ? call.childTypes() : List.of();
            this.arity = childTypes.size();
        }

        public NonTerminal returnType() {
            return lhs;
        }

        @Override
        public String toString() {
            return lhs + " = " + form;
        }
    }

    private final List<Rule> rules;
    private final Map<NonTerminal, List<Integer>> byLhs;
    private final int maxArity;
    private volatile MinDepthMap minDepths;

    private Grammar(List<Rule> rules, Map<NonTerminal, List<Integer>> byLhs) {
        this.rules = rules;
        this.byLhs = byLhs;
        int widest = 0;
        for (Rule rule : rules) {
            widest = Math.max(widest, rule.arity);
        }
        this.maxArity = widest;
    }

    /**
     * Builds a grammar from an ordered list of rule specifications.
     *
     * @throws GrammarException if a specification is malformed
     */
    public static Grammar of(List<RuleSpec> specs) {
        Objects.requireNonNull(specs, "specs");
        if (specs.isEmpty()) {
            throw new GrammarException("A grammar needs at least one rule");
        }
        List<Rule> rules = new ArrayList<>(specs.size());
        Map<NonTerminal, List<Integer>> byLhs = new LinkedHashMap<>();
        for (RuleSpec spec : specs) {
            int index = rules.size() + 1;
            if (spec == null || spec.lhs() == null || spec.form() == null) {
                throw new GrammarException("Rule " + index + " is missing its left-hand side or form");
            }
            if (spec.lhs().name().isBlank()) {
                throw new GrammarException("Rule " + index + " has a blank left-hand side");
            }
            Rule rule = new Rule(index, spec.lhs(), spec.form());
            if (spec.declaredArity() != RuleSpec.UNDECLARED && spec.declaredArity() != rule.arity) {
                throw new GrammarException(
                        "Rule " + index + " (" + rule + ") declares arity " + spec.declaredArity()
                                + " but its form has " + rule.arity + " child slots");
            }
            rules.add(rule);
            byLhs.computeIfAbsent(rule.lhs, key -> new ArrayList<>()).add(index);
        }
        for (Rule rule : rules) {
            validateForm(rule, byLhs.keySet());
        }
        Map<NonTerminal, List<Integer>> frozen = new LinkedHashMap<>();
        byLhs.forEach((nt, indices) -> frozen.put(nt, List.copyOf(indices)));
        Grammar grammar = new Grammar(List.copyOf(rules), Collections.unmodifiableMap(frozen));
        LOG.debug(
                "Built grammar with {} rules over {} non-terminals (max arity {})",
                rules.size(),
                frozen.size(),
                grammar.maxArity);
        return grammar;
    }

    private static void validateForm(Rule rule, Set<NonTerminal> defined) {
        if (rule.form instanceof SymbolTerminal symbol && symbol.name().isBlank()) {
            throw new GrammarException("Rule " + rule.index + " has a blank symbol");
        }
        if (rule.form instanceof Call call) {
            if (call.symbol().isBlank()) {
                throw new GrammarException("Rule " + rule.index + " calls a blank symbol");
            }
            for (ArgSlot slot : call.args()) {
                if (slot instanceof NonTerminalRef ref && !defined.contains(ref.nt())) {
                    throw new GrammarException(
                            "Rule " + rule.index + " (" + rule + ") refers to undefined non-terminal "
                                    + ref.nt());
                }
            }
        }
    }

    public Set<NonTerminal> nonTerminals() {
        return byLhs.keySet();
    }

    public boolean contains(NonTerminal nt) {
        return byLhs.containsKey(nt);
    }

    /** Indices of the rules expanding {@code nt}, in declaration order; empty if none. */
    public List<Integer> rulesFor(NonTerminal nt) {
        return byLhs.getOrDefault(nt, List.of());
    }

    public Rule rule(int index) {
        if (index < 1 || index > rules.size()) {
            throw new IndexOutOfBoundsException(
                    "Rule index " + index + " outside 1.." + rules.size());
        }
        return rules.get(index - 1);
    }

    public List<Rule> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public NonTerminal returnType(int index) {
        return rule(index).lhs;
    }

    public int arity(int index) {
        return rule(index).arity;
    }

    public List<NonTerminal> childTypes(int index) {
        return rule(index).childTypes;
    }

    public boolean isTerminal(int index) {
        Rule rule = rule(index);
        return rule.arity == 0 && !(rule.form instanceof EvalThunk);
    }

    public boolean isEval(int index) {
        return rule(index).form instanceof EvalThunk;
    }

    /** Whether one of the rule's child slots is its own left-hand side. */
    public boolean isRecursive(int index) {
        Rule rule = rule(index);
        return rule.childTypes.contains(rule.lhs);
    }

    public int maxArity() {
        return maxArity;
    }

    /** Min-depth map of this grammar, computed on first use and reused afterwards. */
    public MinDepthMap minDepths() {
        MinDepthMap result = minDepths;
        if (result == null) {
            result = MinDepthAnalysis.compute(this);
            minDepths = result;
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Rule rule : rules) {
            sb.append(rule.index).append(": ").append(rule).append('\n');
        }
        return sb.toString();
    }
}
