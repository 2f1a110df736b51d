package com.gtree.engine.core;

import com.gtree.engine.depth.MinDepthMap;
import com.gtree.engine.enumerate.ExpressionCounter;
import com.gtree.engine.enumerate.ExpressionIterator;
import com.gtree.engine.eval.Builtins;
import com.gtree.engine.eval.Interpreter;
import com.gtree.engine.eval.Namespace;
import com.gtree.engine.eval.SymbolTable;
import com.gtree.engine.gen.TreeGenerators;
import com.gtree.engine.gen.TreeGenerators.TreeGenerator;
import com.gtree.engine.grammar.Grammar;
import com.gtree.engine.grammar.Grammar.NonTerminal;
import com.gtree.engine.mut.Mutators;
import com.gtree.engine.tree.RuleNode;
import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point tying one grammar to its min-depth map, a random tree generator, the mutators and
 * the interpreter. Search loops (genetic programming, MCTS, ...) drive the engine through this
 * class; the loops themselves live with the caller.
 *
 * <p>Not thread-safe: it owns a {@link Random} and a symbol table. Use one engine per
 * thread over the same {@link Grammar}.
 */
public final class ExpressionEngine {
    private static final Logger LOG = LoggerFactory.getLogger(ExpressionEngine.class);

    public static final class Config {
        public int maxDepth = 6;
        public Random random = new Random();
        public Namespace namespace = Builtins.standard();
    }

    private final Grammar grammar;
    private final Config config;
    private final MinDepthMap minDepths;
    private final TreeGenerator generator;
    private final SymbolTable symbolTable;
    private final Interpreter interpreter;

    public ExpressionEngine(Grammar grammar) {
        this(grammar, new Config());
    }

    public ExpressionEngine(Grammar grammar, Config config) {
        this.grammar = Objects.requireNonNull(grammar, "grammar");
        this.config = Objects.requireNonNull(config, "config");
        this.minDepths = grammar.minDepths();
        this.generator = new TreeGenerators.RandomGenerator(grammar, minDepths, config.random);
        this.symbolTable = SymbolTable.forGrammar(grammar, config.namespace);
        this.interpreter = new Interpreter(grammar, symbolTable);
        LOG.debug(
                "Engine ready: {} rules, max depth {}, free symbols {}",
                grammar.size(),
                config.maxDepth,
                symbolTable.freeSymbols());
    }

    public Grammar grammar() {
        return grammar;
    }

    public MinDepthMap minDepths() {
        return minDepths;
    }

    public SymbolTable symbolTable() {
        return symbolTable;
    }

    public RuleNode randomTree(NonTerminal start) {
        return generator.generate(start, config.maxDepth);
    }

    /** Regenerates a random subtree of a copy of {@code tree}; {@code null} if nothing fits. */
    public RuleNode mutate(RuleNode tree) {
        return new Mutators.RandomSubtreeReplacement(grammar, generator, config.maxDepth)
                .mutate(tree, config.random);
    }

    /** Grafts a subtree of {@code donor} into a copy of {@code tree}; {@code null} if none fits. */
    public RuleNode crossover(RuleNode tree, RuleNode donor) {
        Supplier<RuleNode> donorSupplier = () -> donor;
        return new Mutators.SplicingMutation(grammar, donorSupplier, config.maxDepth)
                .mutate(tree, config.random);
    }

    /** Evaluates with the table's current bindings. */
    public Object evaluate(RuleNode tree) {
        return interpreter.evaluate(tree);
    }

    /** Binds {@code bindings} (e.g. input variables), then evaluates. */
    public Object evaluate(RuleNode tree, Map<String, ?> bindings) {
        symbolTable.bindAll(bindings);
        return interpreter.evaluate(tree);
    }

    /**
     * All trees of {@code start} with depth at most {@code maxDepth}, the same bound random trees
     * obey. The enumerator counts levels, hence the extra one.
     */
    public ExpressionIterator enumerate(NonTerminal start) {
        return new ExpressionIterator(grammar, minDepths, start, levels());
    }

    public BigInteger count(NonTerminal start) {
        return new ExpressionCounter(grammar, minDepths).count(start, levels());
    }

    /** Tree levels covering {@code config.maxDepth} edges, saturating at {@code Integer.MAX_VALUE}. */
    private int levels() {
        return config.maxDepth == Integer.MAX_VALUE ? Integer.MAX_VALUE : config.maxDepth + 1;
    }
}
