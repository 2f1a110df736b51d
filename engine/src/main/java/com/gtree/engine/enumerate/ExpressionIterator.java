package com.gtree.engine.enumerate;

import com.gtree.engine.depth.MinDepthMap;
import com.gtree.engine.grammar.Grammar;
import com.gtree.engine.grammar.Grammar.NonTerminal;
import com.gtree.engine.tree.RuleNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Lazy enumeration of every derivation tree of a non-terminal that fits in {@code maxDepth} tree
 * levels, a single node taking one level.
 *
 * <p>The order is fixed. Rules are tried in ascending index order. For a rule with child slots,
 * the children run like the digits of an odometer: the rightmost child steps through its own
 * enumeration fastest and carries into its left neighbour when it wraps around. Rules whose
 * min-depth leaves no room within the remaining levels are skipped before any recursion.
 *
 * <p>Each call to {@link #iterator()} starts over and yields the same sequence. Every tree
 * produced is freshly built and shares no node with any other.
 */
public final class ExpressionIterator implements Iterable<RuleNode> {
    private final Grammar grammar;
    private final MinDepthMap minDepths;
    private final NonTerminal nt;
    private final int maxDepth;

    public ExpressionIterator(Grammar grammar, NonTerminal nt, int maxDepth) {
        this(grammar, grammar.minDepths(), nt, maxDepth);
    }

    public ExpressionIterator(Grammar grammar, MinDepthMap minDepths, NonTerminal nt, int maxDepth) {
        this.grammar = Objects.requireNonNull(grammar, "grammar");
        this.minDepths = Objects.requireNonNull(minDepths, "minDepths");
        this.nt = Objects.requireNonNull(nt, "nt");
        this.maxDepth = maxDepth;
    }

    public NonTerminal nonTerminal() {
        return nt;
    }

    public int maxDepth() {
        return maxDepth;
    }

    @Override
    public Iterator<RuleNode> iterator() {
        return new Walk();
    }

    /** Materializes the whole sequence. */
    public List<RuleNode> toList() {
        List<RuleNode> result = new ArrayList<>();
        for (RuleNode node : this) {
            result.add(node);
        }
        return result;
    }

    private List<Integer> eligibleRules() {
        List<Integer> eligible = new ArrayList<>();
        if (maxDepth < 1) {
            return eligible;
        }
        for (int ruleIndex : grammar.rulesFor(nt)) {
            if (minDepths.ofRule(ruleIndex) < maxDepth) {
                eligible.add(ruleIndex);
            }
        }
        return eligible;
    }

    private final class Walk implements Iterator<RuleNode> {
        private final Iterator<Integer> rules = eligibleRules().iterator();
        private Odometer odometer;
        private RuleNode lookahead;

        @Override
        public boolean hasNext() {
            if (lookahead == null) {
                lookahead = computeNext();
            }
            return lookahead != null;
        }

        @Override
        public RuleNode next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            RuleNode result = lookahead;
            lookahead = null;
            return result;
        }

        private RuleNode computeNext() {
            while (true) {
                if (odometer != null) {
                    RuleNode node = odometer.next();
                    if (node != null) {
                        return node;
                    }
                    odometer = null;
                }
                if (!rules.hasNext()) {
                    return null;
                }
                odometer = new Odometer(rules.next());
            }
        }
    }

    /** Steps through the child combinations of one rule; each child slot is one digit. */
    private final class Odometer {
        private final int ruleIndex;
        private final List<ExpressionIterator> digits = new ArrayList<>();
        private final List<Iterator<RuleNode>> positions = new ArrayList<>();
        private final List<RuleNode> current = new ArrayList<>();
        private boolean started;
        private boolean exhausted;

        Odometer(int ruleIndex) {
            this.ruleIndex = ruleIndex;
            for (NonTerminal child : grammar.childTypes(ruleIndex)) {
                digits.add(new ExpressionIterator(grammar, minDepths, child, maxDepth - 1));
            }
        }

        /** Next tree for this rule, or {@code null} once all combinations were produced. */
        RuleNode next() {
            if (exhausted) {
                return null;
            }
            if (!started) {
                started = true;
                for (ExpressionIterator digit : digits) {
                    Iterator<RuleNode> position = digit.iterator();
                    if (!position.hasNext()) {
                        exhausted = true;
                        return null;
                    }
                    positions.add(position);
                    current.add(position.next());
                }
                return build();
            }
            if (!turn()) {
                exhausted = true;
                return null;
            }
            return build();
        }

        private boolean turn() {
            for (int i = digits.size() - 1; i >= 0; i--) {
                Iterator<RuleNode> position = positions.get(i);
                if (position.hasNext()) {
                    current.set(i, position.next());
                    return true;
                }
                Iterator<RuleNode> restarted = digits.get(i).iterator();
                positions.set(i, restarted);
                current.set(i, restarted.next());
            }
            return false;
        }

        private RuleNode build() {
            List<RuleNode> children = new ArrayList<>(current.size());
            for (RuleNode child : current) {
                children.add(child.deepCopy());
            }
            return RuleNode.of(grammar, ruleIndex, children);
        }
    }
}
