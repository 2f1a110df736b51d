package com.gtree.engine.tree;

import com.gtree.engine.eval.EvaluationException;
import com.gtree.engine.grammar.Grammar;
import com.gtree.engine.grammar.RuleForm.EvalThunk;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Node of a derivation tree: the index of the rule applied here and one exclusively owned child
 * per non-terminal slot of that rule. Nodes of eval-thunk rules also carry the value the thunk
 * produced when the node was built; it is never recomputed.
 *
 * <p>A node belongs to exactly one tree. Edits go through {@link NodeLoc#insert(RuleNode)} or
 * {@link com.gtree.engine.util.TreeOps#replace}.
 */
public final class RuleNode {
    private int ruleIndex;
    private final List<RuleNode> children;
    private Object value;
    private boolean hasValue;

    private RuleNode(int ruleIndex, List<RuleNode> children, Object value, boolean hasValue) {
        this.ruleIndex = ruleIndex;
        this.children = children;
        this.value = value;
        this.hasValue = hasValue;
    }

    public static RuleNode of(Grammar grammar, int ruleIndex, RuleNode... children) {
        return of(grammar, ruleIndex, List.of(children));
    }

    /**
     * Applies rule {@code ruleIndex} of {@code grammar} to {@code children}, running the rule's
     * thunk once if it is an eval-thunk rule.
     *
     * @throws ArityException if the rule does not exist or takes a different number of children
     */
    public static RuleNode of(Grammar grammar, int ruleIndex, List<RuleNode> children) {
        Objects.requireNonNull(grammar, "grammar");
        Objects.requireNonNull(children, "children");
        if (ruleIndex < 1 || ruleIndex > grammar.size()) {
            throw new ArityException(
                    "Rule index " + ruleIndex + " outside 1.." + grammar.size());
        }
        int arity = grammar.arity(ruleIndex);
        if (children.size() != arity) {
            throw new ArityException(
                    "Rule " + ruleIndex + " (" + grammar.rule(ruleIndex) + ") takes " + arity
                            + " children, got " + children.size());
        }
        List<RuleNode> owned = new ArrayList<>(children.size());
        for (RuleNode child : children) {
            owned.add(Objects.requireNonNull(child, "child"));
        }
        if (grammar.rule(ruleIndex).form instanceof EvalThunk eval) {
            Object computed;
            try {
                computed = eval.thunk().get();
            } catch (RuntimeException e) {
                throw new EvaluationException(ruleIndex, "eval thunk failed", e);
            }
            return new RuleNode(ruleIndex, owned, computed, true);
        }
        return new RuleNode(ruleIndex, owned, null, false);
    }

    public int ruleIndex() {
        return ruleIndex;
    }

    public List<RuleNode> children() {
        return Collections.unmodifiableList(children);
    }

    public RuleNode child(int index) {
        return children.get(index);
    }

    public int childCount() {
        return children.size();
    }

    /** Whether this node carries a value fixed at construction (eval-thunk rules only). */
    public boolean hasValue() {
        return hasValue;
    }

    public Object value() {
        if (!hasValue) {
            throw new IllegalStateException("Node of rule " + ruleIndex + " carries no value");
        }
        return value;
    }

    /** Copies the whole subtree; cached thunk values are copied, not recomputed. */
    public RuleNode deepCopy() {
        List<RuleNode> copies = new ArrayList<>(children.size());
        for (RuleNode child : children) {
            copies.add(child.deepCopy());
        }
        return new RuleNode(ruleIndex, copies, value, hasValue);
    }

    /** This node and its descendants, parents before children, children left to right. */
    public List<RuleNode> preOrder() {
        List<RuleNode> result = new ArrayList<>();
        collect(this, result);
        return result;
    }

    private static void collect(RuleNode node, List<RuleNode> into) {
        into.add(node);
        for (RuleNode child : node.children) {
            collect(child, into);
        }
    }

    /** Whether {@code node} is this node or one of its descendants, compared by identity. */
    public boolean contains(RuleNode node) {
        if (this == node) {
            return true;
        }
        for (RuleNode child : children) {
            if (child.contains(node)) {
                return true;
            }
        }
        return false;
    }

    void setChild(int index, RuleNode child) {
        children.set(index, child);
    }

    /**
     * Turns this node into a copy of {@code other}: same rule and value, deep copies of its
     * children. {@code other} keeps its own nodes.
     */
    void overwrite(RuleNode other) {
        List<RuleNode> adopted = new ArrayList<>(other.children.size());
        for (RuleNode child : other.children) {
            adopted.add(child.deepCopy());
        }
        ruleIndex = other.ruleIndex;
        value = other.value;
        hasValue = other.hasValue;
        children.clear();
        children.addAll(adopted);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RuleNode other)) {
            return false;
        }
        return ruleIndex == other.ruleIndex
                && hasValue == other.hasValue
                && Objects.equals(value, other.value)
                && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleIndex, value, children);
    }

    @Override
    public String toString() {
        if (children.isEmpty()) {
            return hasValue ? ruleIndex + "=" + value : Integer.toString(ruleIndex);
        }
        StringBuilder sb = new StringBuilder().append(ruleIndex).append('{');
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(children.get(i));
        }
        return sb.append('}').toString();
    }
}
