package com.gtree.engine.tree;

import java.util.Objects;

/**
 * Position inside a derivation tree, held as the parent node plus the child position, so a
 * subtree can be read or swapped without walking down from the root again. The root is addressed
 * through itself with {@link #SELF}.
 *
 * <p>A location does not own anything. Editing the tree around it may leave it pointing at a
 * detached node or at a position that no longer exists.
 */
public final class NodeLoc {
    public static final int SELF = -1;

    private final RuleNode parent;
    private final int index;

    private NodeLoc(RuleNode parent, int index) {
        this.parent = parent;
        this.index = index;
    }

    public static NodeLoc root(RuleNode root) {
        return new NodeLoc(Objects.requireNonNull(root, "root"), SELF);
    }

    public static NodeLoc child(RuleNode parent, int index) {
        Objects.requireNonNull(parent, "parent");
        if (index < 0 || index >= parent.childCount()) {
            throw new LocationException(
                    "Child position " + index + " outside node " + parent.ruleIndex() + " with "
                            + parent.childCount() + " children");
        }
        return new NodeLoc(parent, index);
    }

    public RuleNode parent() {
        return parent;
    }

    public int index() {
        return index;
    }

    public boolean isRoot() {
        return index == SELF;
    }

    /** The node at this location. */
    public RuleNode get() {
        if (isRoot()) {
            return parent;
        }
        if (index >= parent.childCount()) {
            throw new LocationException("Stale location " + this);
        }
        return parent.child(index);
    }

    /**
     * Puts {@code subtree} at this location. The previous subtree is detached; at the root the
     * root node itself takes over the rule and value of {@code subtree} and copies of its children.
     *
     * @throws LocationException if the location is stale, or if {@code subtree} contains the parent
     *     of this location, which would close a cycle
     */
    public void insert(RuleNode subtree) {
        Objects.requireNonNull(subtree, "subtree");
        if (isRoot()) {
            parent.overwrite(subtree);
            return;
        }
        if (index >= parent.childCount()) {
            throw new LocationException("Stale location " + this);
        }
        if (subtree.contains(parent)) {
            throw new LocationException(
                    "Inserting " + subtree + " at " + this + " would create a cycle");
        }
        parent.setChild(index, subtree);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NodeLoc other && parent == other.parent && index == other.index;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(parent) + index;
    }

    @Override
    public String toString() {
        return isRoot() ? "NodeLoc(root)" : "NodeLoc(" + parent.ruleIndex() + "#" + index + ")";
    }
}
