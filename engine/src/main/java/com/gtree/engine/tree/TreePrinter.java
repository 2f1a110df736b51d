package com.gtree.engine.tree;

import com.gtree.engine.grammar.Grammar;
import com.gtree.engine.util.TreeOps;
import com.gtree.engine.util.TreeOps.Visit;

/**
 * Plain-text rendering of a derivation tree, one node per line, indented by depth:
 *
 * <pre>
 * 1: Real = Real + Real
 *   2: Real = 1
 *   3: Real = x
 * </pre>
 */
public final class TreePrinter {

    private TreePrinter() {}

    public static String render(RuleNode root, Grammar grammar) {
        StringBuilder sb = new StringBuilder();
        for (Visit visit : TreeOps.walk(root)) {
            sb.append("  ".repeat(visit.depth()))
                    .append(visit.ruleIndex())
                    .append(": ")
                    .append(grammar.rule(visit.ruleIndex()))
                    .append('\n');
        }
        return sb.toString();
    }
}
