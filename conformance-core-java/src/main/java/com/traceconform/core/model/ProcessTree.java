package com.traceconform.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Hierarchical, block-structured model. Leaves carry an activity label (or none, when silent);
 * inner nodes carry an operator over an ordered list of children.
 */
public final class ProcessTree {

    public enum Operator { SEQUENCE, XOR, PARALLEL, LOOP }

    private final Operator operator;
    private final String label;
    private final List<ProcessTree> children;

    private ProcessTree(Operator operator, String label, List<ProcessTree> children) {
        this.operator = operator;
        this.label = label;
        this.children = children;
    }

    public static ProcessTree leaf(String label) {
        if (label == null) {
            throw new IllegalArgumentException("use silent() for unlabeled leaves");
        }
        return new ProcessTree(null, label, List.of());
    }

    public static ProcessTree silent() {
        return new ProcessTree(null, null, List.of());
    }

    public static ProcessTree node(Operator operator, ProcessTree... children) {
        if (children.length == 0) {
            throw new IllegalArgumentException("operator node " + operator + " needs at least one child");
        }
        if (operator == Operator.LOOP && children.length < 2) {
            throw new IllegalArgumentException("loop node needs a do and a redo child");
        }
        return new ProcessTree(operator, null, Collections.unmodifiableList(new ArrayList<>(List.of(children))));
    }

    public boolean isLeaf() { return operator == null; }
    public boolean isSilent() { return operator == null && label == null; }
    public Operator getOperator() { return operator; }
    public String getLabel() { return label; }
    public List<ProcessTree> getChildren() { return children; }

    /** Labels of all visible leaves, in depth-first order. */
    public Set<String> labels() {
        Set<String> labels = new LinkedHashSet<>();
        collectLabels(this, labels);
        return labels;
    }

    private static void collectLabels(ProcessTree node, Set<String> into) {
        if (node.isLeaf()) {
            if (node.label != null) into.add(node.label);
            return;
        }
        for (ProcessTree child : node.children) {
            collectLabels(child, into);
        }
    }

    @Override
    public String toString() {
        if (isLeaf()) {
            return label != null ? "'" + label + "'" : "tau";
        }
        StringBuilder sb = new StringBuilder(operator.name()).append('(');
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(children.get(i));
        }
        return sb.append(')').toString();
    }
}
