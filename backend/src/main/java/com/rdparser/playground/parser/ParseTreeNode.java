package com.rdparser.playground.parser;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Node of a parse tree. Ids are unique within one tree and follow creation
 * order, so children always carry smaller ids than their parent.
 */
public record ParseTreeNode(
        int id,
        String label,
        List<ParseTreeNode> children) {

    public ParseTreeNode {
        label = label != null ? label : "";
        children = children == null ? List.of() : List.copyOf(children);
    }

    @JsonIgnore
    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Same labels and the same child counts at every position; ids are ignored.
     */
    boolean sameShape(ParseTreeNode other) {
        if (other == null || !label.equals(other.label) || children.size() != other.children.size()) {
            return false;
        }
        for (int i = 0; i < children.size(); i++) {
            if (!children.get(i).sameShape(other.children.get(i))) {
                return false;
            }
        }
        return true;
    }
}
