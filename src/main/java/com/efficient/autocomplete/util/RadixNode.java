package com.efficient.autocomplete.util;

import lombok.Getter;
import lombok.Setter;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

@Getter
@Setter
public class RadixNode {
    String label;
    boolean terminal;
    Map<Character, RadixNode> children;

    public RadixNode() {
        this("", false);
    }

    public RadixNode(String label, boolean terminal) {
        this.label = label;
        this.terminal = terminal;
        this.children = new HashMap<>();
    }

    RadixNode getChild(char c) {
        return children.get(c);
    }

    /**
     * Stores the child under the first character of its label, replacing any
     * child already registered under that character.
     */
    void putChild(RadixNode child) {
        children.put(child.label.charAt(0), child);
    }

    void removeChild(char c) {
        children.remove(c);
    }

    Collection<RadixNode> childNodes() {
        return children.values();
    }

    boolean isLeaf() {
        return children.isEmpty();
    }

    RadixNode onlyChild() {
        return children.values().iterator().next();
    }

    /**
     * Absorbs the single child: labels are concatenated and the child's
     * terminal flag and children are adopted.
     */
    void mergeWithOnlyChild() {
        RadixNode child = onlyChild();
        label = label + child.label;
        terminal = child.terminal;
        children = child.children;
    }

    @Override
    public String toString() {
        return "RadixNode{label='" + label + "', terminal=" + terminal + ", children=" + children.keySet() + "}";
    }
}
