package com.efficient.autocomplete.util;

import lombok.Getter;

/**
 * Handle on the node a successful {@code find} landed on. When the query ended
 * inside an edge, {@code remainder} holds the part of the label that was not
 * consumed and the match never counts as terminal.
 */
@Getter
public class TrieMatch {
    private final String label;
    private final String remainder;
    private final boolean terminal;

    TrieMatch(RadixNode node, int consumed) {
        this.label = node.getLabel();
        this.remainder = label.substring(consumed);
        this.terminal = node.isTerminal() && remainder.isEmpty();
    }

    public boolean isPartial() {
        return !remainder.isEmpty();
    }

    public MatchType getType() {
        return terminal ? MatchType.WORD : MatchType.PREFIX;
    }

    @Override
    public String toString() {
        return getType() + "(" + label + (isPartial() ? ", remainder=" + remainder : "") + ")";
    }
}
