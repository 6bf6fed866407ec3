package com.efficient.autocomplete.util;

/**
 * Outcome of a lookup against the trie.
 */
public enum MatchType {
    /** No path spells the query. */
    NOT_FOUND,
    /** A path spells the query but it is not a stored word. */
    PREFIX,
    /** The query is a stored word. */
    WORD
}
