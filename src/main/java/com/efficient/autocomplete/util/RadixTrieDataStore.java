package com.efficient.autocomplete.util;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.*;

/**
 * Compressed prefix trie over {@code char} units. Edges carry multi character
 * labels, siblings never share a first character and every non-root node that
 * is not a word has at least two children.
 * <p>
 * Not thread safe: callers that share an instance must serialize access.
 */
@Slf4j
@Getter
public class RadixTrieDataStore {
    private RadixNode root = new RadixNode();

    public void reset() {
        root = new RadixNode();
    }

    public void loadData(Collection<String> words) {
        reset();
        for (String word : words) {
            insert(word);
        }
    }

    public void insert(String word) {
        Objects.requireNonNull(word, "word");
        RadixNode node = root;
        int idx = 0;
        while (idx < word.length()) {
            RadixNode child = node.getChild(word.charAt(idx));
            if (child == null) {
                node.putChild(new RadixNode(word.substring(idx), true));
                log.debug("inserted '{}' as new tail", word);
                assert invariantsHold();
                return;
            }
            String label = child.getLabel();
            int common = commonPrefixLength(label, word, idx);
            if (common == label.length()) {
                node = child;
                idx += common;
                continue;
            }
            // word diverges from, or ends inside, the child's label: split at the common prefix
            RadixNode split = new RadixNode(label.substring(0, common), false);
            child.setLabel(label.substring(common));
            split.putChild(child);
            if (idx + common == word.length()) {
                split.setTerminal(true);
            } else {
                split.putChild(new RadixNode(word.substring(idx + common), true));
            }
            node.putChild(split);
            log.debug("inserted '{}' by splitting label '{}' at {}", word, label, common);
            assert invariantsHold();
            return;
        }
        node.setTerminal(true);
        log.debug("marked '{}' as word", word);
        assert invariantsHold();
    }

    public Optional<TrieMatch> find(String query) {
        return find(query, false);
    }

    /**
     * Walks the trie along {@code query}. With {@code allowPartial} the walk may
     * end inside an edge label, which always reports a prefix match.
     */
    public Optional<TrieMatch> find(String query, boolean allowPartial) {
        Objects.requireNonNull(query, "query");
        RadixNode node = root;
        int idx = 0;
        while (idx < query.length()) {
            RadixNode child = node.getChild(query.charAt(idx));
            if (child == null) {
                return Optional.empty();
            }
            String label = child.getLabel();
            int common = commonPrefixLength(label, query, idx);
            if (common < label.length()) {
                if (allowPartial && idx + common == query.length()) {
                    return Optional.of(new TrieMatch(child, common));
                }
                return Optional.empty();
            }
            node = child;
            idx += common;
        }
        return Optional.of(new TrieMatch(node, node.getLabel().length()));
    }

    public MatchType lookup(String query) {
        return find(query, true).map(TrieMatch::getType).orElse(MatchType.NOT_FOUND);
    }

    public boolean contains(String word) {
        return find(word).map(TrieMatch::isTerminal).orElse(false);
    }

    /**
     * @return {@code true} if {@code word} was stored and has been removed.
     */
    public boolean remove(String word) {
        Objects.requireNonNull(word, "word");
        boolean removed;
        if (word.isEmpty()) {
            removed = root.isTerminal();
            root.setTerminal(false);
        } else {
            removed = remove(root, word, 0);
        }
        if (removed) {
            log.debug("removed '{}'", word);
        }
        assert invariantsHold();
        return removed;
    }

    private boolean remove(RadixNode parent, String word, int idx) {
        RadixNode node = parent.getChild(word.charAt(idx));
        if (node == null || !word.startsWith(node.getLabel(), idx)) {
            return false;
        }
        int next = idx + node.getLabel().length();
        if (next == word.length()) {
            if (!node.isTerminal()) {
                return false;
            }
            node.setTerminal(false);
        } else if (!remove(node, word, next)) {
            return false;
        }
        compact(parent, node);
        return true;
    }

    private void compact(RadixNode parent, RadixNode node) {
        if (node.isTerminal()) {
            return;
        }
        if (node.isLeaf()) {
            parent.removeChild(node.getLabel().charAt(0));
        } else if (node.getChildren().size() == 1) {
            node.mergeWithOnlyChild();
        }
    }

    /**
     * Suffixes that turn {@code prefix} into a stored word. The prefix itself is
     * never reported, so every suffix is non-empty.
     */
    public List<String> complete(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        List<String> list = new ArrayList<>();
        RadixNode node = root;
        String lead = "";
        int idx = 0;
        while (idx < prefix.length()) {
            RadixNode child = node.getChild(prefix.charAt(idx));
            if (child == null) {
                return list;
            }
            String label = child.getLabel();
            int common = commonPrefixLength(label, prefix, idx);
            node = child;
            if (common < label.length()) {
                if (idx + common < prefix.length()) {
                    return list;
                }
                lead = label.substring(common);
                break;
            }
            idx += common;
        }
        if (!lead.isEmpty() && node.isTerminal()) {
            list.add(lead);
        }
        suggestHelper(node, list, new StringBuilder(lead));
        return list;
    }

    private void suggestHelper(RadixNode node, List<String> list, StringBuilder curr) {
        for (RadixNode child : node.childNodes()) {
            curr.append(child.getLabel());
            if (child.isTerminal()) {
                list.add(curr.toString());
            }
            suggestHelper(child, list, curr);
            curr.setLength(curr.length() - child.getLabel().length());
        }
    }

    public List<String> words() {
        List<String> list = new ArrayList<>();
        if (root.isTerminal()) {
            list.add("");
        }
        suggestHelper(root, list, new StringBuilder());
        return list;
    }

    public void render(String mode, Appendable sink) {
        render(RenderMode.fromString(mode), sink);
    }

    public void render(RenderMode mode, Appendable sink) {
        if (mode == null) {
            throw new IllegalArgumentException("Render mode must not be null");
        }
        Objects.requireNonNull(sink, "sink");
        try {
            switch (mode) {
                case LIST:
                    for (String word : words()) {
                        sink.append(word).append('\n');
                    }
                    break;
                case TREE:
                    printTree(root, 1, sink);
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported render mode " + mode);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render trie", e);
        }
    }

    private void printTree(RadixNode node, int depth, Appendable sink) throws IOException {
        sink.append("#".repeat(depth)).append(' ').append(node.getLabel());
        if (node.isTerminal()) {
            sink.append(" *");
        }
        sink.append('\n');
        for (RadixNode child : node.childNodes()) {
            printTree(child, depth + 1, sink);
        }
    }

    /** Number of nodes below the root. */
    public int getTrieSize() {
        return countNodes(root) - 1;
    }

    public int getWordCount() {
        return words().size();
    }

    public boolean isEmpty() {
        return root.isLeaf() && !root.isTerminal();
    }

    private int countNodes(RadixNode node) {
        int count = 1;
        for (RadixNode child : node.childNodes()) {
            count += countNodes(child);
        }
        return count;
    }

    /**
     * Checks that the trie holds exactly {@code expected} and that its structure
     * is sound.
     */
    public boolean verify(Collection<String> expected) {
        try {
            checkInvariants();
        } catch (IllegalStateException e) {
            log.warn("trie structure is corrupt: {}", e.getMessage());
            return false;
        }
        Set<String> actual = new HashSet<>(words());
        if (!actual.equals(new HashSet<>(expected))) {
            log.warn("trie holds {} words, expected {}", actual.size(), new HashSet<>(expected).size());
            return false;
        }
        return true;
    }

    /**
     * @throws IllegalStateException naming the first node that breaks a structural invariant.
     */
    public void checkInvariants() {
        if (!root.getLabel().isEmpty()) {
            throw new IllegalStateException("root carries label '" + root.getLabel() + "'");
        }
        checkChildren(root, new StringBuilder());
    }

    private void checkChildren(RadixNode node, StringBuilder path) {
        for (Map.Entry<Character, RadixNode> entry : node.getChildren().entrySet()) {
            RadixNode child = entry.getValue();
            String label = child.getLabel();
            if (label == null || label.isEmpty()) {
                throw new IllegalStateException("empty label below '" + path + "'");
            }
            if (entry.getKey() != label.charAt(0)) {
                throw new IllegalStateException("label '" + label + "' below '" + path + "' filed under '" + entry.getKey() + "'");
            }
            path.append(label);
            if (!child.isTerminal() && child.getChildren().size() < 2) {
                throw new IllegalStateException("uncompacted node at '" + path + "' with " + child.getChildren().size() + " children");
            }
            checkChildren(child, path);
            path.setLength(path.length() - label.length());
        }
    }

    private boolean invariantsHold() {
        checkInvariants();
        return true;
    }

    private static int commonPrefixLength(String label, String word, int offset) {
        int max = Math.min(label.length(), word.length() - offset);
        int i = 0;
        while (i < max && label.charAt(i) == word.charAt(offset + i)) {
            i++;
        }
        return i;
    }
}
