package com.efficient.autocomplete.service;


import com.efficient.autocomplete.util.MatchType;
import com.efficient.autocomplete.util.RadixTrieDataStore;
import com.efficient.autocomplete.util.RenderMode;
import com.efficient.autocomplete.util.TrieMatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import java.util.List;
import java.util.Optional;

/**
 * Serializes every access to the shared {@link RadixTrieDataStore}: the trie
 * compacts itself during insert and remove and cannot tolerate interleaved
 * mutation.
 */
@Service
@Slf4j
public class TrieService {
    @Value("${common.word.list}")
    List<String> wordList;

    @Value("${data.load.size}")
    Integer dataLoadSize;

    @Value("${radix.verify.on.load:false}")
    boolean verifyOnLoad;

    @Autowired
    private RadixTrieDataStore trieDataStore;

    /**
     * Loads the first {@code data.load.size} words of the configured starter list
     * so completions are available right after startup. With
     * {@code radix.verify.on.load} the resulting trie is checked against the
     * loaded words.
     */
    @PostConstruct
    public synchronized void loadStarterData() {
        List<String> starterWords = starterWords();
        trieDataStore.loadData(starterWords);
        log.info("loaded {} starter words into {} trie nodes", starterWords.size(), trieDataStore.getTrieSize());
        if (verifyOnLoad) {
            if (trieDataStore.verify(starterWords)) {
                log.info("starter trie verified");
            } else {
                log.error("starter trie does not match the configured word list");
            }
        }
    }

    List<String> starterWords() {
        int size = Math.max(0, Math.min(dataLoadSize, wordList.size()));
        return wordList.subList(0, size);
    }

    public synchronized void insertWord(String word) {
        trieDataStore.insert(word);
    }

    public synchronized boolean removeWord(String word) {
        return trieDataStore.remove(word);
    }

    public synchronized Optional<TrieMatch> find(String query, boolean allowPartial) {
        return trieDataStore.find(query, allowPartial);
    }

    public synchronized MatchType classify(String query, boolean allowPartial) {
        return find(query, allowPartial).map(TrieMatch::getType).orElse(MatchType.NOT_FOUND);
    }

    public synchronized List<String> complete(String prefix) {
        return trieDataStore.complete(prefix);
    }

    /**
     * @throws IllegalArgumentException if {@code mode} is not a known {@link RenderMode}.
     */
    public synchronized String render(String mode) {
        StringBuilder sb = new StringBuilder();
        trieDataStore.render(mode, sb);
        return sb.toString();
    }

    public synchronized int getTrieSize() {
        return trieDataStore.getTrieSize();
    }

    public synchronized int getWordCount() {
        return trieDataStore.getWordCount();
    }

    public synchronized void reset() {
        trieDataStore.reset();
        log.info("trie reset");
    }

    /**
     * Replaces the trie content with {@code words} and returns the list and tree
     * renderings of the result.
     */
    public synchronized String runDemo(List<String> words) {
        trieDataStore.loadData(words);
        log.info("demo loaded {} inserts, {} distinct words in {} nodes",
                words.size(), trieDataStore.getWordCount(), trieDataStore.getTrieSize());
        StringBuilder sb = new StringBuilder();
        trieDataStore.render(RenderMode.LIST, sb);
        sb.append('\n');
        trieDataStore.render(RenderMode.TREE, sb);
        return sb.toString();
    }
}
