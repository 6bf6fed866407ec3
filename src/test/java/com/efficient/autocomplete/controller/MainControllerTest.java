package com.efficient.autocomplete.controller;

import com.efficient.autocomplete.service.TrieService;
import com.efficient.autocomplete.util.MatchType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Arrays;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MainController.class)
class MainControllerTest {
    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TrieService trieService;

    @Test
    void insertsWord() throws Exception {
        mockMvc.perform(post("/radix-trie/words").param("word", "carton"))
                .andExpect(status().isOk())
                .andExpect(content().string("SUCCESS\n"));

        verify(trieService).insertWord("carton");
    }

    @Test
    void insertWithoutParameterUsesEmptyWord() throws Exception {
        mockMvc.perform(post("/radix-trie/words"))
                .andExpect(status().isOk());

        verify(trieService).insertWord("");
    }

    @Test
    void removeReportsAbsentWordAsNotFound() throws Exception {
        when(trieService.removeWord("car")).thenReturn(true);
        when(trieService.removeWord("cat")).thenReturn(false);

        mockMvc.perform(delete("/radix-trie/words").param("word", "car"))
                .andExpect(status().isOk())
                .andExpect(content().string("REMOVED\n"));
        mockMvc.perform(delete("/radix-trie/words").param("word", "cat"))
                .andExpect(status().isNotFound())
                .andExpect(content().string("NOT PRESENT\n"));
    }

    @Test
    void findPassesPartialFlag() throws Exception {
        when(trieService.classify("ca", true)).thenReturn(MatchType.PREFIX);
        when(trieService.classify("ca", false)).thenReturn(MatchType.NOT_FOUND);

        mockMvc.perform(get("/radix-trie/find").param("query", "ca").param("partial", "true"))
                .andExpect(status().isOk())
                .andExpect(content().string("PREFIX\n"));
        mockMvc.perform(get("/radix-trie/find").param("query", "ca"))
                .andExpect(status().isOk())
                .andExpect(content().string("NOT_FOUND\n"));
    }

    @Test
    void completesPrefix() throws Exception {
        when(trieService.complete("car")).thenReturn(Arrays.asList("t", "ve"));

        mockMvc.perform(get("/radix-trie/complete").param("prefix", "car"))
                .andExpect(status().isOk())
                .andExpect(content().string("[t, ve]\n"));
    }

    @Test
    void unknownRenderModeIsBadRequest() throws Exception {
        when(trieService.render("graph")).thenThrow(new IllegalArgumentException("Unknown render mode 'graph'"));
        when(trieService.render("list")).thenReturn("car\n");

        mockMvc.perform(get("/radix-trie/render/graph"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/radix-trie/render/list"))
                .andExpect(status().isOk())
                .andExpect(content().string("car\n"));
    }

    @Test
    void unexpectedFailureIsServerError() throws Exception {
        when(trieService.complete(anyString())).thenThrow(new IllegalStateException("corrupt"));

        mockMvc.perform(get("/radix-trie/complete").param("prefix", "x"))
                .andExpect(status().isInternalServerError())
                .andExpect(content().string("Error"));
    }

    @Test
    void runDemoReplaysDemoWords() throws Exception {
        when(trieService.runDemo(MainController.DEMO_WORDS)).thenReturn("demo");

        mockMvc.perform(get("/radix-trie/test/runDemo"))
                .andExpect(status().isOk())
                .andExpect(content().string("demo"));
    }

    @Test
    void reportsSize() throws Exception {
        when(trieService.getTrieSize()).thenReturn(12);
        when(trieService.getWordCount()).thenReturn(8);

        mockMvc.perform(get("/radix-trie/size"))
                .andExpect(status().isOk())
                .andExpect(content().string("nodes=12 words=8\n"));
    }
}
