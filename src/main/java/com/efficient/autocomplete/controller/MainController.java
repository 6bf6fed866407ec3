package com.efficient.autocomplete.controller;

import com.efficient.autocomplete.service.TrieService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.List;

@RestController
@RequestMapping("/radix-trie")
@Slf4j
public class MainController {
    // insert order matters: duplicates, the empty word and a blank word are part of the scenario
    static final List<String> DEMO_WORDS = Arrays.asList(
            "helloworld", "cartoon", "cartoon", "band", "application", "-", "abs", "interest", "hello",
            "worldview", "cat", "interested", "absolutismus", "apple", "application", "apple", "apple",
            "world", "interesting", "banana", "super", "car", "absolution", "moon", "absolutely", "app",
            "appreciation", "appreciation", "Berlin", "casio", "applied", "Bratislava", "applied", "bat",
            "intervention", "superman", "", "", "supercalifragilisticexpialidocious", "applying", " ", " ",
            " ", "caterpillar", "superb");

    @Autowired
    private TrieService trieService;

    @CrossOrigin
    @PostMapping("/words")
    public ResponseEntity<?> insertWord(@RequestParam(defaultValue = "") String word) {
        try {
            trieService.insertWord(word);
            return ResponseEntity.status(HttpStatus.OK).body("SUCCESS" + "\n");
        } catch (Exception e) {
            log.error("insert of '{}' failed", word, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Error");
        }
    }

    @CrossOrigin
    @DeleteMapping("/words")
    public ResponseEntity<?> removeWord(@RequestParam(defaultValue = "") String word) {
        try {
            if (trieService.removeWord(word)) {
                return ResponseEntity.status(HttpStatus.OK).body("REMOVED" + "\n");
            }
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("NOT PRESENT" + "\n");
        } catch (Exception e) {
            log.error("remove of '{}' failed", word, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Error");
        }
    }

    @CrossOrigin
    @GetMapping("/find")
    public ResponseEntity<?> find(@RequestParam(defaultValue = "") String query,
                                  @RequestParam(defaultValue = "false") boolean partial) {
        try {
            return ResponseEntity.status(HttpStatus.OK).body(trieService.classify(query, partial) + "\n");
        } catch (Exception e) {
            log.error("find of '{}' failed", query, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Error");
        }
    }

    @CrossOrigin
    @GetMapping("/complete")
    public ResponseEntity<?> complete(@RequestParam(defaultValue = "") String prefix) {
        try {
            return ResponseEntity.status(HttpStatus.OK).body(trieService.complete(prefix) + "\n");
        } catch (Exception e) {
            log.error("completion of '{}' failed", prefix, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Error");
        }
    }

    @CrossOrigin
    @GetMapping("/render/{mode}")
    public ResponseEntity<?> render(@PathVariable String mode) {
        try {
            return ResponseEntity.status(HttpStatus.OK).body(trieService.render(mode));
        } catch (IllegalArgumentException e) {
            log.warn("rejected render request: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(e.getMessage() + "\n");
        } catch (Exception e) {
            log.error("render in mode '{}' failed", mode, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Error");
        }
    }

    @CrossOrigin
    @GetMapping("/size")
    public ResponseEntity<?> size() {
        try {
            log.info("trie datastore size :{}", trieService.getTrieSize());
            return ResponseEntity.status(HttpStatus.OK)
                    .body("nodes=" + trieService.getTrieSize() + " words=" + trieService.getWordCount() + "\n");
        } catch (Exception e) {
            log.error("", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Error");
        }
    }

    @CrossOrigin
    @PostMapping("/reset")
    public ResponseEntity<?> reset() {
        try {
            trieService.reset();
            return ResponseEntity.status(HttpStatus.OK).body("SUCCESS" + "\n");
        } catch (Exception e) {
            log.error("", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Error");
        }
    }

    @CrossOrigin
    @GetMapping("/test/runDemo")
    public ResponseEntity<?> runDemo() {
        try {
            log.info("replaying {} demo inserts", DEMO_WORDS.size());
            return ResponseEntity.status(HttpStatus.OK).body(trieService.runDemo(DEMO_WORDS));
        } catch (Exception e) {
            log.error("", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Error");
        }
    }
}
