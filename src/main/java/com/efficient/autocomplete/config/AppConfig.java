package com.efficient.autocomplete.config;

import com.efficient.autocomplete.util.RadixTrieDataStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {
    @Bean
    public RadixTrieDataStore radixTrieDataStore() {
        return new RadixTrieDataStore();
    }

}
