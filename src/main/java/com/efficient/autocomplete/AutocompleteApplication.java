package com.efficient.autocomplete;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AutocompleteApplication {
	public static void main(String[] args) {
		SpringApplication.run(AutocompleteApplication.class, args);
	}

}
