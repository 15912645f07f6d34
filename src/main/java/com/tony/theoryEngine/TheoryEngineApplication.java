package com.tony.theoryEngine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TheoryEngineApplication {

	public static void main(String[] args) {
		SpringApplication.run(TheoryEngineApplication.class, args);
	}

}
