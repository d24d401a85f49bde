package com.vidnyan.codegraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * CodeGraph - graph analysis engine for codebases.
 * 
 * Builds call, dependency and inheritance graphs from extracted
 * relationships and reports centrality, cycles, coupling and structure.
 */
@SpringBootApplication
public class CodeGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeGraphApplication.class, args);
    }
}
