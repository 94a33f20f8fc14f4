package com.dcruver.promptloom;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the PromptLoom tag index.
 *
 * Scans a prompt library of text files into a weighted tag index and answers tag searches,
 * suggestions and color lookups from a shell.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class PromptLoomIndexApplication {

    public static void main(String[] args) {
        log.info("Starting PromptLoom tag index...");
        SpringApplication.run(PromptLoomIndexApplication.class, args);
    }
}
