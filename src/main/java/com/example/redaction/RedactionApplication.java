package com.example.redaction;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot entry point for the document redaction service.
 */
@SpringBootApplication
public class RedactionApplication {

    public static void main(String[] args) {
        SpringApplication.run(RedactionApplication.class, args);
    }
}
