package dev.mispesos.interpreter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot application entry point for the statement interpretation service.
 */
@SpringBootApplication
@EnableScheduling
public class InterpreterApplication {

    public static void main(String[] args) {
        SpringApplication.run(InterpreterApplication.class, args);
    }
}
