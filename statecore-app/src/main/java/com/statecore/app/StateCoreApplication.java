package com.statecore.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application entry point for the state core.
 */
@SpringBootApplication
@EnableScheduling
@ComponentScan(basePackages = {
    "com.statecore.app",
    "com.statecore.engine"
})
public class StateCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(StateCoreApplication.class, args);
    }
}
