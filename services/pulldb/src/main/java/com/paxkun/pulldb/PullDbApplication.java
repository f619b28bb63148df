package com.paxkun.pulldb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * PullDB Application Entry Point
 *
 * Spring Boot application for the subscription and pull ledger service.
 */
@SpringBootApplication
public class PullDbApplication {
    public static void main(String[] args) {
        SpringApplication.run(PullDbApplication.class, args);
    }
}
