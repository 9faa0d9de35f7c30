package com.logcount;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LogCountApplication {

    private static final Logger log = LoggerFactory.getLogger(LogCountApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(LogCountApplication.class, args);
        log.info("Log Count Cache Service started.");
        log.info("Counts API:   GET  http://localhost:8080/counts?query=status:error&from=<epoch ms>&to=<epoch ms>");
        log.info("Batch API:    POST http://localhost:8080/query");
        log.info("Status:       GET  http://localhost:8080/status");
        log.info("Health:       GET  http://localhost:8080/actuator/health");
    }
}
