package com.paxkun.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 📚 Tracker Application Entry Point
 *
 * Spring Boot application that watches scanlator sites for newly published chapters.
 */
@EnableScheduling
@SpringBootApplication
public class TrackerApplication {
    public static void main(String[] args) {
        SpringApplication.run(TrackerApplication.class, args);
    }
}
