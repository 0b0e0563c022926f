package com.journalengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Journal Engine.
 *
 * Journal Engine applies sparse, partial updates to double-entry ledger journals
 * while keeping the two legs of every journal balanced and consistent with the
 * journal's transaction type.
 */
@SpringBootApplication
public class JournalEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(JournalEngineApplication.class, args);
    }
}
