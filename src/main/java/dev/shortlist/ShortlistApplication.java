package dev.shortlist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Shortlist retrieval engine.
 *
 * <p>Starts the Spring context holding the embedding model, the cross-encoder, the document store
 * and the {@link dev.shortlist.search.RetrievalService} used to open retrieval sessions.
 */
@SpringBootApplication
public class ShortlistApplication {
    public static void main(String[] args) {
        SpringApplication.run(ShortlistApplication.class, args);
    }
}
