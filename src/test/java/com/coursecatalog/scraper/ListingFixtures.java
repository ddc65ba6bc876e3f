package com.coursecatalog.scraper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads listing pages from src/test/resources/listings.
 */
final class ListingFixtures {
    static final String TERM = "Fall 2025";

    private ListingFixtures() {}

    static String read(String name) {
        try (InputStream in = ListingFixtures.class.getResourceAsStream("/listings/" + name)) {
            if (in == null) throw new IllegalStateException("Missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
