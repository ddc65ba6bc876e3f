package com.coursecatalog.scraper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Utility class for JSON output and file helpers.
 *
 * @author Course Catalog Scraper Team
 * @since 1.0
 */
public class Utils {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .enable(SerializationFeature.INDENT_OUTPUT);

    private Utils() {
    }

    /**
     * Serializes sections to JSON with snake_case keys in declaration order.
     * @param sections Records to write
     * @return JSON array text
     */
    public static String toJson(List<SectionRecord> sections) {
        try {
            return MAPPER.writeValueAsString(sections);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize sections", e);
        }
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Reads a listing file as UTF-8.
     * @param path File path
     * @return File content
     * @throws IOException if the file cannot be read
     */
    public static String readListing(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    /**
     * Normalizes a subject code: trimmed, upper case.
     * @param subject Raw subject argument
     * @return Subject code, or "" for null
     */
    public static String normalizeSubject(String subject) {
        return subject == null ? "" : subject.trim().toUpperCase(Locale.ROOT);
    }
}
