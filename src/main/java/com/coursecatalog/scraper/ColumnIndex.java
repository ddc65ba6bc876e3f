package com.coursecatalog.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Fixed character-offset slices for the listing columns, derived once per page from its header line.
 * <p>
 * Each recognised label starts a slice at its offset in the header; the slice ends where the next
 * recognised label starts, and the last one runs to end-of-line. Labels are searched left to right
 * in registry order, so slices never overlap and their offsets never decrease.
 *
 * @author Course Catalog Scraper Team
 * @since 1.0
 */
public final class ColumnIndex {
    private static final Logger logger = LoggerFactory.getLogger(ColumnIndex.class);

    private final Map<String, ColumnSlice> slices;

    private ColumnIndex(Map<String, ColumnSlice> slices) {
        this.slices = Collections.unmodifiableMap(slices);
    }

    /**
     * Finds the header line of a page: the first line carrying every required label.
     * @param pageId Identifier used in the error message (subject/term, file name)
     * @param lines Page lines in source order
     * @return Index of the header line
     * @throws MalformedPageException if no line qualifies
     */
    public static int locateHeader(String pageId, List<String> lines) throws MalformedPageException {
        if (lines == null) {
            throw new MalformedPageException(pageId, "Listing page " + pageId + " has no content");
        }
        for (int i = 0; i < lines.size(); i++) {
            if (isHeaderLine(lines.get(i))) {
                logger.debug("Header for {} found at line {}", pageId, i + 1);
                return i;
            }
        }
        throw new MalformedPageException(pageId,
            "Listing page " + pageId + " has no header line with " + ColumnFieldRegistry.getRequiredHeaderLabels());
    }

    public static boolean isHeaderLine(String line) {
        if (line == null) return false;
        for (String label : ColumnFieldRegistry.getRequiredHeaderLabels()) {
            if (!line.contains(label)) return false;
        }
        return true;
    }

    /**
     * Builds the slice map from a header line.
     * @param header Header line (must contain the required labels)
     * @return ColumnIndex for every label found in the header
     */
    public static ColumnIndex fromHeader(String header) {
        if (!isHeaderLine(header)) {
            throw new IllegalArgumentException("Not a listing header: " + header);
        }
        List<ColumnField> found = new ArrayList<>();
        List<Integer> offsets = new ArrayList<>();
        int cursor = 0;
        for (ColumnField field : ColumnFieldRegistry.getFields()) {
            int at = header.indexOf(field.label, cursor);
            if (at < 0) {
                logger.debug("Header has no '{}' column", field.label);
                continue;
            }
            found.add(field);
            offsets.add(at);
            cursor = at + field.label.length();
        }
        Map<String, ColumnSlice> slices = new LinkedHashMap<>();
        for (int i = 0; i < found.size(); i++) {
            int start = offsets.get(i);
            int end = i + 1 < found.size() ? offsets.get(i + 1) : ColumnSlice.END_OF_LINE;
            slices.put(found.get(i).fieldName, new ColumnSlice(found.get(i).fieldName, start, end));
        }
        return new ColumnIndex(slices);
    }

    public Optional<ColumnSlice> slice(String fieldName) {
        return Optional.ofNullable(slices.get(fieldName));
    }

    /**
     * Cell text of a column for the given line; "" when the column is absent from the header.
     * @throws IllegalArgumentException if {@code fieldName} is not a listing column
     */
    public String extract(String line, String fieldName) {
        if (ColumnFieldRegistry.getField(fieldName) == null) {
            throw new IllegalArgumentException("Unknown column '" + fieldName + "'");
        }
        ColumnSlice s = slices.get(fieldName);
        return s == null ? "" : s.extract(line);
    }

    public boolean has(String fieldName) {
        return slices.containsKey(fieldName);
    }

    public Map<String, ColumnSlice> asMap() {
        return slices;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnIndex)) return false;
        return slices.equals(((ColumnIndex) o).slices);
    }

    @Override
    public int hashCode() {
        return slices.hashCode();
    }

    @Override
    public String toString() {
        return "ColumnIndex" + slices.values();
    }
}
