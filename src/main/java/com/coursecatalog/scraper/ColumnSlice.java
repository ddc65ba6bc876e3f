package com.coursecatalog.scraper;

/**
 * Half-open character range {@code [start, end)} bound to one listing column.
 * The last column of a header runs to end-of-line, encoded as {@link #END_OF_LINE}.
 */
public record ColumnSlice(String fieldName, int start, int end) {
    public static final int END_OF_LINE = Integer.MAX_VALUE;

    public ColumnSlice {
        if (fieldName == null || fieldName.isBlank()) {
            throw new IllegalArgumentException("fieldName cannot be null or blank");
        }
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid slice [" + start + ", " + end + ") for " + fieldName);
        }
    }

    /**
     * Cuts this column out of a data line, clamped to the line length.
     * @param line Raw listing line (may be null)
     * @return Trimmed cell text, or "" when the line ends before the column
     */
    public String extract(String line) {
        return raw(line).trim();
    }

    /**
     * Same as {@link #extract(String)} without trimming.
     */
    public String raw(String line) {
        if (line == null || start >= line.length()) return "";
        int stop = Math.min(end, line.length());
        return line.substring(start, stop);
    }

    public boolean isOpenEnded() {
        return end == END_OF_LINE;
    }
}
