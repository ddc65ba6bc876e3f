package com.coursecatalog.scraper;

/**
 * Gate deciding whether a sliced listing line is a real course row.
 * <p>
 * A row needs a title and at least one identifying field: a course number, a section, or a
 * numeric call number. Department banners and stray footer lines fill the title slice but carry
 * none of those, so they are dropped before any field is repaired.
 */
public final class RowAcceptance {
    private RowAcceptance() {}

    public static boolean accept(String number, String section, String callNumberText, String title) {
        if (isBlank(title)) return false;
        return !isBlank(number) || !isBlank(section) || parseCallNumber(callNumberText) != null;
    }

    public static boolean accept(RawRow row) {
        return row != null && accept(row.number(), row.section(), row.callNumberText(), row.title());
    }

    /**
     * @return The call number as an Integer, or null when the text is not an integer
     */
    public static Integer parseCallNumber(String text) {
        if (isBlank(text)) return null;
        try {
            return Integer.valueOf(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
