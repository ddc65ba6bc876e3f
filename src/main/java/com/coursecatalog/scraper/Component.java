package com.coursecatalog.scraper;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Kind of meeting a section represents.
 * <p>
 * Derived from the row alone: {@code R} sections and zero-point sections are recitations,
 * {@code L} sections and titles naming a lab are labs, everything else is a lecture.
 */
public enum Component {
    LECTURE, RECITATION, LAB;

    private static final Pattern RECITATION_SECTION = Pattern.compile("(?i)R\\d+");
    private static final Pattern LAB_SECTION = Pattern.compile("(?i)L\\d+");
    private static final Pattern LAB_TITLE = Pattern.compile("(?i)\\bLAB(?:ORATORY)?\\b");

    public static Component classify(String section, Credits credits, String title) {
        String sec = section == null ? "" : section.trim();
        if (RECITATION_SECTION.matcher(sec).matches()) return RECITATION;
        if (credits != null && credits.isZero()) return RECITATION;
        if (LAB_SECTION.matcher(sec).matches()) return LAB;
        if (title != null && LAB_TITLE.matcher(title).find()) return LAB;
        return LECTURE;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
