package com.coursecatalog.scraper;

import java.util.List;

/**
 * Central registry of the listing columns, in the order the catalog prints them.
 * ColumnIndex, SectionParser and the header detection all read from here.
 */
public final class ColumnFieldRegistry {
    private ColumnFieldRegistry() {}

    public static final String NUMBER = "number";
    public static final String SECTION = "section";
    public static final String CALL_NUMBER = "callNumber";
    public static final String POINTS = "points";
    public static final String TITLE = "title";
    public static final String DAY = "day";
    public static final String TIME = "time";
    public static final String ROOM = "room";
    public static final String BUILDING = "building";
    public static final String FACULTY = "faculty";

    // Declaration order matters: slices are assigned left to right.
    private static final List<ColumnField> FIELDS = List.of(
        new ColumnField(NUMBER, "Number"),
        new ColumnField(SECTION, "Sec"),
        new ColumnField(CALL_NUMBER, "Call#"),
        new ColumnField(POINTS, "Pts"),
        new ColumnField(TITLE, "Title"),
        new ColumnField(DAY, "Day"),
        new ColumnField(TIME, "Time"),
        new ColumnField(ROOM, "Room"),
        new ColumnField(BUILDING, "Building"),
        new ColumnField(FACULTY, "Faculty")
    );

    // A header line must carry all of these labels.
    private static final List<String> REQUIRED_HEADER_LABELS = List.of("Number", "Call#", "Faculty");

    /**
     * Returns the list of all listing columns.
     */
    public static List<ColumnField> getFields() {
        return FIELDS;
    }

    /**
     * Returns the ColumnField for a given field name, or null if not found.
     */
    public static ColumnField getField(String name) {
        for (ColumnField f : FIELDS) if (f.fieldName.equals(name)) return f;
        return null;
    }

    public static List<String> getRequiredHeaderLabels() {
        return REQUIRED_HEADER_LABELS;
    }
}
