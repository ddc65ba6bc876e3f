package com.coursecatalog.scraper;

import static com.coursecatalog.scraper.ColumnFieldRegistry.*;

/**
 * One listing line cut into its columns. Cell values are trimmed, never null.
 */
public record RawRow(
    String line,
    String number,
    String section,
    String callNumberText,
    String points,
    String title,
    String day,
    String time,
    String room,
    String building,
    String faculty
) {
    public static RawRow slice(ColumnIndex index, String line) {
        return new RawRow(
            line,
            index.extract(line, NUMBER),
            index.extract(line, SECTION),
            index.extract(line, CALL_NUMBER),
            index.extract(line, POINTS),
            index.extract(line, TITLE),
            index.extract(line, DAY),
            index.extract(line, TIME),
            index.extract(line, ROOM),
            index.extract(line, BUILDING),
            index.extract(line, FACULTY)
        );
    }
}
