package com.coursecatalog.scraper;

/**
 * A section that has been accepted on the current page but not yet handed out.
 * Only the instructor can still change, through {@link ContinuationMerger}.
 */
final class PendingSection {
    private final SectionRecord fields;
    private String instructor;

    PendingSection(SectionRecord fields) {
        this.fields = fields;
        this.instructor = fields.instructor();
    }

    String instructor() {
        return instructor;
    }

    void appendInstructor(String tail) {
        instructor = (instructor.trim() + " " + tail.trim()).trim();
    }

    SectionRecord toRecord() {
        return new SectionRecord(fields.subject(), fields.courseNumber(), fields.courseCode(), fields.section(),
            fields.callNumber(), fields.term(), fields.title(), fields.credits(), fields.days(), fields.startTime(),
            fields.endTime(), fields.room(), fields.building(), instructor, fields.recitation(),
            fields.parentCourseCode(), fields.detailUrl());
    }
}
