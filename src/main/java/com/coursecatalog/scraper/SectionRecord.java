package com.coursecatalog.scraper;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Immutable record representing one normalized course section of a subject listing.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Built by {@link SectionParser} from one accepted listing line, with the instructor possibly
 *   extended by a wrapped continuation line.</li>
 *   <li>Replaced exactly once by {@link RecitationLinker}, which resolves {@code recitation} and
 *   {@code parentCourseCode} through {@link #withLinkage(boolean, String)}.</li>
 *   <li>Handed read-only to consumers afterwards.</li>
 * </ul>
 * Schedule and location fields use null for "unknown / to be announced", never "".
 * When the location is announced later, {@code room} is null and {@code building} is
 * {@value Location#ANNOUNCED_LATER}. The {@code component} property is derived, see {@link Component}.
 *
 * @author Course Catalog Scraper Team
 * @since 1.0
 */
@JsonPropertyOrder({
    "subject", "courseNumber", "courseCode", "section", "callNumber", "term", "title", "credits",
    "days", "startTime", "endTime", "room", "building", "instructor", "component", "recitation",
    "parentCourseCode", "detailUrl"
})
public record SectionRecord(
    String subject,
    String courseNumber,
    String courseCode,
    String section,
    Integer callNumber,
    String term,
    String title,
    Credits credits,
    List<String> days,
    String startTime,
    String endTime,
    String room,
    String building,
    String instructor,
    boolean recitation,
    String parentCourseCode,
    String detailUrl
) {
    public SectionRecord {
        days = days == null ? List.of() : List.copyOf(days);
        instructor = instructor == null ? "" : instructor;
    }

    @JsonProperty("component")
    public Component component() {
        return Component.classify(section, credits, title);
    }

    /**
     * Returns a copy carrying the recitation resolution.
     * @param isRecitation whether the section was flagged as a recitation
     * @param parent parent lecture course code, or null when unlinked
     * @return New SectionRecord
     */
    public SectionRecord withLinkage(boolean isRecitation, String parent) {
        return new SectionRecord(subject, courseNumber, courseCode, section, callNumber, term, title, credits,
            days, startTime, endTime, room, building, instructor, isRecitation, parent, detailUrl);
    }
}
