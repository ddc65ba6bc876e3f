package com.coursecatalog.scraper;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;

/**
 * Whole-page parsing of the COMS fixture listing.
 */
public class SectionParserTest {
    private final SectionParser parser = new SectionParser(new CatalogUrls("https://doc.sis.columbia.edu/"));

    private PageParseResult parseFixture() throws MalformedPageException {
        return parser.parsePage("COMS", ListingFixtures.TERM, ListingFixtures.read("coms_fall2025.txt"));
    }

    private static final String HEADER =
        "Number  Sec  Call#  Pts   Title                         Day   Time              Room   Building        Faculty";

    private static String row(String number, String sec, String call, String pts, String title, String day,
                              String time, String room, String building, String faculty) {
        return String.format("%-8s%-5s%-7s%-6s%-30s%-6s%-18s%-7s%-16s%s",
            number, sec, call, pts, title, day, time, room, building, faculty).stripTrailing();
    }

    private static SectionRecord find(List<SectionRecord> sections, String number, String section) {
        return sections.stream()
            .filter(s -> number.equals(s.courseNumber()) && section.equals(s.section()))
            .findFirst().orElseThrow();
    }

    @Test
    void testAcceptedRowsInListingOrder() throws MalformedPageException {
        PageParseResult result = parseFixture();
        List<String> keys = new ArrayList<>();
        for (SectionRecord s : result.sections()) keys.add(s.courseCode() + "-" + s.section());
        assertEquals(List.of("COMS3134-001", "COMS3134-R01", "COMS3157-001", "COMS3203-001", "COMS3827-001", "COMS4118-001"), keys);
        assertEquals("COMS Fall 2025", result.pageId());
        assertEquals(6, result.stats().getAcceptedRows());
        assertEquals(1, result.stats().getRejectedRows());
    }

    @Test
    void testLectureFields() throws MalformedPageException {
        SectionRecord lecture = find(parseFixture().sections(), "3134", "001");
        assertEquals("COMS", lecture.subject());
        assertEquals(10234, lecture.callNumber());
        assertEquals("DATA STRUCTURES IN JAVA", lecture.title());
        assertEquals(Credits.fixed(3), lecture.credits());
        assertEquals(List.of("Mon", "Wed"), lecture.days());
        assertEquals("13:10", lecture.startTime());
        assertEquals("14:25", lecture.endTime());
        assertEquals("501", lecture.room());
        assertEquals("Schermerhorn", lecture.building());
        assertEquals("Blaer, Paul", lecture.instructor());
        assertEquals("https://doc.sis.columbia.edu/subj/COMS/3134-20253-001/", lecture.detailUrl());
        assertFalse(lecture.recitation());
        assertNull(lecture.parentCourseCode());
    }

    @Test
    void testWrappedInstructorAndDriftedRoom() throws MalformedPageException {
        PageParseResult result = parseFixture();
        SectionRecord recitation = find(result.sections(), "3134", "R01");
        assertEquals("Lee, Ey", recitation.instructor());
        assertEquals("620", recitation.room());
        assertEquals("Kravis Hall", recitation.building());
        assertEquals(List.of("Fri"), recitation.days());
        assertEquals("10:10", recitation.startTime());
        assertTrue(recitation.credits().isZero());
        assertEquals(1, result.stats().getContinuationMerges());
        assertEquals(1, result.stats().getRepairedLocations());
    }

    @Test
    void testAnnouncedLaterAndTba() throws MalformedPageException {
        PageParseResult result = parseFixture();
        SectionRecord ap = find(result.sections(), "3157", "001");
        assertNull(ap.room());
        assertEquals(Location.ANNOUNCED_LATER, ap.building());
        assertEquals(List.of("Tue", "Thu"), ap.days());
        assertEquals("11:40", ap.startTime());
        assertEquals("12:55", ap.endTime());

        SectionRecord discrete = find(result.sections(), "3203", "001");
        assertNull(discrete.startTime());
        assertNull(discrete.endTime());
        assertNull(discrete.room());
        assertNull(discrete.building());
        assertEquals(1, result.stats().getUnannouncedTimes());
        assertEquals(0, result.stats().getAmbiguousTimes());
        assertEquals(1, result.stats().getAnnouncedLaterLocations());
    }

    @Test
    void testTimeNotationsAfterRepeatedHeader() throws MalformedPageException {
        PageParseResult result = parseFixture();
        SectionRecord systems = find(result.sections(), "3827", "001");
        assertEquals("13:10", systems.startTime());
        assertEquals("14:25", systems.endTime());
        SectionRecord os = find(result.sections(), "4118", "001");
        assertEquals("13:10", os.startTime());
        assertEquals("14:25", os.endTime());
        assertEquals(new Credits(1, 3), os.credits());
    }

    @Test
    void testRoomPlaceholderKeepsColumnTime() throws MalformedPageException {
        String page = String.join("\n", HEADER,
            row("3134", "001", "10234", "3", "DATA STRUCTURES IN JAVA", "F", "1410", "TBA", "Mudd", "Blaer, Paul"));
        PageParseResult result = parser.parsePage("COMS", ListingFixtures.TERM, page);
        SectionRecord s = result.sections().get(0);
        assertEquals("14:10", s.startTime());
        assertEquals("14:10", s.endTime());
        assertEquals(0, result.stats().getUnannouncedTimes());
    }

    @Test
    void testRowsWithoutNumberHaveNoDetailUrl() throws MalformedPageException {
        String page = String.join("\n", HEADER,
            row("", "", "10301", "0", "DATA STRUCTURES RECITATION", "F", "TBA", "", "", "Staff"),
            row("", "", "10302", "0", "DATA STRUCTURES RECITATION", "F", "TBA", "", "", "Staff"));
        List<SectionRecord> sections = parser.parsePage("COMS", ListingFixtures.TERM, page).sections();
        assertEquals(2, sections.size());
        for (SectionRecord s : sections) {
            assertNull(s.courseCode());
            assertNull(s.detailUrl());
        }
        assertEquals(Integer.valueOf(10302), sections.get(1).callNumber());
    }

    @Test
    void testHtmlListingMatchesPlainText() throws MalformedPageException {
        List<SectionRecord> fromText = parseFixture().sections();
        List<SectionRecord> fromHtml = parser.parsePage("COMS", ListingFixtures.TERM,
            ListingFixtures.read("coms_fall2025.html")).sections();
        assertEquals(fromText, fromHtml);
    }

    @Test
    void testMissingHeaderIsMalformed() {
        MalformedPageException e = assertThrows(MalformedPageException.class,
            () -> parser.parsePage("HIST", ListingFixtures.TERM, ListingFixtures.read("no_header.txt")));
        assertEquals("HIST Fall 2025", e.getPageId());
    }

    @Test
    void testBlankSubjectIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> parser.parsePage(" ", ListingFixtures.TERM, "x"));
    }
}
