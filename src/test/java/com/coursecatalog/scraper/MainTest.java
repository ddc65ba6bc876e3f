package com.coursecatalog.scraper;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Command-line argument handling, listing loading and JSON output.
 */
public class MainTest {

    @Test
    void testParseArguments() {
        Main.Arguments args = Main.Arguments.parse(new String[]{"coms", "Fall 2025", "a.txt", "--offline", "b.html"});
        assertEquals("COMS", args.subject());
        assertEquals("Fall 2025", args.term());
        assertEquals(List.of(Path.of("a.txt"), Path.of("b.html")), args.files());
        assertTrue(args.offline());
    }

    @Test
    void testParseArgumentsRejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> Main.Arguments.parse(new String[]{"COMS"}));
        assertThrows(IllegalArgumentException.class, () -> Main.Arguments.parse(new String[]{"COMS", "Fall 2025", "--offline"}));
        assertThrows(IllegalArgumentException.class, () -> Main.Arguments.parse(null));
    }

    @Test
    void testLoadPagesFromFiles(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("coms.txt");
        Files.writeString(file, ListingFixtures.read("coms_fall2025.txt"), StandardCharsets.UTF_8);
        Main.Arguments args = Main.Arguments.parse(new String[]{"COMS", "Fall 2025", file.toString()});
        List<ListingPage> pages = Main.loadPages(args, null, new CatalogUrls(CatalogConfig.DEFAULT_BASE_URL));
        assertEquals(1, pages.size());
        assertEquals("COMS Fall 2025", pages.get(0).pageId());
    }

    @Test
    void testLoadPagesDownloadsListing() throws IOException {
        RecitationLinkerTest.FakeFetcher fetcher = new RecitationLinkerTest.FakeFetcher();
        String url = "https://doc.sis.columbia.edu/subj/COMS/_Fall2025_text.html";
        fetcher.pages.put(url, ListingFixtures.read("coms_fall2025.html"));
        Main.Arguments args = Main.Arguments.parse(new String[]{"COMS", "Fall 2025"});
        List<ListingPage> pages = Main.loadPages(args, fetcher, new CatalogUrls(CatalogConfig.DEFAULT_BASE_URL));
        assertEquals(List.of(url), fetcher.requested);
        assertTrue(pages.get(0).text().contains("<pre>"));
    }

    @Test
    void testJsonUsesSnakeCaseInRecordOrder() throws Exception {
        SectionRecord r = new SectionRecord("COMS", "3134", "COMS3134", "001", 10234, "Fall 2025", "DATA STRUCTURES",
            Credits.fixed(3), List.of("Mon", "Wed"), "13:10", "14:25", null, Location.ANNOUNCED_LATER, "Blaer, Paul",
            false, null, null);
        String json = Utils.toJson(List.of(r));
        assertTrue(json.contains("\"course_code\" : \"COMS3134\""));
        assertTrue(json.contains("\"parent_course_code\" : null"));
        assertTrue(json.indexOf("\"subject\"") < json.indexOf("\"course_number\""));
        assertTrue(json.indexOf("\"start_time\"") < json.indexOf("\"end_time\""));
        assertFalse(json.contains("zero"));
        assertTrue(json.contains("\"component\" : \"lecture\""));
        assertTrue(json.indexOf("\"instructor\"") < json.indexOf("\"component\""));
        assertTrue(json.indexOf("\"component\"") < json.indexOf("\"recitation\""));
        assertEquals("Blaer, Paul", Utils.mapper().readTree(json).get(0).get("instructor").asText());
    }
}
