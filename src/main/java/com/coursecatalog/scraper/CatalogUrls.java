package com.coursecatalog.scraper;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds catalog URLs from subject and term.
 * Every method is deterministic, so callers can cache fetched pages on the returned URL.
 */
public final class CatalogUrls {
    private static final Pattern SEASON_YEAR = Pattern.compile("(?i)^\\s*(spring|summer|fall|autumn)\\s*(\\d{4})\\s*$");
    private static final Pattern YEAR_SEASON = Pattern.compile("(?i)^\\s*(\\d{4})\\s*(spring|summer|fall|autumn)\\s*$");

    private final String baseUrl;

    public CatalogUrls(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Base URL cannot be null or empty");
        }
        this.baseUrl = baseUrl.replaceAll("/+$", "");
    }

    /**
     * "Fall 2025" becomes "Fall2025", the form used in listing URLs.
     */
    public static String urlTerm(String termLabel) {
        return termLabel == null ? "" : termLabel.replaceAll("\\s+", "");
    }

    /**
     * Numeric term code: year followed by 1 (Spring), 2 (Summer) or 3 (Fall).
     * "Fall 2025" gives "20253". Labels in any other shape fall back to {@link #urlTerm(String)}.
     */
    public static String termCode(String termLabel) {
        if (termLabel == null) return "";
        String season;
        String year;
        Matcher m = SEASON_YEAR.matcher(termLabel);
        if (m.matches()) {
            season = m.group(1);
            year = m.group(2);
        } else {
            m = YEAR_SEASON.matcher(termLabel);
            if (!m.matches()) return urlTerm(termLabel);
            year = m.group(1);
            season = m.group(2);
        }
        switch (season.toLowerCase(Locale.ROOT)) {
            case "spring":
                return year + "1";
            case "summer":
                return year + "2";
            default:
                return year + "3";
        }
    }

    /**
     * Plain-text listing of a subject for a term.
     */
    public String listingTextUrl(String subject, String termLabel) {
        return baseUrl + "/subj/" + normalizeSubject(subject) + "/_" + urlTerm(termLabel) + "_text.html";
    }

    /**
     * Detail page of one section: {@code /subj/{SUBJ}/{NUMBER}-{TERMCODE}-{SEC}/}.
     * @return the URL, or null when the course number or section is missing
     */
    public String detailUrl(String subject, String termLabel, String courseNumber, String section) {
        if (courseNumber == null || courseNumber.isBlank() || section == null || section.isBlank()) {
            return null;
        }
        return baseUrl + "/subj/" + normalizeSubject(subject) + "/"
            + courseNumber.replaceAll("\\s+", "").toUpperCase(Locale.ROOT) + "-"
            + termCode(termLabel) + "-"
            + section.replaceAll("\\s+", "").toUpperCase(Locale.ROOT) + "/";
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    private static String normalizeSubject(String subject) {
        return subject == null ? "" : subject.trim().toUpperCase(Locale.ROOT);
    }
}
