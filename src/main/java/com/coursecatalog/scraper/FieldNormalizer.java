package com.coursecatalog.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalization of single listing fields: day tokens, room/building pairs and course points.
 * <p>
 * Every method is a pure function of its arguments. Inputs that cannot be normalized with
 * confidence come back as null (or an empty day list) rather than as a guess.
 *
 * @author Course Catalog Scraper Team
 * @since 1.0
 */
public class FieldNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(FieldNormalizer.class);

    public static final List<String> CANONICAL_DAYS = List.of("Mon", "Tue", "Wed", "Thu", "Fri", "Sat", "Sun");

    // Two-letter tokens are consulted before single letters so "Tu" never splits into "T" + "u".
    private static final Map<String, String> TWO_LETTER_DAYS = Map.of(
        "Tu", "Tue",
        "Th", "Thu",
        "Su", "Sun",
        "Sa", "Sat"
    );
    private static final Map<Character, String> ONE_LETTER_DAYS = Map.of(
        'M', "Mon",
        'T', "Tue",
        'W', "Wed",
        'R', "Thu",
        'F', "Fri",
        'S', "Sat",
        'U', "Sun"
    );

    private static final Pattern CREDITS = Pattern.compile(
        "(?i)^(\\d+(?:\\.\\d+)?)(?:\\s*(?:-|–|to)\\s*(\\d+(?:\\.\\d+)?))?$");

    /**
     * Outcome of {@link #classifyLocation(String, String)}.
     */
    public enum LocationFix {
        /** Nothing to repair. */
        NONE,
        /** "To be" + "announced" joined into the canonical phrase. */
        ANNOUNCED_LATER,
        /** A single trailing capital moved from the room to the building. */
        LETTER_DRIFT,
        /** Looks like drift of more than one letter; left as is. */
        UNRESOLVED_DRIFT
    }

    /**
     * Expands a compact day token ({@code MWF}, {@code TuTh}, {@code MTWRF}) into canonical day names.
     * @param token Day column text (may be null)
     * @return Distinct day names in order of first occurrence; unknown characters are skipped
     */
    public List<String> canonicalizeDays(String token) {
        if (token == null || token.isBlank()) return List.of();
        Set<String> days = new LinkedHashSet<>();
        String s = token.trim();
        int i = 0;
        while (i < s.length()) {
            if (i + 1 < s.length()) {
                String pair = TWO_LETTER_DAYS.get(s.substring(i, i + 2));
                if (pair != null) {
                    days.add(pair);
                    i += 2;
                    continue;
                }
            }
            String single = ONE_LETTER_DAYS.get(s.charAt(i));
            if (single != null) {
                days.add(single);
            } else if (!Character.isWhitespace(s.charAt(i))) {
                logger.debug("Ignoring unrecognised day character '{}' in '{}'", s.charAt(i), token);
            }
            i++;
        }
        return List.copyOf(days);
    }

    /**
     * Repairs the room/building pair cut from a listing line.
     * <ul>
     *   <li>Room "To be" with a building mentioning "announced" becomes (null, "To be announced").</li>
     *   <li>Otherwise a lone trailing capital on the room is moved to a building that starts in
     *   lower case: ("620 K", "ravis Hall") becomes ("620", "Kravis Hall").</li>
     * </ul>
     * @param room Room column text (may be null)
     * @param building Building column text (may be null)
     * @return Location with blank values turned into null
     */
    public Location repairLocation(String room, String building) {
        String r = blankToNull(room);
        String b = blankToNull(building);
        switch (classifyLocation(r, b)) {
            case ANNOUNCED_LATER:
                return Location.announcedLater();
            case LETTER_DRIFT:
                char drifted = r.charAt(r.length() - 1);
                String shortened = r.substring(0, r.length() - 1).stripTrailing();
                logger.debug("Moved '{}' from room '{}' to building '{}'", drifted, r, b);
                return new Location(blankToNull(shortened), drifted + b);
            default:
                return new Location(r, b);
        }
    }

    /**
     * Decides which location rule applies, without changing anything. Rules are exclusive:
     * the announced-later join wins over letter drift.
     */
    public LocationFix classifyLocation(String room, String building) {
        String r = blankToNull(room);
        String b = blankToNull(building);
        if (r != null && r.equalsIgnoreCase("To be") && b != null && b.toLowerCase(Locale.ROOT).contains("announced")) {
            return LocationFix.ANNOUNCED_LATER;
        }
        if (r == null && b != null && b.equalsIgnoreCase(Location.ANNOUNCED_LATER)) {
            return LocationFix.ANNOUNCED_LATER;
        }
        if (r == null || b == null || !Character.isLowerCase(b.charAt(0))) {
            return LocationFix.NONE;
        }
        int last = r.length() - 1;
        if (!Character.isUpperCase(r.charAt(last))) {
            return LocationFix.NONE;
        }
        if (last == 0 || Character.isWhitespace(r.charAt(last - 1))) {
            return LocationFix.LETTER_DRIFT;
        }
        if (Character.isUpperCase(r.charAt(last - 1)) && (last == 1 || Character.isWhitespace(r.charAt(last - 2)))) {
            return LocationFix.UNRESOLVED_DRIFT;
        }
        return LocationFix.NONE;
    }

    /**
     * Parses the points column: {@code 3}, {@code 3.00}, {@code 1-3}, {@code 1 to 4}.
     * @param points Points column text (may be null)
     * @return Credits, or null when the text is empty or not a number/range
     */
    public Credits parseCredits(String points) {
        if (points == null || points.isBlank()) return null;
        Matcher m = CREDITS.matcher(points.trim());
        if (!m.matches()) {
            logger.debug("Unparseable points value '{}'", points);
            return null;
        }
        double min = Double.parseDouble(m.group(1));
        if (m.group(2) == null) return Credits.fixed(min);
        double max = Double.parseDouble(m.group(2));
        return max < min ? null : new Credits(min, max);
    }

    private static String blankToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
