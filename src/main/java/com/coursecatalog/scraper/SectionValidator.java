package com.coursecatalog.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Quality checks over finished section records.
 * <p>
 * Errors mark a record that breaks an output invariant; warnings mark data that is legal but suspicious,
 * such as the {@value #GHOST_TIME} time produced when a stray digit token is read as a clock time.
 *
 * @author Course Catalog Scraper Team
 * @since 1.0
 */
public class SectionValidator {
    private static final Logger logger = LoggerFactory.getLogger(SectionValidator.class);

    static final String GHOST_TIME = "00:10";
    private static final int MAX_LISTED = 10;

    public enum Level { ERROR, WARNING }

    public static class ValidationIssue {
        public final Level level;
        public final String field;
        public final String message;
        public ValidationIssue(Level level, String field, String message) {
            this.level = level;
            this.field = field;
            this.message = message;
        }

        @Override
        public String toString() {
            return level + " " + field + ": " + message;
        }
    }

    /**
     * Checks one record.
     * @param record Section to check
     * @return Issues found, errors first in field order; empty when the record is clean
     */
    public List<ValidationIssue> validate(SectionRecord record) {
        List<ValidationIssue> issues = new ArrayList<>();
        if (record == null) {
            logger.warn("validate called with null record.");
            issues.add(new ValidationIssue(Level.ERROR, "record", "Record is null"));
            return issues;
        }
        requireText(issues, "subject", record.subject());
        requireText(issues, "courseCode", record.courseCode());
        requireText(issues, "section", record.section());
        requireText(issues, "title", record.title());

        for (String day : record.days()) {
            if (!FieldNormalizer.CANONICAL_DAYS.contains(day)) {
                issues.add(new ValidationIssue(Level.ERROR, "days", "Non-canonical day '" + day + "'"));
            }
        }

        if (Location.ANNOUNCED_LATER.equals(record.building()) && record.room() != null) {
            issues.add(new ValidationIssue(Level.ERROR, "room",
                "Room '" + record.room() + "' set although the building is announced later"));
        }

        String start = record.startTime();
        String end = record.endTime();
        if ((start == null) != (end == null)) {
            issues.add(new ValidationIssue(Level.ERROR, "time", "Only one of start/end time is present"));
        } else if (start != null) {
            int s = TimeRange.toMinutes(start);
            int e = TimeRange.toMinutes(end);
            if (s < 0 || e < 0) {
                issues.add(new ValidationIssue(Level.ERROR, "time", "Malformed time " + start + "-" + end));
            } else if (e < s) {
                // equal values are a single meeting time, not a range
                issues.add(new ValidationIssue(Level.ERROR, "time", "End " + end + " is before start " + start));
            }
            if (GHOST_TIME.equals(start) || GHOST_TIME.equals(end)) {
                issues.add(new ValidationIssue(Level.WARNING, "time", "Suspicious " + GHOST_TIME + " time " + start + "-" + end));
            }
        }

        if (record.recitation() && record.parentCourseCode() == null) {
            issues.add(new ValidationIssue(Level.WARNING, "parentCourseCode", "Recitation without a parent course"));
        }
        return issues;
    }

    /**
     * Renders a text report over a batch of records.
     * @param records Sections to check
     * @return Multi-line report
     */
    public String generateValidationReport(List<SectionRecord> records) {
        int passed = 0;
        int failed = 0;
        int warnings = 0;
        Map<String, Integer> errorCounts = new LinkedHashMap<>();
        Map<String, Integer> warningCounts = new LinkedHashMap<>();
        List<String> failures = new ArrayList<>();

        for (SectionRecord r : records) {
            List<ValidationIssue> issues = validate(r);
            boolean ok = true;
            for (ValidationIssue issue : issues) {
                if (issue.level == Level.ERROR) {
                    ok = false;
                    errorCounts.merge(issue.field, 1, Integer::sum);
                } else {
                    warnings++;
                    warningCounts.merge(issue.field, 1, Integer::sum);
                }
            }
            if (ok) {
                passed++;
            } else {
                failed++;
                failures.add(describe(r) + ": " + issues.stream()
                    .filter(i -> i.level == Level.ERROR).map(ValidationIssue::toString)
                    .collect(Collectors.joining("; ")));
            }
        }

        String rule = "=".repeat(50);
        StringBuilder sb = new StringBuilder();
        sb.append(rule).append('\n').append("SECTION VALIDATION REPORT").append('\n').append(rule).append('\n');
        sb.append("SUMMARY:\n");
        sb.append("  Sections validated: ").append(records.size()).append('\n');
        sb.append("  Passed: ").append(passed).append('\n');
        sb.append("  Failed: ").append(failed).append('\n');
        double rate = records.isEmpty() ? 0 : passed * 100.0 / records.size();
        sb.append(String.format("  Pass rate: %.2f%%%n", rate));
        sb.append("  Warnings: ").append(warnings).append('\n');
        appendCounts(sb, "COMMON ERRORS:", errorCounts);
        appendCounts(sb, "COMMON WARNINGS:", warningCounts);
        if (!failures.isEmpty()) {
            sb.append("FAILED SECTIONS:\n");
            failures.stream().limit(MAX_LISTED).forEach(f -> sb.append("  ").append(f).append('\n'));
            if (failures.size() > MAX_LISTED) {
                sb.append("  ... and ").append(failures.size() - MAX_LISTED).append(" more\n");
            }
        }
        sb.append(rule);
        return sb.toString();
    }

    private static void appendCounts(StringBuilder sb, String heading, Map<String, Integer> counts) {
        if (counts.isEmpty()) return;
        sb.append(heading).append('\n');
        counts.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
            .limit(5)
            .forEach(e -> sb.append("  - ").append(e.getKey()).append(" (").append(e.getValue()).append(" occurrences)\n"));
    }

    private static void requireText(List<ValidationIssue> issues, String field, String value) {
        if (value == null || value.isBlank()) {
            issues.add(new ValidationIssue(Level.ERROR, field, "Missing " + field));
        }
    }

    private static String describe(SectionRecord r) {
        if (r == null) return "<null>";
        return (r.courseCode() == null ? r.subject() + "?" : r.courseCode()) + " " + (r.section() == null ? "?" : r.section());
    }
}
