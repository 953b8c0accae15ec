package eu.virtualparadox.notedraft.ingest.classifier;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the encounter date of a document by looking for labelled dates
 * (service, visit, admission, discharge...) near the top of the text, falling
 * back to a bare date standing on its own line.
 */
@Component
public class EpisodeDateExtractor {

    static final int HEAD_CHARS = 2000;

    private static final String DATE = "(\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4})";

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("date\\s*(?:of\\s+)?(?:service|visit|admission|discharge|encounter)\\s*:?\\s*" + DATE,
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:service\\s+date|visit\\s+date|encounter\\s+date)\\s*:?\\s*" + DATE,
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:admission\\s+date|discharge\\s+date)\\s*:?\\s*" + DATE,
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:^|\\n)" + DATE + "(?:\\s+|\\n)")
    );

    private static final Pattern PARTS = Pattern.compile("(\\d{1,2})[/-](\\d{1,2})[/-](\\d{2,4})");

    /**
     * @param text document text, may be {@code null}
     * @return episode date formatted {@code YYYY-MM-DD}, empty if no pattern matched
     */
    public Optional<String> extract(final String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        final String head = text.substring(0, Math.min(HEAD_CHARS, text.length()));
        for (Pattern pattern : PATTERNS) {
            final Matcher m = pattern.matcher(head);
            if (m.find()) {
                return Optional.of(normalize(m.group(1)));
            }
        }
        return Optional.empty();
    }

    /**
     * Normalizes a month/day/year date. Month and day are clamped into their
     * calendar ranges; years below 100 pivot at 70.
     */
    static String normalize(final String raw) {
        final Matcher m = PARTS.matcher(raw);
        if (!m.matches()) {
            return raw;
        }
        final int month = clamp(Integer.parseInt(m.group(1)), 1, 12);
        final int day = clamp(Integer.parseInt(m.group(2)), 1, 31);
        int year = Integer.parseInt(m.group(3));
        if (year < 100) {
            year += year < 70 ? 2000 : 1900;
        }
        return String.format("%04d-%02d-%02d", year, month, day);
    }

    /**
     * Converts an ISO episode date into an epoch day for ordering.
     *
     * @return epoch day, or {@code null} when the date is absent or not a real calendar day
     */
    public static Long toEpochDay(final String isoDate) {
        if (isoDate == null || isoDate.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(isoDate).toEpochDay();
        }
        catch (DateTimeParseException e) {
            return null;
        }
    }

    private static int clamp(final int value, final int min, final int max) {
        return Math.max(min, Math.min(max, value));
    }
}
