package io.engram.core.temporal;

import io.engram.core.extraction.ForesightCandidate;
import io.engram.core.memory.Foresight;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pins a foresight candidate's free-text duration to an absolute validity window.
 */
public final class ForesightWindowResolver {
    private static final Logger LOG = LoggerFactory.getLogger(ForesightWindowResolver.class);
    static final Duration ONGOING_REVIEW = Duration.ofDays(30);

    private static final Pattern ISO_DATE = Pattern.compile("(\\d{4}-\\d{2}-\\d{2})");
    private static final Pattern AMOUNT = Pattern.compile(
        "\\b(\\d+(?:\\.\\d+)?|a|an|one|two|three|four|five|six|seven|eight|nine|ten|twelve)\\s*(day|week|month|year)s?\\b"
    );
    private static final Pattern NEXT = Pattern.compile("\\bnext\\s+(day|week|month|year)\\b");
    private static final Map<String, Double> WORDS = Map.ofEntries(
        Map.entry("a", 1.0), Map.entry("an", 1.0), Map.entry("one", 1.0), Map.entry("two", 2.0),
        Map.entry("three", 3.0), Map.entry("four", 4.0), Map.entry("five", 5.0), Map.entry("six", 6.0),
        Map.entry("seven", 7.0), Map.entry("eight", 8.0), Map.entry("nine", 9.0), Map.entry("ten", 10.0),
        Map.entry("twelve", 12.0)
    );
    private static final Map<String, Integer> UNIT_DAYS = Map.of("day", 1, "week", 7, "month", 30, "year", 365);

    public Optional<Foresight> resolve(ForesightCandidate candidate, Instant reference) {
        if (candidate == null || candidate.content().isBlank()) {
            return Optional.empty();
        }
        Instant start = reference.plus(Duration.ofDays(candidate.startOffsetDays()));
        Instant end = resolveEnd(candidate, start);
        if (end != null && end.isBefore(start)) {
            // an expiry already behind the start collapses the window to its first instant
            end = start;
        }
        return Optional.of(Foresight.of(candidate.content(), start, end, candidate.confidence()));
    }

    private Instant resolveEnd(ForesightCandidate candidate, Instant start) {
        if (candidate.expiryDate() != null) {
            return endOfDay(candidate.expiryDate());
        }
        String hint = candidate.durationHint().toLowerCase(Locale.ROOT);
        if (hint.isBlank() || hint.contains("indefinite") || hint.contains("permanent")) {
            return null;
        }

        Matcher date = ISO_DATE.matcher(hint);
        if (date.find()) {
            try {
                return endOfDay(LocalDate.parse(date.group(1)));
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }

        Matcher amount = AMOUNT.matcher(hint);
        if (amount.find()) {
            double count = WORDS.containsKey(amount.group(1)) ? WORDS.get(amount.group(1)) : Double.parseDouble(amount.group(1));
            long minutes = Math.round(count * UNIT_DAYS.get(amount.group(2)) * 24 * 60);
            try {
                return start.plus(Duration.ofMinutes(minutes));
            } catch (ArithmeticException | DateTimeException e) {
                // past the last representable instant, so the window never closes
                LOG.debug("Duration '{}' overflows the timeline, leaving the window open", candidate.durationHint());
                return null;
            }
        }

        Matcher next = NEXT.matcher(hint);
        if (next.find()) {
            return start.plus(Duration.ofDays(UNIT_DAYS.get(next.group(1))));
        }
        if (hint.contains("tomorrow")) {
            return start.plus(Duration.ofDays(1));
        }
        if (hint.contains("ongoing")) {
            return start.plus(ONGOING_REVIEW);
        }
        return null;
    }

    private Instant endOfDay(LocalDate date) {
        return date.atTime(23, 59, 59).toInstant(ZoneOffset.UTC);
    }
}
