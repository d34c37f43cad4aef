package io.engram.core.extraction;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a plain-text transcript into turns. Recognised line shapes:
 * {@code [2025-01-15 09:30] user: text}, {@code user: text} and {@code **user**: text}.
 * Any other non-blank line continues the previous turn. Timestamps are read as UTC and carry
 * over to following turns that have none.
 */
public final class TranscriptParser {
    private static final Pattern TIMESTAMPED = Pattern.compile("^\\[(\\d{4}-\\d{2}-\\d{2}[ T]\\d{2}:\\d{2}(?::\\d{2})?)]\\s*(.+)$");
    private static final Pattern SPEAKER = Pattern.compile("^\\*{0,2}([A-Za-z][A-Za-z0-9 _.-]{0,30}?)\\*{0,2}:\\s*(.*)$");
    private static final DateTimeFormatter MINUTES = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final DateTimeFormatter SECONDS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public List<DialogueTurn> parse(String transcript) {
        List<DialogueTurn> turns = new ArrayList<>();
        if (transcript == null || transcript.isBlank()) {
            return turns;
        }

        String speaker = null;
        StringBuilder content = new StringBuilder();
        Instant timestamp = null;
        Instant currentTimestamp = null;

        for (String rawLine : transcript.strip().split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }

            Instant lineTimestamp = null;
            Matcher stamped = TIMESTAMPED.matcher(line);
            if (stamped.matches()) {
                lineTimestamp = parseTimestamp(stamped.group(1));
                line = stamped.group(2);
            }

            Matcher turn = SPEAKER.matcher(line);
            if (turn.matches()) {
                if (speaker != null && content.length() > 0) {
                    turns.add(new DialogueTurn(speaker, content.toString(), currentTimestamp));
                }
                speaker = turn.group(1).strip();
                content = new StringBuilder(turn.group(2).strip());
                if (lineTimestamp != null) {
                    timestamp = lineTimestamp;
                }
                currentTimestamp = timestamp;
            } else if (speaker != null) {
                if (content.length() > 0) {
                    content.append(' ');
                }
                content.append(line);
            }
        }

        if (speaker != null && content.length() > 0) {
            turns.add(new DialogueTurn(speaker, content.toString(), currentTimestamp));
        }
        return turns;
    }

    private Instant parseTimestamp(String raw) {
        String normalized = raw.replace('T', ' ');
        try {
            DateTimeFormatter format = normalized.length() > 16 ? SECONDS : MINUTES;
            return LocalDateTime.parse(normalized, format).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
