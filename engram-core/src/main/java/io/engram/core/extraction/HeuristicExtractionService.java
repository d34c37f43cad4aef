package io.engram.core.extraction;

import io.engram.core.memory.AttributeClaim;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-driven extraction that needs no model: the whole conversation becomes a single draft.
 * User sentences that state a profile attribute are normalized into {@code "User <attribute> is <value>"}
 * facts, sentences carrying a time bound become foresights, and the rest are kept verbatim.
 */
public final class HeuristicExtractionService implements ExtractionService {
    private static final Pattern NAME_PATTERN = Pattern.compile(
        "\\b(?:my name is|call me) ([A-Za-z][A-Za-z'-]{1,30})", Pattern.CASE_INSENSITIVE);
    private static final Pattern LOCATION_PATTERN = Pattern.compile(
        "\\b(?:i live in|i moved to|i'm based in|i am based in|i am from|i'm from) ([A-Za-z][A-Za-z' -]{1,40}?)(?: now|$|,)", Pattern.CASE_INSENSITIVE);
    private static final Pattern DIET_PATTERN = Pattern.compile(
        "\\b(?:i am|i'm|i became|i have become|i've become|i went|i switched to|my diet is)\\s+(?:now\\s+|a\\s+|an\\s+|fully\\s+|strictly\\s+)*"
            + "(vegetarian|vegan|pescatarian|keto|paleo|omnivore|omnivorous|flexitarian|gluten-free)\\b",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern OCCUPATION_PATTERN = Pattern.compile(
        "\\bi work as (?:a |an )?([A-Za-z][A-Za-z -]{2,40}?)(?: at | for |$|,)", Pattern.CASE_INSENSITIVE);
    private static final Pattern PREFERENCE_PATTERN = Pattern.compile(
        "\\bi (prefer|like|love|enjoy) ([^,;]{3,100})", Pattern.CASE_INSENSITIVE);

    private static final Pattern AMOUNT_PATTERN = Pattern.compile(
        "\\b(?:for|in|over) (?:the next )?((?:\\d+|a|an|one|two|three|four|five|six|seven|eight|nine|ten) "
            + "(?:days?|weeks?|months?|years?))\\b",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern NEXT_PATTERN = Pattern.compile("\\b(next (?:week|month|year)|tomorrow)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern UNTIL_PATTERN = Pattern.compile("\\buntil (\\d{4}-\\d{2}-\\d{2})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern PLAN_PATTERN = Pattern.compile(
        "\\b(?:i'm planning to|i am planning to|i plan to|i'm going to|i am going to|i will|i'm starting|i am starting|i'm learning|i am learning)\\b",
        Pattern.CASE_INSENSITIVE);

    @Override
    public List<MemoryUnitDraft> extract(List<DialogueTurn> turns) {
        if (turns == null || turns.isEmpty()) {
            return List.of();
        }

        List<String> narrative = new ArrayList<>();
        Set<String> facts = new LinkedHashSet<>();
        List<ForesightCandidate> foresights = new ArrayList<>();
        List<AttributeClaim> attributes = new ArrayList<>();
        List<TraitClaim> traits = new ArrayList<>();
        Set<String> tags = new LinkedHashSet<>();
        Instant observedAt = null;

        for (DialogueTurn turn : turns) {
            if (turn.text().isBlank()) {
                continue;
            }
            narrative.add(capitalize(turn.speaker()) + " said: " + turn.text());
            if (turn.timestamp() != null && (observedAt == null || turn.timestamp().isAfter(observedAt))) {
                observedAt = turn.timestamp();
            }
            if (!turn.fromUser()) {
                continue;
            }

            for (String sentence : splitSentences(turn.text())) {
                List<AttributeClaim> claims = claims(sentence);
                if (!claims.isEmpty()) {
                    for (AttributeClaim claim : claims) {
                        attributes.add(claim);
                        facts.add(claim.statement());
                        tags.add(claim.name());
                    }
                    continue;
                }

                ForesightCandidate foresight = foresight(sentence);
                if (foresight != null) {
                    foresights.add(foresight);
                    tags.add("plan");
                } else {
                    facts.add(sentence);
                }

                Matcher preference = PREFERENCE_PATTERN.matcher(sentence);
                if (preference.find()) {
                    String verb = preference.group(1).toLowerCase(Locale.ROOT);
                    traits.add(new TraitClaim("preference", verb + "s " + normalizeTail(preference.group(2)), 0.6));
                    tags.add("preference");
                }
            }
        }

        if (narrative.isEmpty()) {
            return List.of();
        }
        if (tags.isEmpty()) {
            tags.add("conversation");
        }
        return List.of(new MemoryUnitDraft(
            String.join(" ", narrative),
            new ArrayList<>(facts),
            foresights,
            attributes,
            traits,
            new ArrayList<>(tags),
            observedAt
        ));
    }

    private List<AttributeClaim> claims(String sentence) {
        List<AttributeClaim> claims = new ArrayList<>();
        addClaim(claims, NAME_PATTERN, sentence, "name", this::normalizeTail);
        addClaim(claims, LOCATION_PATTERN, sentence, "location", this::normalizeTail);
        addClaim(claims, DIET_PATTERN, sentence, "diet", value -> value.toLowerCase(Locale.ROOT));
        addClaim(claims, OCCUPATION_PATTERN, sentence, "occupation", value -> normalizeTail(value).toLowerCase(Locale.ROOT));
        return claims;
    }

    private void addClaim(
        List<AttributeClaim> claims,
        Pattern pattern,
        String sentence,
        String attribute,
        Function<String, String> normalizer
    ) {
        Matcher matcher = pattern.matcher(sentence);
        if (matcher.find()) {
            String value = normalizer.apply(matcher.group(1));
            if (!value.isBlank()) {
                claims.add(new AttributeClaim(attribute, value, "User " + attribute + " is " + value, 0.9));
            }
        }
    }

    private ForesightCandidate foresight(String sentence) {
        Matcher until = UNTIL_PATTERN.matcher(sentence);
        if (until.find()) {
            try {
                return new ForesightCandidate(sentence, "", 0, LocalDate.parse(until.group(1)), 0.8);
            } catch (DateTimeParseException ignored) {
                return ForesightCandidate.of(sentence, "");
            }
        }
        Matcher amount = AMOUNT_PATTERN.matcher(sentence);
        if (amount.find()) {
            return ForesightCandidate.of(sentence, amount.group(1));
        }
        Matcher next = NEXT_PATTERN.matcher(sentence);
        if (next.find()) {
            return ForesightCandidate.of(sentence, next.group(1));
        }
        if (PLAN_PATTERN.matcher(sentence).find()) {
            return ForesightCandidate.of(sentence, "ongoing");
        }
        return null;
    }

    private List<String> splitSentences(String input) {
        String[] parts = input.split("(?<=[.!?])\\s+|\\n+");
        List<String> sentences = new ArrayList<>();
        for (String part : parts) {
            String cleaned = part.trim().replaceAll("[.!?]+$", "").trim();
            if (cleaned.length() >= 3) {
                sentences.add(cleaned);
            }
        }
        return sentences;
    }

    private String capitalize(String speaker) {
        if (speaker.isEmpty()) {
            return speaker;
        }
        return Character.toUpperCase(speaker.charAt(0)) + speaker.substring(1);
    }

    private String normalizeTail(String text) {
        return text == null ? "" : text.trim().replaceAll("\\s+", " ");
    }
}
