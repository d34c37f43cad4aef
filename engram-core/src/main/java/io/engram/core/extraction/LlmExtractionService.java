package io.engram.core.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.engram.core.error.ExtractionException;
import io.engram.core.memory.AttributeClaim;
import io.engram.core.model.ChatMessage;
import io.engram.core.provider.JsonReplies;
import io.engram.core.provider.LlmProvider;
import io.engram.core.provider.LlmResponse;
import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-prompt extraction: narrative, atomic facts, foresights, profile attributes and traits are
 * requested together as one JSON object.
 */
public final class LlmExtractionService implements ExtractionService {
    private static final Logger LOG = LoggerFactory.getLogger(LlmExtractionService.class);
    private static final DateTimeFormatter TURN_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    private static final String SYSTEM_PROMPT = """
        You are a memory system that converts dialogues into structured memories.
        Extract key information accurately and completely. Respond with JSON only.""";

    private final LlmProvider provider;
    private final String model;
    private final ObjectMapper mapper;

    public LlmExtractionService(LlmProvider provider, String model) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.mapper = new ObjectMapper();
    }

    @Override
    public List<MemoryUnitDraft> extract(List<DialogueTurn> turns) {
        if (turns == null || turns.isEmpty()) {
            return List.of();
        }
        Instant observedAt = latestTimestamp(turns);
        LlmResponse response = provider.chat(model, List.of(
            ChatMessage.system(SYSTEM_PROMPT),
            ChatMessage.user(prompt(turns, observedAt))
        ));
        if (response.failed()) {
            throw new ExtractionException(response.content());
        }

        JsonNode root;
        try {
            root = JsonReplies.parseObject(mapper, response.content());
        } catch (IOException e) {
            throw new ExtractionException("Extraction reply was not valid JSON", e);
        }

        MemoryUnitDraft draft = new MemoryUnitDraft(
            root.path("episode").asText(""),
            JsonReplies.textList(root.path("atomic_facts")),
            foresights(root.path("foresights")),
            attributes(root.path("attributes")),
            traits(root.path("implicit_traits")),
            JsonReplies.textList(root.path("tags")),
            observedAt
        );
        LOG.debug("Extracted {} facts and {} foresights from {} turns", draft.atomicFacts().size(), draft.foresightCandidates().size(), turns.size());
        return draft.isEmpty() ? List.of() : List.of(draft);
    }

    private String prompt(List<DialogueTurn> turns, Instant observedAt) {
        StringBuilder dialogue = new StringBuilder();
        for (DialogueTurn turn : turns) {
            if (turn.timestamp() != null) {
                dialogue.append('[').append(TURN_TIME.format(turn.timestamp())).append("] ");
            }
            dialogue.append(turn.speaker()).append(": ").append(turn.text()).append('\n');
        }
        String now = observedAt == null ? "unknown" : TURN_TIME.format(observedAt);
        return """
            Analyze this dialogue and provide BOTH a narrative summary AND structured extraction.

            DIALOGUE:
            %s
            CURRENT TIME: %s

            Respond with JSON containing:
            {
              "episode": "2-4 sentence third-person narrative with pronouns resolved",
              "atomic_facts": ["independently verifiable statement"],
              "foresights": [
                {
                  "content": "plan, intention or temporary state",
                  "duration_type": "fixed|ongoing|indefinite",
                  "duration_value": "number of days when fixed, otherwise null",
                  "start_offset_days": 0,
                  "expiry_date": "YYYY-MM-DD when determinable, otherwise null"
                }
              ],
              "attributes": [
                {"attribute": "diet|location|occupation|name|...", "value": "current value", "statement": "the atomic fact stating it", "confidence": 0.0}
              ],
              "implicit_traits": [
                {"type": "preference|habit|personality", "description": "trait", "strength": 0.0}
              ],
              "tags": ["high-level category"]
            }
            """.formatted(dialogue, now);
    }

    private List<ForesightCandidate> foresights(JsonNode array) {
        List<ForesightCandidate> candidates = new ArrayList<>();
        if (!array.isArray()) {
            return candidates;
        }
        for (JsonNode item : array) {
            String content = item.path("content").asText("");
            if (content.isBlank()) {
                continue;
            }
            candidates.add(new ForesightCandidate(
                content,
                durationHint(item),
                item.path("start_offset_days").asInt(0),
                expiryDate(item.path("expiry_date")),
                item.path("confidence").asDouble(0.8)
            ));
        }
        return candidates;
    }

    private String durationHint(JsonNode item) {
        String type = item.path("duration_type").asText("indefinite").toLowerCase(Locale.ROOT);
        JsonNode value = item.path("duration_value");
        if ("fixed".equals(type) && (value.isNumber() || value.isTextual() && value.asText().matches("\\d+(\\.\\d+)?"))) {
            return value.asText() + " days";
        }
        return type;
    }

    private LocalDate expiryDate(JsonNode node) {
        String raw = node.asText("");
        if (raw.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(raw.substring(0, 10));
        } catch (DateTimeParseException e) {
            LOG.debug("Ignoring unparseable expiry date '{}'", raw);
            return null;
        }
    }

    private List<AttributeClaim> attributes(JsonNode array) {
        List<AttributeClaim> claims = new ArrayList<>();
        if (!array.isArray()) {
            return claims;
        }
        for (JsonNode item : array) {
            String name = item.path("attribute").asText("");
            String value = item.path("value").asText("");
            if (name.isBlank() || value.isBlank()) {
                continue;
            }
            claims.add(new AttributeClaim(name, value, item.path("statement").asText(null), item.path("confidence").asDouble(1.0)));
        }
        return claims;
    }

    private List<TraitClaim> traits(JsonNode array) {
        List<TraitClaim> traits = new ArrayList<>();
        if (!array.isArray()) {
            return traits;
        }
        for (JsonNode item : array) {
            String description = item.path("description").asText("");
            if (!description.isBlank()) {
                traits.add(new TraitClaim(item.path("type").asText("preference"), description, item.path("strength").asDouble(0.5)));
            }
        }
        return traits;
    }

    private Instant latestTimestamp(List<DialogueTurn> turns) {
        Instant latest = null;
        for (DialogueTurn turn : turns) {
            if (turn.timestamp() != null && (latest == null || turn.timestamp().isAfter(latest))) {
                latest = turn.timestamp();
            }
        }
        return latest;
    }
}
