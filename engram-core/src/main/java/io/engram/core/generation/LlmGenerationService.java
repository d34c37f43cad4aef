package io.engram.core.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.engram.core.error.GenerationException;
import io.engram.core.model.ChatMessage;
import io.engram.core.provider.JsonReplies;
import io.engram.core.provider.LlmProvider;
import io.engram.core.provider.LlmResponse;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LlmGenerationService implements GenerationService {
    private static final Logger LOG = LoggerFactory.getLogger(LlmGenerationService.class);
    private static final int MAX_REFORMULATIONS = 3;

    private static final String VERIFIER_PROMPT = """
        You are a context sufficiency evaluator. Decide whether the provided context contains enough
        information to answer the query. Consider whether all necessary information is present, whether
        gaps would prevent a complete answer and whether the information is unambiguous.""";

    private static final String REWRITER_PROMPT = """
        You are a query rewriting specialist. When retrieval is insufficient you generate targeted
        follow-up queries: pivot to related entities, ask about time-related information, decompose the
        question into sub-questions or broaden the scope.""";

    private static final String ANSWER_PROMPT = """
        Answer based only on the provided memory context. If the context does not contain enough
        information, say so clearly. Be concise and accurate.""";

    private final LlmProvider provider;
    private final String model;
    private final ObjectMapper mapper;

    public LlmGenerationService(LlmProvider provider, String model) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.mapper = new ObjectMapper();
    }

    @Override
    public SufficiencyVerdict judgeSufficiency(String context, String question) {
        JsonNode verdict = askForJson(VERIFIER_PROMPT, """
            Evaluate if this context is sufficient to answer the query.

            QUERY: %s

            CONTEXT:
            %s

            Respond with JSON:
            {"is_sufficient": true, "confidence": 0.0, "reasoning": "explanation", "missing_info": ["missing item"]}
            """.formatted(question, context));
        JsonNode flag = verdict.path("is_sufficient");
        if (!flag.isBoolean()) {
            throw new GenerationException("Sufficiency reply had no is_sufficient flag");
        }
        return new SufficiencyVerdict(
            flag.asBoolean(),
            verdict.path("reasoning").asText(""),
            JsonReplies.textList(verdict.path("missing_info"))
        );
    }

    @Override
    public List<String> reformulate(String question, String rationale) {
        JsonNode reply;
        try {
            reply = askForJson(REWRITER_PROMPT, """
                Generate 2-3 targeted follow-up queries to fill the information gaps.

                ORIGINAL QUERY: %s

                MISSING INFORMATION:
                %s

                Respond with JSON:
                {"queries": ["query 1", "query 2", "query 3"]}
                """.formatted(question, rationale == null || rationale.isBlank() ? "General information gaps" : rationale));
        } catch (GenerationException e) {
            LOG.warn("Query rewriting failed, using fallback phrasings: {}", e.getMessage());
            return Reformulations.fallback(question);
        }
        List<String> queries = JsonReplies.textList(reply.path("queries"));
        return List.copyOf(queries.subList(0, Math.min(MAX_REFORMULATIONS, queries.size())));
    }

    @Override
    public String answer(String context, String question) {
        LlmResponse response = provider.chat(model, List.of(
            ChatMessage.system(ANSWER_PROMPT),
            ChatMessage.user("""
                Based on the following memory context, please answer the user's question.

                MEMORY CONTEXT:
                %s

                QUESTION: %s
                """.formatted(context, question))
        ));
        if (response.failed()) {
            throw new GenerationException(response.content());
        }
        return response.content().trim();
    }

    private JsonNode askForJson(String system, String prompt) {
        LlmResponse response = provider.chat(model, List.of(ChatMessage.system(system), ChatMessage.user(prompt)));
        if (response.failed()) {
            throw new GenerationException(response.content());
        }
        try {
            return JsonReplies.parseObject(mapper, response.content());
        } catch (IOException e) {
            throw new GenerationException("Model reply was not valid JSON", e);
        }
    }
}
