package io.engram.core.engine;

import io.engram.core.cluster.ClusterAssignment;
import io.engram.core.cluster.KeywordClusterLabeler;
import io.engram.core.cluster.ThematicCluster;
import io.engram.core.cluster.ThematicClusteringEngine;
import io.engram.core.embedding.EmbeddingService;
import io.engram.core.error.MemoryException;
import io.engram.core.error.RetrievalException;
import io.engram.core.extraction.DialogueTurn;
import io.engram.core.extraction.ExtractionService;
import io.engram.core.extraction.ForesightCandidate;
import io.engram.core.extraction.MemoryUnitDraft;
import io.engram.core.extraction.TraitClaim;
import io.engram.core.extraction.TranscriptParser;
import io.engram.core.generation.GenerationService;
import io.engram.core.index.IndexFactory;
import io.engram.core.memory.AttributeClaim;
import io.engram.core.memory.Foresight;
import io.engram.core.memory.MemoryUnit;
import io.engram.core.profile.AttributeObservation;
import io.engram.core.profile.ConflictRecord;
import io.engram.core.profile.ConflictResolver;
import io.engram.core.profile.ImplicitTrait;
import io.engram.core.profile.ProfileSummaryFormatter;
import io.engram.core.profile.TraitMerger;
import io.engram.core.profile.UserProfile;
import io.engram.core.retrieval.ClusterHit;
import io.engram.core.retrieval.ClusterSelector;
import io.engram.core.retrieval.ContextAssembler;
import io.engram.core.retrieval.HybridSearch;
import io.engram.core.retrieval.LoopOutcome;
import io.engram.core.retrieval.RankFusion;
import io.engram.core.retrieval.RetrievalPipeline;
import io.engram.core.retrieval.SufficiencyLoop;
import io.engram.core.store.MemorySpaceStore;
import io.engram.core.temporal.ForesightWindowResolver;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the memory system: ingests conversations into per-user memory spaces and
 * answers questions through the retrieval loop.
 *
 * <p>Ingestion performs extraction and embedding before touching any state, then clusters,
 * resolves profile conflicts, indexes and persists while holding the user's lock. A failure
 * in the first phase leaves the space untouched.
 */
public final class MemoryEngine implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(MemoryEngine.class);
    static final String NO_MEMORY_ANSWER = "I don't have enough information in memory to answer this question.";
    private static final int CLUSTER_HITS = 3;

    private final EngineSettings settings;
    private final ExtractionService extraction;
    private final EmbeddingService embeddings;
    private final GenerationService generation;
    private final MemorySpaceStore store;
    private final MemorySpaceRegistry registry;
    private final Clock clock;
    private final ThematicClusteringEngine clustering;
    private final ConflictResolver conflictResolver;
    private final TraitMerger traitMerger;
    private final ForesightWindowResolver windowResolver;
    private final ProfileSummaryFormatter profileFormatter;
    private final RetrievalPipeline pipeline;
    private final SufficiencyLoop loop;
    private final ClusterSelector clusterSelector;
    private final TranscriptParser transcriptParser;
    private final ExecutorService searchExecutor;
    private final ExecutorService queryExecutor;

    public MemoryEngine(
        EngineSettings settings,
        ExtractionService extraction,
        EmbeddingService embeddings,
        GenerationService generation,
        MemorySpaceStore store,
        IndexFactory indexes,
        Clock clock
    ) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.extraction = Objects.requireNonNull(extraction, "extraction must not be null");
        this.embeddings = Objects.requireNonNull(embeddings, "embeddings must not be null");
        this.generation = Objects.requireNonNull(generation, "generation must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.registry = new MemorySpaceRegistry(store, indexes);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.clustering = new ThematicClusteringEngine(settings.clusterThreshold(), new KeywordClusterLabeler(), clock);
        this.conflictResolver = new ConflictResolver(clock);
        this.traitMerger = new TraitMerger(clock);
        this.windowResolver = new ForesightWindowResolver();
        this.profileFormatter = new ProfileSummaryFormatter();
        this.searchExecutor = Executors.newFixedThreadPool(settings.searchThreads(), daemonThreads("engram-search"));
        this.queryExecutor = Executors.newCachedThreadPool(daemonThreads("engram-query"));
        HybridSearch search = new HybridSearch(embeddings, new RankFusion(settings.rrfK()), searchExecutor, settings.topK());
        this.pipeline = new RetrievalPipeline(search, settings.maxContextUnits());
        this.loop = new SufficiencyLoop(generation, new ContextAssembler(), settings.maxRetries());
        this.clusterSelector = new ClusterSelector();
        this.transcriptParser = new TranscriptParser();
    }

    public IngestionResult ingestTranscript(String userId, String conversationId, String transcript, Instant referenceTime) {
        return ingest(userId, conversationId, transcriptParser.parse(transcript), referenceTime);
    }

    public IngestionResult ingest(String userId, String conversationId, List<DialogueTurn> turns, Instant referenceTime) {
        String conversation = conversationId == null || conversationId.isBlank() ? UUID.randomUUID().toString() : conversationId;
        Instant reference = referenceTime == null ? clock.instant() : referenceTime;
        MemorySpace space = registry.space(userId);

        List<PreparedUnit> prepared;
        try {
            prepared = prepare(conversation, turns == null ? List.of() : turns, reference);
        } catch (MemoryException e) {
            LOG.warn("Ingestion of conversation {} for {} failed: {}", conversation, userId, e.getMessage());
            return IngestionResult.failed(userId, conversation, e.getMessage());
        }

        IngestionResult result = space.locked(() -> commit(space, conversation, prepared));
        LOG.info("Ingested conversation {} for {}: {}", conversation, userId, result.describe());
        return result;
    }

    /**
     * Runs the retrieval loop for {@code question} as of {@code referenceTime}.
     *
     * @throws RetrievalException when an index or the embedding service fails, or the query
     *     exceeds its time budget
     */
    public Recollection recall(String userId, String question, Instant referenceTime) {
        Objects.requireNonNull(question, "question must not be null");
        Instant reference = referenceTime == null ? clock.instant() : referenceTime;
        MemorySpace space = registry.space(userId);
        MemorySpace.View view = space.locked(space::view);
        String profileSection = profileFormatter.formatForContext(view.profile());

        Future<LoopOutcome> pending = queryExecutor.submit(() -> loop.run(
            question,
            profileSection,
            pipeline.over(view.units(), view.profile(), space.vectorIndex(), space.lexicalIndex(), reference)
        ));

        LoopOutcome outcome;
        try {
            outcome = pending.get(settings.queryTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new RetrievalException("Query timed out after " + settings.queryTimeout().toSeconds() + "s", e);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new RetrievalException("Query interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof RetrievalException retrievalException) {
                throw retrievalException;
            }
            throw new RetrievalException("Retrieval failed: " + cause.getMessage(), cause);
        }

        List<ClusterHit> clusters = clusterSelector.select(outcome.units(), view.clusters(), CLUSTER_HITS);
        LOG.info(
            "Recalled {} unit(s) for {} in {} cycle(s), sufficient={}",
            outcome.units().size(),
            userId,
            outcome.searchCycles(),
            outcome.sufficient()
        );
        return new Recollection(
            question,
            reference,
            outcome.units(),
            outcome.context(),
            outcome.queriesUsed(),
            outcome.iterations(),
            outcome.sufficient(),
            clusters
        );
    }

    public String answer(String userId, String question, Instant referenceTime) {
        return answer(recall(userId, question, referenceTime));
    }

    /**
     * Generates the answer for an earlier recollection; blank context short-circuits to a fixed reply.
     */
    public String answer(Recollection recollection) {
        if (recollection.context().isBlank()) {
            return NO_MEMORY_ANSWER;
        }
        return generation.answer(recollection.context(), recollection.question());
    }

    public UserProfile profile(String userId) {
        MemorySpace space = registry.space(userId);
        return space.locked(() -> space.profile().copy());
    }

    public String profileSummary(String userId) {
        return profileFormatter.format(profile(userId));
    }

    public List<ThematicCluster> clusters(String userId) {
        MemorySpace space = registry.space(userId);
        return space.locked(() -> space.clusters().stream().map(ThematicCluster::copy).toList());
    }

    public MemorySpaceStats stats(String userId) {
        MemorySpace space = registry.space(userId);
        return space.locked(() -> new MemorySpaceStats(
            userId,
            space.unitCount(),
            space.clusters().size(),
            space.profile().explicitAttributes().size(),
            space.profile().implicitTraits().size(),
            space.profile().conflictHistory().size()
        ));
    }

    public List<String> userIds() {
        return registry.userIds();
    }

    @Override
    public void close() {
        queryExecutor.shutdownNow();
        searchExecutor.shutdownNow();
    }

    private List<PreparedUnit> prepare(String conversationId, List<DialogueTurn> turns, Instant reference) {
        List<PreparedUnit> prepared = new ArrayList<>();
        for (MemoryUnitDraft draft : extraction.extract(turns)) {
            if (draft.isEmpty()) {
                continue;
            }
            Instant observedAt = draft.observedAt() == null ? reference : draft.observedAt();
            List<Foresight> foresights = new ArrayList<>();
            for (ForesightCandidate candidate : draft.foresightCandidates()) {
                windowResolver.resolve(candidate, observedAt).ifPresent(foresights::add);
            }
            MemoryUnit unit = new MemoryUnit(
                UUID.randomUUID().toString(),
                conversationId,
                draft.narrative(),
                draft.atomicFacts(),
                foresights,
                draft.attributes(),
                draft.tags(),
                observedAt,
                null,
                List.of()
            );
            MemoryUnit embedded = new MemoryUnit(
                unit.id(),
                unit.conversationId(),
                unit.narrative(),
                unit.atomicFacts(),
                unit.foresights(),
                unit.attributes(),
                unit.tags(),
                unit.createdAt(),
                null,
                embeddings.embed(unit.searchableText())
            );
            prepared.add(new PreparedUnit(embedded, draft.traits()));
        }
        return prepared;
    }

    private IngestionResult commit(MemorySpace space, String conversationId, List<PreparedUnit> prepared) {
        List<String> unitIds = new ArrayList<>();
        Set<String> clusterIds = new LinkedHashSet<>();
        List<ConflictRecord> conflicts = new ArrayList<>();
        int clustersCreated = 0;

        for (PreparedUnit item : prepared) {
            ClusterAssignment assignment = clustering.assign(item.unit(), space.clusters());
            MemoryUnit unit = item.unit().withClusterId(assignment.cluster().id());
            space.add(unit);
            unitIds.add(unit.id());
            clusterIds.add(assignment.cluster().id());
            if (assignment.created()) {
                clustersCreated++;
            }

            List<AttributeObservation> observations = new ArrayList<>();
            for (AttributeClaim claim : unit.attributes()) {
                observations.add(new AttributeObservation(claim.name(), claim.value(), unit.createdAt(), unit.id(), claim.confidence()));
            }
            conflicts.addAll(conflictResolver.resolve(observations, space.profile()));

            for (TraitClaim trait : item.traits()) {
                traitMerger.merge(
                    new ImplicitTrait(trait.traitType(), trait.description(), trait.strength(), List.of(unit.id()), clock.instant()),
                    space.profile()
                );
            }
        }

        boolean persisted = prepared.isEmpty();
        if (!prepared.isEmpty()) {
            try {
                store.save(space.snapshot(clock.instant()));
                persisted = true;
            } catch (IOException e) {
                LOG.error("Failed to persist memory space {}: {}", space.userId(), e.getMessage());
            }
        }
        return new IngestionResult(
            space.userId(),
            conversationId,
            true,
            "",
            unitIds,
            new ArrayList<>(clusterIds),
            clustersCreated,
            conflicts,
            persisted
        );
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record PreparedUnit(MemoryUnit unit, List<TraitClaim> traits) {
    }
}
