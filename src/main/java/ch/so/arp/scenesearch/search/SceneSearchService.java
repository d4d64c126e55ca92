package ch.so.arp.scenesearch.search;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import ch.so.arp.scenesearch.visual.FailSoftVisualScoring;

/**
 * Orchestrates one scene search: routes the query to a visual mode, resolves
 * the channel weights, retrieves the candidate pool, optionally reranks it
 * with visual scores and calibrates display scores for the top results.
 * <p>
 * The visual text embedding is requested on the search executor while the
 * query text is embedded, bounded by an overall deadline. Any visual failure
 * degrades the request to non-visual ranking; only a failing base retrieval
 * fails the search.
 */
@Service
public class SceneSearchService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SceneSearchService.class);

    private final VisualIntentRouter router;
    private final WeightResolver weightResolver;
    private final CandidateRetriever retriever;
    private final VisualReranker reranker;
    private final FailSoftVisualScoring visualScoring;
    private final EmbeddingProvider embeddingProvider;
    private final DisplayScoreCalibrator calibrator;
    private final SearchSettings settings;
    private final Executor searchExecutor;

    public SceneSearchService(VisualIntentRouter router, WeightResolver weightResolver, CandidateRetriever retriever,
            VisualReranker reranker, FailSoftVisualScoring visualScoring, EmbeddingProvider embeddingProvider,
            DisplayScoreCalibrator calibrator, SearchSettings settings,
            @Qualifier("searchExecutor") Executor searchExecutor) {
        this.router = Objects.requireNonNull(router, "router");
        this.weightResolver = Objects.requireNonNull(weightResolver, "weightResolver");
        this.retriever = Objects.requireNonNull(retriever, "retriever");
        this.reranker = Objects.requireNonNull(reranker, "reranker");
        this.visualScoring = Objects.requireNonNull(visualScoring, "visualScoring");
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        this.calibrator = Objects.requireNonNull(calibrator, "calibrator");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.searchExecutor = Objects.requireNonNull(searchExecutor, "searchExecutor");
    }

    /**
     * @throws InvalidWeightsException if the requested channel weights are unusable
     * @throws SearchFailedException   if the base retrieval fails
     */
    public SearchResponse search(SearchRequest request) {
        long startNanos = System.nanoTime();
        String query = request.query().strip();
        List<String> warnings = new ArrayList<>();

        VisualModeSetting setting = request.visualMode() != null
                ? VisualModeSetting.parse(request.visualMode())
                : settings.visualMode();
        RoutingDecision decision = router.route(query, setting);
        VisualMode mode = decision.mode();
        if (!settings.multiDenseEnabled() && mode != VisualMode.SKIP) {
            warnings.add("multi-dense retrieval disabled, visual mode " + label(mode) + " ignored");
            mode = VisualMode.SKIP;
        }

        CompletableFuture<Optional<float[]>> visualEmbedding = startVisualEmbedding(query, mode);

        float[] textEmbedding = embedText(query);
        WeightResolution weights = weightResolver.resolve(request.channelWeights(), mode);
        if (textEmbedding == null) {
            weights = withoutDenseText(weights);
        }

        float[] queryVisual = null;
        if (mode != VisualMode.SKIP) {
            queryVisual = visualEmbedding.join().orElse(null);
            if (queryVisual == null) {
                LOGGER.warn("Visual query embedding unavailable within {} ms, continuing without visual scoring",
                        settings.visualDeadline().toMillis());
                if (mode == VisualMode.RECALL) {
                    weights = weightResolver.withoutVisual(weights, "visual query embedding unavailable");
                }
                warnings.add("visual mode " + label(mode) + " degraded to skip: visual query embedding unavailable");
                mode = VisualMode.SKIP;
            }
        }

        RetrievalQuery retrievalQuery = new RetrievalQuery(query, textEmbedding,
                mode == VisualMode.RECALL ? queryVisual : null, weights.applied(), mode,
                settings.candidatePoolSize(), request.threshold());
        CandidatePool pool;
        try {
            pool = retriever.retrieve(retrievalQuery);
        } catch (RuntimeException ex) {
            LOGGER.error("Base retrieval failed for query '{}': {}", query, ex.getMessage(), ex);
            throw new SearchFailedException("base retrieval failed", ex);
        }

        RerankOutcome rerank = reranker.rerank(pool, mode, queryVisual);
        List<Candidate> top = rerank.pool().limit(request.limit()).candidates();
        List<Double> displayScores = calibrator.calibrate(top.stream().map(Candidate::finalScore).toList());
        List<SceneResult> results = new ArrayList<>(top.size());
        for (int i = 0; i < top.size(); i++) {
            results.add(SceneResult.from(top.get(i), displayScores.get(i)));
        }

        warnings.addAll(0, weights.warnings());
        SearchDiagnostics diagnostics = new SearchDiagnostics(
                label(setting),
                label(decision.mode()),
                label(mode),
                decision.reason(),
                decision.matchedTerms(),
                weights.applied().asValueMap(),
                weights.source(),
                settings.fusionMethod().label(),
                rerank.applied(),
                rerank.skipReason(),
                rerank.scoredCount(),
                pool.size(),
                warnings);

        long latencyMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
        LOGGER.info("Search completed: mode={} routed={} ({}) weights={} source={} fusion={} pool={} rerank={} "
                + "results={} latency={}ms", label(mode), label(decision.mode()), decision.reason(),
                weights.applied().asValueMap(), weights.source(), settings.fusionMethod().label(), pool.size(),
                rerank.applied() ? "applied" : rerank.skipReason(), results.size(), latencyMs);
        return new SearchResponse(query, results, results.size(), latencyMs, diagnostics);
    }

    private CompletableFuture<Optional<float[]>> startVisualEmbedding(String query, VisualMode mode) {
        if (mode == VisualMode.SKIP) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return CompletableFuture.supplyAsync(() -> visualScoring.embedQuery(query), searchExecutor)
                .exceptionally(ex -> {
                    LOGGER.warn("Visual query embedding failed unexpectedly: {}", ex.getMessage(), ex);
                    return Optional.empty();
                })
                .completeOnTimeout(Optional.empty(), settings.visualDeadline().toMillis(), TimeUnit.MILLISECONDS);
    }

    private float[] embedText(String query) {
        try {
            return embeddingProvider.embed(query);
        } catch (EmbeddingException ex) {
            LOGGER.warn("Text embedding failed, continuing with lexical retrieval only: {}", ex.getMessage());
            return null;
        }
    }

    private WeightResolution withoutDenseText(WeightResolution weights) {
        try {
            return weightResolver.withoutChannels(weights, Set.copyOf(Channels.DENSE_TEXT),
                    "text embedding unavailable");
        } catch (InvalidWeightsException ex) {
            throw new SearchFailedException("text embedding unavailable and no other channel is weighted", ex);
        }
    }

    private static String label(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
