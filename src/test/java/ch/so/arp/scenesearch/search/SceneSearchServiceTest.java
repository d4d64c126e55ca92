package ch.so.arp.scenesearch.search;

import static ch.so.arp.scenesearch.search.SearchFixtures.pool;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import ch.so.arp.scenesearch.visual.FailSoftVisualScoring;
import ch.so.arp.scenesearch.visual.VisualScoringClient;
import ch.so.arp.scenesearch.visual.VisualServiceTimeoutException;

class SceneSearchServiceTest {

    private static final float[] VISUAL_QUERY = new float[] { 0.3f, 0.4f };

    private final Executor directExecutor = Runnable::run;

    private VisualScoringClient visualClient;
    private AtomicReference<RetrievalQuery> lastQuery;
    private CandidatePool retrievedPool;

    @BeforeEach
    void setUp() {
        visualClient = mock(VisualScoringClient.class);
        lastQuery = new AtomicReference<>();
        retrievedPool = pool("a", 0.9d, "b", 0.8d, "c", 0.4d);
    }

    @Test
    void speechQueriesNeverCallTheVisualService() {
        SearchResponse response = service(SearchSettings.defaults()).search(SearchRequest.of("he says hello"));

        assertThat(response.diagnostics().visualModeUsed()).isEqualTo("skip");
        assertThat(response.diagnostics().routingReason()).isEqualTo("says");
        assertThat(response.diagnostics().fusionMethod()).isEqualTo("minmax_mean");
        assertThat(lastQuery.get().weights().valueOf(Channels.VISUAL)).isZero();
        assertThat(response.results()).extracting(SceneResult::id).containsExactly("a", "b", "c");
        verifyNoInteractions(visualClient);
    }

    @Test
    void rerankQueriesBlendVisualScores() {
        when(visualClient.embed(anyString())).thenReturn(VISUAL_QUERY);
        when(visualClient.batchScore(any(), anyList())).thenReturn(Map.of("a", 0.1d, "b", 0.9d, "c", 0.5d));

        SearchResponse response = service(SearchSettings.defaults()).search(SearchRequest.of("budget meeting"));

        assertThat(lastQuery.get().mode()).isEqualTo(VisualMode.RERANK);
        assertThat(lastQuery.get().visualEmbedding()).isNull();
        assertThat(response.diagnostics().visualModeUsed()).isEqualTo("rerank");
        assertThat(response.diagnostics().rerankApplied()).isTrue();
        assertThat(response.diagnostics().visualScoredCount()).isEqualTo(3);
        assertThat(response.results()).extracting(SceneResult::id).containsExactly("b", "a", "c");
        assertThat(response.results().get(0).visualScore()).isEqualTo(0.9d);
        assertThat(response.results().get(0).score()).isCloseTo(0.7d * 0.8d + 0.3d, within(1e-9d));
    }

    @Test
    void recallQueriesPassTheVisualEmbeddingToRetrieval() {
        when(visualClient.embed(anyString())).thenReturn(VISUAL_QUERY);

        SearchResponse response = service(SearchSettings.defaults()).search(SearchRequest.of("red car"));

        assertThat(lastQuery.get().mode()).isEqualTo(VisualMode.RECALL);
        assertThat(lastQuery.get().visualEmbedding()).isSameAs(VISUAL_QUERY);
        assertThat(lastQuery.get().weights().valueOf(Channels.VISUAL)).isCloseTo(0.15d, within(1e-9d));
        assertThat(response.diagnostics().visualModeUsed()).isEqualTo("recall");
        assertThat(response.diagnostics().rerankApplied()).isFalse();
    }

    @Test
    void visualServiceFailureDegradesToSkip() {
        when(visualClient.embed(anyString())).thenThrow(new VisualServiceTimeoutException("timed out", null));

        SearchResponse response = service(SearchSettings.defaults()).search(SearchRequest.of("red car"));

        assertThat(response.diagnostics().routedMode()).isEqualTo("recall");
        assertThat(response.diagnostics().visualModeUsed()).isEqualTo("skip");
        assertThat(response.diagnostics().warnings()).anyMatch(warning -> warning.contains("degraded to skip"));
        assertThat(lastQuery.get().mode()).isEqualTo(VisualMode.SKIP);
        assertThat(lastQuery.get().weights().valueOf(Channels.VISUAL)).isZero();
        assertThat(response.results()).hasSize(3);
    }

    @Test
    void slowVisualEmbeddingIsAbandonedAfterDeadline() {
        Executor neverRuns = task -> {
        };
        SearchSettings shortDeadline = SearchSettings.defaults().withVisualDeadline(Duration.ofMillis(20));

        SearchResponse response = service(shortDeadline, neverRuns, new DeterministicEmbeddingProvider(8))
                .search(SearchRequest.of("budget meeting"));

        assertThat(response.diagnostics().visualModeUsed()).isEqualTo("skip");
        assertThat(response.diagnostics().rerankApplied()).isFalse();
        assertThat(response.results()).extracting(SceneResult::id).containsExactly("a", "b", "c");
    }

    @Test
    void textEmbeddingFailureFallsBackToLexicalRetrieval() {
        EmbeddingProvider failing = new EmbeddingProvider() {
            @Override
            public float[] embed(String text) {
                throw new EmbeddingException("quota exceeded");
            }

            @Override
            public int dimensions() {
                return 8;
            }
        };

        SearchResponse response = service(SearchSettings.defaults(), directExecutor, failing)
                .search(new SearchRequest("budget meeting", null, null, "skip", null));

        assertThat(lastQuery.get().textEmbedding()).isNull();
        assertThat(lastQuery.get().weights().valueOf(Channels.LEXICAL)).isCloseTo(1.0d, within(1e-9d));
        assertThat(response.results()).isNotEmpty();
    }

    @Test
    void requestedModeOverridesConfiguration() {
        service(SearchSettings.defaults()).search(new SearchRequest("red car", null, null, "skip", null));

        assertThat(lastQuery.get().mode()).isEqualTo(VisualMode.SKIP);
        verifyNoInteractions(visualClient);
    }

    @Test
    void disabledMultiDenseForcesSkip() {
        SearchResponse response = service(SearchSettings.defaults().withMultiDenseEnabled(false))
                .search(SearchRequest.of("red car"));

        assertThat(response.diagnostics().visualModeUsed()).isEqualTo("skip");
        assertThat(lastQuery.get().weights().contains(Channels.VISUAL)).isFalse();
        verifyNoInteractions(visualClient);
    }

    @Test
    void limitsResultsAndAttachesDisplayScores() {
        SearchResponse response = service(SearchSettings.defaults())
                .search(new SearchRequest("he says hello", 2, 0.0d, null, null));

        assertThat(response.total()).isEqualTo(2);
        assertThat(response.results()).hasSize(2);
        assertThat(response.results().get(0).displayScore())
                .isGreaterThan(response.results().get(1).displayScore());
        assertThat(response.query()).isEqualTo("he says hello");
    }

    @Test
    void failingRetrievalFailsTheSearch() {
        SceneSearchService service = new SceneSearchService(new VisualIntentRouter(),
                new WeightResolver(new WeightModel(), SearchSettings.defaults()),
                query -> {
                    throw new IllegalStateException("database unreachable");
                },
                new VisualReranker(new FailSoftVisualScoring(visualClient), SearchSettings.defaults()),
                new FailSoftVisualScoring(visualClient), new DeterministicEmbeddingProvider(8),
                new DisplayScoreCalibrator(SearchSettings.defaults()), SearchSettings.defaults(), directExecutor);

        assertThatThrownBy(() -> service.search(SearchRequest.of("he says hello")))
                .isInstanceOf(SearchFailedException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    private SceneSearchService service(SearchSettings settings) {
        return service(settings, directExecutor, new DeterministicEmbeddingProvider(8));
    }

    private SceneSearchService service(SearchSettings settings, Executor executor, EmbeddingProvider embeddings) {
        CandidateRetriever retriever = query -> {
            lastQuery.set(query);
            return retrievedPool;
        };
        FailSoftVisualScoring visualScoring = new FailSoftVisualScoring(visualClient);
        return new SceneSearchService(new VisualIntentRouter(), new WeightResolver(new WeightModel(), settings),
                retriever, new VisualReranker(visualScoring, settings), visualScoring, embeddings,
                new DisplayScoreCalibrator(settings), settings, executor);
    }
}
