package ch.so.arp.scenesearch.search;

import static ch.so.arp.scenesearch.search.SearchFixtures.pool;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import ch.so.arp.scenesearch.visual.FailSoftVisualScoring;
import ch.so.arp.scenesearch.visual.VisualScoringClient;
import ch.so.arp.scenesearch.visual.VisualServiceTimeoutException;

class VisualRerankerTest {

    private static final float[] QUERY = new float[] { 0.1f, 0.2f };

    private VisualScoringClient client;
    private VisualReranker reranker;

    @BeforeEach
    void setUp() {
        client = mock(VisualScoringClient.class);
        reranker = new VisualReranker(new FailSoftVisualScoring(client), SearchSettings.defaults());
    }

    @Test
    void flatVisualScoresKeepBaseOrder() {
        CandidatePool pool = pool("a", 0.9d, "b", 0.8d, "c", 0.7d, "d", 0.6d);
        when(client.batchScore(any(), anyList())).thenReturn(scores("a", 0.50d, "b", 0.51d, "c", 0.52d, "d", 0.53d));

        RerankOutcome outcome = reranker.rerank(pool, VisualMode.RERANK, QUERY);

        assertThat(outcome.applied()).isFalse();
        assertThat(outcome.skipReason()).startsWith("flat visual scores");
        assertThat(outcome.scoredCount()).isEqualTo(4);
        assertThat(outcome.pool().sceneIds()).containsExactly("a", "b", "c", "d");
        outcome.pool().candidates().forEach(candidate -> assertThat(candidate.finalScore())
                .isEqualTo(candidate.baseScore()));
    }

    @Test
    void blendsNormalizedVisualScoresAndResorts() {
        CandidatePool pool = pool("a", 0.9d, "b", 0.8d, "c", 0.7d, "d", 0.6d);
        Map<String, Double> visual = scores("a", 0.1d, "b", 0.2d, "c", 0.9d, "d", 0.5d);
        when(client.batchScore(any(), anyList())).thenReturn(visual);

        RerankOutcome outcome = reranker.rerank(pool, VisualMode.RERANK, QUERY);

        assertThat(outcome.applied()).isTrue();
        assertThat(outcome.minScore()).isEqualTo(0.1d);
        assertThat(outcome.maxScore()).isEqualTo(0.9d);
        assertThat(outcome.pool().sceneIds()).containsExactly("c", "a", "b", "d");
        for (Candidate candidate : outcome.pool().candidates()) {
            double normalized = (visual.get(candidate.sceneId()) - 0.1d) / 0.8d;
            assertThat(candidate.finalScore()).isCloseTo(0.7d * candidate.baseScore() + 0.3d * normalized,
                    within(1e-9d));
            assertThat(candidate.visualScore()).isEqualTo(visual.get(candidate.sceneId()));
        }
        verify(client).batchScore(QUERY, List.of("a", "b", "c", "d"));
    }

    @Test
    void missingScoresGiveZeroVisualContribution() {
        CandidatePool pool = pool("a", 0.9d, "b", 0.8d, "c", 0.7d, "d", 0.6d);
        when(client.batchScore(any(), anyList())).thenReturn(scores("a", 0.1d, "c", 0.9d, "unknown", 0.95d));

        RerankOutcome outcome = reranker.rerank(pool, VisualMode.RERANK, QUERY);

        assertThat(outcome.scoredCount()).isEqualTo(2);
        assertThat(outcome.pool().sceneIds()).containsExactly("c", "a", "b", "d");
        Candidate b = outcome.pool().candidates().get(2);
        assertThat(b.visualScore()).isNull();
        assertThat(b.finalScore()).isCloseTo(0.7d * 0.8d, within(1e-9d));
    }

    @Test
    void equalFinalScoresKeepBaseOrder() {
        CandidatePool pool = pool("b", 0.5d, "a", 0.5d, "c", 0.4d);
        when(client.batchScore(any(), anyList())).thenReturn(scores("b", 0.2d, "a", 0.2d, "c", 0.8d));

        RerankOutcome outcome = reranker.rerank(pool, VisualMode.RERANK, QUERY);

        assertThat(outcome.pool().sceneIds()).containsExactly("c", "b", "a");
    }

    @Test
    void skipsOutsideOfRerankMode() {
        CandidatePool pool = pool("a", 0.9d, "b", 0.8d);

        RerankOutcome outcome = reranker.rerank(pool, VisualMode.SKIP, QUERY);

        assertThat(outcome.applied()).isFalse();
        assertThat(outcome.skipReason()).isEqualTo("visual mode skip");
        assertThat(outcome.pool().sceneIds()).containsExactly("a", "b");
        verifyNoInteractions(client);
    }

    @Test
    void skipsWithoutQueryEmbedding() {
        RerankOutcome outcome = reranker.rerank(pool("a", 0.9d), VisualMode.RERANK, null);

        assertThat(outcome.skipReason()).isEqualTo("visual query embedding unavailable");
        verifyNoInteractions(client);
    }

    @Test
    void degradesWhenBatchScoringFails() {
        CandidatePool pool = pool("a", 0.9d, "b", 0.8d);
        when(client.batchScore(any(), anyList())).thenThrow(new VisualServiceTimeoutException("timed out", null));

        RerankOutcome outcome = reranker.rerank(pool, VisualMode.RERANK, QUERY);

        assertThat(outcome.applied()).isFalse();
        assertThat(outcome.skipReason()).isEqualTo("visual batch scoring failed");
        assertThat(outcome.pool().sceneIds()).containsExactly("a", "b");
    }

    @Test
    void emptyResponseIsTreatedAsFlat() {
        when(client.batchScore(any(), anyList())).thenReturn(Map.of());

        RerankOutcome outcome = reranker.rerank(pool("a", 0.9d, "b", 0.8d), VisualMode.RERANK, QUERY);

        assertThat(outcome.applied()).isFalse();
        assertThat(outcome.skipReason()).isEqualTo("no visual scores");
    }

    private static Map<String, Double> scores(Object... idsAndScores) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (int i = 0; i < idsAndScores.length; i += 2) {
            scores.put((String) idsAndScores[i], (Double) idsAndScores[i + 1]);
        }
        return scores;
    }
}
