package ch.so.arp.scenesearch.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class InMemoryCandidateRetrieverTest {

    private final DeterministicEmbeddingProvider textEmbeddings = new DeterministicEmbeddingProvider(256);
    private final DeterministicEmbeddingProvider visualEmbeddings = new DeterministicEmbeddingProvider(256);
    private final WeightModel model = new WeightModel();

    private final InMemorySceneCatalog catalog = new InMemorySceneCatalog(List.of(
            new SceneSummary("s1", "v1", 0, 0.0d, 4.0d, "we drive the red car to the coast",
                    "a red car on a coastal road", "", List.of("car", "red")),
            new SceneSummary("s2", "v1", 1, 4.0d, 9.0d, "the budget is almost gone", "", "", List.of()),
            new SceneSummary("s3", "v2", 0, 0.0d, 6.0d, "the dog runs after the ball",
                    "a brown dog running in a park", "", List.of("dog", "park"))),
            textEmbeddings, visualEmbeddings);

    private final InMemoryCandidateRetriever retriever = new InMemoryCandidateRetriever(catalog,
            new ScoreFusionEngine());

    @Test
    void ranksScenesSharingQueryWordsFirst() {
        String text = "red car";
        RetrievalQuery query = new RetrievalQuery(text, textEmbeddings.embed(text), null,
                model.normalizeWeights(WeightVector.fromValues(Map.of(Channels.TRANSCRIPT, 0.5d,
                        Channels.LEXICAL, 0.5d))),
                VisualMode.SKIP, 10, 0.0d);

        CandidatePool pool = retriever.retrieve(query);

        assertThat(pool.sceneIds()).first().isEqualTo("s1");
        Candidate best = pool.candidates().get(0);
        assertThat(best.channelScores()).containsEntry(Channels.LEXICAL, 1.0d);
        assertThat(best.baseScore()).isEqualTo(best.finalScore());
    }

    @Test
    void lexicalOnlyRetrievalWorksWithoutTextEmbedding() {
        RetrievalQuery query = new RetrievalQuery("budget", null, null,
                WeightVector.fromValues(Map.of(Channels.TRANSCRIPT, 0.0d, Channels.LEXICAL, 1.0d)), VisualMode.SKIP,
                10, 0.0d);

        CandidatePool pool = retriever.retrieve(query);

        assertThat(pool.sceneIds()).containsExactly("s2");
        assertThat(pool.candidates().get(0).baseScore()).isEqualTo(1.0d);
    }

    @Test
    void visualChannelOnlyContributesInRecall() {
        String text = "brown dog";
        WeightVector weights = WeightVector.fromValues(Map.of(Channels.VISUAL, 1.0d));

        CandidatePool recall = retriever.retrieve(new RetrievalQuery(text, null, visualEmbeddings.embed(text),
                weights, VisualMode.RECALL, 10, 0.0d));
        CandidatePool rerank = retriever.retrieve(new RetrievalQuery(text, null, visualEmbeddings.embed(text),
                weights, VisualMode.RERANK, 10, 0.0d));

        assertThat(recall.sceneIds()).first().isEqualTo("s3");
        assertThat(recall.sceneIds()).doesNotContain("s2");
        assertThat(rerank.isEmpty()).isTrue();
    }

    @Test
    void boundsPoolAndAppliesThreshold() {
        String text = "the red car and the dog";
        WeightVector weights = WeightVector.fromValues(Map.of(Channels.LEXICAL, 1.0d));

        CandidatePool bounded = retriever.retrieve(new RetrievalQuery(text, null, null, weights, VisualMode.SKIP,
                1, 0.0d));
        CandidatePool thresholded = retriever.retrieve(new RetrievalQuery(text, null, null, weights,
                VisualMode.SKIP, 10, 0.99d));

        assertThat(bounded.size()).isEqualTo(1);
        assertThat(thresholded.candidates()).allSatisfy(candidate -> assertThat(candidate.baseScore())
                .isGreaterThanOrEqualTo(0.99d));
    }

    @Test
    void rankFusionScoresByChannelRankInsteadOfNormalizedScore() {
        String text = "the red car and the dog";
        WeightVector weights = WeightVector.fromValues(Map.of(Channels.LEXICAL, 1.0d));
        InMemoryCandidateRetriever rrfRetriever = new InMemoryCandidateRetriever(catalog,
                new ScoreFusionEngine(FusionMethod.RRF, 60));

        CandidatePool minMax = retriever.retrieve(new RetrievalQuery(text, null, null, weights, VisualMode.SKIP,
                10, 0.0d));
        CandidatePool rrf = rrfRetriever.retrieve(new RetrievalQuery(text, null, null, weights, VisualMode.SKIP,
                10, 0.0d));

        assertThat(minMax.sceneIds()).containsExactly("s1", "s3");
        assertThat(minMax.candidates().get(1).baseScore()).isZero();
        assertThat(rrf.sceneIds()).containsExactly("s1", "s3");
        assertThat(rrf.candidates().get(0).baseScore()).isCloseTo(1.0d, within(1e-9d));
        assertThat(rrf.candidates().get(1).baseScore()).isCloseTo(61.0d / 62.0d, within(1e-9d));
        assertThat(rrf.candidates().get(1).channelScores()).containsEntry(Channels.LEXICAL, 0.0d);
    }
}
