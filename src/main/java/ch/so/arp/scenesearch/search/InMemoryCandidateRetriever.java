package ch.so.arp.scenesearch.search;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.scenesearch.search.InMemorySceneCatalog.IndexedScene;

/**
 * {@link CandidateRetriever} over an {@link InMemorySceneCatalog}. Dense
 * channels use cosine similarity of the stored vectors, the lexical channel
 * the share of query words found in the scene text and tags.
 */
class InMemoryCandidateRetriever implements CandidateRetriever {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryCandidateRetriever.class);

    private static final Comparator<Map.Entry<IndexedScene, Double>> BY_SCORE = Map.Entry
            .<IndexedScene, Double>comparingByValue().reversed()
            .thenComparing(entry -> entry.getKey().scene().id());

    private final InMemorySceneCatalog catalog;
    private final ScoreFusionEngine fusion;

    InMemoryCandidateRetriever(InMemorySceneCatalog catalog, ScoreFusionEngine fusion) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.fusion = Objects.requireNonNull(fusion, "fusion");
    }

    @Override
    public CandidatePool retrieve(RetrievalQuery query) {
        CandidateAccumulator accumulator = new CandidateAccumulator();
        for (String channel : query.activeChannels()) {
            Map<IndexedScene, Double> hits = switch (channel) {
                case Channels.TRANSCRIPT -> dense(query.textEmbedding(), IndexedScene::transcriptEmbedding);
                case Channels.SUMMARY -> dense(query.textEmbedding(), IndexedScene::summaryEmbedding);
                case Channels.VISUAL -> dense(query.visualEmbedding(), IndexedScene::visualEmbedding);
                case Channels.LEXICAL -> lexical(query.text());
                default -> Map.of();
            };
            hits.entrySet().stream()
                    .sorted(BY_SCORE)
                    .limit(query.poolSize())
                    .forEach(hit -> accumulator.add(channel, hit.getKey().scene(), hit.getValue()));
        }
        CandidatePool pool = accumulator.toPool(fusion, query);
        LOGGER.debug("In-memory retrieval over {} produced {} candidates from {} hits", query.activeChannels(),
                pool.size(), accumulator.size());
        return pool;
    }

    private Map<IndexedScene, Double> dense(float[] queryVector, Function<IndexedScene, float[]> sceneVector) {
        return catalog.scenes().stream()
                .filter(scene -> sceneVector.apply(scene) != null)
                .collect(Collectors.toMap(Function.identity(),
                        scene -> Vectors.cosine(queryVector, sceneVector.apply(scene))));
    }

    private Map<IndexedScene, Double> lexical(String text) {
        List<String> terms = VisualIntentRouter.contentTokens(text).stream().distinct().toList();
        if (terms.isEmpty()) {
            return Map.of();
        }
        return catalog.scenes().stream()
                .collect(Collectors.toMap(Function.identity(),
                        scene -> (double) terms.stream().filter(scene.keywords()::contains).count() / terms.size()))
                .entrySet().stream()
                .filter(entry -> entry.getValue() > 0.0d)
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));
    }
}
