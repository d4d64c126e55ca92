package ch.so.arp.scenesearch.visual;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.scenesearch.search.Vectors;

/**
 * In-process stand-in for the visual service. Query embeddings come from a
 * deterministic text encoder and candidates are scored by cosine similarity
 * against a fixed visual index. Ids without a stored vector are left out of
 * the result, like the real service does for unknown scenes.
 */
public class DeterministicVisualScoringClient implements VisualScoringClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeterministicVisualScoringClient.class);

    private final Function<String, float[]> textEncoder;
    private final Map<String, float[]> visualIndex;

    public DeterministicVisualScoringClient(Function<String, float[]> textEncoder, Map<String, float[]> visualIndex) {
        this.textEncoder = Objects.requireNonNull(textEncoder, "textEncoder");
        this.visualIndex = Map.copyOf(visualIndex);
        LOGGER.info("Using deterministic visual scoring over {} indexed scenes", this.visualIndex.size());
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new VisualServiceException("text to embed must not be blank");
        }
        return textEncoder.apply(text);
    }

    @Override
    public Map<String, Double> batchScore(float[] queryEmbedding, List<String> candidateIds) {
        Objects.requireNonNull(queryEmbedding, "queryEmbedding");
        Map<String, Double> scores = new LinkedHashMap<>();
        for (String id : candidateIds) {
            float[] stored = visualIndex.get(id);
            if (stored == null) {
                continue;
            }
            if (stored.length != queryEmbedding.length) {
                throw new VisualServiceException("query embedding has " + queryEmbedding.length
                        + " dimensions, scene " + id + " has " + stored.length);
            }
            scores.put(id, Vectors.cosine(queryEmbedding, stored));
        }
        return scores;
    }
}
