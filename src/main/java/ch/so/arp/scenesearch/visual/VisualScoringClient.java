package ch.so.arp.scenesearch.visual;

import java.util.List;
import java.util.Map;

/**
 * Capability interface of the external visual embedding service. The service
 * embeds query text into the same space as the stored scene key frames and
 * scores batches of candidates against such an embedding.
 */
public interface VisualScoringClient {

    /**
     * Embed the query text into the visual embedding space.
     *
     * @param text the query text
     * @return the visual text embedding
     * @throws VisualServiceException if the service cannot produce an embedding
     */
    float[] embed(String text);

    /**
     * Score all candidates against the query embedding in one round trip.
     * Candidates without a stored visual embedding are missing from the result.
     *
     * @param queryEmbedding embedding returned by {@link #embed(String)}
     * @param candidateIds   scene ids to score
     * @return scene id to visual similarity
     * @throws VisualServiceException if the batch cannot be scored
     */
    Map<String, Double> batchScore(float[] queryEmbedding, List<String> candidateIds);
}
