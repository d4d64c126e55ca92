package ch.so.arp.scenesearch.search;

/**
 * Strategy abstraction used to compute text embeddings for queries.
 * Implementations can either call a remote embedding API or provide
 * deterministic vectors suited for tests and local development.
 */
public interface EmbeddingProvider {

    /**
     * Create an embedding vector for the provided text.
     *
     * @param text the text to embed
     * @return the embedding represented as a float array
     * @throws EmbeddingException if no embedding can be produced
     */
    float[] embed(String text);

    /**
     * @return the dimension of the produced vectors
     */
    int dimensions();
}
