package ch.so.arp.scenesearch.search;

/**
 * First ranking stage: produces the ordered, bounded candidate pool for a
 * request from the scene index.
 */
public interface CandidateRetriever {

    /**
     * Retrieve the best scenes over every active channel of the query.
     *
     * @param query the text, embeddings and weights of the request
     * @return candidates ordered by base score, at most {@code query.poolSize()}
     */
    CandidatePool retrieve(RetrievalQuery query);
}
