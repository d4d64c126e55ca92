package ch.so.arp.scenesearch.search;

/**
 * How the visual channel takes part in a single search request.
 */
public enum VisualMode {

    /** Visual similarity is one of the retrieval channels. */
    RECALL,

    /** Visual similarity only reorders the pool retrieved by the other channels. */
    RERANK,

    /** The visual channel is ignored. */
    SKIP
}
