package ch.so.arp.scenesearch.search;

/**
 * The base retrieval of a search failed, no result can be produced.
 */
public class SearchFailedException extends RuntimeException {

    public SearchFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
