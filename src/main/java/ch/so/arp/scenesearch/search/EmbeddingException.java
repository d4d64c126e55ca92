package ch.so.arp.scenesearch.search;

/**
 * The text embedding for a query could not be computed.
 */
public class EmbeddingException extends RuntimeException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
