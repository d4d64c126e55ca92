package ch.so.arp.scenesearch.visual;

/**
 * Failure while talking to the visual embedding service.
 */
public class VisualServiceException extends RuntimeException {

    public VisualServiceException(String message) {
        super(message);
    }

    public VisualServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
