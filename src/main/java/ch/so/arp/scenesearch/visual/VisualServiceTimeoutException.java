package ch.so.arp.scenesearch.visual;

/**
 * The visual embedding service did not answer in time.
 */
public class VisualServiceTimeoutException extends VisualServiceException {

    public VisualServiceTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
