package ch.so.arp.scenesearch.visual;

/**
 * The visual embedding service rejected the request signature.
 */
public class VisualServiceAuthException extends VisualServiceException {

    public VisualServiceAuthException(String message) {
        super(message);
    }
}
