package ch.so.arp.scenesearch.search;

/**
 * Raised when a channel weight configuration cannot be used for scoring, for
 * example because it has no channels or no positive weight.
 */
public class InvalidWeightsException extends RuntimeException {

    public InvalidWeightsException(String message) {
        super(message);
    }
}
