package ch.so.arp.scenesearch.search;

import java.util.Locale;

/**
 * How the per-channel results of one retrieval are combined into the base
 * score of a candidate.
 */
public enum FusionMethod {

    /**
     * Weighted mean of the channel similarities, lexical scores min-max
     * normalized first.
     */
    MINMAX_MEAN,

    /**
     * Weighted reciprocal rank fusion over the per-channel ranks. Raw scores
     * only decide the order within a channel.
     */
    RRF;

    /**
     * Parses the configured value, e.g. {@code minmax_mean} or {@code rrf}.
     * Blank values select {@link #MINMAX_MEAN}.
     */
    public static FusionMethod parse(String value) {
        if (value == null || value.isBlank()) {
            return MINMAX_MEAN;
        }
        try {
            return valueOf(value.strip().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(
                    "unknown fusion method '" + value + "', expected one of minmax_mean, rrf", ex);
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
