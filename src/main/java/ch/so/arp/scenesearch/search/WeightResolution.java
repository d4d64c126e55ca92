package ch.so.arp.scenesearch.search;

import java.util.List;
import java.util.Map;

/**
 * Outcome of resolving the channel weights for one request.
 *
 * @param requested weights supplied with the request or {@code null}
 * @param applied   normalized weights used for scoring
 * @param source    {@code "request"} or {@code "default"}
 * @param clamped   whether a guardrail changed a weight
 * @param warnings  human readable notes about adjustments
 */
public record WeightResolution(Map<String, Double> requested, WeightVector applied, String source, boolean clamped,
        List<String> warnings) {

    public WeightResolution {
        warnings = List.copyOf(warnings);
    }
}
