package ch.so.arp.scenesearch.search;

import java.util.Map;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Incoming payload for scene searches.
 *
 * @param query          natural language query
 * @param limit          number of results, defaults to 20
 * @param threshold      minimum base score, defaults to 0
 * @param visualMode     optional override of the configured visual mode
 * @param channelWeights optional channel weights, take precedence over the configured defaults
 */
public record SearchRequest(
        @NotBlank String query,
        @Min(1) @Max(100) Integer limit,
        @DecimalMin("0.0") @DecimalMax("1.0") Double threshold,
        @Pattern(regexp = "(?i)auto|recall|rerank|skip") String visualMode,
        Map<String, Double> channelWeights) {

    public static final int DEFAULT_LIMIT = 20;

    public SearchRequest {
        limit = limit == null ? DEFAULT_LIMIT : limit;
        threshold = threshold == null ? 0.0d : threshold;
    }

    public static SearchRequest of(String query) {
        return new SearchRequest(query, null, null, null, null);
    }
}
