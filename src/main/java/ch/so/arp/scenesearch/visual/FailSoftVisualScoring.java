package ch.so.arp.scenesearch.visual;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a {@link VisualScoringClient} so that any failure of the visual
 * service becomes an empty result plus a WARN log, including unexpected
 * runtime exceptions of the client. Callers fall back to non-visual ranking
 * instead of failing the search.
 */
public class FailSoftVisualScoring {

    private static final Logger LOGGER = LoggerFactory.getLogger(FailSoftVisualScoring.class);

    private final VisualScoringClient client;

    public FailSoftVisualScoring(VisualScoringClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public Optional<float[]> embedQuery(String text) {
        try {
            return Optional.of(client.embed(text));
        } catch (RuntimeException ex) {
            LOGGER.warn("Visual query embedding unavailable ({}): {}", describe(ex), ex.getMessage());
            return Optional.empty();
        }
    }

    public Optional<Map<String, Double>> batchScore(float[] queryEmbedding, List<String> candidateIds) {
        try {
            return Optional.of(client.batchScore(queryEmbedding, candidateIds));
        } catch (RuntimeException ex) {
            LOGGER.warn("Visual batch scoring of {} candidates failed ({}): {}", candidateIds.size(), describe(ex),
                    ex.getMessage());
            return Optional.empty();
        }
    }

    private static String describe(RuntimeException ex) {
        if (ex instanceof VisualServiceTimeoutException) {
            return "timeout";
        }
        if (ex instanceof VisualServiceAuthException) {
            return "auth";
        }
        if (ex instanceof VisualServiceException) {
            return "error";
        }
        return "unexpected " + ex.getClass().getSimpleName();
    }
}
