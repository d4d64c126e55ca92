package ch.so.arp.scenesearch.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.scenesearch.visual.FailSoftVisualScoring;

/**
 * Second ranking stage for {@link VisualMode#RERANK}: scores the whole pool
 * against the visual query embedding in one batch and blends the min-max
 * normalized visual score into the base score,
 * {@code final = (1 - w) * base + w * visual}.
 * <p>
 * When the visual scores barely differ (spread below the configured minimum
 * range) they carry no ranking signal and the pool is returned with its base
 * order.
 */
public class VisualReranker {

    private static final Logger LOGGER = LoggerFactory.getLogger(VisualReranker.class);

    private static final double FLAT_EPSILON = 1e-12d;

    private final FailSoftVisualScoring visualScoring;
    private final double clipWeight;
    private final double minScoreRange;

    public VisualReranker(FailSoftVisualScoring visualScoring, SearchSettings settings) {
        this.visualScoring = Objects.requireNonNull(visualScoring, "visualScoring");
        this.clipWeight = settings.rerankClipWeight();
        this.minScoreRange = settings.rerankMinScoreRange();
    }

    /**
     * @param pool                   candidates in base order
     * @param mode                   the visual mode of the request
     * @param queryVisualEmbedding   visual embedding of the query, may be {@code null}
     */
    public RerankOutcome rerank(CandidatePool pool, VisualMode mode, float[] queryVisualEmbedding) {
        if (mode != VisualMode.RERANK) {
            return RerankOutcome.skipped(pool, "visual mode " + mode.name().toLowerCase(Locale.ROOT));
        }
        if (queryVisualEmbedding == null) {
            return RerankOutcome.skipped(pool, "visual query embedding unavailable");
        }
        if (pool.isEmpty()) {
            return RerankOutcome.skipped(pool, "empty candidate pool");
        }

        Optional<Map<String, Double>> response = visualScoring.batchScore(queryVisualEmbedding, pool.sceneIds());
        if (response.isEmpty()) {
            return RerankOutcome.skipped(pool, "visual batch scoring failed");
        }
        Map<String, Double> scores = knownScores(response.get(), Set.copyOf(pool.sceneIds()));
        if (scores.isEmpty()) {
            return RerankOutcome.skipped(pool, "no visual scores");
        }

        double min = ScoreFusionEngine.min(scores.values());
        double max = ScoreFusionEngine.max(scores.values());
        double range = max - min;
        if (range < minScoreRange || range < FLAT_EPSILON) {
            LOGGER.info("Visual scores flat (range {} < {}), keeping base order of {} candidates",
                    String.format("%.4f", range), minScoreRange, pool.size());
            return new RerankOutcome(pool.withBaseScoresAsFinal(), false,
                    String.format("flat visual scores (range %.4f)", range), scores.size(), min, max);
        }

        List<Candidate> blended = new ArrayList<>(pool.size());
        for (Candidate candidate : pool.candidates()) {
            Double raw = scores.get(candidate.sceneId());
            double normalized = raw == null ? 0.0d : (raw - min) / range;
            double finalScore = (1.0d - clipWeight) * candidate.baseScore() + clipWeight * normalized;
            blended.add(candidate.withVisual(raw, finalScore));
        }
        // List.sort is stable, equal final scores keep the base order
        blended.sort(Comparator.comparingDouble(Candidate::finalScore).reversed());

        LOGGER.info("Visual rerank blended {}/{} candidates (range {}, weight {})", scores.size(), pool.size(),
                String.format("%.4f", range), clipWeight);
        return new RerankOutcome(new CandidatePool(blended), true, null, scores.size(), min, max);
    }

    private static Map<String, Double> knownScores(Map<String, Double> response, Set<String> poolIds) {
        Map<String, Double> scores = new LinkedHashMap<>();
        response.forEach((id, score) -> {
            if (poolIds.contains(id) && score != null && Double.isFinite(score)) {
                scores.put(id, score);
            }
        });
        return scores;
    }
}
