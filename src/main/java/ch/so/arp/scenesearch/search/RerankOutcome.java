package ch.so.arp.scenesearch.search;

import java.util.Objects;

/**
 * Result of the visual rerank pass.
 *
 * @param pool        candidates ordered by final score
 * @param applied     whether visual scores were blended in
 * @param skipReason  why no blending happened, {@code null} when applied
 * @param scoredCount number of candidates the visual service returned a score for
 * @param minScore    lowest returned visual score, {@code 0} if none
 * @param maxScore    highest returned visual score, {@code 0} if none
 */
public record RerankOutcome(CandidatePool pool, boolean applied, String skipReason, int scoredCount,
        double minScore, double maxScore) {

    public RerankOutcome {
        Objects.requireNonNull(pool, "pool");
    }

    static RerankOutcome skipped(CandidatePool pool, String reason) {
        return new RerankOutcome(pool.withBaseScoresAsFinal(), false, reason, 0, 0.0d, 0.0d);
    }

    public double scoreRange() {
        return maxScore - minScore;
    }
}
