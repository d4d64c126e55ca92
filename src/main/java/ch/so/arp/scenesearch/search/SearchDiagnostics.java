package ch.so.arp.scenesearch.search;

import java.util.List;
import java.util.Map;

/**
 * How a search was executed.
 *
 * @param configuredMode       configured or requested mode setting
 * @param routedMode           mode chosen by the router
 * @param visualModeUsed       mode actually used after degradations
 * @param routingReason        reason of the routing decision
 * @param matchedTerms         lexicon matches of the query
 * @param weights              applied channel weights
 * @param weightSource         {@code request} or {@code default}
 * @param fusionMethod         how channel results were combined
 * @param rerankApplied        whether visual scores were blended in
 * @param rerankSkipReason     why reranking did not blend, {@code null} if applied
 * @param visualScoredCount    candidates scored by the visual service
 * @param candidatePoolSize    size of the retrieved pool
 * @param warnings             degradations and weight adjustments
 */
public record SearchDiagnostics(
        String configuredMode,
        String routedMode,
        String visualModeUsed,
        String routingReason,
        List<String> matchedTerms,
        Map<String, Double> weights,
        String weightSource,
        String fusionMethod,
        boolean rerankApplied,
        String rerankSkipReason,
        int visualScoredCount,
        int candidatePoolSize,
        List<String> warnings) {
}
