package ch.so.arp.scenesearch.search;

import java.util.List;

/**
 * Visual mode chosen for a query together with the reason for the choice.
 *
 * @param mode         the mode to use
 * @param reason       short explanation, e.g. the matched keyword
 * @param matchedTerms lexicon matches as {@code category:term}
 * @param forced       whether the mode was configured rather than classified
 */
public record RoutingDecision(VisualMode mode, String reason, List<String> matchedTerms, boolean forced) {

    public RoutingDecision {
        matchedTerms = List.copyOf(matchedTerms);
    }

    static RoutingDecision forced(VisualMode mode) {
        return new RoutingDecision(mode, "forced", List.of(), true);
    }

    static RoutingDecision classified(VisualMode mode, String reason, List<String> matchedTerms) {
        return new RoutingDecision(mode, reason, matchedTerms, false);
    }
}
