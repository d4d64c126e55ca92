package ch.so.arp.scenesearch.search;

import java.util.List;

/**
 * Result of a scene search.
 */
public record SearchResponse(String query, List<SceneResult> results, int total, long latencyMs,
        SearchDiagnostics diagnostics) {
}
