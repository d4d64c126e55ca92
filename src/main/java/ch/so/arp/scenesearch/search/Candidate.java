package ch.so.arp.scenesearch.search;

import java.util.Map;
import java.util.Objects;

/**
 * A scene considered for one search request.
 *
 * @param scene         scene metadata
 * @param channelScores per-channel similarity in {@code [0, 1]}
 * @param baseScore     fusion of the channel scores
 * @param visualScore   raw visual similarity from reranking, {@code null} if absent
 * @param finalScore    the score results are ordered by
 */
public record Candidate(SceneSummary scene, Map<String, Double> channelScores, double baseScore, Double visualScore,
        double finalScore) {

    public Candidate {
        Objects.requireNonNull(scene, "scene");
        channelScores = Map.copyOf(channelScores);
    }

    public static Candidate scored(SceneSummary scene, Map<String, Double> channelScores, double baseScore) {
        return new Candidate(scene, channelScores, baseScore, null, baseScore);
    }

    public String sceneId() {
        return scene.id();
    }

    public Candidate withFinalScore(double score) {
        return new Candidate(scene, channelScores, baseScore, visualScore, score);
    }

    public Candidate withVisual(Double rawVisualScore, double score) {
        return new Candidate(scene, channelScores, baseScore, rawVisualScore, score);
    }
}
