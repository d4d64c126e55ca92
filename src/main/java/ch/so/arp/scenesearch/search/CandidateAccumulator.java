package ch.so.arp.scenesearch.search;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges per-channel hits of one retrieval into fused candidates. Channel
 * ranks for reciprocal rank fusion are taken from the raw scores, before the
 * lexical scores are normalized.
 */
final class CandidateAccumulator {

    private static final Comparator<Candidate> BY_BASE_SCORE = Comparator
            .comparingDouble(Candidate::baseScore).reversed()
            .thenComparing(Candidate::sceneId);

    private final Map<String, SceneSummary> scenes = new LinkedHashMap<>();
    private final Map<String, Map<String, Double>> scores = new HashMap<>();

    /**
     * Records the score of a scene for a channel. Dense and visual similarities
     * are clamped to {@code [0, 1]}; lexical scores stay raw until
     * {@link #toPool} normalizes them.
     */
    void add(String channel, SceneSummary scene, double score) {
        if (!Double.isFinite(score)) {
            return;
        }
        double value = Channels.LEXICAL.equals(channel) ? score : WeightModel.clamp(score);
        scenes.putIfAbsent(scene.id(), scene);
        scores.computeIfAbsent(channel, key -> new LinkedHashMap<>()).merge(scene.id(), value, Math::max);
    }

    int size() {
        return scenes.size();
    }

    CandidatePool toPool(ScoreFusionEngine fusion, RetrievalQuery query) {
        Map<String, Map<String, Integer>> ranks = new HashMap<>();
        if (fusion.method() == FusionMethod.RRF) {
            scores.forEach((channel, byScene) -> ranks.put(channel, fusion.ranks(byScene)));
        }
        Map<String, Double> lexical = scores.get(Channels.LEXICAL);
        if (lexical != null) {
            scores.put(Channels.LEXICAL, fusion.minMaxNormalize(lexical));
        }
        List<Candidate> candidates = scenes.values().stream()
                .map(scene -> {
                    Map<String, Double> channelScores = channelScores(scene.id());
                    double base = switch (fusion.method()) {
                        case MINMAX_MEAN -> fusion.fuse(channelScores, query.weights(), query.mode());
                        case RRF -> fusion.fuseRanks(channelRanks(ranks, scene.id()), query.weights(), query.mode());
                    };
                    return Candidate.scored(scene, channelScores, base);
                })
                .filter(candidate -> candidate.baseScore() >= query.minScore())
                .sorted(BY_BASE_SCORE)
                .limit(query.poolSize())
                .toList();
        return new CandidatePool(candidates);
    }

    private static Map<String, Integer> channelRanks(Map<String, Map<String, Integer>> ranks, String sceneId) {
        Map<String, Integer> channelRanks = new HashMap<>();
        ranks.forEach((channel, byScene) -> {
            Integer rank = byScene.get(sceneId);
            if (rank != null) {
                channelRanks.put(channel, rank);
            }
        });
        return channelRanks;
    }

    private Map<String, Double> channelScores(String sceneId) {
        Map<String, Double> channelScores = new LinkedHashMap<>();
        scores.forEach((channel, byScene) -> {
            Double score = byScene.get(sceneId);
            if (score != null) {
                channelScores.put(channel, score);
            }
        });
        return channelScores;
    }
}
