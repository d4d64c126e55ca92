package ch.so.arp.scenesearch.search;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Combines the per-channel results of a candidate into one composite score,
 * either from the similarity scores ({@link FusionMethod#MINMAX_MEAN}) or from
 * the per-channel ranks ({@link FusionMethod#RRF}). Composite scores are only
 * comparable within a single request, i.e. for the same weight vector and
 * channel set.
 */
public class ScoreFusionEngine {

    public static final int DEFAULT_RRF_K = 60;

    private static final double FLAT_EPSILON = 1e-9d;

    private final FusionMethod method;
    private final int rrfK;

    public ScoreFusionEngine() {
        this(FusionMethod.MINMAX_MEAN, DEFAULT_RRF_K);
    }

    public ScoreFusionEngine(FusionMethod method, int rrfK) {
        this.method = Objects.requireNonNull(method, "method");
        if (rrfK < 1) {
            throw new IllegalArgumentException("rrfK must be at least 1, got " + rrfK);
        }
        this.rrfK = rrfK;
    }

    public FusionMethod method() {
        return method;
    }

    /**
     * Computes {@code Σ weight[c] * score[c]} over the channels of the weight
     * vector. Channels without a score contribute nothing. The visual channel is
     * ignored unless the mode is {@link VisualMode#RECALL}; in rerank mode the
     * visual score is blended in later by the {@link VisualReranker}.
     */
    public double fuse(Map<String, Double> channelScores, WeightVector weights, VisualMode mode) {
        double score = 0.0d;
        for (ChannelWeight weight : weights.channels()) {
            if (Channels.VISUAL.equals(weight.name()) && mode != VisualMode.RECALL) {
                continue;
            }
            Double channelScore = channelScores.get(weight.name());
            if (channelScore != null && !channelScore.isNaN()) {
                score += weight.value() * channelScore;
            }
        }
        return score;
    }

    /**
     * Weighted reciprocal rank fusion {@code Σ weight[c] * (k + 1) / (k + rank[c])}
     * with 1-based ranks. The factor {@code k + 1} scales a candidate ranked
     * first in every weighted channel to the sum of the weights, so the result
     * stays on the same {@code [0, 1]} scale as the weighted mean. The visual
     * channel counts only in {@link VisualMode#RECALL}.
     */
    public double fuseRanks(Map<String, Integer> channelRanks, WeightVector weights, VisualMode mode) {
        double score = 0.0d;
        for (ChannelWeight weight : weights.channels()) {
            if (Channels.VISUAL.equals(weight.name()) && mode != VisualMode.RECALL) {
                continue;
            }
            Integer rank = channelRanks.get(weight.name());
            if (rank != null && rank > 0) {
                score += weight.value() * (rrfK + 1.0d) / (rrfK + rank);
            }
        }
        return score;
    }

    /**
     * Assigns 1-based ranks by descending score. Equal scores keep the
     * iteration order of the map.
     */
    public <K> Map<K, Integer> ranks(Map<K, Double> scores) {
        List<Map.Entry<K, Double>> ordered = new ArrayList<>(scores.entrySet());
        ordered.sort(Map.Entry.<K, Double>comparingByValue().reversed());
        Map<K, Integer> ranks = new LinkedHashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            ranks.put(ordered.get(i).getKey(), i + 1);
        }
        return ranks;
    }

    /**
     * Maps raw scores of one channel onto {@code [0, 1]} with min-max
     * normalization. A flat distribution maps every score to {@code 1}.
     *
     * @param rawScores id to raw score, iteration order is kept
     */
    public <K> Map<K, Double> minMaxNormalize(Map<K, Double> rawScores) {
        Map<K, Double> normalized = new LinkedHashMap<>();
        if (rawScores.isEmpty()) {
            return normalized;
        }
        double min = min(rawScores.values());
        double range = max(rawScores.values()) - min;
        rawScores.forEach((key, value) -> normalized.put(key,
                range < FLAT_EPSILON ? 1.0d : Math.max(0.0d, Math.min(1.0d, (value - min) / range))));
        return normalized;
    }

    static double min(Collection<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).min().orElse(0.0d);
    }

    static double max(Collection<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).max().orElse(0.0d);
    }
}
