package ch.so.arp.scenesearch.search;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable snapshot of the search configuration. Built once at startup from
 * {@link SceneSearchProperties} and handed to the components at construction
 * time, so request handling never reads ambient configuration.
 *
 * @param visualMode          configured visual mode, {@code AUTO} lets the router decide
 * @param multiDenseEnabled   whether the visual channel exists at all
 * @param defaultWeights      default channel weights, not necessarily normalized
 * @param candidatePoolSize   number of candidates retrieved before reranking
 * @param rerankClipWeight    share of the visual score in the reranked score
 * @param rerankMinScoreRange minimum spread of the visual scores for reranking
 * @param maxVisualWeight     guardrail for the visual weight
 * @param minLexicalWeight    guardrail for a positive lexical weight
 * @param displayAlpha        steepness of the display score calibration
 * @param displayMaxCap       upper bound of display scores
 * @param visualDeadline      overall time budget for the visual query embedding
 * @param fusionMethod        how channel results are combined into the base score
 * @param rrfK                rank offset of reciprocal rank fusion
 */
public record SearchSettings(
        VisualModeSetting visualMode,
        boolean multiDenseEnabled,
        WeightVector defaultWeights,
        int candidatePoolSize,
        double rerankClipWeight,
        double rerankMinScoreRange,
        double maxVisualWeight,
        double minLexicalWeight,
        double displayAlpha,
        double displayMaxCap,
        Duration visualDeadline,
        FusionMethod fusionMethod,
        int rrfK) {

    public SearchSettings {
        Objects.requireNonNull(visualMode, "visualMode");
        Objects.requireNonNull(defaultWeights, "defaultWeights");
        Objects.requireNonNull(visualDeadline, "visualDeadline");
        Objects.requireNonNull(fusionMethod, "fusionMethod");
        if (defaultWeights.isEmpty()) {
            throw new InvalidWeightsException("at least one channel weight must be configured");
        }
        if (candidatePoolSize <= 0) {
            throw new IllegalArgumentException("candidatePoolSize must be positive, got " + candidatePoolSize);
        }
        requireUnitInterval("rerankClipWeight", rerankClipWeight);
        requireUnitInterval("rerankMinScoreRange", rerankMinScoreRange);
        requireUnitInterval("maxVisualWeight", maxVisualWeight);
        requireUnitInterval("minLexicalWeight", minLexicalWeight);
        requireUnitInterval("displayMaxCap", displayMaxCap);
        if (rrfK < 1) {
            throw new IllegalArgumentException("rrfK must be at least 1, got " + rrfK);
        }
        if (!(displayAlpha > 0.0d)) {
            throw new IllegalArgumentException("displayAlpha must be positive, got " + displayAlpha);
        }
    }

    /**
     * Settings matching the documented defaults.
     */
    public static SearchSettings defaults() {
        return new SceneSearchProperties().toSettings(Duration.ofMillis(3100));
    }

    public SearchSettings withVisualMode(VisualModeSetting mode) {
        return new SearchSettings(mode, multiDenseEnabled, defaultWeights, candidatePoolSize, rerankClipWeight,
                rerankMinScoreRange, maxVisualWeight, minLexicalWeight, displayAlpha, displayMaxCap, visualDeadline,
                fusionMethod, rrfK);
    }

    public SearchSettings withMultiDenseEnabled(boolean enabled) {
        return new SearchSettings(visualMode, enabled, defaultWeights, candidatePoolSize, rerankClipWeight,
                rerankMinScoreRange, maxVisualWeight, minLexicalWeight, displayAlpha, displayMaxCap, visualDeadline,
                fusionMethod, rrfK);
    }

    public SearchSettings withFusion(FusionMethod method, int k) {
        return new SearchSettings(visualMode, multiDenseEnabled, defaultWeights, candidatePoolSize, rerankClipWeight,
                rerankMinScoreRange, maxVisualWeight, minLexicalWeight, displayAlpha, displayMaxCap, visualDeadline,
                method, k);
    }

    public SearchSettings withVisualDeadline(Duration deadline) {
        return new SearchSettings(visualMode, multiDenseEnabled, defaultWeights, candidatePoolSize, rerankClipWeight,
                rerankMinScoreRange, maxVisualWeight, minLexicalWeight, displayAlpha, displayMaxCap, deadline,
                fusionMethod, rrfK);
    }

    public SearchSettings withDefaultWeights(WeightVector weights) {
        return new SearchSettings(visualMode, multiDenseEnabled, weights, candidatePoolSize, rerankClipWeight,
                rerankMinScoreRange, maxVisualWeight, minLexicalWeight, displayAlpha, displayMaxCap, visualDeadline,
                fusionMethod, rrfK);
    }

    private static void requireUnitInterval(String name, double value) {
        if (Double.isNaN(value) || value < 0.0d || value > 1.0d) {
            throw new IllegalArgumentException(name + " must be in [0, 1], got " + value);
        }
    }
}
