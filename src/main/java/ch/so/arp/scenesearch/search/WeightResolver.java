package ch.so.arp.scenesearch.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Determines the channel weights that apply to a request. Weights supplied
 * with the request take precedence over the configured defaults. The result is
 * normalized, passed through the guardrails and adjusted to the visual mode.
 */
public class WeightResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(WeightResolver.class);

    static final String SOURCE_REQUEST = "request";
    static final String SOURCE_DEFAULT = "default";

    private final WeightModel weightModel;
    private final SearchSettings settings;

    public WeightResolver(WeightModel weightModel, SearchSettings settings) {
        this.weightModel = Objects.requireNonNull(weightModel, "weightModel");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * @param requested weights supplied with the request, {@code null} to use the
     *                  defaults
     * @param mode      the visual mode of the request
     * @throws InvalidWeightsException if the requested weights are unusable
     */
    public WeightResolution resolve(Map<String, Double> requested, VisualMode mode) {
        List<String> warnings = new ArrayList<>();
        WeightVector weights;
        String source;
        if (requested != null) {
            weights = validateRequested(requested);
            source = SOURCE_REQUEST;
        } else {
            weights = settings.defaultWeights();
            source = SOURCE_DEFAULT;
        }

        if (!settings.multiDenseEnabled() && weights.contains(Channels.VISUAL)) {
            weights = weights.without(Channels.VISUAL);
            if (weightModel.getWeightsSum(weights) <= 0.0d) {
                throw new InvalidWeightsException("no positive channel weight left without the visual channel");
            }
        }

        weights = weightModel.normalizeWeights(weights);

        Guarded guarded = applyGuardrails(weights, warnings);
        weights = guarded.weights();

        if (mode != VisualMode.RECALL && weights.contains(Channels.VISUAL)) {
            double visual = weights.valueOf(Channels.VISUAL);
            weights = weightModel.disableChannels(weights, List.of(Channels.VISUAL));
            if (visual > 0.0d) {
                warnings.add(String.format(Locale.ROOT, "visual weight %.2f set to 0 for visual mode %s", visual,
                        mode.name().toLowerCase(Locale.ROOT)));
            }
        }

        LOGGER.debug("Resolved weights from {}: {} (mode={}, clamped={})", source, weights, mode, guarded.clamped());
        return new WeightResolution(requested == null ? null : Map.copyOf(requested), weights, source,
                guarded.clamped(), warnings);
    }

    /**
     * Removes the visual channel from already resolved weights, used when the
     * visual query embedding turned out to be unavailable.
     */
    public WeightResolution withoutVisual(WeightResolution resolution, String reason) {
        List<String> warnings = new ArrayList<>(resolution.warnings());
        warnings.add("visual channel dropped: " + reason);
        WeightVector weights = weightModel.disableChannels(resolution.applied(), List.of(Channels.VISUAL));
        return new WeightResolution(resolution.requested(), weights, resolution.source(), resolution.clamped(),
                warnings);
    }

    /**
     * Removes channels that cannot produce a score for this request, for
     * example the dense text channels when the text embedding failed.
     */
    public WeightResolution withoutChannels(WeightResolution resolution, Set<String> channels, String reason) {
        List<String> warnings = new ArrayList<>(resolution.warnings());
        warnings.add(channels.stream().sorted().toList() + " dropped: " + reason);
        WeightVector weights = weightModel.disableChannels(resolution.applied(), channels);
        if (weightModel.getWeightsSum(weights) <= 0.0d) {
            throw new InvalidWeightsException("no channel with a positive weight is available: " + reason);
        }
        return new WeightResolution(resolution.requested(), weights, resolution.source(), resolution.clamped(),
                warnings);
    }

    private WeightVector validateRequested(Map<String, Double> requested) {
        for (String channel : requested.keySet()) {
            if (!Channels.isKnown(channel)) {
                throw new InvalidWeightsException(
                        "unknown channel '" + channel + "', allowed channels are " + Channels.ALL);
            }
        }
        return WeightModel.validated(requested);
    }

    /**
     * Caps the visual weight and raises a tiny lexical weight. A guardrail that
     * the final normalization undoes, because no other channel can take the
     * remaining mass, is not reported.
     */
    private Guarded applyGuardrails(WeightVector weights, List<String> warnings) {
        WeightVector guarded = weights;

        double visual = guarded.valueOf(Channels.VISUAL);
        boolean visualCapped = visual > settings.maxVisualWeight() + WeightModel.EPSILON;
        if (visualCapped) {
            guarded = guarded.withValue(Channels.VISUAL, settings.maxVisualWeight()).withLocked(Channels.VISUAL, true);
        }
        double lexical = guarded.valueOf(Channels.LEXICAL);
        boolean lexicalRaised = lexical > 0.0d && lexical < settings.minLexicalWeight() - WeightModel.EPSILON;
        if (lexicalRaised) {
            guarded = guarded.withValue(Channels.LEXICAL, settings.minLexicalWeight())
                    .withLocked(Channels.LEXICAL, true);
        }
        if (!visualCapped && !lexicalRaised) {
            return new Guarded(guarded, false);
        }
        WeightVector normalized = weightModel.normalizeWeights(guarded)
                .map(weight -> weight.locked() ? weight.withLocked(false) : weight);
        WeightVector result = weightModel.normalizeWeights(normalized);

        boolean visualHeld = visualCapped
                && result.valueOf(Channels.VISUAL) <= settings.maxVisualWeight() + WeightModel.EPSILON;
        boolean lexicalHeld = lexicalRaised
                && result.valueOf(Channels.LEXICAL) >= settings.minLexicalWeight() - WeightModel.EPSILON;
        if (visualHeld) {
            warnings.add(String.format(Locale.ROOT, "visual weight clamped from %.2f to %.2f", visual,
                    settings.maxVisualWeight()));
        } else if (visualCapped) {
            LOGGER.debug("Visual weight cap of {} not applicable to {}", settings.maxVisualWeight(), weights);
        }
        if (lexicalHeld) {
            warnings.add(String.format(Locale.ROOT, "lexical weight raised from %.2f to %.2f", lexical,
                    settings.minLexicalWeight()));
        } else if (lexicalRaised) {
            LOGGER.debug("Lexical weight floor of {} not applicable to {}", settings.minLexicalWeight(), weights);
        }
        return new Guarded(result, visualHeld || lexicalHeld);
    }

    private record Guarded(WeightVector weights, boolean clamped) {
    }
}
