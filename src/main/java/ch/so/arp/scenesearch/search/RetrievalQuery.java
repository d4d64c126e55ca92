package ch.so.arp.scenesearch.search;

import java.util.List;
import java.util.Objects;

/**
 * Input of the {@link CandidateRetriever}.
 *
 * @param text            the raw query text
 * @param textEmbedding   embedding for the dense text channels, {@code null} if unavailable
 * @param visualEmbedding visual text embedding, only used in {@link VisualMode#RECALL}
 * @param weights         normalized channel weights
 * @param mode            visual mode of the request
 * @param poolSize        maximum number of candidates
 * @param minScore        candidates with a lower base score are dropped
 */
public record RetrievalQuery(String text, float[] textEmbedding, float[] visualEmbedding, WeightVector weights,
        VisualMode mode, int poolSize, double minScore) {

    public RetrievalQuery {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(weights, "weights");
        Objects.requireNonNull(mode, "mode");
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be positive, got " + poolSize);
        }
    }

    /**
     * Channels with a positive weight whose query input is available.
     */
    public List<String> activeChannels() {
        return weights.channels().stream()
                .filter(weight -> weight.value() > 0.0d)
                .map(ChannelWeight::name)
                .filter(this::hasInput)
                .toList();
    }

    private boolean hasInput(String channel) {
        return switch (channel) {
            case Channels.TRANSCRIPT, Channels.SUMMARY -> textEmbedding != null;
            case Channels.LEXICAL -> !text.isBlank();
            case Channels.VISUAL -> mode == VisualMode.RECALL && visualEmbedding != null;
            default -> false;
        };
    }
}
