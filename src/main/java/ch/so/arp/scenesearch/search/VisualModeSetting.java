package ch.so.arp.scenesearch.search;

import java.util.Locale;
import java.util.Optional;

/**
 * Configured visual mode. Every value except {@link #AUTO} forces the mode and
 * bypasses the {@link VisualIntentRouter}.
 */
public enum VisualModeSetting {

    AUTO(null),
    RECALL(VisualMode.RECALL),
    RERANK(VisualMode.RERANK),
    SKIP(VisualMode.SKIP);

    private final VisualMode forcedMode;

    VisualModeSetting(VisualMode forcedMode) {
        this.forcedMode = forcedMode;
    }

    public Optional<VisualMode> forcedMode() {
        return Optional.ofNullable(forcedMode);
    }

    /**
     * Lenient parser accepting the lower case values used in the environment,
     * e.g. {@code rerank}.
     */
    public static VisualModeSetting parse(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        try {
            return valueOf(value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(
                    "unknown visual mode '" + value + "', expected one of recall, rerank, auto, skip", ex);
        }
    }
}
