package ch.so.arp.scenesearch.search;

/**
 * Category of a keyword in the {@link VisualIntentRouter} lexicon.
 */
public enum TermCategory {

    /** Dialogue and transcript vocabulary, always routes to {@link VisualMode#SKIP}. */
    SPEECH(false, false),

    COLOR(true, true),

    OBJECT(true, true),

    ACTION(true, true),

    /** Dishes and drinks, visible but usually referenced for their context. */
    FOOD(true, false),

    /** Camera and shot vocabulary. */
    SHOT(true, false);

    private final boolean visual;
    private final boolean strong;

    TermCategory(boolean visual, boolean strong) {
        this.visual = visual;
        this.strong = strong;
    }

    public boolean isVisual() {
        return visual;
    }

    /**
     * @return whether a match of this category can make the visual intent
     *         strong enough for {@link VisualMode#RECALL}
     */
    public boolean isStrong() {
        return strong;
    }
}
