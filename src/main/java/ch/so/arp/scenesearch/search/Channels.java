package ch.so.arp.scenesearch.search;

import java.util.List;

/**
 * Names of the similarity channels known to the search engine.
 */
public final class Channels {

    /** Dense embedding of the scene transcript. */
    public static final String TRANSCRIPT = "transcript";

    /** Dense embedding of the generated scene summary. */
    public static final String SUMMARY = "summary";

    /** Full text match over transcript, summary and tags. */
    public static final String LEXICAL = "lexical";

    /** CLIP image embedding of the scene key frame. */
    public static final String VISUAL = "visual";

    public static final List<String> ALL = List.of(TRANSCRIPT, SUMMARY, LEXICAL, VISUAL);

    public static final List<String> DENSE_TEXT = List.of(TRANSCRIPT, SUMMARY);

    private Channels() {
    }

    public static boolean isKnown(String name) {
        return ALL.contains(name);
    }
}
