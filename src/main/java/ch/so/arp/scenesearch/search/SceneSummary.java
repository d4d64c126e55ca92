package ch.so.arp.scenesearch.search;

import java.util.List;

/**
 * Metadata of an indexed video scene as shown in search results.
 */
public record SceneSummary(
        String id,
        String videoId,
        int index,
        double startS,
        double endS,
        String transcriptSegment,
        String visualSummary,
        String thumbnailUrl,
        List<String> tags) {

    public SceneSummary {
        transcriptSegment = transcriptSegment == null ? "" : transcriptSegment;
        visualSummary = visualSummary == null ? "" : visualSummary;
        thumbnailUrl = thumbnailUrl == null ? "" : thumbnailUrl;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
