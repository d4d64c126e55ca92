package ch.so.arp.scenesearch.search;

import java.util.List;
import java.util.Map;

/**
 * One ranked scene in a search response.
 *
 * @param score        final ranking score
 * @param displayScore calibrated score for display, only comparable within the response
 * @param baseScore    multi-channel score before reranking
 * @param visualScore  raw visual similarity, {@code null} if the scene was not visually scored
 */
public record SceneResult(
        String id,
        String videoId,
        int index,
        double startS,
        double endS,
        String transcriptSegment,
        String visualSummary,
        String thumbnailUrl,
        List<String> tags,
        double score,
        double displayScore,
        double baseScore,
        Map<String, Double> channelScores,
        Double visualScore) {

    static SceneResult from(Candidate candidate, double displayScore) {
        SceneSummary scene = candidate.scene();
        return new SceneResult(scene.id(), scene.videoId(), scene.index(), scene.startS(), scene.endS(),
                scene.transcriptSegment(), scene.visualSummary(), scene.thumbnailUrl(), scene.tags(),
                candidate.finalScore(), displayScore, candidate.baseScore(), candidate.channelScores(),
                candidate.visualScore());
    }
}
