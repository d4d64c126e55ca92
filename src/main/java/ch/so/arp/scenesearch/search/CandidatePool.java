package ch.so.arp.scenesearch.search;

import java.util.List;

/**
 * Ordered candidates of one request, best first.
 */
public record CandidatePool(List<Candidate> candidates) {

    public CandidatePool {
        candidates = List.copyOf(candidates);
    }

    public static CandidatePool empty() {
        return new CandidatePool(List.of());
    }

    public List<String> sceneIds() {
        return candidates.stream().map(Candidate::sceneId).toList();
    }

    public int size() {
        return candidates.size();
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    public CandidatePool limit(int maxSize) {
        if (candidates.size() <= maxSize) {
            return this;
        }
        return new CandidatePool(candidates.subList(0, maxSize));
    }

    /**
     * @return the pool with every final score reset to the base score
     */
    public CandidatePool withBaseScoresAsFinal() {
        return new CandidatePool(candidates.stream().map(c -> c.withFinalScore(c.baseScore())).toList());
    }
}
