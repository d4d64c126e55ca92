package ch.so.arp.scenesearch.search;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps the final scores of one result page onto user facing display scores
 * with {@code min(maxCap, 1 - exp(-alpha * x))}, where {@code x} is the
 * min-max normalized score. The mapping is monotonic and never changes the
 * ranking. Display scores are only comparable within one response.
 */
public class DisplayScoreCalibrator {

    private static final double FLAT_EPSILON = 1e-9d;
    private static final double NEUTRAL = 0.5d;

    private final double alpha;
    private final double maxCap;

    public DisplayScoreCalibrator(double alpha, double maxCap) {
        if (!(alpha > 0.0d)) {
            throw new IllegalArgumentException("alpha must be positive, got " + alpha);
        }
        this.alpha = alpha;
        this.maxCap = maxCap;
    }

    public DisplayScoreCalibrator(SearchSettings settings) {
        this(settings.displayAlpha(), settings.displayMaxCap());
    }

    public List<Double> calibrate(List<Double> scores) {
        List<Double> display = new ArrayList<>(scores.size());
        if (scores.isEmpty()) {
            return display;
        }
        double min = ScoreFusionEngine.min(scores);
        double range = ScoreFusionEngine.max(scores) - min;
        for (double score : scores) {
            if (range < FLAT_EPSILON) {
                display.add(Math.min(maxCap, NEUTRAL));
            } else {
                double normalized = (score - min) / range;
                display.add(Math.min(maxCap, 1.0d - Math.exp(-alpha * normalized)));
            }
        }
        return display;
    }
}
