package ch.so.arp.scenesearch.search;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration of the scene search, bound from {@code scenesearch.*}.
 */
@ConfigurationProperties(prefix = "scenesearch")
public class SceneSearchProperties {

    /**
     * One of {@code auto}, {@code recall}, {@code rerank} or {@code skip}.
     */
    private String visualMode = "auto";

    /**
     * Whether the visual channel takes part in retrieval at all.
     */
    private boolean multiDenseEnabled = true;

    /**
     * Default channel weights, normalized at startup.
     */
    private Map<String, Double> weights = defaultWeights();

    /**
     * {@code minmax_mean} or {@code rrf}.
     */
    private String fusionMethod = "minmax_mean";

    /**
     * Rank offset of reciprocal rank fusion.
     */
    private int rrfK = 60;

    /**
     * Threads available for visual service calls.
     */
    private int searchThreads = 4;

    /**
     * JSON scene catalog served by the in-memory index.
     */
    private String demoScenes = "classpath:demo/scenes.json";

    private final Rerank rerank = new Rerank();

    private final Guardrails guardrails = new Guardrails();

    private final Display display = new Display();

    public String getVisualMode() {
        return visualMode;
    }

    public void setVisualMode(String visualMode) {
        this.visualMode = visualMode;
    }

    public boolean isMultiDenseEnabled() {
        return multiDenseEnabled;
    }

    public void setMultiDenseEnabled(boolean multiDenseEnabled) {
        this.multiDenseEnabled = multiDenseEnabled;
    }

    public Map<String, Double> getWeights() {
        return weights;
    }

    public void setWeights(Map<String, Double> weights) {
        this.weights = weights;
    }

    public String getFusionMethod() {
        return fusionMethod;
    }

    public void setFusionMethod(String fusionMethod) {
        this.fusionMethod = fusionMethod;
    }

    public int getRrfK() {
        return rrfK;
    }

    public void setRrfK(int rrfK) {
        this.rrfK = rrfK;
    }

    public int getSearchThreads() {
        return searchThreads;
    }

    public void setSearchThreads(int searchThreads) {
        this.searchThreads = searchThreads;
    }

    public String getDemoScenes() {
        return demoScenes;
    }

    public void setDemoScenes(String demoScenes) {
        this.demoScenes = demoScenes;
    }

    public Rerank getRerank() {
        return rerank;
    }

    public Guardrails getGuardrails() {
        return guardrails;
    }

    public Display getDisplay() {
        return display;
    }

    /**
     * Validates the configuration and freezes it.
     *
     * @param visualDeadline overall budget of the visual query embedding
     * @throws InvalidWeightsException  if the default weights are unusable
     * @throws IllegalArgumentException if another value is out of range
     */
    public SearchSettings toSettings(Duration visualDeadline) {
        for (String channel : weights.keySet()) {
            if (!Channels.isKnown(channel)) {
                throw new InvalidWeightsException("unknown channel '" + channel + "' in scenesearch.weights");
            }
        }
        return new SearchSettings(
                VisualModeSetting.parse(visualMode),
                multiDenseEnabled,
                WeightModel.validated(weights),
                rerank.getCandidatePoolSize(),
                rerank.getClipWeight(),
                rerank.getMinScoreRange(),
                guardrails.getMaxVisualWeight(),
                guardrails.getMinLexicalWeight(),
                display.getAlpha(),
                display.getMaxCap(),
                visualDeadline,
                FusionMethod.parse(fusionMethod),
                rrfK);
    }

    private static Map<String, Double> defaultWeights() {
        Map<String, Double> defaults = new LinkedHashMap<>();
        defaults.put(Channels.TRANSCRIPT, 0.45d);
        defaults.put(Channels.SUMMARY, 0.25d);
        defaults.put(Channels.LEXICAL, 0.15d);
        defaults.put(Channels.VISUAL, 0.15d);
        return defaults;
    }

    public static class Rerank {

        private int candidatePoolSize = 500;

        /**
         * Share of the visual score in the reranked score.
         */
        private double clipWeight = 0.3d;

        /**
         * Visual scores with a smaller spread are treated as flat.
         */
        private double minScoreRange = 0.05d;

        public int getCandidatePoolSize() {
            return candidatePoolSize;
        }

        public void setCandidatePoolSize(int candidatePoolSize) {
            this.candidatePoolSize = candidatePoolSize;
        }

        public double getClipWeight() {
            return clipWeight;
        }

        public void setClipWeight(double clipWeight) {
            this.clipWeight = clipWeight;
        }

        public double getMinScoreRange() {
            return minScoreRange;
        }

        public void setMinScoreRange(double minScoreRange) {
            this.minScoreRange = minScoreRange;
        }
    }

    public static class Guardrails {

        private double maxVisualWeight = 0.8d;

        private double minLexicalWeight = 0.05d;

        public double getMaxVisualWeight() {
            return maxVisualWeight;
        }

        public void setMaxVisualWeight(double maxVisualWeight) {
            this.maxVisualWeight = maxVisualWeight;
        }

        public double getMinLexicalWeight() {
            return minLexicalWeight;
        }

        public void setMinLexicalWeight(double minLexicalWeight) {
            this.minLexicalWeight = minLexicalWeight;
        }
    }

    public static class Display {

        private double alpha = 3.0d;

        private double maxCap = 0.97d;

        public double getAlpha() {
            return alpha;
        }

        public void setAlpha(double alpha) {
            this.alpha = alpha;
        }

        public double getMaxCap() {
            return maxCap;
        }

        public void setMaxCap(double maxCap) {
            this.maxCap = maxCap;
        }
    }
}
