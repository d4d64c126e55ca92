package ch.so.arp.scenesearch.visual;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.EnvironmentAware;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

/**
 * Connection settings of the visual embedding service.
 */
@ConfigurationProperties(prefix = "scenesearch.visual")
public class VisualServiceProperties implements EnvironmentAware {

    /**
     * Base URL of the service, e.g. {@code https://clip.example.com}.
     */
    private String baseUrl = "http://localhost:8001";

    /**
     * Shared secret used to sign every request.
     */
    private String secret;

    /**
     * Timeout of a single attempt in seconds, fractions allowed.
     */
    private double timeoutSeconds = 1.5d;

    /**
     * Number of retries after a failed attempt.
     */
    private int maxRetries = 1;

    /**
     * Wait before the first retry, doubled for every further retry.
     */
    private Duration retryBackoff = Duration.ofMillis(100);

    /**
     * Expected dimension of the visual text embedding.
     */
    private int embeddingDimensions = 512;

    private String embedPath = "/embed-text";

    private String batchScorePath = "/batch-score";

    private Environment environment;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getSecret() {
        if (StringUtils.hasText(secret)) {
            return secret;
        }
        return environment != null ? environment.getProperty("CLIP_SERVICE_SECRET") : null;
    }

    public void setSecret(String secret) {
        this.secret = secret;
    }

    public double getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(double timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public Duration getTimeout() {
        return Duration.ofMillis(Math.round(timeoutSeconds * 1000.0d));
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public void setRetryBackoff(Duration retryBackoff) {
        this.retryBackoff = retryBackoff;
    }

    public int getEmbeddingDimensions() {
        return embeddingDimensions;
    }

    public void setEmbeddingDimensions(int embeddingDimensions) {
        this.embeddingDimensions = embeddingDimensions;
    }

    public String getEmbedPath() {
        return embedPath;
    }

    public void setEmbedPath(String embedPath) {
        this.embedPath = embedPath;
    }

    public String getBatchScorePath() {
        return batchScorePath;
    }

    public void setBatchScorePath(String batchScorePath) {
        this.batchScorePath = batchScorePath;
    }

    /**
     * Worst case duration of one call including all retries and backoff waits.
     */
    public Duration totalBudget() {
        Duration budget = getTimeout().multipliedBy(maxRetries + 1L);
        for (int attempt = 0; attempt < maxRetries; attempt++) {
            budget = budget.plus(retryBackoff.multipliedBy(1L << Math.min(attempt, 10)));
        }
        return budget;
    }

    @Override
    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }
}
