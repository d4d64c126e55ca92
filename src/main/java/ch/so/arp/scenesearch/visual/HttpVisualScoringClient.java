package ch.so.arp.scenesearch.visual;

import java.net.SocketTimeoutException;
import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * {@link VisualScoringClient} talking JSON over HTTP to the visual embedding
 * service. Every request is HMAC signed. Timeouts, I/O errors and server
 * errors are retried up to the configured number of retries with exponential
 * backoff; authentication failures, other client errors and malformed payloads
 * fail immediately.
 */
public class HttpVisualScoringClient implements VisualScoringClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpVisualScoringClient.class);

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final VisualServiceProperties properties;
    private final RequestSigner signer;
    private final Clock clock;

    public HttpVisualScoringClient(RestClient restClient, ObjectMapper objectMapper,
            VisualServiceProperties properties, Clock clock) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (!StringUtils.hasText(properties.getSecret())) {
            throw new IllegalArgumentException(
                    "Property 'scenesearch.visual.secret' must be provided when the visual service mock is disabled");
        }
        this.signer = new RequestSigner(properties.getSecret());
    }

    /**
     * Creates a client backed by the JDK {@link HttpClient} with the configured
     * connect and read timeout.
     */
    public static HttpVisualScoringClient create(VisualServiceProperties properties, ObjectMapper objectMapper) {
        if (!StringUtils.hasText(properties.getBaseUrl())) {
            throw new IllegalArgumentException("Property 'scenesearch.visual.base-url' must be provided");
        }
        HttpClient httpClient = HttpClient.newBuilder().connectTimeout(properties.getTimeout()).build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.getTimeout());
        RestClient restClient = RestClient.builder()
                .baseUrl(properties.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
        return new HttpVisualScoringClient(restClient, objectMapper, properties, Clock.systemUTC());
    }

    @Override
    public float[] embed(String text) {
        if (!StringUtils.hasText(text)) {
            throw new VisualServiceException("text to embed must not be blank");
        }
        Map<String, Object> payload = Map.of("text", text);
        return execute("embed-text", properties.getEmbedPath(), payload, this::parseEmbedding);
    }

    @Override
    public Map<String, Double> batchScore(float[] queryEmbedding, List<String> candidateIds) {
        Objects.requireNonNull(queryEmbedding, "queryEmbedding");
        if (candidateIds.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query_embedding", queryEmbedding);
        payload.put("candidate_ids", candidateIds);
        Map<String, Double> scores = execute("batch-score", properties.getBatchScorePath(), payload,
                this::parseScores);
        LOGGER.debug("Visual service scored {}/{} candidates", scores.size(), candidateIds.size());
        return scores;
    }

    private <T> T execute(String operation, String path, Map<String, Object> payload, Function<JsonNode, T> parser) {
        String body = serialize(payload);
        int attempts = Math.max(0, properties.getMaxRetries()) + 1;
        VisualServiceException lastError = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            long startNanos = System.nanoTime();
            try {
                JsonNode response = post(path, body);
                T result = parser.apply(response);
                LOGGER.debug("Visual service {} succeeded in {} ms (attempt {}/{})", operation,
                        Duration.ofNanos(System.nanoTime() - startNanos).toMillis(), attempt, attempts);
                return result;
            } catch (ResourceAccessException ex) {
                lastError = isTimeout(ex)
                        ? new VisualServiceTimeoutException(
                                "visual service " + operation + " timed out after " + properties.getTimeout(), ex)
                        : new VisualServiceException("visual service " + operation + " I/O error: " + ex.getMessage(),
                                ex);
                LOGGER.warn("Visual service {} failed (attempt {}/{}): {}", operation, attempt, attempts,
                        lastError.getMessage());
            } catch (HttpServerErrorException ex) {
                lastError = new VisualServiceException(
                        "visual service " + operation + " returned " + ex.getStatusCode().value(), ex);
                LOGGER.warn("Visual service {} failed (attempt {}/{}): {}", operation, attempt, attempts,
                        lastError.getMessage());
            } catch (HttpClientErrorException ex) {
                if (ex.getStatusCode().isSameCodeAs(HttpStatus.UNAUTHORIZED)
                        || ex.getStatusCode().isSameCodeAs(HttpStatus.FORBIDDEN)) {
                    throw new VisualServiceAuthException(
                            "visual service rejected the request signature (" + ex.getStatusCode().value() + ")");
                }
                throw new VisualServiceException(
                        "visual service " + operation + " returned " + ex.getStatusCode().value(), ex);
            } catch (RestClientException ex) {
                lastError = new VisualServiceException(
                        "visual service " + operation + " failed: " + ex.getMessage(), ex);
                LOGGER.warn("Visual service {} failed (attempt {}/{}): {}", operation, attempt, attempts,
                        lastError.getMessage());
            }
            if (attempt < attempts) {
                backoff(attempt);
            }
        }
        throw lastError;
    }

    private JsonNode post(String path, String body) {
        long timestamp = clock.instant().getEpochSecond();
        String response = restClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .header(RequestSigner.TIMESTAMP_HEADER, Long.toString(timestamp))
                .header(RequestSigner.SIGNATURE_HEADER, signer.sign(timestamp, body))
                .body(body)
                .retrieve()
                .body(String.class);
        if (!StringUtils.hasText(response)) {
            throw new VisualServiceException("visual service returned an empty body");
        }
        try {
            return objectMapper.readTree(response);
        } catch (JsonProcessingException ex) {
            throw new VisualServiceException("visual service returned malformed JSON", ex);
        }
    }

    private float[] parseEmbedding(JsonNode response) {
        JsonNode embedding = response.path("embedding");
        if (!embedding.isArray() || embedding.isEmpty()) {
            throw new VisualServiceException("visual service response is missing the 'embedding' array");
        }
        if (embedding.size() != properties.getEmbeddingDimensions()) {
            throw new VisualServiceException("visual embedding has " + embedding.size() + " dimensions, expected "
                    + properties.getEmbeddingDimensions());
        }
        float[] vector = new float[embedding.size()];
        for (int i = 0; i < vector.length; i++) {
            JsonNode value = embedding.get(i);
            if (!value.isNumber()) {
                throw new VisualServiceException("visual embedding contains a non numeric value at index " + i);
            }
            vector[i] = value.floatValue();
        }
        return vector;
    }

    private Map<String, Double> parseScores(JsonNode response) {
        JsonNode scores = response.path("scores");
        if (!scores.isObject()) {
            throw new VisualServiceException("visual service response is missing the 'scores' object");
        }
        Map<String, Double> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = scores.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNumber()) {
                throw new VisualServiceException("visual score of '" + field.getKey() + "' is not a number");
            }
            result.put(field.getKey(), field.getValue().doubleValue());
        }
        return result;
    }

    private String serialize(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw new VisualServiceException("unable to serialize visual service request", ex);
        }
    }

    private void backoff(int attempt) {
        long waitMillis = properties.getRetryBackoff().toMillis() << Math.min(attempt - 1, 10);
        if (waitMillis <= 0) {
            return;
        }
        try {
            Thread.sleep(waitMillis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new VisualServiceException("interrupted while waiting to retry the visual service", ex);
        }
    }

    private static boolean isTimeout(ResourceAccessException ex) {
        Throwable cause = ex.getCause();
        while (cause != null) {
            if (cause instanceof SocketTimeoutException || cause instanceof HttpTimeoutException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
