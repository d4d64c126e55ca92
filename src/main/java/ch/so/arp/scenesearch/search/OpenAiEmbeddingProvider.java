package ch.so.arp.scenesearch.search;

import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Text embeddings from the OpenAI {@code /embeddings} endpoint. The model has
 * to be the one the scene index was built with.
 */
class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiEmbeddingProvider.class);

    private final RestClient restClient;
    private final OpenAiEmbeddingProperties properties;

    OpenAiEmbeddingProvider(RestClient restClient, OpenAiEmbeddingProperties properties) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException(
                    "Property 'scenesearch.openai.api-key' must be provided when mock embeddings are disabled");
        }
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.properties = properties;
    }

    static OpenAiEmbeddingProvider create(OpenAiEmbeddingProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder().connectTimeout(properties.getTimeout()).build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.getTimeout());
        RestClient restClient = RestClient.builder()
                .baseUrl(properties.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
        return new OpenAiEmbeddingProvider(restClient, properties);
    }

    @Override
    public float[] embed(String text) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", properties.getModel());
        payload.put("input", text);
        payload.put("dimensions", properties.getDimensions());

        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/embeddings")
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException ex) {
            throw new EmbeddingException("OpenAI embedding request failed: " + ex.getMessage(), ex);
        }

        JsonNode embedding = response == null ? null : response.path("data").path(0).path("embedding");
        if (embedding == null || !embedding.isArray() || embedding.size() != properties.getDimensions()) {
            throw new EmbeddingException("OpenAI response does not contain a " + properties.getDimensions()
                    + " dimensional embedding");
        }
        float[] vector = new float[embedding.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = embedding.get(i).floatValue();
        }
        LOGGER.debug("Embedded query with model {}", properties.getModel());
        return vector;
    }

    @Override
    public int dimensions() {
        return properties.getDimensions();
    }
}
