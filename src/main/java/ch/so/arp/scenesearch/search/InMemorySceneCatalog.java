package ch.so.arp.scenesearch.search;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Scene index held in memory for local development and tests. Embeddings are
 * computed once when the catalog is built; scenes without a visual summary
 * get no visual embedding, like scenes whose key frame was never embedded.
 */
public class InMemorySceneCatalog {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemorySceneCatalog.class);

    private final List<IndexedScene> scenes;

    public InMemorySceneCatalog(List<SceneSummary> scenes, EmbeddingProvider textEmbeddings,
            EmbeddingProvider visualEmbeddings) {
        Objects.requireNonNull(textEmbeddings, "textEmbeddings");
        Objects.requireNonNull(visualEmbeddings, "visualEmbeddings");
        this.scenes = scenes.stream()
                .map(scene -> index(scene, textEmbeddings, visualEmbeddings))
                .toList();
    }

    /**
     * Reads scenes from a JSON array of {@link SceneSummary} objects.
     */
    public static InMemorySceneCatalog load(Resource resource, ObjectMapper objectMapper,
            EmbeddingProvider textEmbeddings, EmbeddingProvider visualEmbeddings) {
        try (InputStream in = resource.getInputStream()) {
            List<SceneSummary> scenes = objectMapper.readValue(in, new TypeReference<List<SceneSummary>>() {
            });
            LOGGER.info("Loaded {} demo scenes from {}", scenes.size(), resource.getDescription());
            return new InMemorySceneCatalog(scenes, textEmbeddings, visualEmbeddings);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read scene catalog " + resource.getDescription(), ex);
        }
    }

    public List<IndexedScene> scenes() {
        return scenes;
    }

    /**
     * Scene id to visual embedding, only for scenes that have one.
     */
    public Map<String, float[]> visualIndex() {
        Map<String, float[]> index = new LinkedHashMap<>();
        for (IndexedScene scene : scenes) {
            if (scene.visualEmbedding() != null) {
                index.put(scene.scene().id(), scene.visualEmbedding());
            }
        }
        return index;
    }

    private static IndexedScene index(SceneSummary scene, EmbeddingProvider text, EmbeddingProvider visual) {
        float[] transcript = scene.transcriptSegment().isBlank() ? null : text.embed(scene.transcriptSegment());
        float[] summary = scene.visualSummary().isBlank() ? null : text.embed(scene.visualSummary());
        float[] visualEmbedding = scene.visualSummary().isBlank()
                ? null
                : visual.embed(scene.visualSummary() + " " + String.join(" ", scene.tags()));
        Set<String> keywords = Set.copyOf(VisualIntentRouter.contentTokens(String.join(" ",
                scene.transcriptSegment(), scene.visualSummary(), String.join(" ", scene.tags()))));
        return new IndexedScene(scene, transcript, summary, visualEmbedding, keywords);
    }

    /**
     * A scene with its precomputed channel inputs. Embeddings are {@code null}
     * when the scene has no text for the channel.
     */
    public record IndexedScene(SceneSummary scene, float[] transcriptEmbedding, float[] summaryEmbedding,
            float[] visualEmbedding, Set<String> keywords) {
    }
}
