package ch.so.arp.scenesearch.search;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.jdbc.core.simple.JdbcClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.scenesearch.visual.DeterministicVisualScoringClient;
import ch.so.arp.scenesearch.visual.FailSoftVisualScoring;
import ch.so.arp.scenesearch.visual.HttpVisualScoringClient;
import ch.so.arp.scenesearch.visual.VisualScoringClient;
import ch.so.arp.scenesearch.visual.VisualServiceProperties;

/**
 * Central configuration wiring the search components together. It exposes
 * toggles that decide whether mocked or real infrastructure components should
 * be used for the scene index, the text embeddings and the visual service.
 */
@Configuration
@EnableConfigurationProperties({ SceneSearchProperties.class, VisualServiceProperties.class,
        OpenAiEmbeddingProperties.class })
public class SearchConfiguration {

    private static final int TEXT_EMBEDDING_DIMENSIONS = 1536;

    @Bean
    public SearchSettings searchSettings(SceneSearchProperties properties, VisualServiceProperties visual) {
        return properties.toSettings(visual.totalBudget());
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "searchExecutor")
    public ExecutorService searchExecutor(SceneSearchProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getSearchThreads()), runnable -> {
            Thread thread = new Thread(runnable, "scene-search-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public WeightModel weightModel() {
        return new WeightModel();
    }

    @Bean
    public WeightResolver weightResolver(WeightModel weightModel, SearchSettings settings) {
        return new WeightResolver(weightModel, settings);
    }

    @Bean
    public VisualIntentRouter visualIntentRouter() {
        return new VisualIntentRouter();
    }

    @Bean
    public ScoreFusionEngine scoreFusionEngine(SearchSettings settings) {
        return new ScoreFusionEngine(settings.fusionMethod(), settings.rrfK());
    }

    @Bean
    public DisplayScoreCalibrator displayScoreCalibrator(SearchSettings settings) {
        return new DisplayScoreCalibrator(settings);
    }

    @Bean
    @ConditionalOnProperty(name = "scenesearch.mock-text-embeddings", havingValue = "true", matchIfMissing = true)
    public EmbeddingProvider deterministicEmbeddingProvider() {
        return new DeterministicEmbeddingProvider(TEXT_EMBEDDING_DIMENSIONS);
    }

    @Bean
    @ConditionalOnProperty(name = "scenesearch.mock-text-embeddings", havingValue = "false")
    public EmbeddingProvider openAiEmbeddingProvider(OpenAiEmbeddingProperties properties) {
        return OpenAiEmbeddingProvider.create(properties);
    }

    @Bean
    @ConditionalOnExpression("${scenesearch.mock-scene-index:true} or ${scenesearch.mock-visual-service:true}")
    public InMemorySceneCatalog inMemorySceneCatalog(SceneSearchProperties properties, ResourceLoader resourceLoader,
            ObjectProvider<ObjectMapper> objectMapper, VisualServiceProperties visual) {
        return InMemorySceneCatalog.load(resourceLoader.getResource(properties.getDemoScenes()),
                objectMapper.getIfAvailable(ObjectMapper::new),
                new DeterministicEmbeddingProvider(TEXT_EMBEDDING_DIMENSIONS),
                new DeterministicEmbeddingProvider(visual.getEmbeddingDimensions()));
    }

    @Bean
    @ConditionalOnProperty(name = "scenesearch.mock-scene-index", havingValue = "true", matchIfMissing = true)
    public CandidateRetriever inMemoryCandidateRetriever(InMemorySceneCatalog catalog, ScoreFusionEngine fusion) {
        return new InMemoryCandidateRetriever(catalog, fusion);
    }

    @Bean
    @ConditionalOnProperty(name = "scenesearch.mock-scene-index", havingValue = "false")
    public CandidateRetriever postgresCandidateRetriever(JdbcClient jdbcClient, ScoreFusionEngine fusion) {
        return new PostgresCandidateRetriever(jdbcClient, fusion);
    }

    @Bean
    @ConditionalOnProperty(name = "scenesearch.mock-visual-service", havingValue = "true", matchIfMissing = true)
    public VisualScoringClient deterministicVisualScoringClient(InMemorySceneCatalog catalog,
            VisualServiceProperties visual) {
        DeterministicEmbeddingProvider encoder = new DeterministicEmbeddingProvider(visual.getEmbeddingDimensions());
        return new DeterministicVisualScoringClient(encoder::embed, catalog.visualIndex());
    }

    @Bean
    @ConditionalOnProperty(name = "scenesearch.mock-visual-service", havingValue = "false")
    public VisualScoringClient httpVisualScoringClient(VisualServiceProperties visual,
            ObjectProvider<ObjectMapper> objectMapper) {
        return HttpVisualScoringClient.create(visual, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    public FailSoftVisualScoring failSoftVisualScoring(VisualScoringClient client) {
        return new FailSoftVisualScoring(client);
    }

    @Bean
    public VisualReranker visualReranker(FailSoftVisualScoring visualScoring, SearchSettings settings) {
        return new VisualReranker(visualScoring, settings);
    }
}
