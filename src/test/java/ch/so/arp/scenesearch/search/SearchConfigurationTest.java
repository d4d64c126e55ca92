package ch.so.arp.scenesearch.search;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import javax.sql.DataSource;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import ch.so.arp.scenesearch.visual.DeterministicVisualScoringClient;
import ch.so.arp.scenesearch.visual.FailSoftVisualScoring;
import ch.so.arp.scenesearch.visual.HttpVisualScoringClient;
import ch.so.arp.scenesearch.visual.VisualScoringClient;
import ch.so.arp.scenesearch.visual.VisualServiceProperties;

class SearchConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(SearchConfiguration.class, InfrastructureConfiguration.class);

    @Test
    void usesMocksByDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(CandidateRetriever.class);
            assertThat(context).getBean(CandidateRetriever.class).isInstanceOf(InMemoryCandidateRetriever.class);
            assertThat(context).hasSingleBean(VisualScoringClient.class);
            assertThat(context).getBean(VisualScoringClient.class)
                    .isInstanceOf(DeterministicVisualScoringClient.class);
            assertThat(context).getBean(EmbeddingProvider.class).isInstanceOf(DeterministicEmbeddingProvider.class);
            assertThat(context).hasSingleBean(FailSoftVisualScoring.class);
            assertThat(context).hasSingleBean(VisualReranker.class);
            assertThat(context.getBean(InMemorySceneCatalog.class).scenes()).isNotEmpty();

            SearchSettings settings = context.getBean(SearchSettings.class);
            assertThat(settings.visualMode()).isEqualTo(VisualModeSetting.AUTO);
            assertThat(settings.candidatePoolSize()).isEqualTo(500);
            assertThat(settings.visualDeadline()).isEqualTo(Duration.ofMillis(3100));
            assertThat(settings.fusionMethod()).isEqualTo(FusionMethod.MINMAX_MEAN);
            assertThat(settings.rrfK()).isEqualTo(60);
        });
    }

    @Test
    void createsRealBeansWhenMocksDisabled() {
        contextRunner
                .withPropertyValues(
                        "scenesearch.mock-scene-index=false",
                        "scenesearch.mock-visual-service=false",
                        "scenesearch.mock-text-embeddings=false",
                        "scenesearch.openai.api-key=test-key",
                        "scenesearch.visual.base-url=https://clip.example.com",
                        "CLIP_SERVICE_SECRET=shared-secret",
                        "scenesearch.visual.timeout-seconds=0.5",
                        "scenesearch.visual.max-retries=2")
                .run(context -> {
                    assertThat(context).getBean(CandidateRetriever.class)
                            .isInstanceOf(PostgresCandidateRetriever.class);
                    assertThat(context).getBean(VisualScoringClient.class)
                            .isInstanceOf(HttpVisualScoringClient.class);
                    assertThat(context).getBean(EmbeddingProvider.class).isInstanceOf(OpenAiEmbeddingProvider.class);
                    assertThat(context).doesNotHaveBean(InMemorySceneCatalog.class);

                    VisualServiceProperties visual = context.getBean(VisualServiceProperties.class);
                    assertThat(visual.getSecret()).isEqualTo("shared-secret");
                    assertThat(context.getBean(SearchSettings.class).visualDeadline())
                            .isEqualTo(Duration.ofMillis(1800));
                });
    }

    @Test
    void bindsSearchSettingsFromProperties() {
        contextRunner
                .withPropertyValues(
                        "scenesearch.visual-mode=rerank",
                        "scenesearch.multi-dense-enabled=false",
                        "scenesearch.rerank.candidate-pool-size=200",
                        "scenesearch.rerank.clip-weight=0.4",
                        "scenesearch.fusion-method=rrf",
                        "scenesearch.rrf-k=30")
                .run(context -> {
                    SearchSettings settings = context.getBean(SearchSettings.class);
                    assertThat(settings.visualMode()).isEqualTo(VisualModeSetting.RERANK);
                    assertThat(settings.multiDenseEnabled()).isFalse();
                    assertThat(settings.candidatePoolSize()).isEqualTo(200);
                    assertThat(settings.rerankClipWeight()).isEqualTo(0.4d);
                    assertThat(settings.fusionMethod()).isEqualTo(FusionMethod.RRF);
                    assertThat(settings.rrfK()).isEqualTo(30);
                    assertThat(context.getBean(ScoreFusionEngine.class).method()).isEqualTo(FusionMethod.RRF);
                });
    }

    @Test
    void failsFastOnUnknownFusionMethod() {
        contextRunner
                .withPropertyValues("scenesearch.fusion-method=borda")
                .run(context -> assertThat(context).hasFailed()
                        .getFailure().hasStackTraceContaining("unknown fusion method 'borda'"));
    }

    @Test
    void failsFastOnInvalidConfiguredWeights() {
        contextRunner
                .withPropertyValues("scenesearch.weights.audio=1.0")
                .run(context -> assertThat(context).hasFailed()
                        .getFailure().rootCause().isInstanceOf(InvalidWeightsException.class));
    }

    @Test
    void failsFastWithoutVisualSecret() {
        contextRunner
                .withPropertyValues("scenesearch.mock-visual-service=false")
                .run(context -> assertThat(context).hasFailed()
                        .getFailure().rootCause().hasMessageContaining("scenesearch.visual.secret"));
    }

    @Configuration(proxyBeanMethods = false)
    static class InfrastructureConfiguration {

        @Bean
        JdbcClient jdbcClient(DataSource dataSource) {
            return JdbcClient.create(dataSource);
        }

        @Bean
        DataSource dataSource() {
            DriverManagerDataSource dataSource = new DriverManagerDataSource();
            dataSource.setDriverClassName("org.h2.Driver");
            dataSource.setUrl("jdbc:h2:mem:scenes;MODE=PostgreSQL");
            dataSource.setUsername("sa");
            dataSource.setPassword("");
            return dataSource;
        }
    }
}
