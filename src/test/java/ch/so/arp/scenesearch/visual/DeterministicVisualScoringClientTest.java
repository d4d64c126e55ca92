package ch.so.arp.scenesearch.visual;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class DeterministicVisualScoringClientTest {

    private final DeterministicVisualScoringClient client = new DeterministicVisualScoringClient(
            text -> text.contains("red") ? new float[] { 1f, 0f } : new float[] { 0f, 1f },
            Map.of("red", new float[] { 1f, 0f }, "blue", new float[] { 0f, 1f }, "mixed",
                    new float[] { 1f, 1f }));

    @Test
    void embedsWithTextEncoder() {
        assertThat(client.embed("a red car")).containsExactly(1f, 0f);
    }

    @Test
    void rejectsBlankText() {
        assertThatThrownBy(() -> client.embed("  ")).isInstanceOf(VisualServiceException.class);
    }

    @Test
    void scoresKnownIdsByCosine() {
        Map<String, Double> scores = client.batchScore(new float[] { 1f, 0f }, List.of("red", "blue", "mixed", "gone"));

        assertThat(scores).containsOnlyKeys("red", "blue", "mixed");
        assertThat(scores.get("red")).isCloseTo(1.0d, within(1e-9));
        assertThat(scores.get("blue")).isCloseTo(0.0d, within(1e-9));
        assertThat(scores.get("mixed")).isCloseTo(Math.sqrt(0.5d), within(1e-6));
    }

    @Test
    void rejectsDimensionMismatch() {
        assertThatThrownBy(() -> client.batchScore(new float[] { 1f, 0f, 0f }, List.of("red")))
                .isInstanceOf(VisualServiceException.class)
                .hasMessageContaining("dimensions");
    }
}
