package ch.so.arp.scenesearch.search;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PostgresCandidateRetrieverTest {

    @Test
    void formatsPgVectorLiteralIndependentOfLocale() {
        assertThat(PostgresCandidateRetriever.toPgVectorLiteral(new float[] { 0.5f, -1.25f, 0f }))
                .isEqualTo("[0.500000,-1.250000,0.000000]");
    }

    @Test
    void formatsEmptyVector() {
        assertThat(PostgresCandidateRetriever.toPgVectorLiteral(new float[0])).isEqualTo("[]");
    }
}
