package io.engram.core.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.Test;

class VectorMathTest {

    @Test
    void shouldComputeCosineSimilarity() {
        assertThat(VectorMath.cosineSimilarity(List.of(1.0, 0.0), List.of(1.0, 0.0))).isCloseTo(1.0, within(1e-9));
        assertThat(VectorMath.cosineSimilarity(List.of(1.0, 0.0), List.of(0.0, 1.0))).isCloseTo(0.0, within(1e-9));
        assertThat(VectorMath.cosineSimilarity(List.of(1.0, 0.0), List.of(-1.0, 0.0))).isCloseTo(-1.0, within(1e-9));
        assertThat(VectorMath.cosineSimilarity(List.of(1.0, 1.0), List.of(1.0, 0.0)))
            .isCloseTo(Math.sqrt(0.5), within(1e-9));
    }

    @Test
    void shouldScoreDegenerateVectorsAsZero() {
        assertThat(VectorMath.cosineSimilarity(List.of(), List.of())).isZero();
        assertThat(VectorMath.cosineSimilarity(List.of(0.0, 0.0), List.of(1.0, 0.0))).isZero();
        assertThat(VectorMath.cosineSimilarity(List.of(1.0), List.of(1.0, 0.0))).isZero();
        assertThat(VectorMath.cosineSimilarity(null, List.of(1.0))).isZero();
    }

    @Test
    void shouldNormalizeToUnitLength() {
        assertThat(VectorMath.normalize(new double[] {3.0, 4.0})).containsExactly(0.6, 0.8);
        assertThat(VectorMath.normalize(new double[] {0.0, 0.0})).containsExactly(0.0, 0.0);
    }
}
