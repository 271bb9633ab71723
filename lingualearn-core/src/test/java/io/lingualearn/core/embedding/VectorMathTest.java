package io.lingualearn.core.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class VectorMathTest {

    @Test
    void shouldComputeCosineSimilarity() {
        assertThat(VectorMath.cosine(new float[] {1, 0}, new float[] {1, 0})).isCloseTo(1.0, within(1e-9));
        assertThat(VectorMath.cosine(new float[] {1, 0}, new float[] {0, 1})).isCloseTo(0.0, within(1e-9));
        assertThat(VectorMath.cosine(new float[] {1, 1}, new float[] {-1, -1})).isCloseTo(-1.0, within(1e-6));
    }

    @Test
    void shouldReturnZeroForZeroMagnitude() {
        assertThat(VectorMath.cosine(new float[] {0, 0}, new float[] {1, 2})).isZero();
        assertThat(VectorMath.cosine(new float[] {3, -4}, new float[] {0, 0})).isZero();
        assertThat(VectorMath.cosine(new float[] {0, 0, 0}, new float[] {0, 0, 0})).isZero();
    }

    @Test
    void shouldBeSymmetric() {
        float[] a = {0.3f, -1.2f, 2.5f, 0.01f};
        float[] b = {-0.7f, 0.4f, 1.9f, 3.3f};

        assertThat(VectorMath.cosine(a, b)).isEqualTo(VectorMath.cosine(b, a));
        assertThat(VectorMath.cosine(a, a)).isCloseTo(1.0, within(1e-6));
        assertThat(VectorMath.cosine(b, b)).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void shouldRejectDimensionMismatch() {
        assertThatThrownBy(() -> VectorMath.cosine(new float[] {1}, new float[] {1, 2}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("dimension mismatch");
    }
}
