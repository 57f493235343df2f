package quest.gekko.pulse.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class VectorMathTest {

    @Test
    void normalizeProducesUnitVector() {
        double[] v = VectorMath.normalize(new double[]{3, 4});

        assertThat(v).containsExactly(0.6, 0.8);
        assertThat(VectorMath.norm(v)).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void zeroVectorNormalizesToZeros() {
        assertThat(VectorMath.normalize(new double[]{0, 0, 0})).containsExactly(0, 0, 0);
    }

    @Test
    void cosineIsUndefinedForEmptyOrMismatchedVectors() {
        assertThat(VectorMath.cosine(new double[0], new double[0])).isNaN();
        assertThat(VectorMath.cosine(new double[]{1, 0}, new double[]{1, 0, 0})).isNaN();
        assertThat(VectorMath.cosine(new double[]{1, 0}, null)).isNaN();
        assertThat(VectorMath.cosine(new double[]{1, 1}, new double[]{2, 2})).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void shiftAwayStaysUnitNorm() {
        double[] c = VectorMath.normalize(new double[]{1, 1});
        double[] s = new double[]{1, 0};

        double[] moved = VectorMath.shift(c, s, 0.08, false);

        assertThat(VectorMath.norm(moved)).isCloseTo(1.0, within(1e-12));
        assertThat(VectorMath.cosine(moved, s)).isLessThan(VectorMath.cosine(c, s));
    }
}
