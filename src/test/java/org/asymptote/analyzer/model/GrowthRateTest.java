package org.asymptote.analyzer.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

/**
 * Unit tests for {@link GrowthRate}: ordering by dominance, arithmetic and rendering.
 */
public class GrowthRateTest {

    @Test
    @Tag("unit")
    void testOrderingByDominance() {
        // Arrange
        List<GrowthRate> rates = new ArrayList<>(List.of(GrowthRate.EXPONENTIAL, GrowthRate.CUBIC,
                GrowthRate.LINEARITHMIC, GrowthRate.CONSTANT, GrowthRate.exponential(GrowthRate.GOLDEN_RATIO),
                GrowthRate.QUADRATIC, GrowthRate.LOGARITHMIC, GrowthRate.LINEAR));

        // Act
        Collections.sort(rates);

        // Assert
        assertThat(rates).extracting(GrowthRate::render)
                .containsExactly("1", "log n", "n", "n log n", "n^2", "n^3", "φ^n", "2^n");
    }

    @Test
    @Tag("unit")
    void testProductAndSum() {
        assertThat(GrowthRate.LINEAR.times(GrowthRate.LOGARITHMIC)).isEqualTo(GrowthRate.LINEARITHMIC);
        assertThat(GrowthRate.LINEAR.times(GrowthRate.LINEAR)).isEqualTo(GrowthRate.QUADRATIC);
        assertThat(GrowthRate.QUADRATIC.max(GrowthRate.LINEARITHMIC)).isEqualTo(GrowthRate.QUADRATIC);
        assertThat(GrowthRate.QUADRATIC.min(GrowthRate.LINEARITHMIC)).isEqualTo(GrowthRate.LINEARITHMIC);
        assertThat(GrowthRate.CONSTANT.times(GrowthRate.CONSTANT).isConstant()).isTrue();
    }

    /**
     * Computed exponents close to an integer compare equal to it.
     */
    @Test
    @Tag("unit")
    void testNearIntegralDegreesSnap() {
        GrowthRate computed = GrowthRate.polynomial(Math.log(8) / Math.log(2));

        assertThat(computed).isEqualTo(GrowthRate.CUBIC);
        assertThat(computed.render()).isEqualTo("n^3");
    }

    @Test
    @Tag("unit")
    void testRenderingAndNotation() {
        assertThat(new GrowthRate(2, 2, 1).render()).isEqualTo("n^2 log^2 n");
        assertThat(GrowthRate.polynomial(1.5).render()).isEqualTo("n^1.5");
        assertThat(GrowthRate.LINEARITHMIC.toNotation(Bound.THETA)).isEqualTo("Θ(n log n)");
        assertThat(GrowthRate.CONSTANT.toNotation(Bound.OMEGA)).isEqualTo("Ω(1)");
        assertThat(GrowthRate.LINEAR.render("k")).isEqualTo("k");
    }

    @Test
    @Tag("unit")
    void testValueAt() {
        assertThat(GrowthRate.LINEARITHMIC.valueAt(64)).isCloseTo(384.0, offset(1e-9));
        assertThat(GrowthRate.LOGARITHMIC.valueAt(1)).isCloseTo(1.0, offset(1e-9));
    }

    @Test
    @Tag("unit")
    void testInvalidValuesAreRejected() {
        assertThatThrownBy(() -> new GrowthRate(-1, 0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GrowthRate(0, 0, 0.5)).isInstanceOf(IllegalArgumentException.class);
    }
}
