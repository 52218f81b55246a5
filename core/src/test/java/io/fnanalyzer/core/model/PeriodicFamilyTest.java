package io.fnanalyzer.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.fnanalyzer.core.algebra.PiLinear;
import io.fnanalyzer.core.algebra.Rational;
import io.fnanalyzer.core.algebra.RealNumber;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PeriodicFamily")
class PeriodicFamilyTest {

    @Test
    @DisplayName("Offset is reduced into one period and the period made positive")
    void normalization() {
        PeriodicFamily a = new PeriodicFamily(PiLinear.piTimes(Rational.of(5, 2)), PiLinear.PI);
        PeriodicFamily b = new PeriodicFamily(PiLinear.piTimes(Rational.of(1, 2)), PiLinear.PI.negate());

        assertThat(a).isEqualTo(b);
        assertThat(a.offset()).isEqualTo(PiLinear.piTimes(Rational.of(1, 2)));
    }

    @Test
    void rendering() {
        assertThat(new PeriodicFamily(PiLinear.ZERO, PiLinear.PI)).hasToString("kπ");
        assertThat(new PeriodicFamily(PiLinear.ZERO, PiLinear.piTimes(Rational.TWO))).hasToString("2kπ");
        assertThat(new PeriodicFamily(PiLinear.piTimes(Rational.of(1, 2)), PiLinear.PI)).hasToString("π/2 + kπ");
        assertThat(new PeriodicFamily(PiLinear.piTimes(Rational.of(1, 4)), PiLinear.piTimes(Rational.of(1, 2))))
                .hasToString("π/4 + kπ/2");
    }

    @Test
    @DisplayName("Members inside a window are listed in closed form")
    void members() {
        PeriodicFamily multiplesOfPi = new PeriodicFamily(PiLinear.ZERO, PiLinear.PI);

        assertThat(multiplesOfPi.members(-10, 10))
                .extracting(RealNumber::toString)
                .containsExactly("-3π", "-2π", "-π", "0", "π", "2π", "3π");
    }

    @Test
    void contains() {
        PeriodicFamily family = new PeriodicFamily(PiLinear.piTimes(Rational.of(1, 2)), PiLinear.PI);

        assertThat(family.contains(-Math.PI / 2)).isTrue();
        assertThat(family.contains(0.0)).isFalse();
    }

    @Test
    void zeroPeriod_rejected() {
        assertThatThrownBy(() -> new PeriodicFamily(PiLinear.ZERO, PiLinear.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
