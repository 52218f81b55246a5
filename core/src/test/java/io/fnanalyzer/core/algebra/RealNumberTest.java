package io.fnanalyzer.core.algebra;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RealNumber, Radical and PiLinear rendering")
class RealNumberTest {

    @Nested
    @DisplayName("RealNumber")
    class RealNumbers {

        @Test
        void kindsRenderDifferently() {
            assertThat(RealNumber.exact(Rational.of(-1, 2))).hasToString("-1/2");
            assertThat(RealNumber.symbolic("√2", Math.sqrt(2))).hasToString("√2");
            assertThat(RealNumber.approximate(1.259921049)).hasToString("1.2599");
            assertThat(RealNumber.approximate(-0.00001)).hasToString("0");
        }

        @Test
        @DisplayName("Fixed decimals keep the sign unless the digits are all zero")
        void decimal() {
            assertThat(RealNumber.exact(-5).decimal(4)).isEqualTo("-5.0000");
            assertThat(RealNumber.exact(Rational.of(1, 3)).decimal(2)).isEqualTo("0.33");
            assertThat(RealNumber.approximate(-0.00001).decimal(4)).isEqualTo("0.0000");
        }

        @Test
        void negate() {
            assertThat(RealNumber.exact(3).negate()).isEqualTo(RealNumber.exact(-3));
            assertThat(RealNumber.symbolic("-√2", -Math.sqrt(2)).negate()).hasToString("√2");
            assertThat(RealNumber.symbolic("π/2", Math.PI / 2).negate()).hasToString("-(π/2)");
        }

        @Test
        @DisplayName("Non-finite approximations → IllegalArgumentException")
        void nonFinite_rejected() {
            assertThatThrownBy(() -> RealNumber.approximate(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> RealNumber.approximate(Double.POSITIVE_INFINITY))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Radical")
    class Radicals {

        @Test
        @DisplayName("Perfect squares collapse to exact values")
        void perfectSquare() {
            RealNumber r = Radical.of(Rational.ONE, Rational.ONE, Rational.of(9, 4));

            assertThat(r.isExact()).isTrue();
            assertThat(r).hasToString("5/2");
        }

        @Test
        @DisplayName("Square factors are pulled out of the root")
        void simplifies() {
            assertThat(Radical.sqrt(Rational.of(8))).hasToString("2√2");
            assertThat(Radical.sqrt(Rational.of(1, 2))).hasToString("√2/2");
            assertThat(Radical.of(Rational.ONE, Rational.of(-1), Rational.of(5))).hasToString("1 - √5");
        }

        @Test
        void value() {
            assertThat(Radical.of(Rational.ONE, Rational.of(-1), Rational.of(5)).doubleValue())
                    .isCloseTo(1 - Math.sqrt(5), within(1e-12));
        }

        @Test
        void negativeRadicand_rejected() {
            assertThatThrownBy(() -> Radical.sqrt(Rational.of(-1))).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("PiLinear")
    class PiMultiples {

        @Test
        void rendering() {
            assertThat(PiLinear.piTimes(Rational.of(1, 2))).hasToString("π/2");
            assertThat(PiLinear.piTimes(Rational.of(-3, 4))).hasToString("-3π/4");
            assertThat(new PiLinear(Rational.ONE, Rational.ONE)).hasToString("1 + π");
            assertThat(new PiLinear(Rational.ONE, Rational.of(-2))).hasToString("1 - 2π");
            assertThat(PiLinear.of(Rational.of(3))).hasToString("3");
        }

        @Test
        @DisplayName("Rational values become exact numbers, others symbolic")
        void toRealNumber() {
            assertThat(PiLinear.of(Rational.of(3)).toRealNumber().isExact()).isTrue();
            RealNumber halfPi = PiLinear.piTimes(Rational.of(1, 2)).toRealNumber();
            assertThat(halfPi.kind()).isEqualTo(RealNumber.Kind.SYMBOLIC);
            assertThat(halfPi.doubleValue()).isCloseTo(Math.PI / 2, within(1e-12));
        }

        @Test
        @DisplayName("Ratio of two multiples of π is rational")
        void divide() {
            assertThat(PiLinear.piTimes(Rational.of(3, 2)).divide(PiLinear.PI))
                    .contains(PiLinear.of(Rational.of(3, 2)));
        }
    }
}
