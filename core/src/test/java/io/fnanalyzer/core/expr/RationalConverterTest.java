package io.fnanalyzer.core.expr;

import static org.assertj.core.api.Assertions.assertThat;

import io.fnanalyzer.core.algebra.Polynomial;
import io.fnanalyzer.core.algebra.RationalFunction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RationalConverter, SignInference and AffineForm")
class RationalConverterTest {

    private final ExpressionParser parser = new ExpressionParser();

    @Test
    @DisplayName("Rational expressions convert without cancelling common factors")
    void keepsCommonFactors() {
        RationalFunction rf = RationalConverter.convert(parser.parse("(x^2-4)/(x-2)"), 32).orElseThrow();

        assertThat(rf.render("x")).isEqualTo("(x^2 - 4)/(x - 2)");
        assertThat(rf.reduced().render("x")).isEqualTo("x + 2");
    }

    @Test
    @DisplayName("Nested fractions become a single quotient")
    void nestedFractions() {
        RationalFunction rf = RationalConverter.convert(parser.parse("1/(1/x)"), 32).orElseThrow().reduced();

        assertThat(rf.isPolynomial()).isTrue();
        assertThat(rf.asPolynomial()).isEqualTo(Polynomial.X);
    }

    @Test
    @DisplayName("Transcendental parts are not rational")
    void transcendental() {
        assertThat(RationalConverter.convert(parser.parse("sin(x) + 1"), 32)).isEmpty();
        assertThat(RationalConverter.convert(parser.parse("x^(1/2)"), 32)).isEmpty();
        assertThat(RationalConverter.convert(parser.parse("pi*x"), 32)).isEmpty();
    }

    @Test
    @DisplayName("Degrees above the limit are refused")
    void degreeLimit() {
        assertThat(RationalConverter.convert(parser.parse("x^40"), 32)).isEmpty();
        assertThat(RationalConverter.convert(parser.parse("x^40"), 40)).isPresent();
    }

    @Test
    @DisplayName("Sign inference proves simple positivity")
    void signInference() {
        assertThat(SignInference.isPositive(parser.parse("x^2 + 1"))).isTrue();
        assertThat(SignInference.isPositive(parser.parse("exp(x)"))).isTrue();
        assertThat(SignInference.isNonNegative(parser.parse("abs(x)"))).isTrue();
        assertThat(SignInference.isPositive(parser.parse("x - 1"))).isFalse();
    }

    @Test
    @DisplayName("Affine arguments with π coefficients")
    void affineForm() {
        AffineForm form = AffineForm.of(parser.parse("2*x + pi")).orElseThrow();

        assertThat(form.slope()).hasToString("2");
        assertThat(form.intercept()).hasToString("π");
        assertThat(AffineForm.of(parser.parse("x^2"))).isEmpty();
    }
}
