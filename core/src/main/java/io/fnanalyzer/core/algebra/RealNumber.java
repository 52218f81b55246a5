package io.fnanalyzer.core.algebra;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A real number as reported by the analyzers: exact rational, closed-form symbolic value
 * (e.g. {@code π/2}, {@code 1 + √2}) carrying its double value, or a decimal approximation.
 *
 * <p>Immutable and thread-safe. Ordering is by numeric value.
 */
public final class RealNumber implements Comparable<RealNumber> {

    /** How the value is known. */
    public enum Kind {
        EXACT,
        SYMBOLIC,
        APPROXIMATE
    }

    public static final RealNumber ZERO = exact(Rational.ZERO);

    private final Kind kind;
    private final Rational exact;
    private final String text;
    private final double value;

    private RealNumber(Kind kind, Rational exact, String text, double value) {
        this.kind = kind;
        this.exact = exact;
        this.text = text;
        this.value = value;
    }

    public static RealNumber exact(Rational value) {
        Objects.requireNonNull(value, "value must not be null");
        return new RealNumber(Kind.EXACT, value, value.toString(), value.doubleValue());
    }

    public static RealNumber exact(long value) {
        return exact(Rational.of(value));
    }

    public static RealNumber symbolic(String text, double value) {
        Objects.requireNonNull(text, "text must not be null");
        return new RealNumber(Kind.SYMBOLIC, null, text, value);
    }

    public static RealNumber approximate(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Approximate value must be finite, got: " + value);
        }
        return new RealNumber(Kind.APPROXIMATE, null, trimmed(value), value);
    }

    public Kind kind() {
        return kind;
    }

    public double doubleValue() {
        return value;
    }

    /** The exact rational value, present only for {@link Kind#EXACT}. */
    public Optional<Rational> exact() {
        return Optional.ofNullable(exact);
    }

    public boolean isExact() {
        return kind == Kind.EXACT;
    }

    /** {@code true} for exact and symbolic values. */
    public boolean isClosedForm() {
        return kind != Kind.APPROXIMATE;
    }

    public boolean isApproximate() {
        return kind == Kind.APPROXIMATE;
    }

    public RealNumber negate() {
        return switch (kind) {
            case EXACT -> exact(exact.negate());
            case SYMBOLIC -> symbolic(text.startsWith("-") ? text.substring(1) : "-(" + text + ")", -value);
            case APPROXIMATE -> approximate(-value);
        };
    }

    /** Fixed-point rendering with the given number of decimals, e.g. {@code -5.0000}. */
    public String decimal(int places) {
        String formatted = String.format(Locale.ROOT, "%." + places + "f", value);
        if (formatted.startsWith("-") && formatted.chars().noneMatch(c -> c >= '1' && c <= '9')) {
            return formatted.substring(1);
        }
        return formatted;
    }

    /** {@code true} if both values agree within the given absolute/relative tolerance. */
    public boolean closeTo(double other, double tolerance) {
        return Math.abs(value - other) <= tolerance * Math.max(1.0, Math.abs(value));
    }

    @Override
    public int compareTo(RealNumber other) {
        return Double.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RealNumber other)) return false;
        return kind == other.kind
                && Objects.equals(exact, other.exact)
                && text.equals(other.text)
                && Double.compare(value, other.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, exact, text, value);
    }

    /** Exact values as integers or fractions, symbolic values as text, approximations trimmed to 4 decimals. */
    @Override
    public String toString() {
        return text;
    }

    private static String trimmed(double value) {
        String plain = BigDecimal.valueOf(value)
                .setScale(4, RoundingMode.HALF_UP)
                .stripTrailingZeros()
                .toPlainString();
        return plain.equals("-0") ? "0" : plain;
    }
}
