package io.fnanalyzer.core.engine.range;

import io.fnanalyzer.core.algebra.Polynomial;
import io.fnanalyzer.core.algebra.PolynomialSolver;
import io.fnanalyzer.core.algebra.RationalFunction;
import io.fnanalyzer.core.algebra.RealNumber;
import io.fnanalyzer.core.expr.RationalConverter;
import io.fnanalyzer.core.model.Interval;
import io.fnanalyzer.core.spi.RangeContext;
import io.fnanalyzer.core.spi.RangeOutcome;
import io.fnanalyzer.core.spi.RangeStrategy;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Range of a polynomial. Odd degree reaches every real value; even degree is bounded on the side
 * of its leading coefficient's opposite sign, by the extreme value over the critical points.
 */
public final class PolynomialRangeStrategy implements RangeStrategy {

    public static final String ID = "polynomial";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RangeOutcome attempt(RangeContext context) {
        int maxDegree = context.config().solveBudget().maxDegree();
        Optional<RationalFunction> converted = RationalConverter.convert(context.expression(), maxDegree);
        if (converted.isEmpty() || !converted.get().isPolynomial()) {
            return RangeOutcome.notApplicable("not a polynomial");
        }
        if (!context.domain().excluded().isEmpty()) {
            return RangeOutcome.notApplicable("the domain has removed points");
        }
        Polynomial p = converted.get().asPolynomial();
        String x = context.variable();
        var trace = context.trace();

        if (p.isConstant()) {
            RealNumber c = RealNumber.exact(p.coefficient(0));
            trace.step("f is the constant " + c + ", so its only value is " + c);
            return RangeOutcome.attained(List.of(Interval.point(c)), false);
        }
        trace.step("f(" + x + ") = " + p.render(x) + " is a polynomial of degree " + p.degree()
                + " with leading coefficient " + p.leadingCoefficient());
        if (p.degree() % 2 == 1) {
            trace.step("Odd degree: f → -∞ at one end and +∞ at the other, and f is continuous,"
                    + " so every real value is attained");
            return RangeOutcome.attained(List.of(Interval.all()), false);
        }

        boolean opensUp = p.leadingCoefficient().signum() > 0;
        trace.step("Even degree with " + (opensUp ? "positive" : "negative") + " leading coefficient: f → "
                + (opensUp ? "+∞" : "-∞") + " at both ends, so the range is bounded "
                + (opensUp ? "below" : "above") + " by the global " + (opensUp ? "minimum" : "maximum"));

        Polynomial derivative = p.derivative();
        PolynomialSolver.RootSet critical = new PolynomialSolver(context.config().solveBudget()).realRoots(derivative);
        trace.step("Critical points solve f'(" + x + ") = " + derivative.render(x) + " = 0: " + x + " = "
                + critical.roots().stream().map(RealNumber::toString).collect(Collectors.joining(", ")));

        RealNumber extreme = null;
        RealNumber extremeAt = null;
        boolean approximate = critical.approximate();
        for (RealNumber c : critical.roots()) {
            RealNumber value = valueAt(p, c);
            approximate |= value.isApproximate();
            if (extreme == null || (opensUp ? value.compareTo(extreme) < 0 : value.compareTo(extreme) > 0)) {
                extreme = value;
                extremeAt = c;
            }
        }
        // An even-degree polynomial always has at least one real critical point.
        trace.step("Global " + (opensUp ? "minimum" : "maximum") + ": f(" + extremeAt + ") = " + extreme);
        Interval values = opensUp ? Interval.atLeast(extreme) : Interval.atMost(extreme);
        return RangeOutcome.attained(List.of(values), approximate);
    }

    static RealNumber valueAt(Polynomial p, RealNumber x) {
        return x.exact()
                .map(r -> RealNumber.exact(p.evaluate(r)))
                .orElseGet(() -> RealNumber.approximate(p.evaluate(x.doubleValue())));
    }
}
