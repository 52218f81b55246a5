package io.fnanalyzer.core.engine;

import io.fnanalyzer.core.algebra.PiLinear;
import io.fnanalyzer.core.algebra.Rational;
import io.fnanalyzer.core.expr.AffineForm;
import io.fnanalyzer.core.expr.Expr;
import io.fnanalyzer.core.expr.MathFunction;
import io.fnanalyzer.core.model.PeriodicFamily;
import java.util.Optional;

/** Zeros of {@code sin}, {@code cos} and {@code tan} of an affine argument as exact periodic families. */
final class PeriodicZeros {

    private static final PiLinear HALF_PI = PiLinear.piTimes(Rational.of(1, 2));

    private PeriodicZeros() {}

    /** Value of the argument at the zeros: {@code kπ} for sin and tan, {@code π/2 + kπ} for cos. */
    static PiLinear target(MathFunction function) {
        return function == MathFunction.COS ? HALF_PI : PiLinear.ZERO;
    }

    /** Empty unless {@code call} is a trigonometric call whose argument is non-constant and affine. */
    static Optional<PeriodicFamily> of(Expr.Call call) {
        if (!call.function().isTrigonometric()) {
            return Optional.empty();
        }
        Optional<AffineForm> affine = AffineForm.of(call.argument());
        if (affine.isEmpty() || affine.get().isConstant()) {
            return Optional.empty();
        }
        Optional<PiLinear> offset = affine.get().solve(target(call.function()));
        Optional<PiLinear> period = PiLinear.PI.divide(affine.get().slope());
        if (offset.isEmpty() || period.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new PeriodicFamily(offset.get(), period.get()));
    }
}
