package io.fnanalyzer.core.algebra;

import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleUnaryOperator;

/**
 * Grid scan of a real function over a closed window. Used wherever no closed form is available:
 * zeros of non-polynomial denominators and numerators, and sign regions of non-rational radicands.
 *
 * <p>The function may return {@code NaN} where it is undefined; such samples break runs and are
 * never reported as roots.
 */
public final class NumericScanner {

    private static final int REFINE_STEPS = 100;
    private static final double ZERO_TOLERANCE = 1e-9;

    private final double min;
    private final double max;
    private final int samples;

    public NumericScanner(double min, double max, int samples) {
        if (!(min < max)) {
            throw new IllegalArgumentException("Window must satisfy min < max, got [" + min + ", " + max + "]");
        }
        if (samples < 3) {
            throw new IllegalArgumentException("At least 3 samples required, got: " + samples);
        }
        this.min = min;
        this.max = max;
        this.samples = samples;
    }

    /** A sub-interval of the window. */
    public record Region(double lower, double upper) {}

    /** Evenly spaced sample abscissas including both window ends. */
    public double[] grid() {
        double[] xs = new double[samples];
        double step = (max - min) / (samples - 1);
        for (int i = 0; i < samples; i++) {
            xs[i] = i == samples - 1 ? max : min + i * step;
        }
        return xs;
    }

    /**
     * Approximate zeros inside the window: sign changes refined by bisection (poles, where the
     * magnitude blows up instead of vanishing, are discarded) and touching zeros found as local
     * minima of {@code |f|}. Sorted ascending.
     */
    public List<Double> roots(DoubleUnaryOperator f) {
        double[] xs = grid();
        double[] ys = new double[xs.length];
        for (int i = 0; i < xs.length; i++) {
            ys[i] = f.applyAsDouble(xs[i]);
        }
        List<Double> roots = new ArrayList<>();
        for (int i = 0; i < xs.length; i++) {
            if (Double.isFinite(ys[i]) && Math.abs(ys[i]) <= ZERO_TOLERANCE * 1e-3) {
                addDistinct(roots, xs[i]);
                continue;
            }
            if (i + 1 < xs.length && isFinite(ys[i], ys[i + 1]) && ys[i] * ys[i + 1] < 0) {
                double root = bisect(f, xs[i], xs[i + 1], ys[i]);
                double value = f.applyAsDouble(root);
                if (Double.isFinite(value) && Math.abs(value) <= 1e-6) {
                    addDistinct(roots, root);
                }
            }
            if (i > 0 && i + 1 < xs.length && isFinite(ys[i - 1], ys[i], ys[i + 1])) {
                double a = Math.abs(ys[i]);
                if (a < Math.abs(ys[i - 1]) && a < Math.abs(ys[i + 1]) && ys[i - 1] * ys[i + 1] > 0) {
                    double candidate = minimizeMagnitude(f, xs[i - 1], xs[i + 1]);
                    double value = f.applyAsDouble(candidate);
                    if (Double.isFinite(value) && Math.abs(value) <= ZERO_TOLERANCE) {
                        addDistinct(roots, candidate);
                    }
                }
            }
        }
        roots.sort(Double::compare);
        return roots;
    }

    /**
     * Maximal runs of samples where {@code f < 0} (or {@code f <= 0} when {@code includeZero}),
     * with boundaries refined by bisection. Runs touching a window end keep that end.
     */
    public List<Region> negativeRegions(DoubleUnaryOperator f, boolean includeZero) {
        double[] xs = grid();
        List<Region> regions = new ArrayList<>();
        Double start = null;
        double previous = Double.NaN;
        for (int i = 0; i < xs.length; i++) {
            double y = f.applyAsDouble(xs[i]);
            boolean inside = Double.isFinite(y) && (y < 0 || (includeZero && y == 0.0));
            if (inside && start == null) {
                start = i == 0 || Double.isNaN(previous)
                        ? xs[i]
                        : boundary(f, xs[i - 1], xs[i], includeZero);
            } else if (!inside && start != null) {
                double end = Double.isNaN(y) ? xs[i - 1] : boundary(f, xs[i - 1], xs[i], includeZero);
                regions.add(new Region(start, end));
                start = null;
            }
            previous = y;
        }
        if (start != null) {
            regions.add(new Region(start, max));
        }
        return regions;
    }

    private static boolean isFinite(double... values) {
        for (double v : values) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }

    private static double bisect(DoubleUnaryOperator f, double a, double b, double fa) {
        double lo = a;
        double hi = b;
        double flo = fa;
        for (int i = 0; i < REFINE_STEPS; i++) {
            double mid = 0.5 * (lo + hi);
            double fm = f.applyAsDouble(mid);
            if (fm == 0.0) {
                return mid;
            }
            if (Double.isNaN(fm)) {
                break;
            }
            if (fm * flo > 0) {
                lo = mid;
                flo = fm;
            } else {
                hi = mid;
            }
        }
        return 0.5 * (lo + hi);
    }

    /** Point between {@code a} (outside the region) and {@code b} (inside) where the sign flips. */
    private static double boundary(DoubleUnaryOperator f, double a, double b, boolean includeZero) {
        double lo = a;
        double hi = b;
        boolean loInside = isInside(f.applyAsDouble(lo), includeZero);
        for (int i = 0; i < REFINE_STEPS; i++) {
            double mid = 0.5 * (lo + hi);
            if (isInside(f.applyAsDouble(mid), includeZero) == loInside) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        return 0.5 * (lo + hi);
    }

    private static boolean isInside(double y, boolean includeZero) {
        return Double.isFinite(y) && (y < 0 || (includeZero && y == 0.0));
    }

    /** Ternary search for the minimum of {@code |f|} on {@code [a, b]}. */
    private static double minimizeMagnitude(DoubleUnaryOperator f, double a, double b) {
        double lo = a;
        double hi = b;
        for (int i = 0; i < REFINE_STEPS; i++) {
            double m1 = lo + (hi - lo) / 3;
            double m2 = hi - (hi - lo) / 3;
            double f1 = Math.abs(f.applyAsDouble(m1));
            double f2 = Math.abs(f.applyAsDouble(m2));
            if (Double.isNaN(f1) || Double.isNaN(f2)) {
                break;
            }
            if (f1 < f2) {
                hi = m2;
            } else {
                lo = m1;
            }
        }
        return 0.5 * (lo + hi);
    }

    private static void addDistinct(List<Double> roots, double root) {
        for (double existing : roots) {
            if (Math.abs(existing - root) <= 1e-7 * Math.max(1.0, Math.abs(root))) {
                return;
            }
        }
        roots.add(root);
    }
}
