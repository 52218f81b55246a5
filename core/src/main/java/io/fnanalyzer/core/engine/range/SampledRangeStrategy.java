package io.fnanalyzer.core.engine.range;

import io.fnanalyzer.core.algebra.NumericScanner;
import io.fnanalyzer.core.algebra.RealNumber;
import io.fnanalyzer.core.engine.AnalyzerConfig;
import io.fnanalyzer.core.expr.Evaluator;
import io.fnanalyzer.core.expr.Expr;
import io.fnanalyzer.core.model.DomainResult;
import io.fnanalyzer.core.model.Interval;
import io.fnanalyzer.core.model.PeriodicFamily;
import io.fnanalyzer.core.model.StepTrace;
import io.fnanalyzer.core.spi.RangeContext;
import io.fnanalyzer.core.spi.RangeOutcome;
import io.fnanalyzer.core.spi.RangeStrategy;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback that always applies: samples {@code f} on each continuous piece of the domain and
 * probes the piece ends for divergence or a limit. The answer is the hull of the sampled values
 * per piece, so it is always flagged approximate.
 */
public final class SampledRangeStrategy implements RangeStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(SampledRangeStrategy.class);

    public static final String ID = "sampled";

    /** Fewest samples taken on a short piece. */
    private static final int MIN_SAMPLES = 101;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RangeOutcome attempt(RangeContext context) {
        AnalyzerConfig config = context.config();
        Expr expr = context.expression();
        DomainResult domain = context.domain();
        StepTrace.Builder trace = context.trace();

        List<Piece> pieces = pieces(domain, config);
        trace.step("No closed form applies: sample f on " + pieces.size() + " continuous piece"
                + (pieces.size() == 1 ? "" : "s") + " of the domain and probe each end");
        List<Interval> attained = new ArrayList<>();
        for (Piece piece : pieces) {
            Interval values = new PieceScan(expr, domain, config, piece).scan();
            if (values == null) {
                trace.step("On " + piece + " no sample is defined");
                continue;
            }
            trace.step("On " + piece + " f takes approximately " + values);
            attained.add(values);
        }
        LOG.debug("Sampled range of {} over {} pieces", expr, pieces.size());
        return RangeOutcome.attained(attained, true);
    }

    /**
     * Allowed intervals of the domain, further cut at the members of periodic families. With
     * families present the outer pieces stop at the first member beyond the window.
     */
    private static List<Piece> pieces(DomainResult domain, AnalyzerConfig config) {
        List<Piece> pieces = new ArrayList<>();
        for (Interval iv : domain.excluded().allowedIntervals()) {
            pieces.add(new Piece(iv.lowerValue(), iv.lowerClosed(), iv.upperValue(), iv.upperClosed()));
        }
        List<PeriodicFamily> families = domain.excluded().families();
        if (families.isEmpty()) {
            return pieces;
        }
        TreeSet<Double> cuts = new TreeSet<>();
        for (PeriodicFamily family : families) {
            double period = family.period().value();
            for (RealNumber member : family.members(config.windowMin() - period, config.windowMax() + period)) {
                cuts.add(member.doubleValue());
            }
        }
        double first = cuts.isEmpty() ? config.windowMin() : cuts.first();
        double last = cuts.isEmpty() ? config.windowMax() : cuts.last();
        List<Piece> split = new ArrayList<>();
        for (Piece piece : pieces) {
            Piece clipped = piece.clip(first, last);
            if (clipped == null) {
                continue;
            }
            double lo = clipped.lo;
            boolean loClosed = clipped.loClosed;
            for (double cut : cuts.subSet(clipped.lo, false, clipped.hi, false)) {
                split.add(new Piece(lo, loClosed, cut, false));
                lo = cut;
                loClosed = false;
            }
            split.add(new Piece(lo, loClosed, clipped.hi, clipped.hiClosed));
        }
        return split;
    }

    /** A continuous piece of the domain; infinite ends are ±∞ and open. */
    private record Piece(double lo, boolean loClosed, double hi, boolean hiClosed) {

        Piece clip(double min, double max) {
            double l = Math.max(lo, min);
            double h = Math.min(hi, max);
            if (!(l < h)) {
                return null;
            }
            return new Piece(l, l == lo && loClosed, h, h == hi && hiClosed);
        }

        @Override
        public String toString() {
            if (lo == hi) {
                return "{" + RealNumber.approximate(lo) + "}";
            }
            String left = Double.isInfinite(lo) ? "(-∞" : (loClosed ? "[" : "(") + RealNumber.approximate(lo);
            String right = Double.isInfinite(hi) ? "∞)" : RealNumber.approximate(hi) + (hiClosed ? "]" : ")");
            return left + ", " + right;
        }
    }

    /** How {@code f} behaves when approaching a piece end. */
    private enum Trend {
        UP,
        DOWN,
        LIMIT,
        UNKNOWN
    }

    /** Samples and end probes of one piece. */
    private static final class PieceScan {
        private final Expr expr;
        private final DomainResult domain;
        private final AnalyzerConfig config;
        private final Piece piece;
        private double min = Double.POSITIVE_INFINITY;
        private double max = Double.NEGATIVE_INFINITY;
        private boolean unboundedBelow;
        private boolean unboundedAbove;
        private double lowerLimit = Double.NaN;
        private double upperLimit = Double.NaN;

        PieceScan(Expr expr, DomainResult domain, AnalyzerConfig config, Piece piece) {
            this.expr = expr;
            this.domain = domain;
            this.config = config;
            this.piece = piece;
        }

        Interval scan() {
            if (piece.lo == piece.hi) {
                double y = value(piece.lo);
                return Double.isFinite(y) ? Interval.point(RealNumber.approximate(y + 0.0)) : null;
            }
            double width = config.windowMax() - config.windowMin();
            double s = Math.max(piece.lo, config.windowMin());
            double t = Math.min(piece.hi, config.windowMax());
            if (!(s < t)) {
                if (Double.isInfinite(piece.hi)) {
                    s = piece.lo;
                    t = piece.lo + width;
                } else if (Double.isInfinite(piece.lo)) {
                    s = piece.hi - width;
                    t = piece.hi;
                } else {
                    s = piece.lo;
                    t = piece.hi;
                }
            }
            int samples = (int) Math.max(MIN_SAMPLES, Math.min(config.sampleCount(), config.sampleCount() * (t - s) / width));
            for (double x : new NumericScanner(s, t, samples).grid()) {
                include(value(x));
            }

            probe(Double.isInfinite(piece.lo) ? outward(s, -1) : inward(piece.lo, +1));
            probe(Double.isInfinite(piece.hi) ? outward(t, +1) : inward(piece.hi, -1));

            boolean anySample = min <= max;
            if (!anySample && Double.isNaN(lowerLimit) && Double.isNaN(upperLimit)
                    && !unboundedBelow && !unboundedAbove) {
                return null;
            }
            RealNumber lower = null;
            boolean lowerClosed = false;
            if (!unboundedBelow) {
                double limit = Double.isNaN(lowerLimit) ? Double.POSITIVE_INFINITY : lowerLimit;
                lowerClosed = anySample && min <= limit;
                lower = RealNumber.approximate(lowerClosed ? min : limit);
            }
            RealNumber upper = null;
            boolean upperClosed = false;
            if (!unboundedAbove) {
                double limit = Double.isNaN(upperLimit) ? Double.NEGATIVE_INFINITY : upperLimit;
                upperClosed = anySample && max >= limit;
                upper = RealNumber.approximate(upperClosed ? max : limit);
            }
            if (lower != null && upper != null && (lower.doubleValue() >= upper.doubleValue()
                    || Interval.near(lower.doubleValue(), upper.doubleValue()))) {
                return Interval.point(lower);
            }
            return new Interval(lower, lowerClosed, upper, upperClosed);
        }

        private void include(double y) {
            if (y == Double.POSITIVE_INFINITY) {
                unboundedAbove = true;
            } else if (y == Double.NEGATIVE_INFINITY) {
                unboundedBelow = true;
            } else if (Double.isFinite(y)) {
                min = Math.min(min, y);
                max = Math.max(max, y);
            }
        }

        /** Probe abscissas beyond {@code from}, at distances 10, 100, ..., 100000. */
        private double[] outward(double from, int direction) {
            double[] xs = new double[5];
            for (int k = 0; k < xs.length; k++) {
                xs[k] = from + direction * Math.pow(10, k + 1);
            }
            return xs;
        }

        /** Probe abscissas approaching the finite end {@code end} from inside the piece. */
        private double[] inward(double end, int direction) {
            double scale = Math.max(1.0, Math.abs(end));
            double[] xs = new double[10];
            for (int k = 0; k < xs.length; k++) {
                xs[k] = end + direction * scale * Math.pow(10, -(k + 3));
            }
            return xs;
        }

        private void probe(double[] xs) {
            List<Double> values = new ArrayList<>();
            for (double x : xs) {
                double y = value(x);
                if (Double.isInfinite(y)) {
                    include(y);
                    return;
                }
                if (Double.isFinite(y)) {
                    values.add(y);
                }
            }
            switch (trend(values)) {
                case UP:
                    unboundedAbove = true;
                    break;
                case DOWN:
                    unboundedBelow = true;
                    break;
                case LIMIT:
                    double limit = values.get(values.size() - 1);
                    if (limit < min) {
                        lowerLimit = Double.isNaN(lowerLimit) ? limit : Math.min(lowerLimit, limit);
                    } else if (limit > max) {
                        upperLimit = Double.isNaN(upperLimit) ? limit : Math.max(upperLimit, limit);
                    }
                    break;
                default:
                    values.forEach(this::include);
                    break;
            }
        }

        /**
         * Monotone probe values whose steps do not shrink away diverge; monotone values with
         * decaying steps converge to the last one.
         */
        private static Trend trend(List<Double> values) {
            if (values.size() < 3) {
                return Trend.UNKNOWN;
            }
            int sign = 0;
            double largest = 0;
            double lastStep = 0;
            for (int i = 1; i < values.size(); i++) {
                double step = values.get(i) - values.get(i - 1);
                if (Interval.near(values.get(i), values.get(i - 1))) {
                    step = 0;
                }
                int s = (int) Math.signum(step);
                if (s != 0) {
                    if (sign != 0 && s != sign) {
                        return Trend.UNKNOWN;
                    }
                    sign = s;
                }
                largest = Math.max(largest, Math.abs(step));
                lastStep = Math.abs(step);
            }
            if (sign == 0 || lastStep < 0.25 * largest) {
                return Trend.LIMIT;
            }
            return sign > 0 ? Trend.UP : Trend.DOWN;
        }

        private double value(double x) {
            if (!domain.contains(x)) {
                return Double.NaN;
            }
            return Evaluator.evaluateOrNaN(expr, x);
        }
    }
}
