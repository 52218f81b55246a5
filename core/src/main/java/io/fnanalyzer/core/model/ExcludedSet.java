package io.fnanalyzer.core.model;

import io.fnanalyzer.core.algebra.RealNumber;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.stream.Collectors;

/**
 * Real numbers removed from ℝ: discrete points, intervals and periodic families.
 *
 * <p>Always kept in normal form: intervals are sorted, disjoint and merged; degenerate intervals
 * become points; points that fall inside an interval or family are absorbed, and a point sitting
 * on an open interval end closes that end. Two sets describing the same points therefore compare
 * equal.
 *
 * <p>Rendering:
 *
 * <ul>
 *   <li>nothing excluded: {@code ℝ}
 *   <li>points and families only: {@code ℝ ∖ {2}}, {@code ℝ ∖ {π/2 + kπ : k ∈ ℤ}}
 *   <li>with intervals: the allowed remainder as a union, e.g. {@code [1, ∞)} or
 *       {@code (-∞, -2) ∪ (-2, 0]}; {@code ∅} when nothing is left
 * </ul>
 *
 * <p>Immutable and thread-safe.
 */
public final class ExcludedSet {

    public static final ExcludedSet NONE = new ExcludedSet(List.of(), List.of(), List.of());

    private static final Comparator<Interval> BY_LOWER = Comparator.comparingDouble(Interval::lowerValue)
            .thenComparing(iv -> !iv.lowerClosed());

    private final List<RealNumber> points;
    private final List<Interval> intervals;
    private final List<PeriodicFamily> families;

    private ExcludedSet(List<RealNumber> points, List<Interval> intervals, List<PeriodicFamily> families) {
        this.points = List.copyOf(points);
        this.intervals = List.copyOf(intervals);
        this.families = List.copyOf(families);
    }

    // --- Factories ---

    public static ExcludedSet ofPoint(RealNumber point) {
        return of(List.of(point), List.of(), List.of());
    }

    public static ExcludedSet ofPoints(Collection<RealNumber> points) {
        return of(points, List.of(), List.of());
    }

    public static ExcludedSet ofInterval(Interval interval) {
        return of(List.of(), List.of(interval), List.of());
    }

    public static ExcludedSet ofIntervals(Collection<Interval> intervals) {
        return of(List.of(), intervals, List.of());
    }

    public static ExcludedSet ofFamily(PeriodicFamily family) {
        return of(List.of(), List.of(), List.of(family));
    }

    /** Everything outside the union of {@code allowed}. */
    public static ExcludedSet complementOf(Collection<Interval> allowed) {
        return ofIntervals(gaps(mergeIntervals(new ArrayList<>(allowed))));
    }

    /** Normalizing factory. */
    public static ExcludedSet of(
            Collection<RealNumber> points, Collection<Interval> intervals, Collection<PeriodicFamily> families) {
        List<PeriodicFamily> fams = new ArrayList<>(new LinkedHashSet<>(families));
        fams.sort(Comparator.comparingDouble(f -> f.offset().value()));

        List<RealNumber> pts = new ArrayList<>(points);
        List<Interval> ivs = new ArrayList<>();
        for (Interval iv : intervals) {
            if (iv.isDegenerate()) {
                pts.add(iv.lower());
            } else {
                ivs.add(iv);
            }
        }
        ivs = mergeIntervals(ivs);

        pts.sort(Comparator.naturalOrder());
        List<RealNumber> kept = new ArrayList<>();
        for (RealNumber p : pts) {
            double v = p.doubleValue();
            if (!kept.isEmpty() && Interval.near(kept.get(kept.size() - 1).doubleValue(), v)) {
                continue;
            }
            if (fams.stream().anyMatch(f -> f.contains(v)) || ivs.stream().anyMatch(iv -> iv.contains(v))) {
                continue;
            }
            int touching = touchingEnd(ivs, v);
            if (touching >= 0) {
                ivs.set(touching, closeEndAt(ivs.get(touching), v));
                continue;
            }
            kept.add(p);
        }
        return new ExcludedSet(kept, mergeIntervals(ivs), fams);
    }

    // --- Queries ---

    public boolean isEmpty() {
        return points.isEmpty() && intervals.isEmpty() && families.isEmpty();
    }

    public boolean contains(double v) {
        return points.stream().anyMatch(p -> Interval.near(p.doubleValue(), v))
                || intervals.stream().anyMatch(iv -> iv.contains(v))
                || families.stream().anyMatch(f -> f.contains(v));
    }

    public List<RealNumber> points() {
        return points;
    }

    public List<Interval> intervals() {
        return intervals;
    }

    public List<PeriodicFamily> families() {
        return families;
    }

    public ExcludedSet union(ExcludedSet other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        List<RealNumber> pts = new ArrayList<>(points);
        pts.addAll(other.points);
        List<Interval> ivs = new ArrayList<>(intervals);
        ivs.addAll(other.intervals);
        List<PeriodicFamily> fams = new ArrayList<>(families);
        fams.addAll(other.families);
        return of(pts, ivs, fams);
    }

    /**
     * The complement of the points and intervals as disjoint ascending intervals. Periodic
     * families are not reflected.
     */
    public List<Interval> allowedIntervals() {
        List<Interval> allowed = gaps(intervals);
        for (RealNumber p : points) {
            double v = p.doubleValue();
            List<Interval> split = new ArrayList<>();
            for (Interval iv : allowed) {
                if (!iv.contains(v)) {
                    split.add(iv);
                    continue;
                }
                if (Interval.isNonEmpty(iv.lower(), iv.lowerClosed(), p, false)) {
                    split.add(new Interval(iv.lower(), iv.lowerClosed(), p, false));
                }
                if (Interval.isNonEmpty(p, false, iv.upper(), iv.upperClosed())) {
                    split.add(new Interval(p, false, iv.upper(), iv.upperClosed()));
                }
            }
            allowed = split;
        }
        return allowed;
    }

    // --- Rendering ---

    /** Human-readable form; see the class documentation. */
    public String render() {
        if (isEmpty()) {
            return "ℝ";
        }
        List<String> removed = new ArrayList<>();
        if (!points.isEmpty()) {
            removed.add(points.stream().map(RealNumber::toString).collect(Collectors.joining(", ", "{", "}")));
        }
        for (PeriodicFamily family : families) {
            removed.add("{" + family + " : k ∈ ℤ}");
        }
        if (intervals.isEmpty()) {
            return "ℝ ∖ " + unionOf(removed);
        }
        List<Interval> allowed = allowedIntervals();
        if (allowed.isEmpty()) {
            return "∅";
        }
        String base = allowed.stream().map(Interval::toString).collect(Collectors.joining(" ∪ "));
        if (families.isEmpty()) {
            return base;
        }
        List<String> familyParts = families.stream()
                .map(f -> "{" + f + " : k ∈ ℤ}")
                .collect(Collectors.toList());
        return (allowed.size() > 1 ? "(" + base + ")" : base) + " ∖ " + unionOf(familyParts);
    }

    private static String unionOf(List<String> parts) {
        if (parts.size() == 1) {
            return parts.get(0);
        }
        StringJoiner joiner = new StringJoiner(" ∪ ", "(", ")");
        parts.forEach(joiner::add);
        return joiner.toString();
    }

    // --- Interval arithmetic ---

    private static List<Interval> mergeIntervals(List<Interval> input) {
        List<Interval> sorted = new ArrayList<>(input);
        sorted.sort(BY_LOWER);
        List<Interval> merged = new ArrayList<>();
        for (Interval next : sorted) {
            if (merged.isEmpty()) {
                merged.add(next);
                continue;
            }
            Interval current = merged.get(merged.size() - 1);
            if (overlapsOrTouches(current, next)) {
                merged.set(merged.size() - 1, span(current, next));
            } else {
                merged.add(next);
            }
        }
        return merged;
    }

    private static boolean overlapsOrTouches(Interval current, Interval next) {
        double hi = current.upperValue();
        double lo = next.lowerValue();
        if (lo < hi && !Interval.near(lo, hi)) {
            return true;
        }
        if (Double.isInfinite(hi) || Double.isInfinite(lo)) {
            return lo < hi;
        }
        return Interval.near(lo, hi) && (current.upperClosed() || next.lowerClosed());
    }

    private static Interval span(Interval a, Interval b) {
        int cmp = Double.compare(a.upperValue(), b.upperValue());
        if (a.upper() != null && b.upper() != null && Interval.near(a.upperValue(), b.upperValue())) {
            cmp = 0;
        }
        if (cmp > 0) {
            return a;
        }
        boolean closed = cmp == 0 ? a.upperClosed() || b.upperClosed() : b.upperClosed();
        return new Interval(a.lower(), a.lowerClosed(), b.upper(), closed);
    }

    /** Complement of sorted, disjoint intervals. */
    private static List<Interval> gaps(List<Interval> sorted) {
        List<Interval> result = new ArrayList<>();
        RealNumber cursor = null;
        boolean cursorClosed = false;
        for (Interval iv : sorted) {
            if (iv.lower() != null && Interval.isNonEmpty(cursor, cursorClosed, iv.lower(), !iv.lowerClosed())) {
                result.add(new Interval(cursor, cursorClosed, iv.lower(), !iv.lowerClosed()));
            }
            if (iv.upper() == null) {
                return result;
            }
            cursor = iv.upper();
            cursorClosed = !iv.upperClosed();
        }
        result.add(new Interval(cursor, cursorClosed, null, false));
        return result;
    }

    private static int touchingEnd(List<Interval> ivs, double v) {
        for (int i = 0; i < ivs.size(); i++) {
            Interval iv = ivs.get(i);
            if ((iv.lower() != null && !iv.lowerClosed() && Interval.near(iv.lowerValue(), v))
                    || (iv.upper() != null && !iv.upperClosed() && Interval.near(iv.upperValue(), v))) {
                return i;
            }
        }
        return -1;
    }

    private static Interval closeEndAt(Interval iv, double v) {
        if (iv.lower() != null && Interval.near(iv.lowerValue(), v)) {
            return new Interval(iv.lower(), true, iv.upper(), iv.upperClosed());
        }
        return new Interval(iv.lower(), iv.lowerClosed(), iv.upper(), true);
    }

    // --- Object ---

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExcludedSet other)) return false;
        return points.equals(other.points) && intervals.equals(other.intervals) && families.equals(other.families);
    }

    @Override
    public int hashCode() {
        return Objects.hash(points, intervals, families);
    }

    @Override
    public String toString() {
        return render();
    }
}
