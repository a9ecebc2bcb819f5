package edu.stanford.futuredata.shardagg.accumulators;

import edu.stanford.futuredata.shardagg.errors.AggregateFunctionException;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Running sum.  Finite inputs, integral or floating, add exactly into one BigDecimal, so the total does not depend on
 * the order or grouping of additions.  Rounding to long or double happens once, when the state is finalized.
 * NaN and infinite inputs are tracked as flags.
 */
public final class SumState {
    public static final SumState EMPTY = new SumState(BigDecimal.ZERO, false, false, 0);

    private static final int NAN = 1;
    private static final int POSITIVE_INFINITY = 2;
    private static final int NEGATIVE_INFINITY = 4;

    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    public final BigDecimal exact;
    public final boolean floating;
    public final boolean seen;
    private final int nonFinite;

    SumState(BigDecimal exact, boolean floating, boolean seen, int nonFinite) {
        this.exact = exact;
        this.floating = floating;
        this.seen = seen;
        this.nonFinite = nonFinite;
    }

    SumState add(String function, Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return new SumState(exact.add(BigDecimal.valueOf(((Number) value).longValue())), floating, true, nonFinite);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d)) {
                return new SumState(exact, true, true, nonFinite | NAN);
            }
            if (Double.isInfinite(d)) {
                return new SumState(exact, true, true, nonFinite | (d > 0 ? POSITIVE_INFINITY : NEGATIVE_INFINITY));
            }
            return new SumState(exact.add(new BigDecimal(d)), true, true, nonFinite);
        }
        throw new AggregateFunctionException(String.format("%s cannot add non-numeric value %s (%s)",
                function, value, value.getClass().getSimpleName()));
    }

    SumState combine(SumState other) {
        if (!other.seen) {
            return this;
        }
        if (!seen) {
            return other;
        }
        return new SumState(exact.add(other.exact), floating || other.floating, true, nonFinite | other.nonFinite);
    }

    boolean fitsInLong() {
        return exact.compareTo(LONG_MIN) >= 0 && exact.compareTo(LONG_MAX) <= 0;
    }

    // The total as a long.  Only valid for an integral state.
    long longValue(String function) {
        if (!fitsInLong()) {
            throw new AggregateFunctionException(String.format("%s overflow: %s does not fit in a long",
                    function, exact.toPlainString()));
        }
        return exact.longValueExact();
    }

    // The total rounded once to the nearest double.
    double doubleValue() {
        if (nonFinite != 0) {
            return nonFiniteValue();
        }
        return exact.doubleValue();
    }

    // The mean over count values, rounded once to the nearest double.
    double mean(long count) {
        if (nonFinite != 0) {
            return nonFiniteValue();
        }
        return exact.divide(BigDecimal.valueOf(count), MathContext.DECIMAL128).doubleValue();
    }

    private double nonFiniteValue() {
        if ((nonFinite & NAN) != 0 || nonFinite == (POSITIVE_INFINITY | NEGATIVE_INFINITY)) {
            return Double.NaN;
        }
        return (nonFinite & POSITIVE_INFINITY) != 0 ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
    }

    @Override
    public String toString() {
        return nonFinite != 0 ? String.valueOf(nonFiniteValue()) : exact.toPlainString();
    }
}
