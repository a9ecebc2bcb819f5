package edu.stanford.futuredata.shardagg.accumulators;

import edu.stanford.futuredata.shardagg.errors.AggregateFunctionException;

/**
 * Shared logic of min and max.  Values must be mutually Comparable.  When two values compare equal the one from the
 * lower row index is kept, so the winner does not depend on how rows were split across workers.
 */
public abstract class ExtremumAccumulator implements Accumulator<Ranked, Object> {

    // Negative for min, positive for max.
    protected abstract int direction();

    @Override
    public Ranked init() {
        return null;
    }

    @Override
    public Ranked accumulate(Ranked state, long rowIndex, Object value) {
        if (value == null) {
            return state;
        }
        if (!(value instanceof Comparable)) {
            throw new AggregateFunctionException(String.format("%s requires comparable values, got %s",
                    name(), value.getClass().getName()));
        }
        return pick(state, new Ranked(rowIndex, value));
    }

    @Override
    public Ranked merge(Ranked left, Ranked right) {
        return pick(left, right);
    }

    private Ranked pick(Ranked left, Ranked right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        int c = compare(left.value, right.value) * direction();
        if (c > 0) {
            return left;
        } else if (c < 0) {
            return right;
        }
        return left.rowIndex <= right.rowIndex ? left : right;
    }

    @Override
    public Object finalizeState(Ranked state) {
        return state == null ? null : state.value;
    }

    private int compare(Object a, Object b) {
        try {
            return Integer.signum(((Comparable) a).compareTo(b));
        } catch (ClassCastException e) {
            throw new AggregateFunctionException(String.format("%s cannot compare %s (%s) with %s (%s)", name(),
                    a, a.getClass().getSimpleName(), b, b.getClass().getSimpleName()), e);
        }
    }
}
