package edu.stanford.futuredata.shardagg.accumulators;

import edu.stanford.futuredata.shardagg.errors.AggregateFunctionException;

// Sum of non-null numeric values.  Long when every input was integral, Double otherwise.
public class SumAccumulator implements Accumulator<SumState, Number> {

    @Override
    public String name() {
        return "sum";
    }

    @Override
    public SumState init() {
        return SumState.EMPTY;
    }

    @Override
    public SumState accumulate(SumState state, long rowIndex, Object value) {
        return value == null ? state : state.add(name(), value);
    }

    @Override
    public SumState merge(SumState left, SumState right) {
        return left.combine(right);
    }

    // An integral total outside the long range cannot be finalized.
    @Override
    public void verify(SumState state) {
        if (state.seen && !state.floating && !state.fitsInLong()) {
            throw new AggregateFunctionException(String.format("%s overflow: %s does not fit in a long",
                    name(), state.exact.toPlainString()));
        }
    }

    @Override
    public Number finalizeState(SumState state) {
        if (!state.seen) {
            return null;
        }
        if (state.floating) {
            return state.doubleValue();
        }
        return state.longValue(name());
    }
}
