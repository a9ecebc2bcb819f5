package edu.stanford.futuredata.shardagg.accumulators;

import edu.stanford.futuredata.shardagg.errors.AggregateFunctionException;

// Number of non-null values.  Use AggregateColumn.ALL_ROWS to count rows.
public class CountAccumulator implements Accumulator<Long, Long> {

    @Override
    public String name() {
        return "count";
    }

    @Override
    public Long init() {
        return 0L;
    }

    @Override
    public Long accumulate(Long state, long rowIndex, Object value) {
        return value == null ? state : state + 1;
    }

    @Override
    public Long merge(Long left, Long right) {
        try {
            return Math.addExact(left, right);
        } catch (ArithmeticException e) {
            throw new AggregateFunctionException("count overflow", e);
        }
    }

    @Override
    public Long finalizeState(Long state) {
        return state;
    }
}
