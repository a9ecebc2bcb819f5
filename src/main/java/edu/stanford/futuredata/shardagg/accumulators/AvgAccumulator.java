package edu.stanford.futuredata.shardagg.accumulators;

// Mean of non-null numeric values, kept as a (sum, count) pair until finalize.
public class AvgAccumulator implements Accumulator<AvgState, Double> {

    @Override
    public String name() {
        return "avg";
    }

    @Override
    public AvgState init() {
        return AvgState.EMPTY;
    }

    @Override
    public AvgState accumulate(AvgState state, long rowIndex, Object value) {
        if (value == null) {
            return state;
        }
        return new AvgState(state.sum.add(name(), value), state.count + 1);
    }

    @Override
    public AvgState merge(AvgState left, AvgState right) {
        return new AvgState(left.sum.combine(right.sum), left.count + right.count);
    }

    @Override
    public Double finalizeState(AvgState state) {
        if (state.count == 0) {
            return null;
        }
        return state.sum.mean(state.count);
    }
}
