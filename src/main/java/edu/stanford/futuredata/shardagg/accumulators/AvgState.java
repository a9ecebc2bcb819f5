package edu.stanford.futuredata.shardagg.accumulators;

public final class AvgState {
    public static final AvgState EMPTY = new AvgState(SumState.EMPTY, 0L);

    public final SumState sum;
    public final long count;

    AvgState(SumState sum, long count) {
        this.sum = sum;
        this.count = count;
    }

    @Override
    public String toString() {
        return sum + "/" + count;
    }
}
