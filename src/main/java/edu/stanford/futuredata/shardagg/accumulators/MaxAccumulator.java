package edu.stanford.futuredata.shardagg.accumulators;

public class MaxAccumulator extends ExtremumAccumulator {

    @Override
    public String name() {
        return "max";
    }

    @Override
    protected int direction() {
        return 1;
    }
}
