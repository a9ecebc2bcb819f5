package edu.stanford.futuredata.shardagg.accumulators;

public class MinAccumulator extends ExtremumAccumulator {

    @Override
    public String name() {
        return "min";
    }

    @Override
    protected int direction() {
        return -1;
    }
}
