package edu.stanford.futuredata.shardagg.accumulators;

// first and last: the non-null value at the lowest or highest global row index.
public class PositionalAccumulator implements Accumulator<Ranked, Object> {

    private final String name;
    private final boolean earliest;

    private PositionalAccumulator(String name, boolean earliest) {
        this.name = name;
        this.earliest = earliest;
    }

    public static PositionalAccumulator first() {
        return new PositionalAccumulator("first", true);
    }

    public static PositionalAccumulator last() {
        return new PositionalAccumulator("last", false);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Ranked init() {
        return null;
    }

    @Override
    public Ranked accumulate(Ranked state, long rowIndex, Object value) {
        return value == null ? state : pick(state, new Ranked(rowIndex, value));
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
        boolean leftFirst = left.rowIndex <= right.rowIndex;
        return leftFirst == earliest ? left : right;
    }

    @Override
    public Object finalizeState(Ranked state) {
        return state == null ? null : state.value;
    }
}
