package edu.stanford.futuredata.shardagg.accumulators;

import edu.stanford.futuredata.shardagg.interfaces.Row;

/**
 * One requested aggregate: an accumulator bound to the input column it reads.
 */
public final class AggregateColumn {
    // Feed every row to the accumulator regardless of nulls, as in count(*).
    public static final int ALL_ROWS = -1;

    private final Accumulator<Object, Object> accumulator;
    private final int column;

    private AggregateColumn(Accumulator<?, ?> accumulator, int column) {
        this.accumulator = (Accumulator<Object, Object>) accumulator;
        this.column = column;
    }

    public static AggregateColumn of(Accumulator<?, ?> accumulator, int column) {
        if (column < ALL_ROWS) {
            throw new IllegalArgumentException("Invalid column " + column);
        }
        return new AggregateColumn(accumulator, column);
    }

    public Accumulator<Object, Object> accumulator() {
        return accumulator;
    }

    public int column() {
        return column;
    }

    // The measure this aggregate reads from a row.
    public Object measure(Row row) {
        return column == ALL_ROWS ? Boolean.TRUE : row.getValue(column);
    }

    @Override
    public String toString() {
        return accumulator.name() + "(" + (column == ALL_ROWS ? "*" : "$" + column) + ")";
    }
}
