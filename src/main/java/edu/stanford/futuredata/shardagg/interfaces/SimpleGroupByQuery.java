package edu.stanford.futuredata.shardagg.interfaces;

import edu.stanford.futuredata.shardagg.accumulators.AggregateColumn;
import edu.stanford.futuredata.shardagg.shard.GroupKey;

import java.util.List;

/**
 * Groups by a fixed list of column positions.
 */
public class SimpleGroupByQuery<R extends Row> implements GroupByQuery<R> {

    private final int[] keyColumns;
    private final List<AggregateColumn> aggregates;

    public SimpleGroupByQuery(int[] keyColumns, List<AggregateColumn> aggregates) {
        if (aggregates.isEmpty()) {
            throw new IllegalArgumentException("A query needs at least one aggregate");
        }
        this.keyColumns = keyColumns.clone();
        this.aggregates = List.copyOf(aggregates);
    }

    public SimpleGroupByQuery(int keyColumn, AggregateColumn... aggregates) {
        this(new int[]{keyColumn}, List.of(aggregates));
    }

    @Override
    public GroupKey groupKey(R row) {
        Object[] values = new Object[keyColumns.length];
        for (int i = 0; i < keyColumns.length; i++) {
            values[i] = row.getValue(keyColumns[i]);
        }
        return GroupKey.of(values);
    }

    @Override
    public List<AggregateColumn> aggregates() {
        return aggregates;
    }
}
