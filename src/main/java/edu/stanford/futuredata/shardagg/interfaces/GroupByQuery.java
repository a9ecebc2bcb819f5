package edu.stanford.futuredata.shardagg.interfaces;

import edu.stanford.futuredata.shardagg.accumulators.AggregateColumn;
import edu.stanford.futuredata.shardagg.shard.GroupKey;

import java.util.List;

public interface GroupByQuery<R extends Row> {
    /*
     A GROUP BY aggregation, supplied by the query layer.
     Accumulators are chosen once here, not per row.
     */

    // Extract the group key of a row.  Must be a pure function of the row.
    GroupKey groupKey(R row);
    // Aggregates computed for every group, in output order.
    List<AggregateColumn> aggregates();
}
