package edu.stanford.futuredata.shardagg.engine;

import edu.stanford.futuredata.shardagg.accumulators.AggregateColumn;
import edu.stanford.futuredata.shardagg.errors.AggregateFunctionException;
import edu.stanford.futuredata.shardagg.errors.AggregationException;
import edu.stanford.futuredata.shardagg.errors.ResourceExhaustionException;
import edu.stanford.futuredata.shardagg.shard.GroupKey;
import edu.stanford.futuredata.shardagg.shard.ShardTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Merge task for one shard index: folds that shard's table from every worker into one table.  Tasks for different
 * shard indexes read and write disjoint tables.
 */
class ShardMergeTask implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(ShardMergeTask.class);

    private final int shardIndex;
    // Indexed [worker][shard].  This task reads and then clears column shardIndex only.
    private final ShardTable[][] scatterTables;
    private final List<AggregateColumn> aggregates;
    private final int checkInterval;
    private final int initialCapacity;
    private final int maxCapacity;
    private final TaskContext context;
    private final ShardTable[] merged;
    private final CountDownLatch done;

    ShardMergeTask(int shardIndex, ShardTable[][] scatterTables, List<AggregateColumn> aggregates, int checkInterval,
                   int initialCapacity, int maxCapacity, TaskContext context, ShardTable[] merged,
                   CountDownLatch done) {
        this.shardIndex = shardIndex;
        this.scatterTables = scatterTables;
        this.aggregates = aggregates;
        this.checkInterval = checkInterval;
        this.initialCapacity = initialCapacity;
        this.maxCapacity = maxCapacity;
        this.context = context;
        this.merged = merged;
        this.done = done;
    }

    @Override
    public void run() {
        boolean completed = false;
        try {
            merged[shardIndex] = merge();
            completed = true;
        } catch (AggregationException e) {
            logger.debug("Merge of shard {} stopped: {}", shardIndex, e.getMessage());
            context.recordFailure(e);
            completed = true;
        } catch (OutOfMemoryError e) {
            context.recordFailure(new ResourceExhaustionException(
                    String.format("Merge of shard %d ran out of memory", shardIndex), e));
            completed = true;
        } finally {
            if (!completed) {
                context.recordFailure(new AggregationException(
                        String.format("Merge of shard %d exited abnormally", shardIndex)));
            }
            for (ShardTable[] workerTables: scatterTables) {
                workerTables[shardIndex] = null;
            }
            done.countDown();
        }
    }

    private ShardTable merge() {
        context.checkpoint();
        if (scatterTables.length == 1) {
            // A single worker's sealed table is already the merged result.
            ShardTable only = scatterTables[0][shardIndex];
            verify(only);
            return only;
        }
        int largest = initialCapacity;
        for (ShardTable[] workerTables: scatterTables) {
            largest = Math.max(largest, workerTables[shardIndex].size());
        }
        ShardTable out = new ShardTable(ShardTable.MERGED, shardIndex, aggregates, largest, maxCapacity);
        long entries = 0;
        for (ShardTable[] workerTables: scatterTables) {
            ShardTable in = workerTables[shardIndex];
            if (!in.isSealed()) {
                throw new IllegalStateException(String.format("Shard %d of worker %d read before sealing",
                        shardIndex, in.getWorkerId()));
            }
            for (int slot = 0; slot < in.capacity(); slot++) {
                if (in.keyAt(slot) == null) {
                    continue;
                }
                if (entries % checkInterval == 0) {
                    context.checkpoint();
                }
                try {
                    out.mergeEntry(in, slot);
                } catch (AggregationException e) {
                    throw e;
                } catch (RuntimeException e) {
                    throw new AggregateFunctionException(String.format("Merging key %s of shard %d failed: %s",
                            in.keyAt(slot), shardIndex, e), e);
                }
                entries++;
            }
        }
        context.checkpoint();
        verify(out);
        out.seal();
        logger.debug("Shard {} merged {} entries into {} groups", shardIndex, entries, out.size());
        return out;
    }

    // Every merged state must have a valid output before the job can finish.
    private void verify(ShardTable table) {
        for (int slot = 0; slot < table.capacity(); slot++) {
            GroupKey key = table.keyAt(slot);
            if (key == null) {
                continue;
            }
            for (int a = 0; a < aggregates.size(); a++) {
                try {
                    aggregates.get(a).accumulator().verify(table.getState(slot, a));
                } catch (AggregationException e) {
                    throw e;
                } catch (RuntimeException e) {
                    throw new AggregateFunctionException(String.format("%s failed on group %s of shard %d: %s",
                            aggregates.get(a), key, shardIndex, e), e);
                }
            }
        }
    }
}
