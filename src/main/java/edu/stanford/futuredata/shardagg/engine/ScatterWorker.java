package edu.stanford.futuredata.shardagg.engine;

import edu.stanford.futuredata.shardagg.accumulators.AggregateColumn;
import edu.stanford.futuredata.shardagg.errors.AggregateFunctionException;
import edu.stanford.futuredata.shardagg.errors.AggregationException;
import edu.stanford.futuredata.shardagg.errors.InputException;
import edu.stanford.futuredata.shardagg.errors.ResourceExhaustionException;
import edu.stanford.futuredata.shardagg.interfaces.GroupByQuery;
import edu.stanford.futuredata.shardagg.interfaces.Row;
import edu.stanford.futuredata.shardagg.interfaces.RowSource;
import edu.stanford.futuredata.shardagg.partition.Partition;
import edu.stanford.futuredata.shardagg.shard.GroupKey;
import edu.stanford.futuredata.shardagg.shard.ShardTable;
import edu.stanford.futuredata.shardagg.utilities.ShardHash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Scatter task: aggregates one partition into the worker's private shard tables.  No other task touches those
 * tables until this one has sealed them and counted down the barrier.
 */
class ScatterWorker<R extends Row> implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(ScatterWorker.class);

    private final Partition partition;
    private final RowSource<R> source;
    private final GroupByQuery<R> query;
    private final AggregateColumn[] aggregates;
    private final int shardCount;
    private final int checkInterval;
    private final int initialCapacity;
    private final int maxCapacity;
    private final TaskContext context;
    // Row of shardTables owned by this worker, filled on success.
    private final ShardTable[] output;
    private final long[] rowsScanned;
    private final CountDownLatch barrier;

    ScatterWorker(Partition partition, RowSource<R> source, GroupByQuery<R> query, List<AggregateColumn> aggregates,
                  int shardCount, int checkInterval, int initialCapacity, int maxCapacity, TaskContext context,
                  ShardTable[] output, long[] rowsScanned, CountDownLatch barrier) {
        this.partition = partition;
        this.source = source;
        this.query = query;
        this.aggregates = aggregates.toArray(new AggregateColumn[0]);
        this.shardCount = shardCount;
        this.checkInterval = checkInterval;
        this.initialCapacity = initialCapacity;
        this.maxCapacity = maxCapacity;
        this.context = context;
        this.output = output;
        this.rowsScanned = rowsScanned;
        this.barrier = barrier;
    }

    @Override
    public void run() {
        boolean completed = false;
        try {
            ShardTable[] tables = scatter();
            for (ShardTable t: tables) {
                t.seal();
            }
            System.arraycopy(tables, 0, output, 0, shardCount);
            completed = true;
        } catch (AggregationException e) {
            logger.debug("Worker {} stopped: {}", partition.workerId, e.getMessage());
            context.recordFailure(e);
            completed = true;
        } catch (OutOfMemoryError e) {
            context.recordFailure(new ResourceExhaustionException(
                    String.format("Worker %d ran out of memory", partition.workerId), e));
            completed = true;
        } finally {
            if (!completed) {
                context.recordFailure(new AggregationException(
                        String.format("Worker %d exited abnormally", partition.workerId)));
            }
            barrier.countDown();
        }
    }

    private ShardTable[] scatter() {
        List<AggregateColumn> aggregateList = List.of(aggregates);
        ShardTable[] tables = new ShardTable[shardCount];
        for (int s = 0; s < shardCount; s++) {
            tables[s] = new ShardTable(partition.workerId, s, aggregateList, initialCapacity, maxCapacity);
        }
        long count = 0;
        for (long i = partition.startRow; i < partition.endRow; i++) {
            if (count % checkInterval == 0) {
                context.checkpoint();
            }
            R row;
            GroupKey key;
            try {
                row = source.getRow(i);
                key = query.groupKey(row);
            } catch (AggregationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new InputException(String.format("Could not read group key of row %d: %s", i, e), e);
            }
            if (key == null) {
                throw new InputException(String.format("Row %d has no group key", i));
            }
            ShardTable table = tables[ShardHash.shardIndexOf(key, shardCount)];
            int slot = table.getOrInit(key);
            for (int a = 0; a < aggregates.length; a++) {
                Object value;
                try {
                    value = aggregates[a].measure(row);
                } catch (RuntimeException e) {
                    throw new InputException(String.format("Could not read %s of row %d: %s", aggregates[a], i, e), e);
                }
                Object next;
                try {
                    next = aggregates[a].accumulator().accumulate(table.getState(slot, a), i, value);
                } catch (AggregationException e) {
                    throw e;
                } catch (RuntimeException e) {
                    throw new AggregateFunctionException(String.format("%s failed on row %d: %s",
                            aggregates[a], i, e), e);
                }
                table.update(slot, a, next);
            }
            count++;
        }
        context.checkpoint();
        rowsScanned[partition.workerId] = count;
        logger.debug("Worker {} scanned {} rows", partition.workerId, count);
        return tables;
    }
}
