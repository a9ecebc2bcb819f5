package edu.stanford.futuredata.shardagg.engine;

import edu.stanford.futuredata.shardagg.accumulators.AggregateColumn;
import edu.stanford.futuredata.shardagg.config.JobConfig;
import edu.stanford.futuredata.shardagg.errors.AggregationException;
import edu.stanford.futuredata.shardagg.errors.JobCancelledException;
import edu.stanford.futuredata.shardagg.interfaces.GroupByQuery;
import edu.stanford.futuredata.shardagg.interfaces.Row;
import edu.stanford.futuredata.shardagg.interfaces.RowSource;
import edu.stanford.futuredata.shardagg.partition.Partition;
import edu.stanford.futuredata.shardagg.partition.PartitionAssigner;
import edu.stanford.futuredata.shardagg.shard.ShardTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One run of a GROUP BY aggregation over a row source.
 *
 * The calling thread coordinates: it partitions the input, submits one scatter task per worker, blocks at the barrier
 * until every worker has sealed its shard tables, submits one merge task per shard index, blocks until they finish,
 * and only then exposes the result.  The barrier is the only point where tables change hands.
 */
public class AggregationJob<R extends Row> {
    private static final Logger logger = LoggerFactory.getLogger(AggregationJob.class);

    private final long jobID;
    private final GroupByQuery<R> query;
    private final RowSource<R> source;
    private final JobConfig config;
    private final ExecutorService pool;
    private final TaskContext context;
    private final JobStatistics statistics;
    private final AtomicReference<JobState> state = new AtomicReference<>(JobState.SCATTER);

    AggregationJob(long jobID, GroupByQuery<R> query, RowSource<R> source, JobConfig config, ExecutorService pool) {
        this.jobID = jobID;
        this.query = query;
        this.source = source;
        this.config = config;
        this.pool = pool;
        this.context = new TaskContext(jobID, config.getCancellationToken());
        this.statistics = new JobStatistics(jobID, config.getWorkerCount(), config.getShardCount());
    }

    // Run the job to a terminal state on the calling thread.
    JobOutcome run() {
        int workerCount = config.getWorkerCount();
        int shardCount = config.getShardCount();
        List<AggregateColumn> aggregates = query.aggregates();
        logger.info("Job {} starting: {} aggregates {}", jobID, config, aggregates);

        /*
         * SCATTER
         */
        long scatterStart = System.nanoTime();
        List<Partition> partitions;
        try {
            partitions = PartitionAssigner.assign(source, workerCount, config.getPartitionStrategy());
        } catch (AggregationException e) {
            context.recordFailure(e);
            return finish();
        }
        ShardTable[][] scatterTables = new ShardTable[workerCount][shardCount];
        CountDownLatch barrier = new CountDownLatch(workerCount);
        for (Partition p: partitions) {
            ScatterWorker<R> worker = new ScatterWorker<>(p, source, query, aggregates, shardCount,
                    config.getCancellationCheckInterval(), config.getInitialShardCapacity(),
                    config.getMaxShardTableCapacity(), context, scatterTables[p.workerId], statistics.rowsPerWorker,
                    barrier);
            submit(worker, barrier, "scatter worker " + p.workerId);
        }

        if (!await(barrier)) {
            return finish();
        }

        /*
         * BARRIER
         */
        transition(JobState.BARRIER);
        statistics.scatterMicros = (System.nanoTime() - scatterStart) / 1000L;
        if (context.getFirstError().isPresent() || context.isCancelled()) {
            return finish();
        }
        logger.debug("Job {} scatter finished: {} rows in {}μs", jobID, statistics.getRowsScanned(),
                statistics.scatterMicros);

        /*
         * MERGE
         */
        transition(JobState.MERGE);
        long mergeStart = System.nanoTime();
        ShardTable[] merged = new ShardTable[shardCount];
        CountDownLatch mergeDone = new CountDownLatch(shardCount);
        for (int s = 0; s < shardCount; s++) {
            ShardMergeTask task = new ShardMergeTask(s, scatterTables, aggregates,
                    config.getCancellationCheckInterval(), config.getInitialShardCapacity(),
                    config.getMaxShardTableCapacity(), context, merged, mergeDone);
            submit(task, mergeDone, "merge task " + s);
        }
        if (!await(mergeDone)) {
            return finish();
        }
        statistics.mergeMicros = (System.nanoTime() - mergeStart) / 1000L;
        if (context.getFirstError().isPresent() || context.isCancelled()) {
            return finish();
        }
        for (int s = 0; s < shardCount; s++) {
            statistics.groupsPerShard[s] = merged[s].size();
        }
        transition(JobState.DONE);
        logger.info("Job {} done. {}", jobID, statistics);
        return JobOutcome.done(new GroupedResult(merged, aggregates), statistics);
    }

    private void submit(Runnable task, CountDownLatch latch, String name) {
        try {
            pool.execute(task);
        } catch (RejectedExecutionException e) {
            context.recordFailure(new AggregationException(String.format("Job %d could not start %s", jobID, name), e));
            latch.countDown();
        }
    }

    private boolean await(CountDownLatch latch) {
        try {
            latch.await();
            return true;
        } catch (InterruptedException e) {
            logger.warn("Job {} interrupted in {}", jobID, state.get());
            context.recordFailure(new JobCancelledException(String.format("Job %d interrupted", jobID), e));
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // Terminal transition for a job that will not produce a result.
    private JobOutcome finish() {
        Optional<AggregationException> error = context.getFirstError();
        if (error.isEmpty() || error.get() instanceof JobCancelledException) {
            AggregationException e = error.orElseGet(() ->
                    new JobCancelledException(String.format("Job %d cancelled", jobID)));
            transition(JobState.CANCELLED);
            logger.warn("Job {} cancelled: {}", jobID, e.getMessage());
            return JobOutcome.cancelled(e, statistics);
        }
        transition(JobState.FAILED);
        logger.warn("Job {} failed: {}", jobID, error.get().toString());
        return JobOutcome.failed(error.get(), statistics);
    }

    private void transition(JobState next) {
        JobState current = state.get();
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException(String.format("Job %d cannot move from %s to %s", jobID, current, next));
        }
        state.set(next);
        logger.debug("Job {} {} -> {}", jobID, current, next);
    }
}
