package edu.stanford.futuredata.shardagg.engine;

import edu.stanford.futuredata.shardagg.config.JobConfig;
import edu.stanford.futuredata.shardagg.interfaces.GroupByQuery;
import edu.stanford.futuredata.shardagg.interfaces.Row;
import edu.stanford.futuredata.shardagg.interfaces.RowSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point.  Owns the fixed pool that runs the scatter and merge tasks of every job.
 */
public class AggregationEngine {
    private static final Logger logger = LoggerFactory.getLogger(AggregationEngine.class);

    public static int shutdownTimeoutSeconds = 10;

    private final ExecutorService taskPool;
    private final int parallelism;

    public final Collection<Long> scatterTimes = new ConcurrentLinkedQueue<>();
    public final Collection<Long> mergeTimes = new ConcurrentLinkedQueue<>();

    private final AtomicLong jobIDs = new AtomicLong(0);

    /*
     * CONSTRUCTOR/TEARDOWN
     */

    public AggregationEngine() {
        this(Runtime.getRuntime().availableProcessors());
    }

    public AggregationEngine(int parallelism) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("Parallelism must be positive: " + parallelism);
        }
        this.parallelism = parallelism;
        this.taskPool = Executors.newFixedThreadPool(parallelism, namedDaemonThreads("shardagg-task-%d"));
    }

    public void shutdown() {
        taskPool.shutdown();
        try {
            if (!taskPool.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
                logger.warn("Task pool did not stop within {}s", shutdownTimeoutSeconds);
                taskPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            taskPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        int numJobs = scatterTimes.size();
        if (numJobs > 0) {
            long p50Scatter = scatterTimes.stream().mapToLong(i -> i).sorted().toArray()[numJobs / 2];
            long p99Scatter = scatterTimes.stream().mapToLong(i -> i).sorted().toArray()[numJobs * 99 / 100];
            long p50Merge = mergeTimes.stream().mapToLong(i -> i).sorted().toArray()[numJobs / 2];
            long p99Merge = mergeTimes.stream().mapToLong(i -> i).sorted().toArray()[numJobs * 99 / 100];
            logger.info("Jobs: {} p50 Scatter: {}μs p99 Scatter: {}μs  p50 Merge: {}μs p99 Merge: {}μs",
                    numJobs, p50Scatter, p99Scatter, p50Merge, p99Merge);
        }
    }

    /*
     * PUBLIC FUNCTIONS
     */

    // Run a GROUP BY aggregation to completion.  Job failures and cancellation are reported in the outcome.
    public <R extends Row> JobOutcome aggregate(GroupByQuery<R> query, RowSource<R> source, JobConfig config) {
        if (taskPool.isShutdown()) {
            throw new IllegalStateException("Engine is shut down");
        }
        AggregationJob<R> job = new AggregationJob<>(jobIDs.getAndIncrement(), query, source, config, taskPool);
        JobOutcome outcome = job.run();
        if (outcome.getState() == JobState.DONE) {
            scatterTimes.add(outcome.getStatistics().getScatterMicros());
            mergeTimes.add(outcome.getStatistics().getMergeMicros());
        }
        return outcome;
    }

    public int getParallelism() {
        return parallelism;
    }

    private static ThreadFactory namedDaemonThreads(String nameFormat) {
        ThreadFactory backing = Executors.defaultThreadFactory();
        AtomicLong count = new AtomicLong(0L);
        return runnable -> {
            Thread thread = backing.newThread(runnable);
            thread.setName(String.format(nameFormat, count.getAndIncrement()));
            thread.setDaemon(true);
            return thread;
        };
    }
}
