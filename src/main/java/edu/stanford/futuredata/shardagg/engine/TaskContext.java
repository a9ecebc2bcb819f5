package edu.stanford.futuredata.shardagg.engine;

import edu.stanford.futuredata.shardagg.config.CancellationToken;
import edu.stanford.futuredata.shardagg.errors.AggregationException;
import edu.stanford.futuredata.shardagg.errors.JobCancelledException;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * State shared by the tasks of one job: the caller's cancellation token, the first error, and the abort flag that
 * stops the remaining tasks once any of them failed.
 */
class TaskContext {
    private final long jobID;
    private final CancellationToken token;
    private final AtomicReference<AggregationException> firstError = new AtomicReference<>();
    private final AtomicBoolean aborted = new AtomicBoolean(false);

    TaskContext(long jobID, CancellationToken token) {
        this.jobID = jobID;
        this.token = token;
    }

    // Called by tasks every few rows or entries.
    void checkpoint() {
        if (token.isCancelled()) {
            throw new JobCancelledException(String.format("Job %d cancelled", jobID));
        }
        if (aborted.get()) {
            throw new JobCancelledException(String.format("Job %d aborted after a task failure", jobID));
        }
    }

    // Keep the first error only; later ones are usually caused by the abort itself.
    void recordFailure(AggregationException e) {
        firstError.compareAndSet(null, e);
        aborted.set(true);
    }

    boolean isCancelled() {
        return token.isCancelled();
    }

    Optional<AggregationException> getFirstError() {
        return Optional.ofNullable(firstError.get());
    }
}
