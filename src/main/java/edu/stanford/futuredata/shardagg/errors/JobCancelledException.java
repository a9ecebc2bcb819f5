package edu.stanford.futuredata.shardagg.errors;

/**
 * Raised inside a task when the job's cancellation token trips.  Reported to callers as the CANCELLED status,
 * not as a failure.
 */
public class JobCancelledException extends AggregationException {

    public JobCancelledException(String message) {
        super(message);
    }

    public JobCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
