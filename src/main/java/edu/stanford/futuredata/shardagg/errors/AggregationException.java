package edu.stanford.futuredata.shardagg.errors;

/**
 * Base of every error that aborts an aggregation job.
 */
public class AggregationException extends RuntimeException {

    public AggregationException(String message) {
        super(message);
    }

    public AggregationException(String message, Throwable cause) {
        super(message, cause);
    }
}
