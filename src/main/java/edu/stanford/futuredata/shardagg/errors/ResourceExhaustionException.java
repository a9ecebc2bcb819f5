package edu.stanford.futuredata.shardagg.errors;

// A shard table could not grow.
public class ResourceExhaustionException extends AggregationException {

    public ResourceExhaustionException(String message) {
        super(message);
    }

    public ResourceExhaustionException(String message, Throwable cause) {
        super(message, cause);
    }
}
