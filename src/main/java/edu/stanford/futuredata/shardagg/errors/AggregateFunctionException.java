package edu.stanford.futuredata.shardagg.errors;

// Invalid input to accumulate or merge: overflow, type mismatch.
public class AggregateFunctionException extends AggregationException {

    public AggregateFunctionException(String message) {
        super(message);
    }

    public AggregateFunctionException(String message, Throwable cause) {
        super(message, cause);
    }
}
