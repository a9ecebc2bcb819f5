package edu.stanford.futuredata.shardagg.errors;

// Malformed row, inaccessible column, or a row source that cannot report its extent.
public class InputException extends AggregationException {

    public InputException(String message) {
        super(message);
    }

    public InputException(String message, Throwable cause) {
        super(message, cause);
    }
}
