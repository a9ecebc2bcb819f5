package edu.stanford.futuredata.shardagg.accumulators;

/**
 * The semantics of one aggregate function.
 *
 * States are values: every operation returns the resulting state and callers must use the returned object in place of
 * the one they passed in.  {@link #merge} must be associative and commutative so that partial states from any number
 * of workers can be combined in any order.
 *
 * @param <S> accumulator state
 * @param <O> finalized output value
 */
public interface Accumulator<S, O> {

    // Registry name, e.g. "sum".
    String name();
    // State of a group that has seen no values.
    S init();
    // Fold one value into a state.  rowIndex is the global position of the row in the row source.
    S accumulate(S state, long rowIndex, Object value);
    // Combine two partial states.
    S merge(S left, S right);
    // Throw AggregateFunctionException if a fully merged state has no valid output.  Called before results are exposed.
    default void verify(S state) {
    }
    // Output value of a state.
    O finalizeState(S state);
}
