package edu.stanford.futuredata.shardagg.engine;

/**
 * Phases of an aggregation job.  A job moves forward only:
 * SCATTER -> BARRIER -> MERGE -> DONE, or from any non-terminal phase to FAILED or CANCELLED.
 */
public enum JobState {
    SCATTER,
    BARRIER,
    MERGE,
    DONE,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(JobState next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED || next == CANCELLED) {
            return true;
        }
        return next.ordinal() == ordinal() + 1;
    }
}
