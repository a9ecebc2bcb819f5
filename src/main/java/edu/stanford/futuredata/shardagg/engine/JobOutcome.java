package edu.stanford.futuredata.shardagg.engine;

import edu.stanford.futuredata.shardagg.errors.AggregationException;

import java.util.Optional;

/**
 * Terminal status of a job.  A result is present only for DONE; an error only for FAILED or CANCELLED.
 */
public class JobOutcome {
    private final JobState state;
    private final GroupedResult result;
    private final AggregationException error;
    private final JobStatistics statistics;

    private JobOutcome(JobState state, GroupedResult result, AggregationException error, JobStatistics statistics) {
        this.state = state;
        this.result = result;
        this.error = error;
        this.statistics = statistics;
    }

    static JobOutcome done(GroupedResult result, JobStatistics statistics) {
        return new JobOutcome(JobState.DONE, result, null, statistics);
    }

    static JobOutcome failed(AggregationException error, JobStatistics statistics) {
        return new JobOutcome(JobState.FAILED, null, error, statistics);
    }

    static JobOutcome cancelled(AggregationException error, JobStatistics statistics) {
        return new JobOutcome(JobState.CANCELLED, null, error, statistics);
    }

    public JobState getState() {
        return state;
    }

    public Optional<GroupedResult> getResult() {
        return Optional.ofNullable(result);
    }

    public Optional<AggregationException> getError() {
        return Optional.ofNullable(error);
    }

    public JobStatistics getStatistics() {
        return statistics;
    }

    public GroupedResult resultOrThrow() {
        if (result == null) {
            throw error;
        }
        return result;
    }
}
