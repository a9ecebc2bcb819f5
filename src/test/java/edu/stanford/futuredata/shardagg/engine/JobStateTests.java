package edu.stanford.futuredata.shardagg.engine;

import edu.stanford.futuredata.shardagg.config.CancellationToken;
import edu.stanford.futuredata.shardagg.errors.AggregateFunctionException;
import edu.stanford.futuredata.shardagg.errors.InputException;
import edu.stanford.futuredata.shardagg.errors.JobCancelledException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JobStateTests {

    @Test
    public void testForwardTransitions() {
        assertTrue(JobState.SCATTER.canTransitionTo(JobState.BARRIER));
        assertTrue(JobState.BARRIER.canTransitionTo(JobState.MERGE));
        assertTrue(JobState.MERGE.canTransitionTo(JobState.DONE));
        assertFalse(JobState.SCATTER.canTransitionTo(JobState.MERGE));
        assertFalse(JobState.SCATTER.canTransitionTo(JobState.DONE));
        assertFalse(JobState.MERGE.canTransitionTo(JobState.BARRIER));
        assertFalse(JobState.BARRIER.canTransitionTo(JobState.SCATTER));
    }

    @Test
    public void testTerminalStates() {
        for (JobState s: new JobState[]{JobState.SCATTER, JobState.BARRIER, JobState.MERGE}) {
            assertFalse(s.isTerminal());
            assertTrue(s.canTransitionTo(JobState.FAILED));
            assertTrue(s.canTransitionTo(JobState.CANCELLED));
        }
        for (JobState s: new JobState[]{JobState.DONE, JobState.FAILED, JobState.CANCELLED}) {
            assertTrue(s.isTerminal());
            for (JobState next: JobState.values()) {
                assertFalse(s.canTransitionTo(next), s + " -> " + next);
            }
        }
    }

    @Test
    public void testFirstFailureWins() {
        CancellationToken token = new CancellationToken();
        TaskContext context = new TaskContext(1, token);
        context.checkpoint();
        assertFalse(context.getFirstError().isPresent());
        InputException first = new InputException("bad row");
        context.recordFailure(first);
        context.recordFailure(new AggregateFunctionException("later"));
        assertSame(first, context.getFirstError().get());
        assertThrows(JobCancelledException.class, context::checkpoint);
        assertFalse(context.isCancelled());
    }

    @Test
    public void testCancelledTokenStopsTasks() {
        CancellationToken token = new CancellationToken();
        TaskContext context = new TaskContext(2, token);
        token.cancel();
        assertTrue(context.isCancelled());
        assertThrows(JobCancelledException.class, context::checkpoint);
        assertFalse(context.getFirstError().isPresent());
    }
}
