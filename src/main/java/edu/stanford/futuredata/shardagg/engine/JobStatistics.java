package edu.stanford.futuredata.shardagg.engine;

import java.util.Arrays;

public class JobStatistics {
    public final long jobID;
    public final long[] rowsPerWorker;
    public final int[] groupsPerShard;
    volatile long scatterMicros;
    volatile long mergeMicros;

    JobStatistics(long jobID, int workerCount, int shardCount) {
        this.jobID = jobID;
        this.rowsPerWorker = new long[workerCount];
        this.groupsPerShard = new int[shardCount];
    }

    public long getRowsScanned() {
        return Arrays.stream(rowsPerWorker).sum();
    }

    public long getGroups() {
        return Arrays.stream(groupsPerShard).asLongStream().sum();
    }

    public long getScatterMicros() {
        return scatterMicros;
    }

    public long getMergeMicros() {
        return mergeMicros;
    }

    @Override
    public String toString() {
        return String.format("Job %d: %d rows, %d groups, scatter %dμs, merge %dμs", jobID, getRowsScanned(),
                getGroups(), scatterMicros, mergeMicros);
    }
}
