package edu.stanford.futuredata.shardagg.partition;

public enum PartitionStrategy {
    // Equal numbers of rows (whole pages) per worker.
    BY_ROW_COUNT,
    // Equal estimated bytes per worker, for rows whose cost varies.
    BY_BYTE_SIZE
}
