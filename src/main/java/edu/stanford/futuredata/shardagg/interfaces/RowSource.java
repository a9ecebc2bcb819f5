package edu.stanford.futuredata.shardagg.interfaces;

public interface RowSource<R extends Row> {
    /*
     Random-access input to an aggregation job, supplied by the storage or execution layer.

     Concurrency contract:
     getRow may be called concurrently from several workers, each on a disjoint index range.
     The source must not change while a job reads it.
     */

    // Number of rows.  A negative value means the extent is unknown and the source cannot be partitioned.
    long rowCount();
    // Return the row at a global index in [0, rowCount()).
    R getRow(long index);
    // Estimated cost of a row in bytes, used by the by-byte-size partition strategy.
    default long rowByteSize(long index) {
        return 1L;
    }
    // Rows are stored in pages of this many rows.  Partitions by row count are cut on page boundaries.
    default int pageSize() {
        return 1;
    }
}
