package edu.stanford.futuredata.shardagg.partition;

/**
 * A contiguous range [startRow, endRow) of the row source assigned to one worker.
 */
public final class Partition {
    public final int workerId;
    public final long startRow;
    public final long endRow;

    public Partition(int workerId, long startRow, long endRow) {
        if (startRow < 0 || endRow < startRow) {
            throw new IllegalArgumentException(String.format("Invalid partition [%d, %d)", startRow, endRow));
        }
        this.workerId = workerId;
        this.startRow = startRow;
        this.endRow = endRow;
    }

    public long size() {
        return endRow - startRow;
    }

    public boolean isEmpty() {
        return endRow == startRow;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Partition)) {
            return false;
        }
        Partition p = (Partition) o;
        return workerId == p.workerId && startRow == p.startRow && endRow == p.endRow;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(startRow) * 31 + Long.hashCode(endRow) * 17 + workerId;
    }

    @Override
    public String toString() {
        return String.format("W%d[%d, %d)", workerId, startRow, endRow);
    }
}
