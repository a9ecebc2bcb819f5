package edu.stanford.futuredata.shardagg.partition;

import edu.stanford.futuredata.shardagg.errors.InputException;
import edu.stanford.futuredata.shardagg.interfaces.RowSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a row source into one contiguous partition per worker.  Partitions are disjoint, in worker order, and
 * their union is exactly [0, rowCount).  Some partitions are empty when there are more workers than rows (or pages).
 */
public class PartitionAssigner {
    private static final Logger logger = LoggerFactory.getLogger(PartitionAssigner.class);

    public static List<Partition> assign(RowSource<?> source, int workerCount, PartitionStrategy strategy) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("Worker count must be positive: " + workerCount);
        }
        long rowCount;
        try {
            rowCount = source.rowCount();
        } catch (RuntimeException e) {
            throw new InputException("Row source cannot report its extent", e);
        }
        if (rowCount < 0) {
            throw new InputException("Row source cannot report its extent: " + rowCount);
        }
        long[] bounds;
        if (strategy == PartitionStrategy.BY_BYTE_SIZE) {
            bounds = byByteSize(source, rowCount, workerCount);
        } else {
            int pageSize;
            try {
                pageSize = source.pageSize();
            } catch (RuntimeException e) {
                throw new InputException("Row source cannot report its page size", e);
            }
            bounds = byRowCount(rowCount, pageSize, workerCount);
        }
        List<Partition> partitions = new ArrayList<>(workerCount);
        for (int w = 0; w < workerCount; w++) {
            partitions.add(new Partition(w, bounds[w], bounds[w + 1]));
        }
        logger.debug("Partitioned {} rows {}: {}", rowCount, strategy, partitions);
        return partitions;
    }

    // Whole pages, spread so that page counts differ by at most one.  The last page may be short.
    static long[] byRowCount(long rowCount, int pageSize, int workerCount) {
        if (pageSize <= 0) {
            throw new InputException("Row source reported a non-positive page size: " + pageSize);
        }
        long pages = rowCount / pageSize + (rowCount % pageSize == 0 ? 0 : 1);
        long base = pages / workerCount;
        long extra = pages % workerCount;
        long[] bounds = new long[workerCount + 1];
        long page = 0;
        for (int w = 0; w < workerCount; w++) {
            page += base + (w < extra ? 1 : 0);
            bounds[w + 1] = page >= pages ? rowCount : page * pageSize;
        }
        return bounds;
    }

    // Cut where the running byte total first reaches each multiple of total / workerCount.
    static long[] byByteSize(RowSource<?> source, long rowCount, int workerCount) {
        long total = 0;
        for (long i = 0; i < rowCount; i++) {
            try {
                total = Math.addExact(total, sizeOf(source, i));
            } catch (ArithmeticException e) {
                throw new InputException("Total row size does not fit in a long", e);
            }
        }
        long[] bounds = new long[workerCount + 1];
        long row = 0;
        long running = 0;
        for (int w = 1; w < workerCount; w++) {
            double target = (double) total * w / workerCount;
            while (row < rowCount && running < target) {
                running += sizeOf(source, row);
                row++;
            }
            bounds[w] = row;
        }
        bounds[workerCount] = rowCount;
        return bounds;
    }

    private static long sizeOf(RowSource<?> source, long row) {
        long bytes;
        try {
            bytes = source.rowByteSize(row);
        } catch (RuntimeException e) {
            throw new InputException("Could not size row " + row, e);
        }
        if (bytes < 0) {
            throw new InputException(String.format("Row %d reported negative size %d", row, bytes));
        }
        return bytes;
    }
}
