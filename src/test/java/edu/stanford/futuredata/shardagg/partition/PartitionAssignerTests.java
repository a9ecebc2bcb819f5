package edu.stanford.futuredata.shardagg.partition;

import edu.stanford.futuredata.shardagg.errors.InputException;
import edu.stanford.futuredata.shardagg.interfaces.RowSource;
import edu.stanford.futuredata.shardagg.rows.ArrayRow;
import edu.stanford.futuredata.shardagg.rows.ListRowSource;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PartitionAssignerTests {
    private static final Logger logger = LoggerFactory.getLogger(PartitionAssignerTests.class);

    private static List<ArrayRow> rows(int n) {
        List<ArrayRow> rows = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            rows.add(new ArrayRow((long) i));
        }
        return rows;
    }

    private static void assertCovers(List<Partition> partitions, long rowCount, int workerCount) {
        assertEquals(workerCount, partitions.size());
        long next = 0;
        for (int w = 0; w < workerCount; w++) {
            Partition p = partitions.get(w);
            assertEquals(w, p.workerId);
            assertEquals(next, p.startRow);
            next = p.endRow;
        }
        assertEquals(rowCount, next);
    }

    @Test
    public void testRowCountCoverage() {
        logger.info("testRowCountCoverage");
        for (int n: new int[]{0, 1, 7, 100, 1001}) {
            ListRowSource<ArrayRow> source = new ListRowSource<>(rows(n));
            for (int w = 1; w <= 16; w++) {
                List<Partition> partitions = PartitionAssigner.assign(source, w, PartitionStrategy.BY_ROW_COUNT);
                assertCovers(partitions, n, w);
                long min = partitions.stream().mapToLong(Partition::size).min().getAsLong();
                long max = partitions.stream().mapToLong(Partition::size).max().getAsLong();
                assertTrue(max - min <= 1, String.format("n=%d w=%d %s", n, w, partitions));
            }
        }
    }

    @Test
    public void testPageAlignment() {
        logger.info("testPageAlignment");
        ListRowSource<ArrayRow> source = new ListRowSource<>(rows(10), 3, r -> 1L);
        assertEquals(List.of(new Partition(0, 0, 6), new Partition(1, 6, 10)),
                PartitionAssigner.assign(source, 2, PartitionStrategy.BY_ROW_COUNT));
        assertEquals(List.of(new Partition(0, 0, 6), new Partition(1, 6, 9), new Partition(2, 9, 10)),
                PartitionAssigner.assign(source, 3, PartitionStrategy.BY_ROW_COUNT));
        List<Partition> wide = PartitionAssigner.assign(source, 8, PartitionStrategy.BY_ROW_COUNT);
        assertCovers(wide, 10, 8);
        assertEquals(4, wide.stream().filter(p -> !p.isEmpty()).count());
        for (Partition p: wide) {
            assertEquals(0, p.startRow % 3);
        }
    }

    @Test
    public void testByteSizeBalance() {
        logger.info("testByteSizeBalance");
        ListRowSource<ArrayRow> uniform = new ListRowSource<>(rows(100), 1, r -> 8L);
        List<Partition> partitions = PartitionAssigner.assign(uniform, 4, PartitionStrategy.BY_BYTE_SIZE);
        assertCovers(partitions, 100, 4);
        for (Partition p: partitions) {
            assertEquals(25, p.size());
        }
        // 90 light rows followed by 10 rows nine times as heavy.
        ListRowSource<ArrayRow> skewed = new ListRowSource<>(rows(100), 1,
                r -> r.getLong(0) < 90 ? 1L : 9L);
        assertEquals(List.of(new Partition(0, 0, 90), new Partition(1, 90, 100)),
                PartitionAssigner.assign(skewed, 2, PartitionStrategy.BY_BYTE_SIZE));
        assertCovers(PartitionAssigner.assign(skewed, 7, PartitionStrategy.BY_BYTE_SIZE), 100, 7);
    }

    @Test
    public void testMoreWorkersThanRows() {
        logger.info("testMoreWorkersThanRows");
        ListRowSource<ArrayRow> source = new ListRowSource<>(rows(3));
        for (PartitionStrategy strategy: PartitionStrategy.values()) {
            List<Partition> partitions = PartitionAssigner.assign(source, 10, strategy);
            assertCovers(partitions, 3, 10);
            assertEquals(3, partitions.stream().filter(p -> !p.isEmpty()).count());
        }
    }

    // A source with a fixed extent whose rows are never read.
    private static RowSource<ArrayRow> extent(long rowCount, int pageSize) {
        return new RowSource<>() {
            @Override
            public long rowCount() {
                return rowCount;
            }

            @Override
            public ArrayRow getRow(long index) {
                throw new UnsupportedOperationException();
            }

            @Override
            public int pageSize() {
                return pageSize;
            }
        };
    }

    @Test
    public void testLargeExtents() {
        logger.info("testLargeExtents");
        long rowCount = 3L << 32;
        List<Partition> partitions = PartitionAssigner.assign(extent(rowCount, 1), 4, PartitionStrategy.BY_ROW_COUNT);
        assertCovers(partitions, rowCount, 4);
        assertEquals(3L << 30, partitions.get(0).size());
        List<Partition> paged = PartitionAssigner.assign(extent(Long.MAX_VALUE, 1000), 3,
                PartitionStrategy.BY_ROW_COUNT);
        assertCovers(paged, Long.MAX_VALUE, 3);
        for (Partition p: paged) {
            assertEquals(0, p.startRow % 1000);
        }
    }

    @Test
    public void testPageSizeErrors() {
        logger.info("testPageSizeErrors");
        RowSource<ArrayRow> broken = new RowSource<>() {
            @Override
            public long rowCount() {
                return 10;
            }

            @Override
            public ArrayRow getRow(long index) {
                return new ArrayRow(index);
            }

            @Override
            public int pageSize() {
                throw new UnsupportedOperationException("no pages");
            }
        };
        InputException e = assertThrows(InputException.class,
                () -> PartitionAssigner.assign(broken, 2, PartitionStrategy.BY_ROW_COUNT));
        assertTrue(e.getCause() instanceof UnsupportedOperationException);
        // Byte-size partitioning does not look at pages.
        assertCovers(PartitionAssigner.assign(broken, 2, PartitionStrategy.BY_BYTE_SIZE), 10, 2);
        assertThrows(InputException.class,
                () -> PartitionAssigner.assign(extent(10, 0), 2, PartitionStrategy.BY_ROW_COUNT));
    }

    @Test
    public void testInvalidArguments() {
        logger.info("testInvalidArguments");
        ListRowSource<ArrayRow> source = new ListRowSource<>(rows(3));
        assertThrows(IllegalArgumentException.class,
                () -> PartitionAssigner.assign(source, 0, PartitionStrategy.BY_ROW_COUNT));
        assertThrows(IllegalArgumentException.class,
                () -> PartitionAssigner.assign(source, -2, PartitionStrategy.BY_BYTE_SIZE));
        RowSource<ArrayRow> unknown = new RowSource<>() {
            @Override
            public long rowCount() {
                return -1;
            }

            @Override
            public ArrayRow getRow(long index) {
                throw new UnsupportedOperationException();
            }
        };
        assertThrows(InputException.class,
                () -> PartitionAssigner.assign(unknown, 2, PartitionStrategy.BY_ROW_COUNT));
        ListRowSource<ArrayRow> negative = new ListRowSource<>(rows(3), 1, r -> -1L);
        assertThrows(InputException.class,
                () -> PartitionAssigner.assign(negative, 2, PartitionStrategy.BY_BYTE_SIZE));
    }
}
