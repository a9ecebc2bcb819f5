package edu.stanford.futuredata.shardagg.shard;

import edu.stanford.futuredata.shardagg.accumulators.AccumulatorRegistry;
import edu.stanford.futuredata.shardagg.accumulators.AggregateColumn;
import edu.stanford.futuredata.shardagg.errors.ResourceExhaustionException;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ShardTableTests {
    private static final Logger logger = LoggerFactory.getLogger(ShardTableTests.class);

    private static final AccumulatorRegistry registry = new AccumulatorRegistry();
    private static final List<AggregateColumn> COUNT_AND_MAX = List.of(registry.column("count", 0),
            registry.column("max", 0));

    private static void add(ShardTable t, GroupKey key, long rowIndex, Object value) {
        int slot = t.getOrInit(key);
        for (int a = 0; a < COUNT_AND_MAX.size(); a++) {
            t.update(slot, a, COUNT_AND_MAX.get(a).accumulator().accumulate(t.getState(slot, a), rowIndex, value));
        }
    }

    @Test
    public void testGrowthKeepsEntries() {
        logger.info("testGrowthKeepsEntries");
        ShardTable t = new ShardTable(0, 0, COUNT_AND_MAX, 2, ShardTable.MAXIMUM_CAPACITY);
        assertEquals(2, t.capacity());
        Map<GroupKey, Long> expected = new HashMap<>();
        for (long i = 0; i < 10000; i++) {
            GroupKey k = GroupKey.of("k" + (i % 3001));
            add(t, k, i, i);
            expected.merge(k, 1L, Long::sum);
        }
        assertEquals(3001, t.size());
        assertTrue(t.size() <= t.capacity() * ShardTable.LOAD_FACTOR);
        assertEquals(1, Integer.bitCount(t.capacity()));
        for (Map.Entry<GroupKey, Long> e: expected.entrySet()) {
            Object[] states = t.get(e.getKey());
            assertNotNull(states);
            assertEquals(e.getValue(), states[0]);
        }
        int[] visited = new int[1];
        t.forEach((k, s) -> visited[0]++);
        assertEquals(3001, visited[0]);
        assertNull(t.get(GroupKey.of("missing")));
    }

    @Test
    public void testSealedTableRejectsWrites() {
        logger.info("testSealedTableRejectsWrites");
        ShardTable t = new ShardTable(3, 1, COUNT_AND_MAX);
        add(t, GroupKey.of("a"), 0, 1L);
        t.seal();
        assertTrue(t.isSealed());
        assertThrows(IllegalStateException.class, () -> t.getOrInit(GroupKey.of("a")));
        assertThrows(IllegalStateException.class, () -> t.update(0, 0, 1L));
        assertEquals(1, t.size());
        assertEquals(3, t.getWorkerId());
        assertEquals(1, t.getShardIndex());
    }

    @Test
    public void testCapacityLimit() {
        logger.info("testCapacityLimit");
        ShardTable t = new ShardTable(0, 0, COUNT_AND_MAX, 4, 8);
        for (int i = 0; i < 6; i++) {
            add(t, GroupKey.of(i), i, (long) i);
        }
        assertEquals(8, t.capacity());
        assertThrows(ResourceExhaustionException.class, () -> add(t, GroupKey.of(6), 6, 6L));
        assertThrows(ResourceExhaustionException.class, () -> new ShardTable(0, 0, COUNT_AND_MAX, 16, 8));
    }

    @Test
    public void testMergeEntries() {
        logger.info("testMergeEntries");
        ShardTable w0 = new ShardTable(0, 2, COUNT_AND_MAX);
        ShardTable w1 = new ShardTable(1, 2, COUNT_AND_MAX);
        add(w0, GroupKey.of("x"), 0, 5L);
        add(w0, GroupKey.of("y"), 1, 7L);
        add(w1, GroupKey.of("x"), 2, 9L);
        add(w1, GroupKey.of("z"), 3, 1L);
        w0.seal();
        w1.seal();
        ShardTable out = new ShardTable(ShardTable.MERGED, 2, COUNT_AND_MAX);
        for (ShardTable in: List.of(w0, w1)) {
            for (int slot = 0; slot < in.capacity(); slot++) {
                if (in.keyAt(slot) != null) {
                    out.mergeEntry(in, slot);
                }
            }
        }
        assertEquals(3, out.size());
        Object[] x = out.get(GroupKey.of("x"));
        assertEquals(2L, x[0]);
        assertEquals(9L, COUNT_AND_MAX.get(1).accumulator().finalizeState(x[1]));
        assertEquals(1L, out.get(GroupKey.of("z"))[0]);
        // Inputs are untouched.
        assertEquals(1L, w0.get(GroupKey.of("x"))[0]);
    }
}
