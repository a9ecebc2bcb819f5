package edu.stanford.futuredata.shardagg.config;

import edu.stanford.futuredata.shardagg.partition.PartitionStrategy;
import edu.stanford.futuredata.shardagg.shard.ShardTable;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class JobConfigTests {
    private static final Logger logger = LoggerFactory.getLogger(JobConfigTests.class);

    @Test
    public void testDefaults() {
        logger.info("testDefaults");
        JobConfig c = JobConfig.builder().build();
        assertEquals(Runtime.getRuntime().availableProcessors(), c.getWorkerCount());
        assertEquals(JobConfig.DEFAULT_SHARD_COUNT, c.getShardCount());
        assertEquals(PartitionStrategy.BY_ROW_COUNT, c.getPartitionStrategy());
        assertFalse(c.getCancellationToken().isCancelled());
        assertEquals(ShardTable.MAXIMUM_CAPACITY, c.getMaxShardTableCapacity());
    }

    @Test
    public void testBuilderValidation() {
        logger.info("testBuilderValidation");
        assertThrows(IllegalArgumentException.class, () -> JobConfig.builder().workerCount(0).build());
        assertThrows(IllegalArgumentException.class, () -> JobConfig.builder().shardCount(0).build());
        assertThrows(IllegalArgumentException.class, () -> JobConfig.builder().shardCount(12).build());
        assertThrows(IllegalArgumentException.class, () -> JobConfig.builder().partitionStrategy(null).build());
        assertThrows(IllegalArgumentException.class, () -> JobConfig.builder().cancellationToken(null).build());
        assertThrows(IllegalArgumentException.class,
                () -> JobConfig.builder().cancellationCheckInterval(0).build());
        assertThrows(IllegalArgumentException.class, () -> JobConfig.builder().maxShardTableCapacity(-1).build());
        assertEquals(1, JobConfig.builder().shardCount(1).build().getShardCount());
    }

    @Test
    public void testToBuilder() {
        logger.info("testToBuilder");
        JobConfig c = JobConfig.builder().workerCount(3).shardCount(8).build();
        CancellationToken token = new CancellationToken();
        JobConfig copy = c.toBuilder().cancellationToken(token).build();
        assertEquals(3, copy.getWorkerCount());
        assertEquals(8, copy.getShardCount());
        assertSame(token, copy.getCancellationToken());
        assertNotSame(c.getCancellationToken(), copy.getCancellationToken());
        assertTrue(token.cancel());
        assertFalse(token.cancel());
        assertTrue(copy.getCancellationToken().isCancelled());
        assertFalse(c.getCancellationToken().isCancelled());
    }

    @Test
    public void testFromProperties() {
        logger.info("testFromProperties");
        Properties p = new Properties();
        p.setProperty("shardagg.workerCount", "5");
        p.setProperty("shardagg.shardCount", " 32 ");
        p.setProperty("shardagg.partitionStrategy", "by_byte_size");
        p.setProperty("shardagg.cancellationCheckInterval", "7");
        p.setProperty("shardagg.maxShardTableCapacity", "4096");
        JobConfig c = JobConfig.fromProperties(p);
        assertEquals(5, c.getWorkerCount());
        assertEquals(32, c.getShardCount());
        assertEquals(PartitionStrategy.BY_BYTE_SIZE, c.getPartitionStrategy());
        assertEquals(7, c.getCancellationCheckInterval());
        assertEquals(JobConfig.DEFAULT_INITIAL_SHARD_CAPACITY, c.getInitialShardCapacity());
        assertEquals(4096, c.getMaxShardTableCapacity());

        Properties bad = new Properties();
        bad.setProperty("shardagg.shardCount", "many");
        assertThrows(IllegalArgumentException.class, () -> JobConfig.fromProperties(bad));
        bad.setProperty("shardagg.shardCount", "16");
        bad.setProperty("shardagg.partitionStrategy", "round_robin");
        assertThrows(IllegalArgumentException.class, () -> JobConfig.fromProperties(bad));
    }

    @Test
    public void testLoadFromClasspath() {
        logger.info("testLoadFromClasspath");
        JobConfig c = JobConfig.load();
        assertEquals(64, c.getShardCount());
        assertEquals(PartitionStrategy.BY_ROW_COUNT, c.getPartitionStrategy());
        assertEquals(1024, c.getCancellationCheckInterval());
    }
}
