package edu.stanford.futuredata.shardagg.config;

import edu.stanford.futuredata.shardagg.partition.PartitionStrategy;
import edu.stanford.futuredata.shardagg.shard.ShardTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * Settings of one aggregation job.  Immutable; build with {@link #builder()} or read from properties.
 */
public class JobConfig {
    private static final Logger logger = LoggerFactory.getLogger(JobConfig.class);

    public static final String RESOURCE_NAME = "shardagg.properties";
    public static final String PREFIX = "shardagg.";

    public static final int DEFAULT_SHARD_COUNT = 64;
    public static final int DEFAULT_CANCELLATION_CHECK_INTERVAL = 1024;
    public static final int DEFAULT_INITIAL_SHARD_CAPACITY = 16;

    private final int workerCount;
    private final int shardCount;
    private final PartitionStrategy partitionStrategy;
    private final CancellationToken cancellationToken;
    private final int cancellationCheckInterval;
    private final int initialShardCapacity;
    private final int maxShardTableCapacity;

    private JobConfig(Builder b) {
        this.workerCount = b.workerCount;
        this.shardCount = b.shardCount;
        this.partitionStrategy = b.partitionStrategy;
        this.cancellationToken = b.cancellationToken;
        this.cancellationCheckInterval = b.cancellationCheckInterval;
        this.initialShardCapacity = b.initialShardCapacity;
        this.maxShardTableCapacity = b.maxShardTableCapacity;
    }

    public static Builder builder() {
        return new Builder();
    }

    // A builder preset with this config's values, e.g. to attach a fresh cancellation token.
    public Builder toBuilder() {
        return new Builder()
                .workerCount(workerCount)
                .shardCount(shardCount)
                .partitionStrategy(partitionStrategy)
                .cancellationToken(cancellationToken)
                .cancellationCheckInterval(cancellationCheckInterval)
                .initialShardCapacity(initialShardCapacity)
                .maxShardTableCapacity(maxShardTableCapacity);
    }

    public static JobConfig fromProperties(Properties properties) {
        Builder b = builder();
        String v;
        if ((v = properties.getProperty(PREFIX + "workerCount")) != null) {
            b.workerCount(parseInt("workerCount", v));
        }
        if ((v = properties.getProperty(PREFIX + "shardCount")) != null) {
            b.shardCount(parseInt("shardCount", v));
        }
        if ((v = properties.getProperty(PREFIX + "partitionStrategy")) != null) {
            try {
                b.partitionStrategy(PartitionStrategy.valueOf(v.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown partition strategy " + v, e);
            }
        }
        if ((v = properties.getProperty(PREFIX + "cancellationCheckInterval")) != null) {
            b.cancellationCheckInterval(parseInt("cancellationCheckInterval", v));
        }
        if ((v = properties.getProperty(PREFIX + "initialShardCapacity")) != null) {
            b.initialShardCapacity(parseInt("initialShardCapacity", v));
        }
        if ((v = properties.getProperty(PREFIX + "maxShardTableCapacity")) != null) {
            b.maxShardTableCapacity(parseInt("maxShardTableCapacity", v));
        }
        return b.build();
    }

    // Read shardagg.properties from the classpath.  Defaults apply when it is absent.
    public static JobConfig load() {
        Properties properties = new Properties();
        try (InputStream in = JobConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                logger.info("No {} on the classpath, using defaults", RESOURCE_NAME);
            } else {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Could not read " + RESOURCE_NAME, e);
        }
        return fromProperties(properties);
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("%s%s is not an integer: %s", PREFIX, key, value), e);
        }
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public int getShardCount() {
        return shardCount;
    }

    public PartitionStrategy getPartitionStrategy() {
        return partitionStrategy;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public int getCancellationCheckInterval() {
        return cancellationCheckInterval;
    }

    public int getInitialShardCapacity() {
        return initialShardCapacity;
    }

    public int getMaxShardTableCapacity() {
        return maxShardTableCapacity;
    }

    @Override
    public String toString() {
        return String.format("JobConfig{workers=%d, shards=%d, strategy=%s, checkInterval=%d, initialCapacity=%d, " +
                        "maxCapacity=%d}", workerCount, shardCount, partitionStrategy, cancellationCheckInterval,
                initialShardCapacity, maxShardTableCapacity);
    }

    public static class Builder {
        private int workerCount = Runtime.getRuntime().availableProcessors();
        private int shardCount = DEFAULT_SHARD_COUNT;
        private PartitionStrategy partitionStrategy = PartitionStrategy.BY_ROW_COUNT;
        private CancellationToken cancellationToken = new CancellationToken();
        private int cancellationCheckInterval = DEFAULT_CANCELLATION_CHECK_INTERVAL;
        private int initialShardCapacity = DEFAULT_INITIAL_SHARD_CAPACITY;
        private int maxShardTableCapacity = ShardTable.MAXIMUM_CAPACITY;

        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        public Builder shardCount(int shardCount) {
            this.shardCount = shardCount;
            return this;
        }

        public Builder partitionStrategy(PartitionStrategy partitionStrategy) {
            this.partitionStrategy = partitionStrategy;
            return this;
        }

        public Builder cancellationToken(CancellationToken cancellationToken) {
            this.cancellationToken = cancellationToken;
            return this;
        }

        public Builder cancellationCheckInterval(int cancellationCheckInterval) {
            this.cancellationCheckInterval = cancellationCheckInterval;
            return this;
        }

        public Builder initialShardCapacity(int initialShardCapacity) {
            this.initialShardCapacity = initialShardCapacity;
            return this;
        }

        public Builder maxShardTableCapacity(int maxShardTableCapacity) {
            this.maxShardTableCapacity = maxShardTableCapacity;
            return this;
        }

        public JobConfig build() {
            if (workerCount <= 0) {
                throw new IllegalArgumentException("Worker count must be positive: " + workerCount);
            }
            if (shardCount <= 0 || Integer.bitCount(shardCount) != 1) {
                throw new IllegalArgumentException("Shard count must be a power of two: " + shardCount);
            }
            if (partitionStrategy == null || cancellationToken == null) {
                throw new IllegalArgumentException("Partition strategy and cancellation token are required");
            }
            if (cancellationCheckInterval <= 0) {
                throw new IllegalArgumentException("Cancellation check interval must be positive: "
                        + cancellationCheckInterval);
            }
            if (initialShardCapacity <= 0 || maxShardTableCapacity <= 0) {
                throw new IllegalArgumentException("Shard table capacities must be positive");
            }
            return new JobConfig(this);
        }
    }
}
