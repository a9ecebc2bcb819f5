package edu.stanford.futuredata.shardagg.accumulators;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named aggregate functions.  Preloaded with sum, count, min, max, avg, first and last.
 */
public class AccumulatorRegistry {
    private static final Logger logger = LoggerFactory.getLogger(AccumulatorRegistry.class);

    private final Map<String, Accumulator<?, ?>> accumulators = new ConcurrentHashMap<>();

    public AccumulatorRegistry() {
        register(new SumAccumulator());
        register(new CountAccumulator());
        register(new MinAccumulator());
        register(new MaxAccumulator());
        register(new AvgAccumulator());
        register(PositionalAccumulator.first());
        register(PositionalAccumulator.last());
    }

    // Add or replace an accumulator under its own name.
    public void register(Accumulator<?, ?> accumulator) {
        String key = accumulator.name().toLowerCase(Locale.ROOT);
        if (accumulators.put(key, accumulator) != null) {
            logger.info("Replaced accumulator {}", key);
        }
    }

    public Accumulator<?, ?> get(String name) {
        Accumulator<?, ?> accumulator = accumulators.get(name.toLowerCase(Locale.ROOT));
        if (accumulator == null) {
            throw new IllegalArgumentException(String.format("Unknown aggregate function %s, known: %s", name, names()));
        }
        return accumulator;
    }

    // Shorthand for AggregateColumn.of(get(name), column).
    public AggregateColumn column(String name, int column) {
        return AggregateColumn.of(get(name), column);
    }

    public Set<String> names() {
        return new TreeSet<>(accumulators.keySet());
    }
}
