package edu.stanford.futuredata.shardagg.engine;

import edu.stanford.futuredata.shardagg.accumulators.AggregateColumn;
import edu.stanford.futuredata.shardagg.shard.GroupKey;
import edu.stanford.futuredata.shardagg.shard.ShardTable;
import org.javatuples.Pair;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The finished aggregation: merged shards in ascending shard index order.  Values are finalized lazily as the
 * sequence is consumed.  The sequence can be iterated once.
 */
public class GroupedResult implements Iterable<Pair<GroupKey, List<Object>>> {

    private final ShardTable[] shards;
    private final AggregateColumn[] aggregates;
    private final AtomicBoolean consumed = new AtomicBoolean(false);
    private final long size;

    GroupedResult(ShardTable[] shards, List<AggregateColumn> aggregates) {
        this.shards = shards;
        this.aggregates = aggregates.toArray(new AggregateColumn[0]);
        long n = 0;
        for (ShardTable t: shards) {
            n += t.size();
        }
        this.size = n;
    }

    // Number of groups.
    public long size() {
        return size;
    }

    public int shardCount() {
        return shards.length;
    }

    @Override
    public Iterator<Pair<GroupKey, List<Object>>> iterator() {
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("Aggregation result can only be iterated once");
        }
        return new ResultIterator();
    }

    // Drain the sequence into a map in enumeration order.
    public Map<GroupKey, List<Object>> toMap() {
        Map<GroupKey, List<Object>> map = new LinkedHashMap<>();
        for (Pair<GroupKey, List<Object>> p: this) {
            map.put(p.getValue0(), p.getValue1());
        }
        return map;
    }

    private class ResultIterator implements Iterator<Pair<GroupKey, List<Object>>> {
        private int shard = 0;
        private int slot = -1;

        ResultIterator() {
            advance();
        }

        private void advance() {
            slot++;
            while (shard < shards.length) {
                ShardTable t = shards[shard];
                while (slot < t.capacity()) {
                    if (t.keyAt(slot) != null) {
                        return;
                    }
                    slot++;
                }
                // Release the shard once it has been read.
                shards[shard] = null;
                shard++;
                slot = 0;
            }
        }

        @Override
        public boolean hasNext() {
            return shard < shards.length;
        }

        @Override
        public Pair<GroupKey, List<Object>> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ShardTable t = shards[shard];
            Object[] values = new Object[aggregates.length];
            for (int a = 0; a < aggregates.length; a++) {
                values[a] = aggregates[a].accumulator().finalizeState(t.getState(slot, a));
            }
            Pair<GroupKey, List<Object>> p = new Pair<>(t.keyAt(slot), Collections.unmodifiableList(Arrays.asList(values)));
            advance();
            return p;
        }
    }
}
