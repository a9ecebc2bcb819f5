package edu.stanford.futuredata.shardagg.shard;

import edu.stanford.futuredata.shardagg.accumulators.AggregateColumn;
import edu.stanford.futuredata.shardagg.errors.ResourceExhaustionException;
import edu.stanford.futuredata.shardagg.utilities.ShardHash;

import java.util.List;
import java.util.function.BiConsumer;

/**
 * A hash table from group key to accumulator states, owned by one (worker, shard index) pair.
 *
 * Concurrency contract:
 * Only the owning task writes.  After seal() the table is read-only and may be handed to exactly one merge task.
 *
 * Open addressing with linear probing.  The table doubles when it is more than three quarters full.  Slot numbers
 * returned by getOrInit stay valid until the next insertion.
 */
public class ShardTable {
    public static final int MERGED = -1;
    public static final float LOAD_FACTOR = 0.75f;
    public static final int MAXIMUM_CAPACITY = 1 << 30;

    private final int workerId;
    private final int shardIndex;
    private final AggregateColumn[] aggregates;
    private final int width;
    private final int maxCapacity;

    private GroupKey[] keys;
    // States of slot s live at [s * width, (s + 1) * width).
    private Object[] states;
    private int mask;
    private int maxFill;
    private int size;
    private boolean sealed;

    public ShardTable(int workerId, int shardIndex, List<AggregateColumn> aggregates, int initialCapacity,
                      int maxCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("Initial capacity must be positive: " + initialCapacity);
        }
        this.workerId = workerId;
        this.shardIndex = shardIndex;
        this.aggregates = aggregates.toArray(new AggregateColumn[0]);
        this.width = this.aggregates.length;
        this.maxCapacity = Math.min(maxCapacity, MAXIMUM_CAPACITY);
        int capacity = tableSizeFor(initialCapacity);
        if (capacity > this.maxCapacity) {
            throw new ResourceExhaustionException(String.format(
                    "Initial capacity %d exceeds shard table limit %d", capacity, this.maxCapacity));
        }
        allocate(capacity);
    }

    public ShardTable(int workerId, int shardIndex, List<AggregateColumn> aggregates) {
        this(workerId, shardIndex, aggregates, 16, MAXIMUM_CAPACITY);
    }

    /*
     * SCATTER
     */

    // Slot of key, inserting it with init() states if absent.
    public int getOrInit(GroupKey key) {
        checkWritable();
        int slot = find(key);
        if (slot >= 0) {
            return slot;
        }
        if (size >= maxFill) {
            grow();
        }
        slot = insertionSlot(key);
        keys[slot] = key;
        int base = slot * width;
        for (int i = 0; i < width; i++) {
            states[base + i] = aggregates[i].accumulator().init();
        }
        size++;
        return slot;
    }

    public Object getState(int slot, int aggregate) {
        return states[slot * width + aggregate];
    }

    public void update(int slot, int aggregate, Object state) {
        checkWritable();
        states[slot * width + aggregate] = state;
    }

    /*
     * MERGE
     */

    // Fold the states of one entry of another table into this one.
    public void mergeEntry(ShardTable source, int sourceSlot) {
        checkWritable();
        GroupKey key = source.keys[sourceSlot];
        int sourceBase = sourceSlot * width;
        int slot = find(key);
        if (slot < 0) {
            if (size >= maxFill) {
                grow();
            }
            slot = insertionSlot(key);
            keys[slot] = key;
            System.arraycopy(source.states, sourceBase, states, slot * width, width);
            size++;
            return;
        }
        int base = slot * width;
        for (int i = 0; i < width; i++) {
            states[base + i] = aggregates[i].accumulator().merge(states[base + i], source.states[sourceBase + i]);
        }
    }

    /*
     * READ
     */

    // Copy of the states of key, or null if absent.
    public Object[] get(GroupKey key) {
        int slot = find(key);
        if (slot < 0) {
            return null;
        }
        Object[] out = new Object[width];
        System.arraycopy(states, slot * width, out, 0, width);
        return out;
    }

    // Key in a slot, null for an empty slot.  Slots range over [0, capacity()).
    public GroupKey keyAt(int slot) {
        return keys[slot];
    }

    public void forEach(BiConsumer<GroupKey, Object[]> consumer) {
        for (int slot = 0; slot < keys.length; slot++) {
            if (keys[slot] != null) {
                Object[] out = new Object[width];
                System.arraycopy(states, slot * width, out, 0, width);
                consumer.accept(keys[slot], out);
            }
        }
    }

    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return keys.length;
    }

    public int getWorkerId() {
        return workerId;
    }

    public int getShardIndex() {
        return shardIndex;
    }

    /*
     * INTERNALS
     */

    private int find(GroupKey key) {
        int slot = ShardHash.slotHash(key.hashCode()) & mask;
        GroupKey k;
        while ((k = keys[slot]) != null) {
            if (k.equals(key)) {
                return slot;
            }
            slot = (slot + 1) & mask;
        }
        return -1;
    }

    private int insertionSlot(GroupKey key) {
        int slot = ShardHash.slotHash(key.hashCode()) & mask;
        while (keys[slot] != null) {
            slot = (slot + 1) & mask;
        }
        return slot;
    }

    private void grow() {
        int oldCapacity = keys.length;
        if (oldCapacity >= MAXIMUM_CAPACITY || (oldCapacity << 1) > maxCapacity) {
            throw new ResourceExhaustionException(String.format(
                    "Shard table (worker %d, shard %d) cannot grow past %d slots with %d groups",
                    workerId, shardIndex, maxCapacity, size));
        }
        GroupKey[] oldKeys = keys;
        Object[] oldStates = states;
        allocate(oldCapacity << 1);
        for (int s = 0; s < oldCapacity; s++) {
            GroupKey k = oldKeys[s];
            if (k != null) {
                int slot = insertionSlot(k);
                keys[slot] = k;
                System.arraycopy(oldStates, s * width, states, slot * width, width);
            }
        }
    }

    private void allocate(int capacity) {
        try {
            GroupKey[] newKeys = new GroupKey[capacity];
            Object[] newStates = new Object[Math.multiplyExact(capacity, Math.max(width, 1))];
            keys = newKeys;
            states = newStates;
        } catch (OutOfMemoryError | ArithmeticException e) {
            throw new ResourceExhaustionException(String.format(
                    "Could not allocate %d slots for shard table (worker %d, shard %d)", capacity, workerId, shardIndex), e);
        }
        mask = capacity - 1;
        maxFill = Math.max(1, (int) (capacity * LOAD_FACTOR));
        if (maxFill >= capacity) {
            maxFill = capacity - 1;
        }
    }

    private void checkWritable() {
        if (sealed) {
            throw new IllegalStateException(String.format("Shard table (worker %d, shard %d) is sealed",
                    workerId, shardIndex));
        }
    }

    private static int tableSizeFor(int n) {
        if (n >= MAXIMUM_CAPACITY) {
            return MAXIMUM_CAPACITY;
        }
        return Math.max(2, Integer.highestOneBit(Math.max(n, 1) - 1) << 1);
    }
}
