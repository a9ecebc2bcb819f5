package edu.stanford.futuredata.shardagg.shard;

import java.util.Arrays;
import java.util.List;

/**
 * The group-by column values of one row.  Immutable.  Equality and hash code are those of the value array, so they
 * are stable across a job as long as every value has a stable hash code (String and boxed primitives do).
 * Ordering compares values position by position, nulls first.
 */
public final class GroupKey implements Comparable<GroupKey> {

    private final Object[] values;
    private final int hash;

    private GroupKey(Object[] values) {
        this.values = values;
        this.hash = Arrays.hashCode(values);
    }

    public static GroupKey of(Object... values) {
        return new GroupKey(values.clone());
    }

    public int size() {
        return values.length;
    }

    public Object get(int i) {
        return values[i];
    }

    public List<Object> values() {
        return Arrays.asList(values.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GroupKey)) {
            return false;
        }
        GroupKey other = (GroupKey) o;
        return hash == other.hash && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public int compareTo(GroupKey o) {
        int n = Math.min(values.length, o.values.length);
        for (int i = 0; i < n; i++) {
            Object a = values[i];
            Object b = o.values[i];
            if (a == b) {
                continue;
            }
            if (a == null) {
                return -1;
            }
            if (b == null) {
                return 1;
            }
            int c = ((Comparable) a).compareTo(b);
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(values.length, o.values.length);
    }

    @Override
    public String toString() {
        return values.length == 1 ? String.valueOf(values[0]) : Arrays.toString(values);
    }
}
