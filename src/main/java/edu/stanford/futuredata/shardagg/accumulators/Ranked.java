package edu.stanford.futuredata.shardagg.accumulators;

import java.util.Objects;

/**
 * A value tagged with the global index of the row it came from.  Used by accumulators whose winner depends on row
 * position (first, last) or that break ties by it (min, max).
 */
public final class Ranked {
    public final long rowIndex;
    public final Object value;

    public Ranked(long rowIndex, Object value) {
        this.rowIndex = rowIndex;
        this.value = value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Ranked)) {
            return false;
        }
        Ranked ranked = (Ranked) o;
        return rowIndex == ranked.rowIndex && Objects.equals(value, ranked.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowIndex, value);
    }

    @Override
    public String toString() {
        return value + "@" + rowIndex;
    }
}
