package edu.stanford.futuredata.shardagg.rows;

import edu.stanford.futuredata.shardagg.interfaces.Row;

import java.util.Arrays;

public class ArrayRow implements Row {
    private final Object[] values;

    public ArrayRow(Object... values) {
        this.values = values;
    }

    @Override
    public int columnCount() {
        return values.length;
    }

    @Override
    public Object getValue(int column) {
        return values[column];
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
