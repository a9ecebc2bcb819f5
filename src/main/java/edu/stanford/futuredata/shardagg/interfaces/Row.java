package edu.stanford.futuredata.shardagg.interfaces;

public interface Row {
    /*
     A row of input data.  Columns are addressed by position.
     Values are boxed Java values (Long, Double, String, ...) or null.
     */

    // Number of columns in this row.
    int columnCount();
    // Value of a column.  Throws IndexOutOfBoundsException for a column this row does not have.
    Object getValue(int column);

    default long getLong(int column) {
        Object v = getValue(column);
        if (!(v instanceof Number)) {
            throw new ClassCastException(String.format("Column %d is not numeric: %s", column, v));
        }
        return ((Number) v).longValue();
    }
}
