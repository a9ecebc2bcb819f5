package edu.stanford.futuredata.shardagg.rows;

import edu.stanford.futuredata.shardagg.interfaces.Row;
import edu.stanford.futuredata.shardagg.interfaces.RowSource;

import java.util.List;
import java.util.function.ToLongFunction;

/**
 * An in-memory row source over a list.
 */
public class ListRowSource<R extends Row> implements RowSource<R> {

    private final List<R> rows;
    private final int pageSize;
    private final ToLongFunction<R> byteSize;

    public ListRowSource(List<R> rows) {
        this(rows, 1, r -> 1L);
    }

    public ListRowSource(List<R> rows, int pageSize, ToLongFunction<R> byteSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive: " + pageSize);
        }
        this.rows = rows;
        this.pageSize = pageSize;
        this.byteSize = byteSize;
    }

    @Override
    public long rowCount() {
        return rows.size();
    }

    @Override
    public R getRow(long index) {
        return rows.get(Math.toIntExact(index));
    }

    @Override
    public long rowByteSize(long index) {
        return byteSize.applyAsLong(getRow(index));
    }

    @Override
    public int pageSize() {
        return pageSize;
    }
}
