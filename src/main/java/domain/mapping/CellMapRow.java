package domain.mapping;

import java.util.List;
import java.util.Map;

/**
 * Read-only, name-addressable view of one {@link CellMapTable} row.
 *
 * <p>Shares the owning table's column index, so lookups never rebuild a map per row.</p>
 */
public final class CellMapRow {

    private final int index;
    private final List<Object> values;
    private final Map<String, Integer> columnIndex;

    CellMapRow(int index, List<Object> values, Map<String, Integer> columnIndex) {
        this.index = index;
        this.values = values;
        this.columnIndex = columnIndex;
    }

    /** 0-based position of the row in the table. */
    public int getIndex() {
        return index;
    }

    public Object get(String column) {
        Integer i = columnIndex.get(CellMapTable.key(column));
        if (i == null) throw new UnknownColumnException(column);
        return values.get(i);
    }

    public boolean has(String column) {
        return column != null && columnIndex.containsKey(CellMapTable.key(column));
    }

    /** Value as trimmed text; blank for absent values. */
    public String getString(String column) {
        Object v = get(column);
        return v == null ? "" : String.valueOf(v).trim();
    }
}
