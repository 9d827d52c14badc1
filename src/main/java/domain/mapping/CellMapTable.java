package domain.mapping;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory table over the cell map rows.
 *
 * <p>Fixed schema: the ordered column list is resolved once into an index at construction.
 * Column lookups are case-sensitive, exact after trimming. Immutable; a changed cell map file
 * means building a new table.</p>
 *
 * <p>Values are kept as read (trimmed text, numbers...). {@code null} and whitespace-only
 * strings count as blank.</p>
 */
public final class CellMapTable {

    private final List<String> columns;
    private final List<List<Object>> rows;
    private final Map<String, Integer> columnIndex;

    public CellMapTable(List<String> columns, List<? extends List<?>> rows) {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("Columns cannot be empty");
        }

        List<String> cols = new ArrayList<>(columns.size());
        Map<String, Integer> idx = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            String name = key(columns.get(i));
            cols.add(name);
            // repeated names resolve to the rightmost column
            idx.put(name, i);
        }

        List<List<Object>> copy = new ArrayList<>(rows == null ? 0 : rows.size());
        if (rows != null) {
            for (int r = 0; r < rows.size(); r++) {
                List<?> row = rows.get(r);
                int width = row == null ? 0 : row.size();
                if (width != cols.size()) {
                    throw new IllegalArgumentException(
                            "Row " + (r + 1) + " has " + width + " values but there are " + cols.size() + " columns");
                }
                copy.add(Collections.unmodifiableList(new ArrayList<Object>(row)));
            }
        }

        this.columns = Collections.unmodifiableList(cols);
        this.rows = Collections.unmodifiableList(copy);
        this.columnIndex = Collections.unmodifiableMap(idx);
    }

    static String key(String column) {
        return column == null ? "" : column.trim();
    }

    public static boolean isBlank(Object value) {
        return value == null || (value instanceof String && ((String) value).trim().isEmpty());
    }

    public List<String> getColumns() {
        return columns;
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean hasColumn(String column) {
        return column != null && columnIndex.containsKey(key(column));
    }

    /** Whole column, top to bottom. */
    public List<Object> columnValues(String column) {
        int i = indexOf(column);
        List<Object> out = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            out.add(row.get(i));
        }
        return out;
    }

    /** Per cell: true when the value is absent or whitespace-only. */
    public boolean[][] nullMask() {
        boolean[][] mask = new boolean[rows.size()][columns.size()];
        for (int r = 0; r < rows.size(); r++) {
            List<Object> row = rows.get(r);
            for (int c = 0; c < columns.size(); c++) {
                mask[r][c] = isBlank(row.get(c));
            }
        }
        return mask;
    }

    public boolean hasBlankCells() {
        for (boolean[] row : nullMask()) {
            for (boolean blank : row) {
                if (blank) return true;
            }
        }
        return false;
    }

    /**
     * Per row: true when the tuple of values at {@code subsetColumns} already appeared in an
     * earlier row. The first occurrence is never flagged. {@code null} or empty subset means all
     * columns.
     */
    public boolean[] duplicateMask(List<String> subsetColumns) {
        List<String> subset = (subsetColumns == null || subsetColumns.isEmpty()) ? columns : subsetColumns;
        int[] positions = new int[subset.size()];
        for (int i = 0; i < subset.size(); i++) {
            positions[i] = indexOf(subset.get(i));
        }

        boolean[] mask = new boolean[rows.size()];
        Set<List<Object>> seen = new HashSet<>(rows.size() * 2);
        for (int r = 0; r < rows.size(); r++) {
            List<Object> row = rows.get(r);
            Object[] tuple = new Object[positions.length];
            for (int i = 0; i < positions.length; i++) {
                tuple[i] = row.get(positions[i]);
            }
            mask[r] = !seen.add(Arrays.asList(tuple));
        }
        return mask;
    }

    public List<CellMapRow> rows() {
        List<CellMapRow> out = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            out.add(new CellMapRow(r, rows.get(r), columnIndex));
        }
        return out;
    }

    /**
     * Typed view over the required columns. Only meaningful once the table passed cell map
     * validation.
     */
    public List<MappingEntry> entries() {
        List<MappingEntry> out = new ArrayList<>(rows.size());
        for (CellMapRow row : rows()) {
            out.add(new MappingEntry(
                    row.getString(CellMapColumns.SOURCE_SHEET),
                    row.getString(CellMapColumns.SOURCE_CELL),
                    row.getString(CellMapColumns.DESTINATION_COLUMN)
            ));
        }
        return out;
    }

    private int indexOf(String column) {
        Integer i = columnIndex.get(key(column));
        if (i == null) throw new UnknownColumnException(column);
        return i;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CellMapTable)) return false;
        CellMapTable other = (CellMapTable) o;
        return columns.equals(other.columns) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return 31 * columns.hashCode() + rows.hashCode();
    }

    @Override
    public String toString() {
        return "CellMapTable{columns=" + columns + ", rows=" + rows.size() + '}';
    }
}
