package domain.mapping;

/**
 * One cell map row: which sheet/cell of every estimate file feeds which destination column.
 *
 * <p>Plain immutable DTO. Values are stored trimmed.</p>
 */
public final class MappingEntry {

    public final String sourceSheet;
    public final String sourceCell;
    public final String destinationColumn;

    public MappingEntry(String sourceSheet, String sourceCell, String destinationColumn) {
        this.sourceSheet = trim(sourceSheet);
        this.sourceCell = trim(sourceCell);
        this.destinationColumn = trim(destinationColumn);
    }

    private static String trim(String s) {
        return s == null ? "" : s.trim();
    }

    @Override
    public String toString() {
        return "MappingEntry{" +
                "sourceSheet='" + sourceSheet + '\'' +
                ", sourceCell='" + sourceCell + '\'' +
                ", destinationColumn='" + destinationColumn + '\'' +
                '}';
    }
}
