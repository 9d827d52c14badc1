package domain.mapping;

import domain.error.ConsolidationException;
import domain.error.ErrorCode;

/** Raised when a column name is not part of a {@link CellMapTable}. */
public final class UnknownColumnException extends ConsolidationException {

    private final String column;

    public UnknownColumnException(String column) {
        super(ErrorCode.UNKNOWN_COLUMN, "Column '" + column + "' not found");
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
