package domain.mapping;

import java.util.List;

/** Column names the cell map must carry. */
public final class CellMapColumns {

    public static final String SOURCE_SHEET = "Source Sheet";
    public static final String SOURCE_CELL = "Source Cell";
    public static final String DESTINATION_COLUMN = "Destination Column (Consolidation)";

    /** Also the uniqueness key of a mapping row, in this order. */
    public static final List<String> REQUIRED = List.of(SOURCE_SHEET, SOURCE_CELL, DESTINATION_COLUMN);

    private CellMapColumns() {
    }
}
