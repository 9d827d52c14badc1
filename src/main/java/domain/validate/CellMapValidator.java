package domain.validate;

import domain.error.ConsolidationException;
import domain.error.ErrorCode;
import domain.mapping.CellMapColumns;
import domain.mapping.CellMapTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Schema checks of a loaded cell map: required columns, no blank cells, no duplicate mappings.
 *
 * <p>Checks run in that order and stop at the first failure. Row numbers in messages count
 * data rows only (blank rows skipped by the loader are not counted).</p>
 */
public final class CellMapValidator {

    private static final int MAX_REPORTED = 10;

    /**
     * @return the same table, once it is known to be valid
     */
    public CellMapTable validate(CellMapTable table) {
        if (table == null) {
            throw new ConsolidationException(ErrorCode.CELL_MAP_UNREADABLE, "Cell Map is not loaded");
        }

        List<String> missing = new ArrayList<>();
        for (String col : CellMapColumns.REQUIRED) {
            if (!table.hasColumn(col)) missing.add(col);
        }
        if (!missing.isEmpty()) {
            throw new ConsolidationException(ErrorCode.MISSING_COLUMNS,
                    "Cell Map is missing required columns: " + String.join(", ", missing));
        }

        List<String> blanks = new ArrayList<>();
        boolean[][] nulls = table.nullMask();
        for (int r = 0; r < nulls.length; r++) {
            for (int c = 0; c < nulls[r].length; c++) {
                if (nulls[r][c]) blanks.add("row " + (r + 1) + " '" + table.getColumns().get(c) + "'");
            }
        }
        if (!blanks.isEmpty()) {
            throw new ConsolidationException(ErrorCode.EMPTY_MAPPING_CELLS,
                    "Cell Map contains empty cells. Please fill all values. " + summarize(blanks));
        }

        List<String> duplicates = new ArrayList<>();
        boolean[] dup = table.duplicateMask(CellMapColumns.REQUIRED);
        for (int r = 0; r < dup.length; r++) {
            if (dup[r]) duplicates.add("row " + (r + 1));
        }
        if (!duplicates.isEmpty()) {
            throw new ConsolidationException(ErrorCode.DUPLICATE_MAPPING,
                    "Cell Map contains duplicate mappings. Please remove them. " + summarize(duplicates));
        }

        return table;
    }

    private static String summarize(List<String> items) {
        List<String> head = items.size() > MAX_REPORTED ? items.subList(0, MAX_REPORTED) : items;
        String more = items.size() > MAX_REPORTED ? ", ... (" + items.size() + " total)" : "";
        return "[" + String.join(", ", head) + more + "]";
    }
}
