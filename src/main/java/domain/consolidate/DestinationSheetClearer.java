package domain.consolidate;

import infra.workbook.CellTexts;
import infra.workbook.FormulaCellWriter;
import infra.workbook.HeaderIndex;
import infra.workbook.Workbooks;
import org.apache.poi.ss.usermodel.Sheet;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * Clears stale consolidation rows before new rows are written.
 *
 * <p>A row from {@code dataStartRow} on is occupied when column 1 is non-blank. For an occupied
 * row columns 1 and 2 and every mapped destination column found in the header are emptied.
 * Data is assumed contiguous: once more than {@code maxBlankRows} consecutive rows are not
 * occupied, scanning stops and rows after that gap are left untouched.</p>
 */
public final class DestinationSheetClearer {

    public static final int FILENAME_COLUMN = 1;
    public static final int ITEM_NUMBER_COLUMN = 2;

    private final int maxBlankRows;

    public DestinationSheetClearer(int maxBlankRows) {
        this.maxBlankRows = maxBlankRows;
    }

    public ClearingResult clear(Sheet sheet, HeaderIndex header, Collection<String> destinationColumns, int dataStartRow) {
        Set<Integer> columns = new TreeSet<>();
        columns.add(FILENAME_COLUMN);
        columns.add(ITEM_NUMBER_COLUMN);
        for (String name : destinationColumns) {
            int pos = header.positionOf(name);
            if (pos > 0) columns.add(pos);
        }

        int lastRow = Workbooks.physicalRowCount(sheet);
        int blankRun = 0;
        int cleared = 0;
        int scanned = 0;

        for (int r = dataStartRow; r <= lastRow; r++) {
            scanned = r;
            if (!CellTexts.text(sheet, r, FILENAME_COLUMN).isEmpty()) {
                for (int c : columns) {
                    FormulaCellWriter.clear(sheet, r, c);
                }
                cleared++;
                blankRun = 0;
            } else {
                blankRun++;
            }

            if (blankRun > maxBlankRows) {
                return new ClearingResult(cleared, scanned, r < lastRow);
            }
        }
        return new ClearingResult(cleared, scanned, false);
    }
}
