package infra.workbook;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaError;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;

import java.util.Locale;

/**
 * Cell value to trimmed text, the way it reads on screen (numbers without a trailing ".0",
 * formula cells by their cached result).
 */
public final class CellTexts {

    private static final DataFormatter FORMATTER = new DataFormatter(Locale.ROOT);

    private CellTexts() {
    }

    public static String text(Cell cell) {
        if (cell == null) return "";
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
            switch (type) {
                case STRING:
                    return cell.getRichStringCellValue().getString().trim();
                case NUMERIC:
                    return FORMATTER.formatRawCellContents(cell.getNumericCellValue(),
                            cell.getCellStyle().getDataFormat(),
                            cell.getCellStyle().getDataFormatString()).trim();
                case BOOLEAN:
                    return String.valueOf(cell.getBooleanCellValue()).toUpperCase(Locale.ROOT);
                case ERROR:
                    return FormulaError.forInt(cell.getErrorCellValue()).getString();
                default:
                    return "";
            }
        }
        if (type == CellType.BLANK || type == CellType._NONE) return "";
        // error values (#N/A, #REF! ...) read as their text, so such a cell is not blank
        return FORMATTER.formatCellValue(cell).trim();
    }

    /** 1-based row / column; blank when the row or cell does not exist. */
    public static String text(Sheet sheet, int row1, int col1) {
        Row row = sheet.getRow(row1 - 1);
        if (row == null) return "";
        return text(row.getCell(col1 - 1));
    }

    public static boolean isBlank(Cell cell) {
        return text(cell).isEmpty();
    }
}
