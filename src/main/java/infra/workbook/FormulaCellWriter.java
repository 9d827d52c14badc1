package infra.workbook;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFCell;
import org.openxmlformats.schemas.spreadsheetml.x2006.main.CTCell;
import org.openxmlformats.schemas.spreadsheetml.x2006.main.CTCellFormula;

/**
 * Writes values and formula text into a sheet, creating rows and cells on demand.
 *
 * <p>POI's formula parser cannot read external references that carry a directory path
 * ({@code 'C:\dir\[book.xlsx]Sheet1'!B2}). For XLSX cells the text therefore goes straight
 * into the cell's {@code <f>} element; the spreadsheet application resolves it when the file is
 * opened. Binary (.xls) cells go through the regular parser.</p>
 */
public final class FormulaCellWriter {

    private FormulaCellWriter() {
    }

    /** 1-based row / column. */
    public static Cell cell(Sheet sheet, int row1, int col1) {
        Row row = sheet.getRow(row1 - 1);
        if (row == null) row = sheet.createRow(row1 - 1);
        Cell cell = row.getCell(col1 - 1);
        if (cell == null) cell = row.createCell(col1 - 1);
        return cell;
    }

    public static void setText(Sheet sheet, int row1, int col1, String value) {
        cell(sheet, row1, col1).setCellValue(value);
    }

    public static void setNumber(Sheet sheet, int row1, int col1, double value) {
        cell(sheet, row1, col1).setCellValue(value);
    }

    /** Empties an existing cell, keeping its style. Missing cells are left missing. */
    public static void clear(Sheet sheet, int row1, int col1) {
        Row row = sheet.getRow(row1 - 1);
        if (row == null) return;
        Cell cell = row.getCell(col1 - 1);
        if (cell != null) cell.setBlank();
    }

    /**
     * @param formula formula text with or without the leading '='
     */
    public static void setFormula(Sheet sheet, int row1, int col1, String formula) {
        String text = formula == null ? "" : formula.trim();
        if (text.startsWith("=")) text = text.substring(1);

        Cell cell = cell(sheet, row1, col1);
        if (cell instanceof XSSFCell) {
            cell.setBlank();
            CTCell ct = ((XSSFCell) cell).getCTCell();
            CTCellFormula f = CTCellFormula.Factory.newInstance();
            f.setStringValue(text);
            ct.setF(f);
            return;
        }
        cell.setCellFormula(text);
    }
}
