package infra.mapping;

import domain.error.ConsolidationException;
import domain.error.ErrorCode;
import domain.mapping.CellMapTable;
import infra.workbook.CellTexts;
import infra.workbook.Workbooks;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Cell map workbook loader.
 *
 * <p>Reads the active sheet. The first non-empty row is the header, every later non-empty row
 * is data. Completely blank rows are skipped and do not count.</p>
 * <ul>
 *   <li>blank header cells become {@code Column_<index>} (0-based index)</li>
 *   <li>header width = last non-blank header cell; data cells beyond it are dropped</li>
 *   <li>short data rows are padded with blanks</li>
 * </ul>
 */
public class CellMapXlsxLoader {

    public CellMapTable load(Path path) {
        try (Workbook wb = Workbooks.open(path)) {
            if (wb.getNumberOfSheets() == 0) {
                throw new ConsolidationException(ErrorCode.CELL_MAP_UNREADABLE,
                        "Failed to read Cell Map file '" + path.getFileName() + "': workbook has no sheets");
            }
            Sheet sheet = wb.getSheetAt(wb.getActiveSheetIndex());
            return read(sheet, path);
        } catch (ConsolidationException e) {
            if (e.getCode() == ErrorCode.WORKBOOK_UNREADABLE) {
                throw new ConsolidationException(ErrorCode.CELL_MAP_UNREADABLE,
                        "Failed to read Cell Map file: " + e.getMessage(), e);
            }
            throw e;
        } catch (IOException e) {
            throw new ConsolidationException(ErrorCode.CELL_MAP_UNREADABLE,
                    "Failed to read Cell Map file '" + path.getFileName() + "': " + e.getMessage(), e);
        }
    }

    CellMapTable read(Sheet sheet, Path path) {
        List<String> columns = null;
        List<List<String>> data = new ArrayList<>();

        for (Row row : sheet) {
            List<String> values = texts(row);
            if (values.stream().allMatch(String::isEmpty)) continue;

            if (columns == null) {
                columns = headers(values);
                continue;
            }

            List<String> padded = new ArrayList<>(columns.size());
            for (int i = 0; i < columns.size(); i++) {
                padded.add(i < values.size() ? values.get(i) : "");
            }
            data.add(padded);
        }

        if (columns == null) {
            throw new ConsolidationException(ErrorCode.CELL_MAP_UNREADABLE,
                    "Failed to read Cell Map file '" + path.getFileName() + "': sheet '"
                            + sheet.getSheetName() + "' appears to be empty");
        }
        return new CellMapTable(columns, data);
    }

    private static List<String> texts(Row row) {
        int last = row.getLastCellNum();
        List<String> out = new ArrayList<>(Math.max(0, last));
        for (int c = 0; c < last; c++) {
            out.add(CellTexts.text(row.getCell(c)));
        }
        return out;
    }

    private static List<String> headers(List<String> values) {
        int width = values.size();
        while (width > 0 && values.get(width - 1).isEmpty()) width--;

        List<String> headers = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            String h = values.get(i);
            headers.add(h.isEmpty() ? "Column_" + i : h);
        }
        return headers;
    }
}
