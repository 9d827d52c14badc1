package infra.workbook;

import domain.error.ConsolidationException;
import domain.error.ErrorCode;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Opening, saving and sheet lookup for POI workbooks.
 *
 * <p>Workbooks are read fully into memory from a stream, so the file on disk is not held open
 * and the returned handle can be closed on every exit path with try-with-resources.</p>
 */
public final class Workbooks {

    private Workbooks() {
    }

    /**
     * Caller owns the returned workbook and must close it.
     */
    public static Workbook open(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            return WorkbookFactory.create(is);
        } catch (IOException | RuntimeException e) {
            throw new ConsolidationException(ErrorCode.WORKBOOK_UNREADABLE,
                    "Cannot open workbook '" + path.getFileName() + "': " + e.getMessage(), e);
        }
    }

    public static void save(Workbook wb, Path target) throws IOException {
        Path parent = target.getParent();
        if (parent != null) Files.createDirectories(parent);
        try (OutputStream os = Files.newOutputStream(target)) {
            wb.write(os);
        }
    }

    public static List<String> sheetNames(Workbook wb) {
        List<String> names = new ArrayList<>(wb.getNumberOfSheets());
        for (int i = 0; i < wb.getNumberOfSheets(); i++) {
            names.add(wb.getSheetName(i));
        }
        return names;
    }

    /**
     * Exact (case-sensitive) sheet lookup. {@link Workbook#getSheet} ignores case, which would
     * accept references the spreadsheet application itself would not resolve.
     */
    public static Sheet findSheet(Workbook wb, String name) {
        if (name == null) return null;
        for (int i = 0; i < wb.getNumberOfSheets(); i++) {
            if (wb.getSheetName(i).equals(name)) return wb.getSheetAt(i);
        }
        return null;
    }

    /** Number of physical rows, i.e. 1-based number of the last row holding data (0 if none). */
    public static int physicalRowCount(Sheet sheet) {
        return Math.max(0, sheet.getLastRowNum() + 1);
    }
}
