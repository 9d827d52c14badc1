package infra.validate;

import domain.error.ConsolidationException;
import domain.error.ErrorCode;
import domain.mapping.CellMapColumns;
import domain.mapping.CellMapTable;
import domain.model.ConsolidationConfig;
import infra.workbook.HeaderIndex;
import infra.workbook.Workbooks;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Checks the destination workbook: configured sheet present, enough rows to reach the header
 * row, and every destination column of the cell map present among the header texts.
 *
 * <p>Opens and closes the workbook itself; nothing is kept between calls.</p>
 */
public final class TargetSchemaValidator {

    private final Logger log;

    public TargetSchemaValidator(Logger log) {
        this.log = log;
    }

    public void validate(Path consolidationFile, String sheetName, ConsolidationConfig config, CellMapTable cellMap) {
        if (cellMap == null) {
            throw new ConsolidationException(ErrorCode.PRECONDITION,
                    "Cell Map must be validated first before validating consolidation file");
        }
        config.validateRows();
        int headerRow = config.getHeaderRow();

        try (Workbook wb = Workbooks.open(consolidationFile)) {
            Sheet sheet = Workbooks.findSheet(wb, sheetName);
            if (sheet == null) {
                throw new ConsolidationException(ErrorCode.SHEET_NOT_FOUND,
                        "Sheet '" + sheetName + "' not found. Available sheets: ["
                                + String.join(", ", Workbooks.sheetNames(wb)) + "]");
            }

            if (Workbooks.physicalRowCount(sheet) < headerRow) {
                throw new ConsolidationException(ErrorCode.INSUFFICIENT_ROWS,
                        "Consolidation sheet has less than " + headerRow + " rows. Cannot find header row.");
            }

            HeaderIndex header = HeaderIndex.read(sheet, headerRow);
            Set<String> missing = new TreeSet<>();
            for (Object v : cellMap.columnValues(CellMapColumns.DESTINATION_COLUMN)) {
                String name = v == null ? "" : String.valueOf(v).trim();
                if (!header.getHeaderTexts().contains(name)) missing.add(name);
            }

            if (!missing.isEmpty()) {
                List<String> texts = header.getHeaderTexts();
                log.error("Header data from row {}: {}", headerRow, texts);
                log.error("Missing destination columns: {}", missing);
                throw new ConsolidationException(ErrorCode.MISSING_DESTINATION_COLUMNS,
                        "Missing destination columns in consolidation sheet (row " + headerRow + "): "
                                + String.join(", ", missing));
            }
        } catch (IOException e) {
            throw new ConsolidationException(ErrorCode.WORKBOOK_UNREADABLE,
                    "Cannot validate consolidation file: " + e.getMessage(), e);
        }

        log.info("Consolidation file validated successfully: {}", consolidationFile.getFileName());
    }
}
