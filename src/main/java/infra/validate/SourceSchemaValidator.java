package infra.validate;

import domain.error.ConsolidationException;
import domain.error.ErrorCode;
import domain.mapping.MappingEntry;
import infra.workbook.Workbooks;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellReference;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Checks one estimate workbook against the cell map: every source sheet exists and every
 * source cell is a single, in-bounds cell reference.
 *
 * <p>All mapping rows are checked before returning. The workbook is opened and closed here.</p>
 */
public final class SourceSchemaValidator {

    private final Logger log;

    public SourceSchemaValidator(Logger log) {
        this.log = log;
    }

    /**
     * @param estimateFile already resolved estimate path
     */
    public void validate(Path estimateFile, List<MappingEntry> entries) {
        if (entries == null) {
            throw new ConsolidationException(ErrorCode.PRECONDITION,
                    "Cell Map must be validated first before validating estimate files");
        }
        String fileName = String.valueOf(estimateFile.getFileName());

        try (Workbook wb = Workbooks.open(estimateFile)) {
            SpreadsheetVersion version = (wb instanceof HSSFWorkbook)
                    ? SpreadsheetVersion.EXCEL97
                    : SpreadsheetVersion.EXCEL2007;

            for (MappingEntry e : entries) {
                if (Workbooks.findSheet(wb, e.sourceSheet) == null) {
                    throw new ConsolidationException(ErrorCode.SHEET_NOT_FOUND,
                            "In file '" + fileName + "', required sheet '" + e.sourceSheet
                                    + "' not found. Available sheets: [" + String.join(", ", Workbooks.sheetNames(wb)) + "]");
                }
                if (!isAddressable(e.sourceCell, version)) {
                    throw new ConsolidationException(ErrorCode.CELL_NOT_ADDRESSABLE,
                            "In file '" + fileName + "', cell '" + e.sourceCell
                                    + "' could not be accessed in sheet '" + e.sourceSheet + "'");
                }
            }
        } catch (IOException ex) {
            throw new ConsolidationException(ErrorCode.WORKBOOK_UNREADABLE,
                    "Cannot validate estimate file '" + fileName + "': " + ex.getMessage(), ex);
        }

        log.info("Estimate file validated: {}", fileName);
    }

    /**
     * A1-style single cell ({@code B7}, {@code $B$7}) within the limits of the file format.
     */
    static boolean isAddressable(String ref, SpreadsheetVersion version) {
        if (ref == null || ref.isBlank()) return false;
        try {
            return CellReference.classifyCellReference(ref.trim(), version) == CellReference.NameType.CELL;
        } catch (RuntimeException e) {
            return false;
        }
    }
}
