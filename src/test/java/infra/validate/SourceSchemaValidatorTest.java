package infra.validate;

import domain.error.ConsolidationException;
import domain.error.ErrorCode;
import domain.mapping.MappingEntry;
import org.apache.poi.ss.SpreadsheetVersion;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import support.Xlsx;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceSchemaValidatorTest {

    @TempDir
    Path tempDir;

    private final SourceSchemaValidator validator = new SourceSchemaValidator(LoggerFactory.getLogger(SourceSchemaValidatorTest.class));

    @Test
    void existingSheetsAndCells_pass() throws Exception {
        Path f = Xlsx.estimate(tempDir, "est1.xlsx", "Sheet1", "B2", 100, "Labour", "C3", 7);

        assertDoesNotThrow(() -> validator.validate(f, List.of(
                new MappingEntry("Sheet1", "B2", "Cost"),
                new MappingEntry("Labour", "$C$3", "Hours"),
                new MappingEntry("Sheet1", "Z99", "Empty is fine"))));
    }

    @Test
    void missingSheet_namesFileAndSheet() throws Exception {
        Path f = Xlsx.estimate(tempDir, "est1.xlsx", "Sheet1", "B2", 100);

        ConsolidationException e = assertThrows(ConsolidationException.class,
                () -> validator.validate(f, List.of(new MappingEntry("Sheet2", "B2", "Cost"))));
        assertEquals(ErrorCode.SHEET_NOT_FOUND, e.getCode());
        assertTrue(e.getMessage().contains("'est1.xlsx'"));
        assertTrue(e.getMessage().contains("'Sheet2'"));
        assertTrue(e.getMessage().contains("[Sheet1]"));
    }

    @Test
    void unaddressableCell_fails() throws Exception {
        Path f = Xlsx.estimate(tempDir, "est1.xlsx", "Sheet1", "B2", 100);

        ConsolidationException e = assertThrows(ConsolidationException.class,
                () -> validator.validate(f, List.of(new MappingEntry("Sheet1", "B2:C3", "Cost"))));
        assertEquals(ErrorCode.CELL_NOT_ADDRESSABLE, e.getCode());
    }

    @Test
    void nullEntries_isAPreconditionFailure() throws Exception {
        Path f = Xlsx.estimate(tempDir, "est1.xlsx", "Sheet1", "B2", 100);

        ConsolidationException e = assertThrows(ConsolidationException.class, () -> validator.validate(f, null));
        assertEquals(ErrorCode.PRECONDITION, e.getCode());
    }

    @Test
    void isAddressable() {
        SpreadsheetVersion x = SpreadsheetVersion.EXCEL2007;
        assertTrue(SourceSchemaValidator.isAddressable("A1", x));
        assertTrue(SourceSchemaValidator.isAddressable(" XFD1048576 ", x));
        assertFalse(SourceSchemaValidator.isAddressable("XFE1", x));
        assertFalse(SourceSchemaValidator.isAddressable("A1:B2", x));
        assertFalse(SourceSchemaValidator.isAddressable("Total", x));
        assertFalse(SourceSchemaValidator.isAddressable("", x));
        assertFalse(SourceSchemaValidator.isAddressable("IW1", SpreadsheetVersion.EXCEL97));
    }
}
