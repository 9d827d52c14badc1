package app;

import domain.consolidate.ConsolidationState;
import domain.error.ConsolidationException;
import domain.error.ErrorCode;
import domain.model.ConsolidationConfig;
import domain.model.ConsolidationPhase;
import domain.model.ConsolidationWarning;
import domain.model.ListConsolidationWarningSink;
import domain.model.ProgressEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import support.Xlsx;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExcelConsolidatorTest {

    private static final String SHEET = "General Consolidation";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-17T10:15:30Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private Path cellMap;
    private Path consolidation;
    private Path est1;
    private final List<ConsolidationWarning> warnings = new ArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        cellMap = Xlsx.cellMap(tempDir, "Cell Map.xlsx", new String[]{"Sheet1", "B2", "Cost"});
        consolidation = Xlsx.consolidation(tempDir, "cons.xlsx", SHEET, 4, "Filename", "Item #", "Cost");
        est1 = Xlsx.estimate(tempDir, "est1.xlsx", "Sheet1", "B2", 100);
    }

    private ExcelConsolidator consolidator(ConsolidationConfig.Builder b) {
        return new ExcelConsolidator(b.build(), LoggerFactory.getLogger(ExcelConsolidatorTest.class),
                new ListConsolidationWarningSink(warnings), CLOCK);
    }

    private ConsolidationConfig.Builder config() {
        return ConsolidationConfig.builder()
                .cellMapPath(cellMap.toString())
                .consolidationPath(consolidation.toString());
    }

    @Test
    void fullPipeline_validatesThenRuns() {
        ExcelConsolidator c = consolidator(config());

        assertEquals(1, c.validateCellMap().rowCount());
        c.validateConsolidationFile();
        c.validateEstimateFile(est1.toString());
        Path out = c.run(List.of(est1.toString()), null);

        assertTrue(Files.exists(out));
        assertEquals(ConsolidationState.DONE, c.getState());
        assertEquals(SHEET, c.getSheetName());
    }

    @Test
    void constructor_rejectsBadPathsAndSheetNames() {
        assertEquals(ErrorCode.FILE_NOT_FOUND, assertThrows(ConsolidationException.class,
                () -> consolidator(config().cellMapPath(tempDir.resolve("nope.xlsx").toString()))).getCode());
        assertEquals(ErrorCode.EMPTY_PATH, assertThrows(ConsolidationException.class,
                () -> consolidator(config().consolidationPath(" "))).getCode());
        assertEquals(ErrorCode.INVALID_SHEET_NAME, assertThrows(ConsolidationException.class,
                () -> consolidator(config().consolidationSheetName("a/b"))).getCode());
    }

    @Test
    void stagesOutOfOrder_arePreconditionFailures() {
        ExcelConsolidator c = consolidator(config());

        assertEquals(ErrorCode.PRECONDITION, assertThrows(ConsolidationException.class,
                c::validateConsolidationFile).getCode());
        assertEquals(ErrorCode.PRECONDITION, assertThrows(ConsolidationException.class,
                () -> c.validateEstimateFile(est1.toString())).getCode());
        assertEquals(ErrorCode.PRECONDITION, assertThrows(ConsolidationException.class,
                () -> c.run(List.of(est1.toString()), null)).getCode());

        c.validateCellMap();
        assertEquals(ErrorCode.PRECONDITION, assertThrows(ConsolidationException.class,
                () -> c.validateEstimateFile(est1.toString())).getCode());
        assertEquals(ErrorCode.PRECONDITION, assertThrows(ConsolidationException.class,
                () -> c.run(List.of(est1.toString()), null)).getCode());

        c.validateConsolidationFile();
        assertEquals(ErrorCode.PRECONDITION, assertThrows(ConsolidationException.class,
                () -> c.run(List.of(est1.toString()), null)).getCode());
        assertEquals(ConsolidationState.IDLE, c.getState());
    }

    @Test
    void revalidatingCellMap_resetsLaterStages() {
        ExcelConsolidator c = consolidator(config());
        c.validateCellMap();
        c.validateConsolidationFile();

        c.validateCellMap();

        assertEquals(ErrorCode.PRECONDITION, assertThrows(ConsolidationException.class,
                () -> c.validateEstimateFile(est1.toString())).getCode());
    }

    @Test
    void validateAll_reportsOneValidationStepPerStage() throws Exception {
        Path est2 = Xlsx.estimate(tempDir, "est2.xlsx", "Sheet1", "B2", 5);
        List<ProgressEvent> events = new ArrayList<>();
        ExcelConsolidator c = consolidator(config());

        c.validateAll(List.of(est1.toString(), est2.toString()), events::add);

        assertEquals(5, events.size());
        for (int i = 0; i < events.size(); i++) {
            assertEquals(ConsolidationPhase.VALIDATION, events.get(i).getPhase());
            assertEquals(i, events.get(i).getCurrent());
            assertEquals(4, events.get(i).getTotal());
        }
        assertEquals(10d, events.get(4).overallPercent(), 1e-9);
        assertNotNull(c.run(List.of(est1.toString(), est2.toString()), null));
    }

    @Test
    void validateAll_withoutEstimates_fails() {
        ExcelConsolidator c = consolidator(config());
        assertEquals(ErrorCode.NO_ESTIMATE_FILES, assertThrows(ConsolidationException.class,
                () -> c.validateAll(List.of(), null)).getCode());
    }

    @Test
    void estimateMissingSourceSheet_failsValidation() throws Exception {
        Path bad = Xlsx.estimate(tempDir, "bad.xlsx", "Other", "B2", 1);
        ExcelConsolidator c = consolidator(config());

        ConsolidationException e = assertThrows(ConsolidationException.class,
                () -> c.validateAll(List.of(est1.toString(), bad.toString()), null));
        assertEquals(ErrorCode.SHEET_NOT_FOUND, e.getCode());
        assertTrue(e.getMessage().contains("bad.xlsx"));
    }

    @Test
    void invalidCellMap_failsFirstStage() throws Exception {
        Xlsx.cellMap(tempDir, "Cell Map.xlsx",
                new String[]{"Sheet1", "B2", "Cost"},
                new String[]{"Sheet1", "B2", "Cost"});
        ExcelConsolidator c = consolidator(config());

        assertEquals(ErrorCode.DUPLICATE_MAPPING, assertThrows(ConsolidationException.class,
                c::validateCellMap).getCode());
        assertNull(c.getCellMap());
    }
}
