package domain.consolidate;

import domain.error.ConsolidationException;
import domain.error.ErrorCode;
import domain.mapping.CellMapTable;
import domain.mapping.MappingEntry;
import domain.model.ConsolidationConfig;
import domain.model.ConsolidationPhase;
import domain.model.ConsolidationWarning;
import domain.model.ConsolidationWarningSink;
import domain.model.ProgressEvent;
import domain.model.ProgressSink;
import domain.model.WarningCode;
import domain.output.CrossFileFormula;
import domain.output.OutputFileNamePolicy;
import domain.validate.InputValidator;
import infra.workbook.FormulaCellWriter;
import infra.workbook.HeaderIndex;
import infra.workbook.Workbooks;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.slf4j.Logger;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes one formula-linked row per estimate file into a copy of the consolidation workbook.
 *
 * <p>Not reentrant and not thread-safe: one run at a time per instance. Progress events are
 * delivered synchronously on the calling thread. There is no cancellation.</p>
 *
 * <p>The destination file itself is never written; the result goes to
 * {@code Consolidation_AutoLinked_<timestamp>} next to it. On failure nothing is saved.</p>
 */
public final class ConsolidationEngine {

    private final ConsolidationConfig config;
    private final Path consolidationFile;
    private final String sheetName;
    private final Logger log;
    private final ConsolidationWarningSink warningSink;
    private final Clock clock;

    private ConsolidationState state = ConsolidationState.IDLE;

    /**
     * @param consolidationFile resolved destination workbook
     * @param sheetName         validated destination sheet name
     */
    public ConsolidationEngine(ConsolidationConfig config,
                               Path consolidationFile,
                               String sheetName,
                               Logger log,
                               ConsolidationWarningSink warningSink,
                               Clock clock) {
        this.config = config;
        this.consolidationFile = consolidationFile;
        this.sheetName = sheetName;
        this.log = log;
        this.warningSink = warningSink == null ? ConsolidationWarningSink.none() : warningSink;
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
    }

    public ConsolidationState getState() {
        return state;
    }

    /**
     * @param cellMap       validated cell map, read-only for the whole run
     * @param estimateFiles estimate paths; list order is output row order and item numbering
     * @return path of the saved workbook
     */
    public Path run(CellMapTable cellMap, List<String> estimateFiles, ProgressSink progress) {
        if (state.isRunning()) {
            throw new IllegalStateException("A consolidation run is already in progress (state=" + state + ")");
        }
        if (cellMap == null) {
            throw new ConsolidationException(ErrorCode.PRECONDITION,
                    "Cell Map must be validated first before running consolidation");
        }
        if (estimateFiles == null || estimateFiles.isEmpty()) {
            throw new ConsolidationException(ErrorCode.NO_ESTIMATE_FILES, "No estimate files selected.");
        }
        ProgressSink sink = progress == null ? ProgressSink.none() : progress;

        try {
            Path output = doRun(cellMap.entries(), estimateFiles, sink);
            state = ConsolidationState.DONE;
            log.info("Consolidation completed: {}", output);
            return output;
        } catch (ConsolidationException e) {
            state = ConsolidationState.FAILED;
            log.error("Consolidation failed: {}", e.getMessage());
            throw e;
        } catch (Exception e) {
            state = ConsolidationState.FAILED;
            log.error("Error during consolidation", e);
            throw new ConsolidationException(ErrorCode.CONSOLIDATION_FAILED,
                    "A critical error occurred: " + e.getClass().getSimpleName() + " - " + e.getMessage(), e);
        }
    }

    private Path doRun(List<MappingEntry> entries, List<String> estimateFiles, ProgressSink sink) throws Exception {
        config.validateRows();
        int headerRow = config.getHeaderRow();
        int dataStartRow = config.getDataStartRow();
        int total = estimateFiles.size();

        try (Workbook wb = Workbooks.open(consolidationFile)) {
            Sheet sheet = Workbooks.findSheet(wb, sheetName);
            if (sheet == null) {
                throw new ConsolidationException(ErrorCode.SHEET_NOT_FOUND,
                        "Critical: Consolidation sheet '" + sheetName + "' not found in workbook '"
                                + consolidationFile.getFileName() + "'");
            }
            if (Workbooks.physicalRowCount(sheet) < headerRow) {
                throw new ConsolidationException(ErrorCode.INSUFFICIENT_ROWS,
                        "Consolidation sheet '" + sheetName + "' has less than " + headerRow
                                + " rows. Cannot find header row for writing.");
            }

            HeaderIndex header = HeaderIndex.read(sheet, headerRow);

            if (config.isClearExistingData()) {
                state = ConsolidationState.CLEARING;
                sink.onProgress(new ProgressEvent(ConsolidationPhase.CLEARING, 0, total, "Clearing existing data..."));
                ClearingResult cleared = new DestinationSheetClearer(config.getMaxBlankRowsBeforeStop())
                        .clear(sheet, header, destinationColumns(entries), dataStartRow);
                log.info("Cleared {} row(s), last row scanned={}, stoppedEarly={}",
                        cleared.getRowsCleared(), cleared.getLastRowScanned(), cleared.isStoppedEarly());
                sink.onProgress(new ProgressEvent(ConsolidationPhase.CLEARING, total, total,
                        "Clearing complete. " + cleared.getRowsCleared() + " row(s) cleared."));
            }

            state = ConsolidationState.WRITING;
            int row = dataStartRow;
            int itemNumber = 1;
            for (int i = 0; i < total; i++) {
                Path estimate = InputValidator.sanitize(estimateFiles.get(i), "Estimate");
                writeRow(sheet, header, entries, estimate, row, itemNumber);

                sink.onProgress(new ProgressEvent(ConsolidationPhase.PROCESSING, i + 1, total,
                        "Processed " + estimate.getFileName() + " (Item #" + itemNumber + ")"));
                row++;
                itemNumber++;
            }

            state = ConsolidationState.SAVING;
            sink.onProgress(new ProgressEvent(ConsolidationPhase.SAVING, 0, 1, "Saving consolidated file..."));
            Path output = outputPath(LocalDateTime.now(clock));
            wb.setForceFormulaRecalculation(true);
            Workbooks.save(wb, output);
            sink.onProgress(new ProgressEvent(ConsolidationPhase.SAVING, 1, 1, "Saved " + output.getFileName()));
            return output;
        }
    }

    private void writeRow(Sheet sheet, HeaderIndex header, List<MappingEntry> entries,
                          Path estimate, int row, int itemNumber) {
        String fileName = String.valueOf(estimate.getFileName());

        FormulaCellWriter.setText(sheet, row, DestinationSheetClearer.FILENAME_COLUMN, InputValidator.baseName(estimate));
        FormulaCellWriter.setNumber(sheet, row, DestinationSheetClearer.ITEM_NUMBER_COLUMN, itemNumber);

        for (MappingEntry e : entries) {
            int col = header.positionOf(e.destinationColumn);
            if (col < 0) {
                log.warn("Destination column '{}' not found in consolidation header. Skipping.", e.destinationColumn);
                warningSink.warn(new ConsolidationWarning(WarningCode.DESTINATION_COLUMN_NOT_FOUND, fileName,
                        "Destination column '" + e.destinationColumn + "' not found in consolidation header",
                        e.sourceSheet + "!" + e.sourceCell));
                continue;
            }
            String sourceSheet = InputValidator.validateSheetName(e.sourceSheet);
            FormulaCellWriter.setFormula(sheet, row, col, CrossFileFormula.build(estimate, sourceSheet, e.sourceCell));
        }
    }

    private Path outputPath(LocalDateTime saveTime) {
        Path dir = consolidationFile.toAbsolutePath().getParent();
        String ext = InputValidator.extension(consolidationFile);
        Path output = OutputFileNamePolicy.resolve(dir, saveTime, ext);

        String plain = OutputFileNamePolicy.build(saveTime, ext);
        if (!String.valueOf(output.getFileName()).equals(plain)) {
            log.warn("Output file {} already exists, saving as {}", plain, output.getFileName());
            warningSink.warn(new ConsolidationWarning(WarningCode.OUTPUT_NAME_COLLISION,
                    plain, "Output file already exists", "saved as " + output.getFileName()));
        }
        return output;
    }

    private static List<String> destinationColumns(List<MappingEntry> entries) {
        Set<String> names = new LinkedHashSet<>();
        for (MappingEntry e : entries) {
            names.add(e.destinationColumn);
        }
        return new ArrayList<>(names);
    }
}
