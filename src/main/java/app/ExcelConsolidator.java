package app;

import domain.consolidate.ConsolidationEngine;
import domain.consolidate.ConsolidationState;
import domain.error.ConsolidationException;
import domain.error.ErrorCode;
import domain.mapping.CellMapTable;
import domain.model.ConsolidationConfig;
import domain.model.ConsolidationPhase;
import domain.model.ConsolidationWarningSink;
import domain.model.ProgressEvent;
import domain.model.ProgressSink;
import domain.validate.CellMapValidator;
import domain.validate.InputValidator;
import infra.mapping.CellMapXlsxLoader;
import infra.validate.SourceSchemaValidator;
import infra.validate.TargetSchemaValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Entry point of one consolidation: three-stage validation followed by {@link #run}.
 *
 * <p>Call order is enforced:</p>
 * <ol>
 *   <li>{@link #validateCellMap()}</li>
 *   <li>{@link #validateConsolidationFile()}</li>
 *   <li>{@link #validateEstimateFile(String)} once per estimate file</li>
 *   <li>{@link #run(List, ProgressSink)}</li>
 * </ol>
 * Any step called out of order fails with {@link ErrorCode#PRECONDITION}. Each validation step
 * opens and closes the workbooks it needs; no handle outlives a step.
 */
public final class ExcelConsolidator {

    private final ConsolidationConfig config;
    private final Logger log;
    private final InputValidator inputValidator;
    private final CellMapXlsxLoader cellMapLoader;
    private final CellMapValidator cellMapValidator;
    private final TargetSchemaValidator targetValidator;
    private final SourceSchemaValidator sourceValidator;
    private final ConsolidationEngine engine;

    private final Path cellMapPath;
    private final Path consolidationPath;
    private final String sheetName;

    private CellMapTable cellMap;
    private boolean consolidationValidated;
    private final Set<Path> validatedEstimates = new HashSet<>();

    public ExcelConsolidator(ConsolidationConfig config) {
        this(config, LoggerFactory.getLogger(ExcelConsolidator.class), ConsolidationWarningSink.none(),
                Clock.systemDefaultZone());
    }

    /**
     * Resolves both input paths and the sheet name right away; a bad path fails here, before
     * any workbook is opened.
     */
    public ExcelConsolidator(ConsolidationConfig config, Logger log, ConsolidationWarningSink warningSink, Clock clock) {
        if (config == null) throw new IllegalArgumentException("config is null");
        this.config = config;
        this.log = log;
        this.inputValidator = new InputValidator(log, warningSink);
        this.cellMapLoader = new CellMapXlsxLoader();
        this.cellMapValidator = new CellMapValidator();
        this.targetValidator = new TargetSchemaValidator(log);
        this.sourceValidator = new SourceSchemaValidator(log);

        this.cellMapPath = resolve(config.getCellMapPath(), "Cell Map");
        this.consolidationPath = resolve(config.getConsolidationPath(), "Consolidation");
        this.sheetName = InputValidator.validateSheetName(config.getConsolidationSheetName());

        this.engine = new ConsolidationEngine(config, consolidationPath, sheetName, log, warningSink, clock);
    }

    private Path resolve(String raw, String fileType) {
        Path p = inputValidator.resolvePath(raw, fileType);
        // oversized files are only reported, never rejected
        inputValidator.checkFileSize(p, config.getMaxFileSizeMb());
        return p;
    }

    /**
     * Loads and checks the cell map. Safe to repeat; the mapping table is rebuilt from the file.
     */
    public CellMapTable validateCellMap() {
        CellMapTable table = cellMapValidator.validate(cellMapLoader.load(cellMapPath));
        this.cellMap = table;
        this.consolidationValidated = false;
        this.validatedEstimates.clear();
        log.info("Cell Map validated successfully: {} mappings loaded", table.rowCount());
        return table;
    }

    public void validateConsolidationFile() {
        if (cellMap == null) {
            throw new ConsolidationException(ErrorCode.PRECONDITION,
                    "Cell Map must be validated first before validating consolidation file");
        }
        targetValidator.validate(consolidationPath, sheetName, config, cellMap);
        consolidationValidated = true;
    }

    /**
     * @return resolved path of the estimate file
     */
    public Path validateEstimateFile(String path) {
        if (cellMap == null) {
            throw new ConsolidationException(ErrorCode.PRECONDITION,
                    "Cell Map must be validated first before validating estimate files");
        }
        if (!consolidationValidated) {
            throw new ConsolidationException(ErrorCode.PRECONDITION,
                    "Consolidation file must be validated before validating estimate files");
        }
        Path resolved = resolve(path, "Estimate");
        sourceValidator.validate(resolved, cellMap.entries());
        validatedEstimates.add(resolved);
        return resolved;
    }

    /**
     * Runs the three validation stages in order and reports them as the validation phase
     * (one step for the cell map, one for the consolidation file, one per estimate file).
     */
    public void validateAll(List<String> estimateFiles, ProgressSink progress) {
        ProgressSink sink = progress == null ? ProgressSink.none() : progress;
        int n = estimateFiles == null ? 0 : estimateFiles.size();
        if (n == 0) {
            throw new ConsolidationException(ErrorCode.NO_ESTIMATE_FILES, "No estimate files selected.");
        }
        int total = 2 + n;

        sink.onProgress(new ProgressEvent(ConsolidationPhase.VALIDATION, 0, total, "Validating Cell Map..."));
        validateCellMap();
        sink.onProgress(new ProgressEvent(ConsolidationPhase.VALIDATION, 1, total, "Validating consolidation file..."));
        validateConsolidationFile();
        sink.onProgress(new ProgressEvent(ConsolidationPhase.VALIDATION, 2, total,
                "Validating " + n + " estimate file(s)..."));
        for (int i = 0; i < n; i++) {
            Path p = validateEstimateFile(estimateFiles.get(i));
            sink.onProgress(new ProgressEvent(ConsolidationPhase.VALIDATION, 3 + i, total,
                    "Validated estimate file " + (i + 1) + ": " + p.getFileName()));
        }
    }

    /**
     * @return path of the new consolidated workbook
     */
    public Path run(List<String> estimateFiles, ProgressSink progress) {
        if (cellMap == null) {
            throw new ConsolidationException(ErrorCode.PRECONDITION,
                    "Cell Map must be validated first before running consolidation");
        }
        if (!consolidationValidated) {
            throw new ConsolidationException(ErrorCode.PRECONDITION,
                    "Consolidation file must be validated before running consolidation");
        }
        if (estimateFiles != null) {
            for (String f : estimateFiles) {
                Path p = (f == null || f.isBlank()) ? null : InputValidator.sanitize(f, "Estimate");
                if (p == null || !validatedEstimates.contains(p)) {
                    throw new ConsolidationException(ErrorCode.PRECONDITION,
                            "Estimate file must be validated before running consolidation: " + f);
                }
            }
        }
        return engine.run(cellMap, estimateFiles, progress);
    }

    public CellMapTable getCellMap() {
        return cellMap;
    }

    public ConsolidationState getState() {
        return engine.getState();
    }

    public Path getCellMapPath() {
        return cellMapPath;
    }

    public Path getConsolidationPath() {
        return consolidationPath;
    }

    public String getSheetName() {
        return sheetName;
    }
}
