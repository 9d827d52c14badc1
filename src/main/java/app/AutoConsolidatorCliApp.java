package app;

import cli.AutoConsolidatorCli;
import cli.CliArgParser;
import cli.CliPathResolver;
import domain.error.ConsolidationException;
import domain.model.ConsolidationConfig;
import domain.model.ConsolidationWarning;
import domain.model.ConsolidationWarningSink;
import domain.model.ListConsolidationWarningSink;
import domain.model.ProgressSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** CLI entry (invoked by {@link AutoConsolidatorCli}). */
public final class AutoConsolidatorCliApp {

    private static final Logger log = LoggerFactory.getLogger(AutoConsolidatorCliApp.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    private AutoConsolidatorCliApp() {}

    /**
     * @return process exit code
     */
    public static int run(String[] args, PrintStream out) {
        return run(args, out, Clock.systemDefaultZone());
    }

    static int run(String[] args, PrintStream out, Clock clock) {
        long t0 = System.nanoTime();
        Map<String, String> argv = CliArgParser.parseArgs(args);

        if (argv.containsKey("help") || argv.containsKey("h")) {
            printUsage(out);
            return EXIT_OK;
        }

        // ------------------------------------------------------------
        // options -> config
        // ------------------------------------------------------------
        ConsolidationConfig config;
        List<String> estimates;
        try {
            Path baseDir = CliPathResolver.resolveBaseDir(argv);

            String cellMapRaw = CliArgParser.value(argv, "cellMap");
            String cellMap = (cellMapRaw == null)
                    ? CliPathResolver.findDefaultCellMap(baseDir, ConsolidationConfig.DEFAULT_CELL_MAP_FILENAME)
                    : CliPathResolver.resolvePath(baseDir, cellMapRaw);
            String consolidation = CliPathResolver.resolvePath(baseDir, CliArgParser.value(argv, "consolidation"));

            String sheet = CliArgParser.value(argv, "sheet");
            config = ConsolidationConfig.builder()
                    .cellMapPath(cellMap)
                    .consolidationPath(consolidation)
                    .consolidationSheetName(sheet == null ? ConsolidationConfig.DEFAULT_SHEET_NAME : sheet)
                    .headerRow(CliArgParser.parseInt(CliArgParser.value(argv, "headerRow"),
                            ConsolidationConfig.DEFAULT_HEADER_ROW))
                    .dataStartRow(CliArgParser.parseInt(CliArgParser.value(argv, "dataStartRow"),
                            ConsolidationConfig.DEFAULT_DATA_START_ROW))
                    .clearExistingData(CliArgParser.flag(argv, "clear", true))
                    .maxFileSizeMb(CliArgParser.parseInt(CliArgParser.value(argv, "maxFileSizeMb"),
                            ConsolidationConfig.DEFAULT_MAX_FILE_SIZE_MB))
                    .maxBlankRowsBeforeStop(CliArgParser.parseInt(CliArgParser.value(argv, "maxBlankRows"),
                            ConsolidationConfig.DEFAULT_MAX_BLANK_ROWS_BEFORE_STOP))
                    .build();

            estimates = collectEstimates(argv, baseDir);

            out.println("==================================================");
            out.println("[START] Auto consolidation");
            out.println("[CONF] baseDir        = " + baseDir);
            out.println("[CONF] cellMap        = " + config.getCellMapPath());
            out.println("[CONF] consolidation  = " + config.getConsolidationPath());
            out.println("[CONF] sheet          = " + config.getConsolidationSheetName());
            out.println("[CONF] headerRow      = " + config.getHeaderRow());
            out.println("[CONF] dataStartRow   = " + config.getDataStartRow());
            out.println("[CONF] clear          = " + config.isClearExistingData() + " (use --clear=false)");
            out.println("[CONF] maxFileSizeMb  = " + config.getMaxFileSizeMb());
            out.println("[CONF] maxBlankRows   = " + config.getMaxBlankRowsBeforeStop());
            out.println("[CONF] estimates      = " + estimates.size());
            out.println("==================================================");

            if (estimates.isEmpty()) {
                throw new IllegalArgumentException("Please add at least one estimate spreadsheet (--estimates or --estimateDir).");
            }
            config.validateRows();
        } catch (IllegalArgumentException | IOException e) {
            out.println("[ERROR] " + e.getMessage());
            printUsage(out);
            return EXIT_USAGE;
        } catch (ConsolidationException e) {
            out.println("[ERROR] " + e.getMessage());
            return EXIT_USAGE;
        }

        // ------------------------------------------------------------
        // validate + run
        // ------------------------------------------------------------
        List<ConsolidationWarning> warnings = new ArrayList<>();
        ConsolidationWarningSink warningSink = new ListConsolidationWarningSink(warnings);
        ConsolidatorComponentsFactory factory = new ConsolidatorComponentsFactory(log, clock);
        ProgressSink progress = factory.createProgressSink(out);

        try {
            ExcelConsolidator consolidator = factory.createConsolidator(config, warningSink);

            long tVal0 = System.nanoTime();
            out.println("[STEP1] validating cell map, consolidation file and " + estimates.size() + " estimate file(s)...");
            consolidator.validateAll(estimates, progress);
            out.println("[STEP1] validation done. mappings=" + consolidator.getCellMap().rowCount()
                    + ", elapsed=" + ms(tVal0) + "ms");

            long tRun0 = System.nanoTime();
            out.println("[STEP2] consolidating...");
            Path output = consolidator.run(estimates, progress);
            out.println("[STEP2] consolidation done. elapsed=" + ms(tRun0) + "ms");

            printWarnings(out, warnings);
            out.println("==================================================");
            out.println("[DONE] Consolidation complete! Output saved as: " + output);
            out.println("[DONE] totalElapsed=" + ms(t0) + "ms");
            out.println("==================================================");
            return EXIT_OK;

        } catch (ConsolidationException e) {
            log.error("Validation or consolidation error [{}]: {}", e.getCode(), e.getMessage());
            printWarnings(out, warnings);
            out.println("[ERROR] " + e.getMessage());
            return EXIT_FAILED;
        } catch (RuntimeException e) {
            String msg = "A critical error occurred: " + e.getClass().getSimpleName() + " - " + e.getMessage();
            log.error(msg, e);
            out.println("[ERROR] " + msg);
            return EXIT_FAILED;
        }
    }

    private static List<String> collectEstimates(Map<String, String> argv, Path baseDir) throws IOException {
        List<String> raw = new ArrayList<>(CliArgParser.parseList(CliArgParser.value(argv, "estimates")));
        raw.addAll(CliArgParser.parseList(argv.get(CliArgParser.POSITIONAL)));

        String dir = CliArgParser.value(argv, "estimateDir");
        if (dir != null) {
            raw.addAll(CliPathResolver.listEstimateFiles(Path.of(CliPathResolver.resolvePath(baseDir, dir))));
        }

        List<String> resolved = new ArrayList<>(raw.size());
        for (String r : raw) {
            resolved.add(CliPathResolver.resolvePath(baseDir, r));
        }
        return CliPathResolver.dedupe(resolved);
    }

    private static void printWarnings(PrintStream out, List<ConsolidationWarning> warnings) {
        out.println("[STAT] warnings=" + warnings.size());
        for (ConsolidationWarning w : warnings) {
            out.println("[WARN] " + w);
        }
    }

    private static void printUsage(PrintStream out) {
        out.println("usage: auto-consolidator --consolidation <file> --estimates <a.xlsx,b.xlsx> [options] [estimate ...]");
        out.println("  --cellMap <file>        cell map workbook (default: \"" + ConsolidationConfig.DEFAULT_CELL_MAP_FILENAME
                + "\" in baseDir or next to the jar)");
        out.println("  --estimateDir <dir>     add every spreadsheet in <dir>, sorted by name");
        out.println("  --sheet <name>          consolidation sheet (default: " + ConsolidationConfig.DEFAULT_SHEET_NAME + ")");
        out.println("  --headerRow <n>         header row, 1-based (default: " + ConsolidationConfig.DEFAULT_HEADER_ROW + ")");
        out.println("  --dataStartRow <n>      first data row, 1-based (default: " + ConsolidationConfig.DEFAULT_DATA_START_ROW + ")");
        out.println("  --clear[=true|false]    clear existing data rows first (default: true)");
        out.println("  --maxFileSizeMb <n>     warn above this size (default: " + ConsolidationConfig.DEFAULT_MAX_FILE_SIZE_MB + ")");
        out.println("  --maxBlankRows <n>      stop clearing after more than n blank rows (default: "
                + ConsolidationConfig.DEFAULT_MAX_BLANK_ROWS_BEFORE_STOP + ")");
        out.println("  --baseDir <dir>         base for relative paths (default: working directory)");
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }
}
