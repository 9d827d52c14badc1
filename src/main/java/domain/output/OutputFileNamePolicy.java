package domain.output;

import domain.error.ConsolidationException;
import domain.error.ErrorCode;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * File naming policy for the consolidated workbook.
 * <p>
 * Consolidation_AutoLinked_&lt;yyyyMMdd_HHmmss&gt;&lt;ext&gt;
 * e.g. Consolidation_AutoLinked_20261017_143005.xlsx
 * <p>
 * NOTE:
 * - placed next to the input consolidation file, which is never overwritten
 * - ext follows the input file (.xlsm keeps its macros container, .xls stays binary)
 * - a name that already exists gets _2, _3 ... appended; when _999 is taken too, resolving fails
 */
public final class OutputFileNamePolicy {

    public static final String PREFIX = "Consolidation_AutoLinked_";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss", Locale.ROOT);
    private static final int MAX_SUFFIX = 999;

    private OutputFileNamePolicy() {
    }

    /**
     * Build output filename: Consolidation_AutoLinked_&lt;timestamp&gt;&lt;ext&gt;
     */
    public static String build(LocalDateTime saveTime, String extension) {
        return PREFIX + TIMESTAMP.format(saveTime) + normalizeExtension(extension);
    }

    /**
     * First free path for {@code saveTime} in {@code dir}.
     *
     * @throws ConsolidationException CONSOLIDATION_FAILED when every suffix up to _999 is taken
     */
    public static Path resolve(Path dir, LocalDateTime saveTime, String extension) {
        String ext = normalizeExtension(extension);
        String stem = PREFIX + TIMESTAMP.format(saveTime);

        Path candidate = dir.resolve(stem + ext);
        for (int n = 2; Files.exists(candidate); n++) {
            if (n > MAX_SUFFIX) {
                throw new ConsolidationException(ErrorCode.CONSOLIDATION_FAILED,
                        "No free output file name for " + stem + ext + " in " + dir
                                + " (suffixes _2.._" + MAX_SUFFIX + " are taken)");
            }
            candidate = dir.resolve(stem + "_" + n + ext);
        }
        return candidate;
    }

    private static String normalizeExtension(String extension) {
        String e = extension == null ? "" : extension.trim().toLowerCase(Locale.ROOT);
        if (e.isEmpty()) return ".xlsx";
        return e.startsWith(".") ? e : "." + e;
    }
}
