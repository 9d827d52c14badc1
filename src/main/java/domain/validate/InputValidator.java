package domain.validate;

import domain.error.ConsolidationException;
import domain.error.ErrorCode;
import domain.model.ConsolidationWarning;
import domain.model.ConsolidationWarningSink;
import domain.model.WarningCode;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * Path, file-size and sheet-name checks applied to every user supplied input.
 */
public final class InputValidator {

    public static final List<String> SPREADSHEET_EXTENSIONS = List.of(".xlsx", ".xlsm", ".xls");
    public static final int MAX_SHEET_NAME_LENGTH = 31;

    private static final char[] INVALID_SHEET_CHARS = {'\\', '/', '*', '[', ']', ':', '?'};
    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final Logger log;
    private final ConsolidationWarningSink warningSink;

    public InputValidator(Logger log, ConsolidationWarningSink warningSink) {
        this.log = log;
        this.warningSink = warningSink == null ? ConsolidationWarningSink.none() : warningSink;
    }

    /**
     * Resolves a user supplied path to an existing spreadsheet file.
     *
     * @param rawPath  path as typed / selected by the user
     * @param fileType label used in messages ("Cell Map", "Consolidation", "Estimate")
     * @return absolute, normalized path
     */
    public Path resolvePath(String rawPath, String fileType) {
        if (rawPath == null || rawPath.isBlank()) {
            throw new ConsolidationException(ErrorCode.EMPTY_PATH, fileType + " path cannot be empty");
        }

        Path path = sanitize(rawPath, fileType);

        if (!Files.exists(path)) {
            throw new ConsolidationException(ErrorCode.FILE_NOT_FOUND, fileType + " not found: " + path);
        }
        if (!Files.isRegularFile(path)) {
            throw new ConsolidationException(ErrorCode.NOT_A_FILE, "Path is not a file: " + path);
        }

        String ext = extension(path);
        if (!SPREADSHEET_EXTENSIONS.contains(ext)) {
            throw new ConsolidationException(ErrorCode.UNSUPPORTED_FILE_TYPE,
                    "Invalid file type. Expected Excel file (" + String.join(", ", SPREADSHEET_EXTENSIONS)
                            + "), got: " + (ext.isEmpty() ? "<none>" : ext));
        }
        return path;
    }

    /**
     * Absolute path with every literal {@code ..} segment dropped. No existence check.
     */
    public static Path sanitize(String rawPath, String fileType) {
        try {
            Path p = Paths.get(rawPath.trim());
            Path out = p.getRoot();
            for (Path name : p) {
                if (name.toString().equals("..")) continue;
                out = (out == null) ? name : out.resolve(name);
            }
            if (out == null) {
                throw new ConsolidationException(ErrorCode.EMPTY_PATH, fileType + " path cannot be empty");
            }
            return out.toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new ConsolidationException(ErrorCode.FILE_NOT_FOUND,
                    "Invalid " + fileType + " path '" + rawPath + "': " + e.getMessage(), e);
        }
    }

    /**
     * @return false (and a LARGE_FILE warning) when the file exceeds {@code maxMb}; true when it
     * fits or its size cannot be read
     */
    public boolean checkFileSize(Path path, int maxMb) {
        long size;
        try {
            size = Files.size(path);
        } catch (IOException | SecurityException e) {
            log.debug("Cannot read size of {}, assuming it is acceptable: {}", path, e.toString());
            return true;
        }

        if (size > maxMb * BYTES_PER_MB) {
            String mb = String.format(Locale.ROOT, "%.1fMB", size / (double) BYTES_PER_MB);
            log.warn("Large file detected: {} ({})", path.getFileName(), mb);
            warningSink.warn(new ConsolidationWarning(WarningCode.LARGE_FILE,
                    String.valueOf(path.getFileName()), "Large file detected", mb + " > " + maxMb + "MB"));
            return false;
        }
        return true;
    }

    /**
     * Spreadsheet sheet-name rule: not blank, none of {@code \ / * [ ] : ?}, at most 31 characters
     * once trimmed.
     *
     * @return the trimmed name
     */
    public static String validateSheetName(String name) {
        if (name == null || name.isBlank()) {
            throw new ConsolidationException(ErrorCode.INVALID_SHEET_NAME, "Sheet name cannot be empty");
        }
        for (char c : INVALID_SHEET_CHARS) {
            if (name.indexOf(c) >= 0) {
                throw new ConsolidationException(ErrorCode.INVALID_SHEET_NAME,
                        "Sheet name '" + name + "' contains invalid character '" + c + "'");
            }
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_SHEET_NAME_LENGTH) {
            throw new ConsolidationException(ErrorCode.INVALID_SHEET_NAME,
                    "Sheet name cannot exceed " + MAX_SHEET_NAME_LENGTH + " characters: '" + trimmed + "'");
        }
        return trimmed;
    }

    public static String extension(Path path) {
        Path fn = path.getFileName();
        String name = fn == null ? "" : fn.toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }

    /** File name without its extension. */
    public static String baseName(Path path) {
        Path fn = path.getFileName();
        String name = fn == null ? "" : fn.toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }
}
