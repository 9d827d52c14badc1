package domain.model;

/**
 * A single non-fatal finding of a validation or consolidation step.
 */
public final class ConsolidationWarning {

    private final WarningCode code;
    private final String file;
    private final String message;
    private final String detail;

    public ConsolidationWarning(WarningCode code, String file, String message, String detail) {
        this.code = code == null ? WarningCode.LARGE_FILE : code;
        this.file = nullToEmpty(file);
        this.message = nullToEmpty(message);
        this.detail = nullToEmpty(detail);
    }

    public static ConsolidationWarning of(WarningCode code, String file, String message) {
        return new ConsolidationWarning(code, file, message, "");
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public WarningCode getCode() {
        return code;
    }

    public String getFile() {
        return file;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return code + " " + (file.isEmpty() ? "" : file + ": ") + message
                + (detail.isEmpty() ? "" : " (" + detail + ")");
    }
}
