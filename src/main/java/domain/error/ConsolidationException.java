package domain.error;

/**
 * Fatal error of a validation or consolidation step.
 *
 * <p>The message is meant for the operator: it names the concrete missing or invalid
 * item (column names, sheet name, available sheets...). Stack traces belong in the log.</p>
 */
public class ConsolidationException extends RuntimeException {

    private final ErrorCode code;

    public ConsolidationException(ErrorCode code, String message) {
        super(message);
        this.code = code == null ? ErrorCode.CONSOLIDATION_FAILED : code;
    }

    public ConsolidationException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code == null ? ErrorCode.CONSOLIDATION_FAILED : code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }
}
