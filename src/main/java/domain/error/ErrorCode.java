package domain.error;

/**
 * Standard error codes raised by validation and consolidation.
 *
 * <p>Every code is fatal for the step that raises it. Non-fatal findings go to
 * {@link domain.model.WarningCode} instead.</p>
 */
public enum ErrorCode {

    /** A column name was looked up in the mapping table but is not one of its columns. */
    UNKNOWN_COLUMN(ErrorCategory.SCHEMA),

    EMPTY_PATH(ErrorCategory.INPUT),
    FILE_NOT_FOUND(ErrorCategory.INPUT),
    NOT_A_FILE(ErrorCategory.INPUT),
    UNSUPPORTED_FILE_TYPE(ErrorCategory.INPUT),
    INVALID_SHEET_NAME(ErrorCategory.INPUT),
    NO_ESTIMATE_FILES(ErrorCategory.INPUT),

    /** Cell map workbook could not be read or holds no header row. */
    CELL_MAP_UNREADABLE(ErrorCategory.SCHEMA),
    MISSING_COLUMNS(ErrorCategory.SCHEMA),
    EMPTY_MAPPING_CELLS(ErrorCategory.SCHEMA),
    DUPLICATE_MAPPING(ErrorCategory.SCHEMA),

    /** A step was invoked before the step it depends on. */
    PRECONDITION(ErrorCategory.SCHEMA),
    SHEET_NOT_FOUND(ErrorCategory.SCHEMA),
    INSUFFICIENT_ROWS(ErrorCategory.SCHEMA),
    MISSING_DESTINATION_COLUMNS(ErrorCategory.SCHEMA),
    CELL_NOT_ADDRESSABLE(ErrorCategory.SCHEMA),

    ROW_OUT_OF_RANGE(ErrorCategory.CONFIGURATION),
    DATA_ROW_NOT_AFTER_HEADER(ErrorCategory.CONFIGURATION),

    WORKBOOK_UNREADABLE(ErrorCategory.RUNTIME),
    CONSOLIDATION_FAILED(ErrorCategory.RUNTIME);

    private final ErrorCategory category;

    ErrorCode(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
