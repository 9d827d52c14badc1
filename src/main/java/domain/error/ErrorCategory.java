package domain.error;

/**
 * Coarse error families.
 *
 * <p>INPUT: bad path / file type. SCHEMA: cell map or workbook content does not match.
 * CONFIGURATION: row settings out of range. RUNTIME: unexpected failure while reading or saving.</p>
 */
public enum ErrorCategory {
    INPUT,
    SCHEMA,
    CONFIGURATION,
    RUNTIME
}
