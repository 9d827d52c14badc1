package domain.model;

/**
 * Standard warning codes for consolidation.
 *
 * <p>Keep the set small and stable. Warnings never stop a run.</p>
 */
public enum WarningCode {

    /**
     * Input file is larger than the configured size ceiling. Processing continues.
     */
    LARGE_FILE,

    /**
     * Mapping entry skipped while writing because its destination column is not in the header.
     */
    DESTINATION_COLUMN_NOT_FOUND,

    /**
     * The timestamped output name already existed; a numeric suffix was appended.
     */
    OUTPUT_NAME_COLLISION
}
