package domain.consolidate;

/**
 * Lifecycle of one run: IDLE -> CLEARING (optional) -> WRITING -> SAVING -> DONE,
 * any failure -> FAILED. The in-memory workbook is only persisted in SAVING.
 */
public enum ConsolidationState {
    IDLE,
    CLEARING,
    WRITING,
    SAVING,
    DONE,
    FAILED;

    public boolean isRunning() {
        return this == CLEARING || this == WRITING || this == SAVING;
    }
}
