package domain.consolidate;

/** Outcome of the clearing pass. Rows are 1-based. */
public final class ClearingResult {

    private final int rowsCleared;
    private final int lastRowScanned;
    private final boolean stoppedEarly;

    public ClearingResult(int rowsCleared, int lastRowScanned, boolean stoppedEarly) {
        this.rowsCleared = rowsCleared;
        this.lastRowScanned = lastRowScanned;
        this.stoppedEarly = stoppedEarly;
    }

    public int getRowsCleared() {
        return rowsCleared;
    }

    /** 0 when nothing was scanned. */
    public int getLastRowScanned() {
        return lastRowScanned;
    }

    /** True when the blank-row threshold ended the scan before the sheet's last row. */
    public boolean isStoppedEarly() {
        return stoppedEarly;
    }

    @Override
    public String toString() {
        return "ClearingResult{rowsCleared=" + rowsCleared + ", lastRowScanned=" + lastRowScanned
                + ", stoppedEarly=" + stoppedEarly + '}';
    }
}
