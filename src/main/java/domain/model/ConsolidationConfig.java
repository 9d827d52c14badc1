package domain.model;

import domain.error.ConsolidationException;
import domain.error.ErrorCode;

/**
 * Settings of one consolidation run. Built once from user input, immutable afterwards.
 *
 * <p>Rows are 1-based, as the operator sees them in the spreadsheet.</p>
 */
public final class ConsolidationConfig {

    public static final String DEFAULT_SHEET_NAME = "General Consolidation";
    public static final int DEFAULT_HEADER_ROW = 4;
    public static final int DEFAULT_DATA_START_ROW = 5;
    public static final int DEFAULT_MAX_FILE_SIZE_MB = 50;
    public static final int DEFAULT_MAX_BLANK_ROWS_BEFORE_STOP = 20;
    public static final String DEFAULT_CELL_MAP_FILENAME = "Cell Map.xlsx";

    public static final int MIN_ROW_NUMBER = 1;
    public static final int MAX_ROW_NUMBER = 1000;

    private final String cellMapPath;
    private final String consolidationPath;
    private final String consolidationSheetName;
    private final int headerRow;
    private final int dataStartRow;
    private final boolean clearExistingData;
    private final int maxFileSizeMb;
    private final int maxBlankRowsBeforeStop;

    private ConsolidationConfig(Builder b) {
        this.cellMapPath = b.cellMapPath;
        this.consolidationPath = b.consolidationPath;
        this.consolidationSheetName = b.consolidationSheetName;
        this.headerRow = b.headerRow;
        this.dataStartRow = b.dataStartRow;
        this.clearExistingData = b.clearExistingData;
        this.maxFileSizeMb = b.maxFileSizeMb;
        this.maxBlankRowsBeforeStop = b.maxBlankRowsBeforeStop;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Checks both rows are within 1..1000 and that data starts after the header.
     *
     * @throws ConsolidationException ROW_OUT_OF_RANGE or DATA_ROW_NOT_AFTER_HEADER
     */
    public void validateRows() {
        checkRow(headerRow, "Header row");
        checkRow(dataStartRow, "Data start row");
        if (dataStartRow <= headerRow) {
            throw new ConsolidationException(ErrorCode.DATA_ROW_NOT_AFTER_HEADER,
                    "Data start row must be after the header row (header row=" + headerRow
                            + ", data start row=" + dataStartRow + ")");
        }
    }

    private static void checkRow(int value, String label) {
        if (value < MIN_ROW_NUMBER || value > MAX_ROW_NUMBER) {
            throw new ConsolidationException(ErrorCode.ROW_OUT_OF_RANGE,
                    label + " must be between " + MIN_ROW_NUMBER + " and " + MAX_ROW_NUMBER + " (got " + value + ")");
        }
    }

    public String getCellMapPath() {
        return cellMapPath;
    }

    public String getConsolidationPath() {
        return consolidationPath;
    }

    public String getConsolidationSheetName() {
        return consolidationSheetName;
    }

    public int getHeaderRow() {
        return headerRow;
    }

    public int getDataStartRow() {
        return dataStartRow;
    }

    public boolean isClearExistingData() {
        return clearExistingData;
    }

    public int getMaxFileSizeMb() {
        return maxFileSizeMb;
    }

    public int getMaxBlankRowsBeforeStop() {
        return maxBlankRowsBeforeStop;
    }

    @Override
    public String toString() {
        return "ConsolidationConfig{" +
                "cellMapPath='" + cellMapPath + '\'' +
                ", consolidationPath='" + consolidationPath + '\'' +
                ", sheet='" + consolidationSheetName + '\'' +
                ", headerRow=" + headerRow +
                ", dataStartRow=" + dataStartRow +
                ", clearExistingData=" + clearExistingData +
                ", maxFileSizeMb=" + maxFileSizeMb +
                ", maxBlankRowsBeforeStop=" + maxBlankRowsBeforeStop +
                '}';
    }

    public static final class Builder {

        private String cellMapPath = "";
        private String consolidationPath = "";
        private String consolidationSheetName = DEFAULT_SHEET_NAME;
        private int headerRow = DEFAULT_HEADER_ROW;
        private int dataStartRow = DEFAULT_DATA_START_ROW;
        private boolean clearExistingData = true;
        private int maxFileSizeMb = DEFAULT_MAX_FILE_SIZE_MB;
        private int maxBlankRowsBeforeStop = DEFAULT_MAX_BLANK_ROWS_BEFORE_STOP;

        private Builder() {
        }

        public Builder cellMapPath(String v) {
            this.cellMapPath = v == null ? "" : v;
            return this;
        }

        public Builder consolidationPath(String v) {
            this.consolidationPath = v == null ? "" : v;
            return this;
        }

        public Builder consolidationSheetName(String v) {
            this.consolidationSheetName = v == null ? "" : v;
            return this;
        }

        public Builder headerRow(int v) {
            this.headerRow = v;
            return this;
        }

        public Builder dataStartRow(int v) {
            this.dataStartRow = v;
            return this;
        }

        public Builder clearExistingData(boolean v) {
            this.clearExistingData = v;
            return this;
        }

        public Builder maxFileSizeMb(int v) {
            this.maxFileSizeMb = v;
            return this;
        }

        public Builder maxBlankRowsBeforeStop(int v) {
            if (v < 1) throw new IllegalArgumentException("maxBlankRowsBeforeStop must be >= 1");
            this.maxBlankRowsBeforeStop = v;
            return this;
        }

        public ConsolidationConfig build() {
            return new ConsolidationConfig(this);
        }
    }
}
