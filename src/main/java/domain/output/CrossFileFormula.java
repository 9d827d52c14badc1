package domain.output;

import java.nio.file.Path;

/**
 * Text of an external-workbook cell reference.
 *
 * <pre>
 * ='&lt;directory&gt;\[&lt;file name&gt;]&lt;sheet&gt;'!&lt;cell&gt;
 * </pre>
 *
 * Only the text is produced; nothing here evaluates it.
 */
public final class CrossFileFormula {

    private CrossFileFormula() {
    }

    /**
     * @param estimateFile absolute path of the estimate workbook
     */
    public static String build(Path estimateFile, String sourceSheet, String sourceCell) {
        Path parent = estimateFile.getParent();
        String dir = parent == null ? "" : parent.toString();
        String fileName = String.valueOf(estimateFile.getFileName());
        return "='" + dir + "\\[" + fileName + "]" + sourceSheet + "'!" + sourceCell.trim();
    }

    /** Formula text as stored in a cell, i.e. without the leading '='. */
    public static String stripEquals(String formula) {
        if (formula == null) return "";
        String f = formula.trim();
        return f.startsWith("=") ? f.substring(1) : f;
    }
}
