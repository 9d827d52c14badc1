package infra.workbook;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Destination header index: trimmed header text of the header row to its 1-based column.
 *
 * <p>Blank header cells are not indexed. When the same text appears twice the rightmost
 * column wins.</p>
 */
public final class HeaderIndex {

    private final List<String> headerTexts;
    private final Map<String, Integer> positions;

    private HeaderIndex(List<String> headerTexts, Map<String, Integer> positions) {
        this.headerTexts = Collections.unmodifiableList(headerTexts);
        this.positions = Collections.unmodifiableMap(positions);
    }

    /**
     * @param headerRow 1-based header row
     */
    public static HeaderIndex read(Sheet sheet, int headerRow) {
        List<String> texts = new ArrayList<>();
        Map<String, Integer> positions = new LinkedHashMap<>();

        Row row = sheet.getRow(headerRow - 1);
        if (row != null && row.getLastCellNum() > 0) {
            for (int c = 0; c < row.getLastCellNum(); c++) {
                Cell cell = row.getCell(c);
                String t = CellTexts.text(cell);
                texts.add(t);
                if (!t.isEmpty()) positions.put(t, c + 1);
            }
        }
        return new HeaderIndex(texts, positions);
    }

    /** Trimmed text of every header cell from column A on, blank for empty cells. */
    public List<String> getHeaderTexts() {
        return headerTexts;
    }

    public boolean contains(String name) {
        return name != null && positions.containsKey(name.trim());
    }

    /** 1-based column, or -1 when absent. */
    public int positionOf(String name) {
        if (name == null) return -1;
        Integer p = positions.get(name.trim());
        return p == null ? -1 : p;
    }

    public int size() {
        return positions.size();
    }
}
