package domain.mapping;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CellMapTableTest {

    private static final List<String> COLS = List.of("Source Sheet", "Source Cell", "Destination Column (Consolidation)");

    private static CellMapTable table(List<?>... rows) {
        return new CellMapTable(COLS, Arrays.asList(rows));
    }

    @Test
    void columnValues_returnsWholeColumnInRowOrder() {
        CellMapTable t = table(
                List.of("Sheet1", "B2", "Cost"),
                List.of("Sheet2", "C3", "Qty"));

        assertEquals(List.of("B2", "C3"), t.columnValues("Source Cell"));
        assertEquals(2, t.rowCount());
        assertEquals(COLS, t.getColumns());
    }

    @Test
    void columnLookup_isExactAfterTrim_andCaseSensitive() {
        CellMapTable t = table(List.of("Sheet1", "B2", "Cost"));

        assertEquals(List.of("Sheet1"), t.columnValues("  Source Sheet "));
        UnknownColumnException e = assertThrows(UnknownColumnException.class, () -> t.columnValues("source sheet"));
        assertEquals("source sheet", e.getColumn());
        assertFalse(t.hasColumn("Source"));
    }

    @Test
    void nullMask_flagsNullAndWhitespaceOnly() {
        CellMapTable t = table(
                Arrays.asList("Sheet1", null, "Cost"),
                List.of("Sheet1", "   ", "Qty"),
                List.of("Sheet1", "B4", "Rate"));

        boolean[][] mask = t.nullMask();
        assertArrayEquals(new boolean[]{false, true, false}, mask[0]);
        assertArrayEquals(new boolean[]{false, true, false}, mask[1]);
        assertArrayEquals(new boolean[]{false, false, false}, mask[2]);
        assertTrue(t.hasBlankCells());
    }

    @Test
    void nullMask_allFalse_whenNoBlankCell() {
        CellMapTable t = table(List.of("Sheet1", "B2", "Cost"), List.of("Sheet1", "B3", 42));
        assertFalse(t.hasBlankCells());
    }

    @Test
    void duplicateMask_flagsOnlyLaterOccurrences() {
        CellMapTable t = table(
                List.of("Sheet1", "B2", "Cost"),
                List.of("Sheet1", "B3", "Cost"),
                List.of("Sheet1", "B2", "Cost"),
                List.of("Sheet1", "B2", "Cost"),
                List.of("Sheet1", "B3", "Qty"));

        assertArrayEquals(new boolean[]{false, false, true, true, false}, t.duplicateMask(COLS));
    }

    @Test
    void duplicateMask_onSubset_ignoresOtherColumns() {
        CellMapTable t = table(
                List.of("Sheet1", "B2", "Cost"),
                List.of("Sheet1", "B2", "Qty"));

        assertArrayEquals(new boolean[]{false, true}, t.duplicateMask(List.of("Source Sheet", "Source Cell")));
        assertArrayEquals(new boolean[]{false, false}, t.duplicateMask(null));
    }

    @Test
    void rowsAreNameAddressable() {
        CellMapTable t = table(List.of("Sheet1", " B2 ", "Cost"));

        CellMapRow row = t.rows().get(0);
        assertEquals(0, row.getIndex());
        assertEquals("B2", row.getString("Source Cell"));
        assertTrue(row.has("Destination Column (Consolidation)"));
        assertThrows(UnknownColumnException.class, () -> row.get("Nope"));

        MappingEntry e = t.entries().get(0);
        assertEquals("Sheet1", e.sourceSheet);
        assertEquals("B2", e.sourceCell);
        assertEquals("Cost", e.destinationColumn);
    }

    @Test
    void rejectsRaggedRowsAndEmptyColumns() {
        assertThrows(IllegalArgumentException.class, () -> table(List.of("Sheet1", "B2")));
        assertThrows(IllegalArgumentException.class, () -> new CellMapTable(List.of(), List.of()));
    }

    @Test
    void equalContent_isEqual() {
        assertEquals(table(List.of("Sheet1", "B2", "Cost")), table(List.of("Sheet1", "B2", "Cost")));
    }

    @Test
    void repeatedColumnName_resolvesToRightmostColumn() {
        CellMapTable t = new CellMapTable(
                List.of("Source Sheet", "Source Cell", "Source Cell", "Destination Column (Consolidation)"),
                List.of(List.of("S1", "A1", "B2", "Cost")));

        assertEquals(List.of("B2"), t.columnValues("Source Cell"));
        assertEquals("B2", t.rows().get(0).getString("Source Cell"));
        assertEquals("B2", t.entries().get(0).sourceCell);
    }
}
