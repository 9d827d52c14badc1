package cli;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CliArgParserTest {

    @Test
    void parseArgs_supportsEqualsSpaceFlagAndPositional() {
        Map<String, String> m = CliArgParser.parseArgs(new String[]{
                "--sheet=Summary", "--headerRow", "3", "--clear", "--consolidation", "c.xlsx", "a.xlsx", "b.xlsx"});

        assertEquals("Summary", m.get("sheet"));
        assertEquals("3", m.get("headerRow"));
        assertEquals("", m.get("clear"));
        assertEquals("c.xlsx", m.get("consolidation"));
        assertEquals("a.xlsx;b.xlsx", m.get(CliArgParser.POSITIONAL));
    }

    @Test
    void flag_presenceAndExplicitValues() {
        assertTrue(CliArgParser.flag(Map.of("clear", ""), "clear", false));
        assertFalse(CliArgParser.flag(Map.of("clear", "false"), "clear", true));
        assertTrue(CliArgParser.flag(Map.of(), "clear", true));
    }

    @Test
    void parseInt_defaultsAndRejectsGarbage() {
        assertEquals(4, CliArgParser.parseInt(null, 4));
        assertEquals(7, CliArgParser.parseInt(" 7 ", 4));
        assertThrows(IllegalArgumentException.class, () -> CliArgParser.parseInt("seven", 4));
    }

    @Test
    void parseList_splitsOnCommaAndSemicolon() {
        assertEquals(List.of("a.xlsx", "b.xlsx", "c.xlsx"), CliArgParser.parseList(" a.xlsx, ;b.xlsx;c.xlsx "));
        assertTrue(CliArgParser.parseList(null).isEmpty());
    }

    @Test
    void dedupe_keepsFirstOccurrenceOrder() {
        assertEquals(List.of("b", "a"), CliPathResolver.dedupe(List.of("b", "a", "b")));
    }

    @Test
    void bareClearFlag_doesNotSwallowTheNextEstimate() {
        Map<String, String> m = CliArgParser.parseArgs(new String[]{"--clear", "a.xlsx", "--help", "b.xlsx"});

        assertEquals("", m.get("clear"));
        assertEquals("", m.get("help"));
        assertEquals("a.xlsx;b.xlsx", m.get(CliArgParser.POSITIONAL));
        assertTrue(CliArgParser.flag(m, "clear", false));
    }

    @Test
    void clearFlag_takesAValueOnlyThroughEquals() {
        Map<String, String> m = CliArgParser.parseArgs(new String[]{"--clear=false", "a.xlsx"});

        assertFalse(CliArgParser.flag(m, "clear", true));
        assertEquals("a.xlsx", m.get(CliArgParser.POSITIONAL));
    }
}
