package cli;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CliArgParserTest {

    @Test
    void parses_equals_space_and_bare_flags() {
        Map<String, String> m = CliArgParser.parseArgs(new String[]{
                "--designs=designs/sales", "--out", "output/sql", "--failFast", "--max", "3", "stray"
        });

        assertEquals("designs/sales", m.get("designs"));
        assertEquals("output/sql", m.get("out"));
        assertEquals("", m.get("failFast"));
        assertEquals("3", m.get("max"));
        assertFalse(m.containsKey("stray"));
    }

    @Test
    void flag_is_presence_style() {
        Map<String, String> m = CliArgParser.parseArgs(new String[]{"--noResult", "--noSqlOut=false"});

        assertTrue(CliArgParser.flag(m, "noResult"));
        assertFalse(CliArgParser.flag(m, "noSqlOut"));
        assertFalse(CliArgParser.flag(m, "noValidate"));
    }

    @Test
    void numbers_fall_back_to_default() {
        assertEquals(7, CliArgParser.parseInt("x", 7));
        assertEquals(12, CliArgParser.parseInt(" 12 ", 7));
        assertEquals(500L, CliArgParser.parseLong(null, 500L));
        assertTrue(CliArgParser.parseBoolean("Y", false));
    }
}
