package domain.convert;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SqlImporterTest {

    private final SqlImporter importer = new SqlImporter();

    @Test
    void plain_statement_is_kept_as_body() {
        SqlImporter.ImportedSql r = importer.split("  SELECT * FROM t  ");

        assertTrue(r.getCtes().isEmpty());
        assertEquals("SELECT * FROM t", r.getBody());
    }

    @Test
    void leading_ctes_are_split_off() {
        String sql = "WITH a AS (SELECT (1) AS x), b (x) AS (\n  SELECT x FROM a -- )\n)\nSELECT * FROM b";

        SqlImporter.ImportedSql r = importer.split(sql);

        assertEquals(2, r.getCtes().size());
        assertEquals("a", r.getCtes().get(0).getName());
        assertEquals("SELECT (1) AS x", r.getCtes().get(0).getBody());
        assertEquals("b (x)", r.getCtes().get(1).getName());
        assertEquals("SELECT x FROM a -- )", r.getCtes().get(1).getBody());
        assertEquals("SELECT * FROM b", r.getBody());
    }

    @Test
    void malformed_with_block_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> importer.split("WITH a (SELECT 1) SELECT 1"));
        assertThrows(IllegalArgumentException.class, () -> importer.split("WITH a AS (SELECT 1"));
        assertThrows(IllegalArgumentException.class, () -> importer.split("WITH a AS (SELECT 1)"));
        assertThrows(IllegalArgumentException.class, () -> importer.split("   "));
    }
}
