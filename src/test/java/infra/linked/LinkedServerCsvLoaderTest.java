package infra.linked;

import domain.model.LinkedServerMap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LinkedServerCsvLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loads_alias_to_linked_server() throws Exception {
        Path csv = tempDir.resolve("linked.csv");
        Files.writeString(csv, "\uFEFFlinkedServer,alias\n LS1 , X \n,Y\nLS3,Z\n", StandardCharsets.UTF_8);

        LinkedServerMap m = new LinkedServerCsvLoader().load(csv);

        assertEquals(2, m.size());
        assertEquals("LS1", m.find("X"));
        assertNull(m.find("Y"));
        assertEquals("LS3", m.find("Z"));
    }

    @Test
    void korean_headers_are_accepted() throws Exception {
        Path csv = tempDir.resolve("linked_ko.csv");
        Files.writeString(csv, "별칭,링크드서버\nX,LS1\n", StandardCharsets.UTF_8);

        assertEquals("LS1", new LinkedServerCsvLoader().load(csv).find("X"));
    }

    @Test
    void missing_file_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new LinkedServerCsvLoader().load(tempDir.resolve("none.csv")));
    }
}
