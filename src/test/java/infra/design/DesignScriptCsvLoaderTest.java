package infra.design;

import domain.design.DesignCommand;
import domain.design.DesignScript;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DesignScriptCsvLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loads_commands_skipping_comments_and_blank_rows() throws Exception {
        Path csv = tempDir.resolve("top_customers.csv");
        Files.writeString(csv, "\uFEFFcommand,arg1,arg2,arg3,arg4\n"
                + "addNode,A,\"id,name\",,\n"
                + "# note,,,,\n"
                + "\n"
                + ",,,,\n"
                + "addCte,c,\"SELECT id\n  FROM A\",,\n", StandardCharsets.UTF_8);

        DesignScript s = new DesignScriptCsvLoader().load(csv, "sales");

        assertEquals("sales", s.getGroup());
        assertEquals("top_customers", s.getName());
        assertEquals(2, s.getCommands().size());

        DesignCommand first = s.getCommands().get(0);
        assertEquals("addNode", first.getName());
        assertEquals(2, first.getLineNo());
        assertEquals("id,name", first.arg(1));

        assertEquals("SELECT id\n  FROM A", s.getCommands().get(1).rawArg(1));
    }

    @Test
    void korean_headers_map_to_columns() throws Exception {
        Path csv = tempDir.resolve("k.csv");
        Files.writeString(csv, "인자1,명령\nA,removeNode\n", StandardCharsets.UTF_8);

        DesignScript s = new DesignScriptCsvLoader().load(csv, "");

        assertEquals("removeNode", s.getCommands().get(0).getName());
        assertEquals("A", s.getCommands().get(0).arg(0));
    }

    @Test
    void header_only_file_is_empty() throws Exception {
        Path csv = tempDir.resolve("empty.csv");
        Files.writeString(csv, "command,arg1\n", StandardCharsets.UTF_8);

        assertTrue(new DesignScriptCsvLoader().load(csv, "").isEmpty());
    }
}
