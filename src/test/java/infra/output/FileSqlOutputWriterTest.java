package infra.output;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileSqlOutputWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void should_write_sql_under_group_dirs_and_design_name() throws Exception {
        FileSqlOutputWriter w = new FileSqlOutputWriter(new SqlFileWriter());

        Path out = tempDir.resolve("output");
        String sql = "SELECT *\nFROM A";

        w.write(out, "sales/monthly", "top_customers", sql);

        Path expected = out
                .resolve("sales")
                .resolve("monthly")
                .resolve("top_customers.sql");

        assertTrue(Files.exists(expected), "expected file not found: " + expected);
        assertEquals("SELECT *\nFROM A\n", Files.readString(expected));
    }

    @Test
    void should_write_directly_under_out_when_group_is_empty() throws Exception {
        new FileSqlOutputWriter(null).write(tempDir, "", "d1", "-- No tables selected on canvas => no SELECT.\n");

        assertEquals("-- No tables selected on canvas => no SELECT.\n", Files.readString(tempDir.resolve("d1.sql")));
    }
}
