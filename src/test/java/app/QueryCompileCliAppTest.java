package app;

import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class QueryCompileCliAppTest {

    @TempDir
    Path tempDir;

    @Test
    void compiles_every_design_and_writes_report() throws Exception {
        Path designs = Files.createDirectories(tempDir.resolve("designs").resolve("sales"));
        Files.writeString(designs.resolve("customers.csv"),
                "command,arg1,arg2,arg3,arg4\n"
                        + "addNode,X.db1.A,\"id,name\",,\n"
                        + "addNode,B,\"id,aid\",,\n"
                        + "addJoin,X.db1.A,B,INNER,X.db1.A.id=B.aid\n"
                        + "selectColumns,X.db1.A,\"id,name\",,\n",
                StandardCharsets.UTF_8);
        Files.writeString(designs.resolve("broken.csv"),
                "command,arg1,arg2\naddNode,A,id\nremoveNode,Z,\n", StandardCharsets.UTF_8);
        Files.writeString(designs.resolve("empty.csv"), "command,arg1\n", StandardCharsets.UTF_8);

        Path linked = tempDir.resolve("linked.csv");
        Files.writeString(linked, "alias,linkedServer\nX,LS1\n", StandardCharsets.UTF_8);

        Path out = tempDir.resolve("out");
        Path result = tempDir.resolve("result.xlsx");

        int skip = QueryCompileCliApp.run(new String[]{
                "--designs", tempDir.resolve("designs").toString(),
                "--linked", linked.toString(),
                "--out", out.toString(),
                "--result", result.toString(),
                "--slowMs", "600000"
        });

        assertEquals(2, skip);

        Path sql = out.resolve("sales").resolve("customers.sql");
        assertEquals("SELECT X.db1.A.id, X.db1.A.name\n"
                + "FROM [LS1].[db1].dbo.[A]\n"
                + "INNER JOIN B ON X.db1.A.id=B.aid\n", Files.readString(sql));
        assertFalse(Files.exists(out.resolve("sales").resolve("broken.sql")));

        try (InputStream is = Files.newInputStream(result); Workbook wb = new XSSFWorkbook(is)) {
            Sheet rs = wb.getSheet("result");
            assertEquals(3, rs.getLastRowNum());
            // sorted by path: broken, customers, empty
            assertEquals("SKIP", rs.getRow(1).getCell(0).getStringCellValue());
            assertEquals("DESIGN_REPLAY_ERROR", rs.getRow(1).getCell(6).getStringCellValue());
            assertEquals("SUCCESS", rs.getRow(2).getCell(0).getStringCellValue());
            assertEquals("SELECT", rs.getRow(2).getCell(3).getStringCellValue());
            assertNotNull(rs.getRow(2).getCell(4));
            assertEquals("DESIGN_EMPTY", rs.getRow(3).getCell(6).getStringCellValue());

            Sheet ws = wb.getSheet("warnings");
            boolean replayWarned = false;
            for (int i = 1; i <= ws.getLastRowNum(); i++) {
                if ("DESIGN_REPLAY_ERROR".equals(ws.getRow(i).getCell(0).getStringCellValue())) replayWarned = true;
            }
            assertTrue(replayWarned);
        }
    }

    @Test
    void missing_linked_file_is_a_warning_not_a_failure() throws Exception {
        Path designs = Files.createDirectories(tempDir.resolve("designs"));
        Files.writeString(designs.resolve("one.csv"), "command,arg1,arg2\naddNode,A,id\n", StandardCharsets.UTF_8);
        Path out = tempDir.resolve("out");

        int skip = QueryCompileCliApp.run(new String[]{
                "--designs=" + designs,
                "--linked=" + tempDir.resolve("nope.csv"),
                "--out=" + out,
                "--noResult",
                "--noValidate"
        });

        assertEquals(0, skip);
        assertEquals("SELECT *\nFROM A\n", Files.readString(out.resolve("one.sql")));
    }
}
