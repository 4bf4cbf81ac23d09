package infra.design;

import domain.design.DesignScript;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DesignScriptXlsxLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loads_first_sheet_with_numeric_cells() throws Exception {
        Path xlsx = tempDir.resolve("paging.xlsx");
        try (Workbook wb = new XSSFWorkbook(); OutputStream os = Files.newOutputStream(xlsx)) {
            Sheet sh = wb.createSheet("design");
            Row h = sh.createRow(0);
            h.createCell(0).setCellValue("command");
            h.createCell(1).setCellValue("arg1");
            h.createCell(2).setCellValue("arg2");

            Row r1 = sh.createRow(1);
            r1.createCell(0).setCellValue("addNode");
            r1.createCell(1).setCellValue("A");
            r1.createCell(2).setCellValue("id");

            Row r2 = sh.createRow(2);
            r2.createCell(0).setCellValue("#skip");

            Row r4 = sh.createRow(4);
            r4.createCell(0).setCellValue("setLimit");
            r4.createCell(1).setCellValue(10);
            wb.write(os);
        }

        DesignScript s = new DesignScriptXlsxLoader().load(xlsx, "g");

        assertEquals("paging", s.getName());
        assertEquals(2, s.getCommands().size());
        assertEquals("addNode", s.getCommands().get(0).getName());
        assertEquals(2, s.getCommands().get(0).getLineNo());
        assertEquals(5, s.getCommands().get(1).getLineNo());
        assertEquals(10, s.getCommands().get(1).intArg(0, "limit"));
    }
}
