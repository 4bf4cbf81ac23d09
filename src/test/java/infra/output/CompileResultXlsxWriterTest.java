package infra.output;

import domain.model.CompileContext;
import domain.model.CompileResult;
import domain.model.CompileWarning;
import domain.model.WarningCode;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompileResultXlsxWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writes_result_and_warning_sheets() throws Exception {
        Path xlsx = tempDir.resolve("report").resolve("compile-result.xlsx");
        List<CompileResult> results = List.of(
                new CompileResult("SUCCESS", "sales", "top", "", "SELECT", true, "Valid.", "/d/sales/top.csv"),
                new CompileResult("SKIP", "sales", "broken", "DESIGN_REPLAY_ERROR")
        );
        List<CompileWarning> warnings = List.of(
                CompileWarning.of(WarningCode.DISCONNECTED_JOIN_GRAPH, new CompileContext("sales", "top"), "2 components", "A,B")
        );

        new CompileResultXlsxWriter().write(xlsx, results, warnings);

        try (InputStream is = Files.newInputStream(xlsx); Workbook wb = new XSSFWorkbook(is)) {
            Sheet result = wb.getSheet("result");
            assertNotNull(result);
            assertEquals(2, result.getLastRowNum());
            Row first = result.getRow(1);
            assertEquals("SUCCESS", first.getCell(0).getStringCellValue());
            assertEquals("SELECT", first.getCell(3).getStringCellValue());
            assertTrue(first.getCell(4).getBooleanCellValue());
            assertNull(result.getRow(2).getCell(4));
            assertEquals("DESIGN_REPLAY_ERROR", result.getRow(2).getCell(6).getStringCellValue());

            Sheet w = wb.getSheet("warnings");
            assertEquals("DISCONNECTED_JOIN_GRAPH", w.getRow(1).getCell(0).getStringCellValue());
            assertEquals("A,B", w.getRow(1).getCell(4).getStringCellValue());
        }
    }
}
