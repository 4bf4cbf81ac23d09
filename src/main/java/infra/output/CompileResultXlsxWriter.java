package infra.output;

import domain.model.CompileResult;
import domain.model.CompileWarning;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * XLSX report writer.
 *
 * <p>Sheets:
 * <ul>
 *   <li>result: SUCCESS/SKIP summary per design</li>
 *   <li>warnings: non-fatal warnings (standard codes)</li>
 * </ul>
 */
public final class CompileResultXlsxWriter {

    private static void writeResultSheet(Workbook wb, List<CompileResult> results) {
        Sheet sh = wb.createSheet("result");
        int r = 0;
        Row header = sh.createRow(r++);
        header.createCell(0)
                .setCellValue("status");
        header.createCell(1)
                .setCellValue("designGroup");
        header.createCell(2)
                .setCellValue("designName");
        header.createCell(3)
                .setCellValue("operationMode");
        header.createCell(4)
                .setCellValue("syntaxValid");
        header.createCell(5)
                .setCellValue("validation");
        header.createCell(6)
                .setCellValue("message");
        header.createCell(7)
                .setCellValue("source");

        for (CompileResult it : results) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(nullToEmpty(it.getStatus()));
            row.createCell(1)
                    .setCellValue(nullToEmpty(it.getDesignGroup()));
            row.createCell(2)
                    .setCellValue(nullToEmpty(it.getDesignName()));
            row.createCell(3)
                    .setCellValue(nullToEmpty(it.getOperationMode()));
            // blank when validation was skipped
            if (it.getSyntaxValid() != null) {
                row.createCell(4)
                        .setCellValue(it.getSyntaxValid());
            }
            row.createCell(5)
                    .setCellValue(nullToEmpty(it.getValidationMessage()));
            row.createCell(6)
                    .setCellValue(nullToEmpty(it.getMessage()));
            row.createCell(7)
                    .setCellValue(nullToEmpty(it.getSource()));
        }
    }

    private static void writeWarningsSheet(Workbook wb, List<CompileWarning> warnings) {
        Sheet sh = wb.createSheet("warnings");
        int r = 0;
        Row header = sh.createRow(r++);
        header.createCell(0)
                .setCellValue("code");
        header.createCell(1)
                .setCellValue("designGroup");
        header.createCell(2)
                .setCellValue("designName");
        header.createCell(3)
                .setCellValue("message");
        header.createCell(4)
                .setCellValue("detail");

        for (CompileWarning w : warnings) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(w.getCode() == null ? "" : w.getCode()
                            .name());
            row.createCell(1)
                    .setCellValue(nullToEmpty(w.getDesignGroup()));
            row.createCell(2)
                    .setCellValue(nullToEmpty(w.getDesignName()));
            row.createCell(3)
                    .setCellValue(nullToEmpty(w.getMessage()));
            row.createCell(4)
                    .setCellValue(nullToEmpty(w.getDetail()));
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public void write(Path resultXlsx, List<CompileResult> results, List<CompileWarning> warnings) {
        if (resultXlsx == null) throw new IllegalArgumentException("resultXlsx is null");
        if (results == null) throw new IllegalArgumentException("results is null");
        if (warnings == null) throw new IllegalArgumentException("warnings is null");

        try {
            Path parent = resultXlsx.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create resultXlsx parent dir: " + resultXlsx, e);
        }

        try (Workbook wb = new XSSFWorkbook()) {
            writeResultSheet(wb, results);
            writeWarningsSheet(wb, warnings);

            try (OutputStream os = Files.newOutputStream(resultXlsx)) {
                wb.write(os);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write xlsx: " + resultXlsx, e);
        }
    }
}
