package infra.design;

import domain.design.DesignCommand;
import domain.design.DesignScript;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * XLSX design script loader: first sheet, first row is the header.
 */
public final class DesignScriptXlsxLoader {

    private final DataFormatter formatter = new DataFormatter();

    public DesignScript load(Path xlsxPath, String group) {
        if (xlsxPath == null) throw new IllegalArgumentException("xlsxPath is null");
        if (!Files.exists(xlsxPath)) throw new IllegalArgumentException("design xlsx not found: " + xlsxPath);

        try (InputStream is = Files.newInputStream(xlsxPath);
             Workbook wb = new XSSFWorkbook(is)) {

            List<DesignCommand> commands = new ArrayList<>();
            if (wb.getNumberOfSheets() == 0) {
                return new DesignScript(group, DesignScriptLoader.baseName(xlsxPath), xlsxPath.toString(), commands);
            }
            Sheet sheet = wb.getSheetAt(0);

            int[] cols = null;
            for (Row row : sheet) {
                // 헤더
                if (cols == null) {
                    List<String> headers = new ArrayList<>();
                    for (int c = 0; c < Math.max(row.getLastCellNum(), 0); c++) headers.add(get(row, c));
                    Map<String, Integer> idx = ScriptHeaders.index(headers);
                    cols = ScriptHeaders.scriptColumns(idx);
                    continue;
                }

                String cmd = get(row, cols[0]).trim();
                if (cmd.isEmpty() || cmd.startsWith("#")) continue;

                List<String> args = new ArrayList<>(4);
                for (int a = 1; a <= 4; a++) args.add(get(row, cols[a]));
                commands.add(new DesignCommand(row.getRowNum() + 1, cmd, args));
            }
            return new DesignScript(group, DesignScriptLoader.baseName(xlsxPath), xlsxPath.toString(), commands);
        } catch (Exception e) {
            throw new IllegalStateException("failed to load design xlsx: " + xlsxPath, e);
        }
    }

    private String get(Row row, int idx) {
        if (idx < 0) return "";
        Cell cell = row.getCell(idx);
        if (cell == null) return "";
        return formatter.formatCellValue(cell);
    }
}
