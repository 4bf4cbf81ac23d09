package infra.design;

import domain.design.DesignCommand;
import domain.design.DesignScript;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * CSV design script loader (UTF-8, BOM tolerated, first row is the header).
 *
 * <p>Quoted cells may span several lines, which keeps SQL bodies (CTEs, sub-queries,
 * imported statements) readable inside the script.</p>
 */
public final class DesignScriptCsvLoader {

    public DesignScript load(Path csvPath, String group) {
        if (csvPath == null) throw new IllegalArgumentException("csvPath is null");
        if (!Files.exists(csvPath)) throw new IllegalArgumentException("design csv not found: " + csvPath);

        try (InputStream is = Files.newInputStream(csvPath);
             InputStreamReader reader = new InputStreamReader(is, StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT
                     .builder()
                     .setIgnoreEmptyLines(true)
                     .build()
                     .parse(reader)) {

            List<DesignCommand> commands = new ArrayList<>();
            Iterator<CSVRecord> it = parser.iterator();
            if (!it.hasNext()) {
                return new DesignScript(group, DesignScriptLoader.baseName(csvPath), csvPath.toString(), commands);
            }

            CSVRecord headerRec = it.next();
            List<String> headers = new ArrayList<>(headerRec.size());
            for (int i = 0; i < headerRec.size(); i++) headers.add(headerRec.get(i));
            Map<String, Integer> idx = ScriptHeaders.index(headers);
            int[] cols = ScriptHeaders.scriptColumns(idx);

            while (it.hasNext()) {
                CSVRecord r = it.next();
                String cmd = cell(r, cols[0]).trim();
                if (cmd.isEmpty() || cmd.startsWith("#")) continue;

                List<String> args = new ArrayList<>(4);
                for (int a = 1; a <= 4; a++) args.add(cell(r, cols[a]));
                commands.add(new DesignCommand((int) r.getRecordNumber(), cmd, args));
            }
            return new DesignScript(group, DesignScriptLoader.baseName(csvPath), csvPath.toString(), commands);
        } catch (Exception e) {
            throw new IllegalStateException("failed to load design csv: " + csvPath, e);
        }
    }

    private static String cell(CSVRecord r, int i) {
        if (i < 0 || i >= r.size()) return "";
        String v = r.get(i);
        return v == null ? "" : v;
    }
}
