package infra.linked;

import domain.model.LinkedServerMap;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * linked_servers.csv 로더
 *
 * <p>Header: {@code alias,linkedServer} (Korean {@code 별칭,링크드서버} also accepted).
 * Unknown headers fall back to the first two columns. Later rows win for a repeated alias.</p>
 */
public final class LinkedServerCsvLoader {

    private static String stripBom(String s) {
        if (s == null || s.isEmpty()) return s;
        if (s.charAt(0) == '\uFEFF') return s.substring(1);
        return s;
    }

    private static String norm(String s) {
        if (s == null) return "";
        return stripBom(s).trim()
                .toLowerCase(Locale.ROOT)
                .replace(" ", "")
                .replace("_", "");
    }

    private static int find(List<String> headers, int fallback, String... keys) {
        for (String k : keys) {
            for (int i = 0; i < headers.size(); i++) {
                if (norm(headers.get(i)).equals(norm(k))) return i;
            }
        }
        return fallback;
    }

    public LinkedServerMap load(Path csvPath) {
        if (csvPath == null) throw new IllegalArgumentException("csvPath is null");
        if (!Files.exists(csvPath)) throw new IllegalArgumentException("linked server csv not found: " + csvPath);

        try (InputStream is = Files.newInputStream(csvPath);
             InputStreamReader reader = new InputStreamReader(is, StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT
                     .builder()
                     .setTrim(true)
                     .setIgnoreEmptyLines(true)
                     .build()
                     .parse(reader)) {

            Iterator<CSVRecord> it = parser.iterator();
            if (!it.hasNext()) return LinkedServerMap.empty();

            CSVRecord headerRec = it.next();
            List<String> headers = new ArrayList<>(headerRec.size());
            for (int i = 0; i < headerRec.size(); i++) headers.add(headerRec.get(i));

            int aliasCol = find(headers, 0, "alias", "별칭");
            int linkedCol = find(headers, 1, "linkedServer", "linkedServerName", "링크드서버");

            Map<String, String> m = new LinkedHashMap<>();
            while (it.hasNext()) {
                CSVRecord r = it.next();
                String alias = (aliasCol < r.size()) ? r.get(aliasCol) : "";
                String linked = (linkedCol < r.size()) ? r.get(linkedCol) : "";
                if (alias.isBlank() || linked.isBlank()) continue;
                m.put(alias.trim(), linked.trim());
            }
            return LinkedServerMap.of(m);
        } catch (Exception e) {
            throw new IllegalStateException("failed to load linked server csv: " + csvPath, e);
        }
    }
}
