package infra.design;

import domain.design.DesignScript;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Finds design scripts under a root (or accepts a single file) and loads them by extension.
 *
 * <p>Group = the script's directory relative to the root, with '/' separators
 * ("" for scripts directly under the root).</p>
 */
public final class DesignScriptLoader {

    private final DesignScriptCsvLoader csvLoader;
    private final DesignScriptXlsxLoader xlsxLoader;

    public DesignScriptLoader(DesignScriptCsvLoader csvLoader, DesignScriptXlsxLoader xlsxLoader) {
        this.csvLoader = csvLoader;
        this.xlsxLoader = xlsxLoader;
    }

    public static boolean isScript(Path p) {
        if (p == null || p.getFileName() == null) return false;
        String n = p.getFileName().toString().toLowerCase(Locale.ROOT);
        if (n.startsWith("~$")) return false; // Excel lock file
        return n.endsWith(".csv") || n.endsWith(".xlsx");
    }

    /** Script files sorted by path. */
    public List<Path> scan(Path designs) {
        if (designs == null) throw new IllegalArgumentException("designs path is null");
        if (!Files.exists(designs)) throw new IllegalArgumentException("designs path not found: " + designs);
        if (Files.isRegularFile(designs)) {
            if (!isScript(designs)) throw new IllegalArgumentException("not a .csv/.xlsx design script: " + designs);
            return List.of(designs);
        }

        List<Path> out = new ArrayList<>();
        try (Stream<Path> s = Files.walk(designs)) {
            s.filter(Files::isRegularFile)
                    .filter(DesignScriptLoader::isScript)
                    .forEach(out::add);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to scan design scripts under: " + designs, e);
        }
        out.sort(Comparator.comparing(Path::toString));
        return out;
    }

    public DesignScript load(Path root, Path file) {
        String group = groupOf(root, file);
        String n = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (n.endsWith(".xlsx")) return xlsxLoader.load(file, group);
        return csvLoader.load(file, group);
    }

    static String groupOf(Path root, Path file) {
        if (root == null || file == null || Files.isRegularFile(root)) return "";
        Path parent = file.toAbsolutePath().normalize().getParent();
        Path r = root.toAbsolutePath().normalize();
        if (parent == null || !parent.startsWith(r)) return "";
        return r.relativize(parent).toString().replace('\\', '/');
    }

    static String baseName(Path file) {
        String n = file.getFileName() == null ? "" : file.getFileName().toString();
        int dot = n.lastIndexOf('.');
        return dot > 0 ? n.substring(0, dot) : n;
    }
}
