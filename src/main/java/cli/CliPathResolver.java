package cli;

import java.nio.file.Files;

import java.nio.file.Path;

import java.nio.file.Paths;

import java.util.Map;

/** CLI path resolver (baseDir and paths relative to it). */
public final class CliPathResolver {

    private CliPathResolver() {}

    public static final String PROP_BASE_DIR = "baseDir";

    public static void applyBaseDirPropertyIfPresent(Map<String, String> argv) {
        String bd = (argv == null) ? null : argv.get("baseDir");
        if (bd == null || bd.isBlank()) return;
        System.setProperty(PROP_BASE_DIR, bd.trim());
    }
    public static Path resolveBaseDir() {
        String bd = System.getProperty(PROP_BASE_DIR);
        if (bd != null && !bd.isBlank()) {
            return resolveAgainstUserDir(bd).toAbsolutePath().normalize();
        }
        return Paths.get(".").toAbsolutePath().normalize();
    }
    public static void ensureBaseDirProperty(Path baseDir) {
        if (System.getProperty(PROP_BASE_DIR) == null) {
            System.setProperty(PROP_BASE_DIR, baseDir.toAbsolutePath().normalize().toString());
        }
    }
    public static Path resolvePath(Path baseDir, String input) {
        if (input == null || input.isBlank()) return null;
        Path p = Paths.get(input.trim());
        if (!p.isAbsolute()) {
            if (baseDir != null) p = baseDir.resolve(p);
            else p = resolveAgainstUserDir(input.trim());
        }
        return p.toAbsolutePath().normalize();
    }
    public static Path resolveAgainstUserDir(String raw) {
        if (raw == null || raw.isBlank()) return null;
        Path p = Paths.get(raw.trim());
        if (p.isAbsolute()) return p;
        return Paths.get(System.getProperty("user.dir")).resolve(p);
    }
    public static void validateFileExists(Path p, String label) {
        if (p == null) throw new IllegalArgumentException(label + " is null");
        if (!Files.exists(p)) throw new IllegalArgumentException(label + " not found: " + p);
    }

    /**
     * Optional input: explicit arg wins; otherwise {@code baseDir/defaultName} when it exists; else null.
     */
    public static Path resolveOptionalFile(Path baseDir, String rawArg, String defaultName) {
        if (rawArg != null && !rawArg.isBlank()) return resolvePath(baseDir, rawArg);
        if (defaultName == null || baseDir == null) return null;
        Path p = baseDir.resolve(defaultName).toAbsolutePath().normalize();
        return Files.isRegularFile(p) ? p : null;
    }
    public static void mkdirs(Path p) {
        if (p == null) return;
        try {
            Files.createDirectories(p);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create directory: " + p, e);
        }
    }
    public static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
