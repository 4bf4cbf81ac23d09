package infra.output;

import domain.output.SqlFileNamePolicy;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes one SQL text to {@code <dir>/<designName>.sql} (UTF-8, trailing newline).
 */
public final class SqlFileWriter {

    public Path write(Path dir, String designName, String sqlText) {
        if (dir == null) throw new IllegalArgumentException("dir is null");
        Path file = dir.resolve(SqlFileNamePolicy.build(designName));
        String body = sqlText == null ? "" : sqlText;
        if (!body.endsWith("\n")) body = body + "\n";
        try {
            Files.writeString(file, body, StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write sql file: " + file, e);
        }
        return file;
    }
}
