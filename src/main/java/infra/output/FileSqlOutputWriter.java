package infra.output;

import domain.output.SqlFileNamePolicy;
import domain.output.SqlOutputWriter;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link SqlOutputWriter} that stores generated SQL into files.
 * <p>
 * Output layout:
 * <outDir>/<design group dirs>/<designName>.sql
 */
public final class FileSqlOutputWriter implements SqlOutputWriter {

    private final SqlFileWriter delegate;

    public FileSqlOutputWriter(SqlFileWriter delegate) {
        this.delegate = (delegate == null) ? new SqlFileWriter() : delegate;
    }

    @Override
    public void write(Path outDir, String designGroup, String designName, String sqlText) {
        if (outDir == null) throw new IllegalArgumentException("outDir is null");

        Path targetDir = outDir;
        for (String seg : SqlFileNamePolicy.groupDirs(designGroup)) {
            targetDir = targetDir.resolve(seg);
        }

        try {
            Files.createDirectories(targetDir);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create output directory: " + targetDir, e);
        }

        delegate.write(targetDir, designName, sqlText);
    }
}
