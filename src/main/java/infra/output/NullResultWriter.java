package infra.output;

import domain.model.CompileResult;
import domain.model.CompileWarning;
import domain.output.ResultWriter;

import java.nio.file.Path;
import java.util.List;

/**
 * No-op implementation (--noResult).
 */
public final class NullResultWriter implements ResultWriter {
    @Override
    public void write(Path resultXlsx, List<CompileResult> results, List<CompileWarning> warnings) {
        // intentionally no-op
    }
}
