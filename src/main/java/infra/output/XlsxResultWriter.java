package infra.output;

import java.nio.file.Path;

import java.util.List;

import domain.model.CompileResult;

import domain.model.CompileWarning;

import domain.output.ResultWriter;

/** CompileResultXlsxWriter 기반 XLSX 결과 출력 구현체. */
public final class XlsxResultWriter implements ResultWriter {

    private final CompileResultXlsxWriter delegate;

    public XlsxResultWriter(CompileResultXlsxWriter delegate) {
        this.delegate = delegate;
    }

    @Override
    public void write(Path resultXlsx, List<CompileResult> results, List<CompileWarning> warnings) {
        delegate.write(resultXlsx, results, warnings);
    }
}
