package domain.output;

import java.nio.file.Path;

import java.util.List;

import domain.model.CompileResult;

import domain.model.CompileWarning;

/** 결과 리포트를 저장하는 책임. */
public interface ResultWriter {

    void write(
            Path resultXlsx,
            List<CompileResult> results,
            List<CompileWarning> warnings
    );
}
