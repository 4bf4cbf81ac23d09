package domain.model;

/**
 * Sink for compile warnings.
 *
 * <p>Warnings are produced across many internal components (FROM builder, DML translator,
 * linked-server rewriter, validator). A simple sink collects them without coupling internals
 * to the CLI or the XLSX writer.</p>
 */
public interface CompileWarningSink {

    static CompileWarningSink none() {
        return NullCompileWarningSink.INSTANCE;
    }

    void warn(CompileWarning warning);
}
