package domain.model;
/** No-op warning sink. */
final class NullCompileWarningSink implements CompileWarningSink {

    static final NullCompileWarningSink INSTANCE = new NullCompileWarningSink();

    private NullCompileWarningSink() {
    }

    @Override
    public void warn(CompileWarning warning) {
        // no-op
    }
}
