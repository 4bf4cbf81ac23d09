package app;

import java.nio.file.Files;

import java.nio.file.Path;

import java.util.ArrayList;

import java.util.List;

import java.util.Map;

import cli.CliArgParser;

import cli.CliPathResolver;

import cli.CliProgressMonitor;

import cli.QueryCompileCli;

import domain.design.DesignReplayException;

import domain.design.DesignScript;

import domain.design.DesignScriptReplayer;

import domain.model.CompileContext;

import domain.model.CompileResult;

import domain.model.CompileWarning;

import domain.model.CompileWarningSink;

import domain.model.LinkedServerMap;

import domain.model.ListCompileWarningSink;

import domain.model.WarningCode;

import domain.output.ResultWriter;

import domain.output.SqlOutputWriter;

import domain.session.GenerationResult;

import domain.session.QuerySession;

import domain.validate.SyntaxValidator;

import domain.validate.ValidationResult;

import infra.design.DesignScriptLoader;

/** CLI entry (invoked by {@link QueryCompileCli}). */
public final class QueryCompileCliApp {

    static final String DEFAULT_DESIGNS = "designs";
    static final String DEFAULT_LINKED = "linked_servers.csv";
    static final String DEFAULT_OUT = "output/sql";
    static final String DEFAULT_RESULT = "output/compile-result.xlsx";
    static final long HEARTBEAT_MILLIS = 30_000L;

    private QueryCompileCliApp() {}

    public static void main(String[] args) {
        run(args);
    }

    /**
     * Runs the whole batch.
     *
     * @return number of SKIP rows
     */
    static int run(String[] args) {

        long t0 = System.nanoTime();
        Map<String, String> argv = CliArgParser.parseArgs(args);

        // ------------------------------------------------------------
        // baseDir 결정 + system property 반영
        // ------------------------------------------------------------
        CliPathResolver.applyBaseDirPropertyIfPresent(argv);

        Path baseDir = CliPathResolver.resolveBaseDir();
        CliPathResolver.ensureBaseDirProperty(baseDir);

        // ------------------------------------------------------------
        // input / output
        // ------------------------------------------------------------
        Path designsPath = CliPathResolver.resolvePath(baseDir, argv.getOrDefault("designs", DEFAULT_DESIGNS));
        String linkedRaw = CliPathResolver.trimToNull(argv.get("linked"));
        Path linkedPath = CliPathResolver.resolveOptionalFile(baseDir, linkedRaw, DEFAULT_LINKED);

        Path outputSqlDir = CliPathResolver.resolvePath(baseDir, argv.getOrDefault("out", DEFAULT_OUT));
        Path resultXlsx = CliPathResolver.resolvePath(baseDir, argv.getOrDefault("result", DEFAULT_RESULT));

        int max = CliArgParser.parseInt(argv.get("max"), -1);
        int logEvery = Math.max(1, CliArgParser.parseInt(argv.get("logEvery"), 100));
        long slowMs = CliArgParser.parseLong(argv.get("slowMs"), 500L);
        boolean failFast = CliArgParser.flag(argv, "failFast");

        // ------------------------------------------------------------
        // feature toggles (presence-style)
        // ------------------------------------------------------------
        boolean noSqlOut = CliArgParser.flag(argv, "noSqlOut") || CliArgParser.flag(argv, "noOut");
        boolean noResult = CliArgParser.flag(argv, "noResult") || CliArgParser.flag(argv, "noXlsx");
        boolean noValidate = CliArgParser.flag(argv, "noValidate");

        System.out.println("==================================================");
        System.out.println("[START] Query graph compile");
        System.out.println("[CONF] baseDir        = " + baseDir.toAbsolutePath());
        System.out.println("[CONF] designs        = " + designsPath.toAbsolutePath());
        System.out.println("[CONF] linked         = " + (linkedPath == null ? "(none)" : linkedPath.toAbsolutePath()));
        System.out.println("[CONF] out            = " + outputSqlDir.toAbsolutePath());
        System.out.println("[CONF] result         = " + resultXlsx.toAbsolutePath());
        System.out.println("[CONF] max            = " + max);
        System.out.println("[CONF] logEvery       = " + logEvery);
        System.out.println("[CONF] slowMs         = " + slowMs);
        System.out.println("[CONF] failFast       = " + failFast);
        System.out.println("[CONF] enableSqlOut   = " + (!noSqlOut) + " (use --noSqlOut)");
        System.out.println("[CONF] enableResult   = " + (!noResult) + " (use --noResult)");
        System.out.println("[CONF] enableValidate = " + (!noValidate) + " (use --noValidate)");
        System.out.println("==================================================");

        CliPathResolver.validateFileExists(designsPath, "design scripts (--designs)");

        // warnings (collected even when result xlsx is disabled)
        List<CompileWarning> warnings = new ArrayList<>(128);
        CompileWarningSink warningSink = new ListCompileWarningSink(warnings);

        if (!noSqlOut) {
            CliPathResolver.mkdirs(outputSqlDir);
        }
        if (!noResult) {
            if (resultXlsx.getParent() != null) CliPathResolver.mkdirs(resultXlsx.getParent());
        }

        // ------------------------------------------------------------
        // assemble runtime components
        // ------------------------------------------------------------
        QueryCompileComponentsFactory factory = new QueryCompileComponentsFactory();

        // linked-server map
        long tLinked0 = System.nanoTime();
        LinkedServerMap linked = LinkedServerMap.empty();
        if (linkedPath != null && !Files.isRegularFile(linkedPath)) {
            System.out.println("[WARN] linked-server csv not found: " + linkedPath.toAbsolutePath());
            System.out.println("       - three-part names are left as written.");
            warningSink.warn(CompileWarning.of(
                    WarningCode.LINKED_MAP_MISSING, CompileContext.none(),
                    "linked-server csv not found: " + linkedPath.toAbsolutePath(),
                    "--linked=" + linkedRaw
            ));
        } else if (linkedPath != null) {
            linked = factory.loadLinkedServers(linkedPath);
        }
        System.out.println("[STEP1] linked-server map loaded. size=" + linked.size() + ", elapsed=" + ms(tLinked0) + "ms");

        // design scripts
        long tScan0 = System.nanoTime();
        DesignScriptLoader scriptLoader = factory.createScriptLoader();
        List<Path> scripts = scriptLoader.scan(designsPath);
        System.out.println("[STEP2] design scripts scanned. size=" + scripts.size() + ", elapsed=" + ms(tScan0) + "ms");

        if (max > 0 && scripts.size() > max) {
            scripts = scripts.subList(0, max);
            System.out.println("[STEP2] apply max => truncated to " + scripts.size());
        }

        DesignScriptReplayer replayer = factory.createReplayer();
        SyntaxValidator validator = factory.createValidator(!noValidate);
        SqlOutputWriter sqlOutputWriter = factory.createSqlOutputWriter(!noSqlOut);
        ResultWriter resultWriter = factory.createResultWriter(!noResult);

        long tLoop0 = System.nanoTime();
        int total = scripts.size();
        System.out.println("[STEP3] compiling start. total=" + total);

        List<CompileResult> results = new ArrayList<>(Math.max(16, total));
        int skip;

        // heartbeat thread: 멈춘 지점 확인용
        try (CliProgressMonitor progress = CliProgressMonitor.start(total, HEARTBEAT_MILLIS)) {

            for (int i = 0; i < total; i++) {
                Path file = scripts.get(i);
                String source = file.toAbsolutePath().normalize().toString();
                String key = source;

                progress.setCurrent(key, i + 1);

                long one0 = System.nanoTime();
                String group = "";
                String name = "";
                String mode = "";

                try {
                    DesignScript script = scriptLoader.load(designsPath, file);
                    group = script.getGroup();
                    name = script.getName();
                    key = group.isEmpty() ? name : group + "/" + name;
                    progress.setCurrent(key, i + 1);
                    CompileContext ctx = new CompileContext(group, name);

                    if (script.isEmpty()) {
                        record(results, progress,
                                new CompileResult("SKIP", group, name, "DESIGN_EMPTY", "", null, null, source));
                        warningSink.warn(CompileWarning.of(WarningCode.DESIGN_EMPTY, ctx, "design script has no commands", source));
                        logProgressIfDue(progress, logEvery);
                        continue;
                    }

                    GenerationResult generated;
                    try (QuerySession session = factory.createSession(ctx, warningSink, linked)) {
                        replayer.replay(script, session);
                        generated = session.regenerate();
                    }
                    mode = generated.getMode().name();

                    Boolean syntaxValid = null;
                    String validationMessage = null;
                    if (validator != null) {
                        ValidationResult vr = validator.validate(generated.getSql());
                        syntaxValid = vr.isValid();
                        validationMessage = vr.getMessage();
                        if (vr.getStatus() == ValidationResult.Status.INVALID) {
                            warningSink.warn(CompileWarning.of(WarningCode.SYNTAX_INVALID, ctx,
                                    "generated SQL failed the syntax check", vr.getMessage()));
                        }
                    }

                    sqlOutputWriter.write(outputSqlDir, group, name, generated.getSql());

                    record(results, progress, new CompileResult("SUCCESS", group, name,
                            generated.isIncomplete() ? "INCOMPLETE" : "", mode, syntaxValid, validationMessage, source));

                } catch (Exception e) {
                    String reason = (e instanceof DesignReplayException)
                            ? "DESIGN_REPLAY_ERROR"
                            : e.getClass().getSimpleName();
                    record(results, progress, new CompileResult("SKIP", group, name, reason, mode, null, null, source));
                    warningSink.warn(CompileWarning.of(
                            WarningCode.DESIGN_REPLAY_ERROR, new CompileContext(group, name),
                            e.getClass().getSimpleName(), safe(e.getMessage())
                    ));

                    System.out.println("[ERROR] compile failed: " + key);
                    System.out.println("        ex=" + e.getClass().getName() + ": " + safe(e.getMessage()));

                    if (failFast) {
                        System.out.println("[FAILFAST] stop on first error.");
                        break;
                    }
                }

                long oneMs = (System.nanoTime() - one0) / 1_000_000L;
                if (oneMs >= slowMs) {
                    System.out.println("[SLOW] " + oneMs + "ms : " + key);
                    warningSink.warn(CompileWarning.of(
                            WarningCode.SLOW_DESIGN, new CompileContext(group, name),
                            "slowMs=" + slowMs + ", actualMs=" + oneMs
                    ));
                }

                logProgressIfDue(progress, logEvery);
            }

            skip = progress.getSkip();
            System.out.println("[STEP3] compiling done. elapsed=" + ms(tLoop0) + "ms");
            System.out.println("[STAT] " + progress.counts());
            System.out.println("[STAT] warnings=" + warnings.size());
        }

        if (!noResult) {
            long tXlsx0 = System.nanoTime();
            System.out.println("[STEP4] writing result xlsx... rows=" + results.size());
            resultWriter.write(resultXlsx, results, warnings);
            System.out.println("[STEP4] result xlsx written. elapsed=" + ms(tXlsx0) + "ms");
        } else {
            System.out.println("[STEP4] result xlsx skipped (--noResult). rows=" + results.size());
        }

        System.out.println("==================================================");
        System.out.println("[DONE] totalElapsed=" + ms(t0) + "ms");
        System.out.println("==================================================");
        return skip;
    }

    private static void record(List<CompileResult> results, CliProgressMonitor progress, CompileResult row) {
        results.add(row);
        progress.record(row);
    }

    private static void logProgressIfDue(CliProgressMonitor progress, int logEvery) {
        if (progress.isProgressDue(logEvery)) {
            progress.logProgress();
        }
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }

    private static String safe(String s) {
        return (s == null) ? "" : s;
    }
}
