package domain.validate;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Single-shot, restartable validation timer.
 *
 * <p>Each {@link #schedule(String)} cancels the pending run (if any) and starts a new countdown,
 * so a burst of edits validates once, after the input settles. Validation runs on one daemon
 * thread owned by this instance and never blocks the caller.</p>
 */
public final class DebouncedValidator implements AutoCloseable {

    public static final long DEFAULT_DELAY_MILLIS = 500L;
    public static final long MIN_DELAY_MILLIS = 400L;
    public static final long MAX_DELAY_MILLIS = 800L;

    private final SyntaxValidator validator;
    private final long delayMillis;
    private final Consumer<ValidationResult> listener;
    private final ScheduledExecutorService scheduler;

    private ScheduledFuture<?> pending;
    private volatile ValidationResult lastResult;

    public DebouncedValidator(SyntaxValidator validator, Consumer<ValidationResult> listener) {
        this(validator, DEFAULT_DELAY_MILLIS, listener);
    }

    public DebouncedValidator(SyntaxValidator validator, long delayMillis, Consumer<ValidationResult> listener) {
        if (validator == null) throw new IllegalArgumentException("validator is null");
        if (delayMillis < MIN_DELAY_MILLIS || delayMillis > MAX_DELAY_MILLIS) {
            throw new IllegalArgumentException("debounce delay must be within "
                    + MIN_DELAY_MILLIS + ".." + MAX_DELAY_MILLIS + " ms: " + delayMillis);
        }
        this.validator = validator;
        this.delayMillis = delayMillis;
        this.listener = listener;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sql-validator");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void schedule(String sql) {
        if (scheduler.isShutdown()) return;
        if (pending != null) {
            pending.cancel(false);
        }
        pending = scheduler.schedule(() -> runValidation(sql), delayMillis, TimeUnit.MILLISECONDS);
    }

    private void runValidation(String sql) {
        ValidationResult r = validator.validate(sql);
        lastResult = r;
        if (listener != null) listener.accept(r);
    }

    /** Synchronous check on the caller's thread; also cancels the pending run. */
    public ValidationResult validateNow(String sql) {
        synchronized (this) {
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
        }
        ValidationResult r = validator.validate(sql);
        lastResult = r;
        return r;
    }

    /** @return result of the most recent completed run, or null before the first one */
    public ValidationResult getLastResult() {
        return lastResult;
    }

    public long getDelayMillis() {
        return delayMillis;
    }

    @Override
    public synchronized void close() {
        if (pending != null) pending.cancel(false);
        scheduler.shutdownNow();
    }
}
