package cli;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

import domain.model.CompileResult;

/**
 * Progress / heartbeat logger for one batch compile run.
 *
 * <p>Counts every recorded {@link CompileResult} by outcome (SUCCESS, INCOMPLETE, SKIP)
 * and by operation mode. The heartbeat thread lives until {@link #close()}.</p>
 */
public final class CliProgressMonitor implements AutoCloseable {

    static final String INCOMPLETE = "INCOMPLETE";

    private final int total;
    private final long startNs;

    private final AtomicInteger currentIndex = new AtomicInteger(0);
    private volatile String currentKey = "";

    private final AtomicInteger recorded = new AtomicInteger(0);
    private final AtomicInteger success = new AtomicInteger(0);
    private final AtomicInteger incomplete = new AtomicInteger(0);
    private final AtomicInteger skip = new AtomicInteger(0);
    private final Map<String, Integer> byMode = new TreeMap<>();

    private final Thread heartbeat;

    private CliProgressMonitor(int total, long heartbeatMillis) {
        this.total = Math.max(0, total);
        this.startNs = System.nanoTime();
        this.heartbeat = (heartbeatMillis > 0) ? startHeartbeat(heartbeatMillis) : null;
    }

    /**
     * @param heartbeatMillis interval of the [HEARTBEAT] line; 0 or less disables the thread
     */
    public static CliProgressMonitor start(int total, long heartbeatMillis) {
        return new CliProgressMonitor(total, heartbeatMillis);
    }

    private Thread startHeartbeat(long intervalMillis) {
        Thread t = new Thread(() -> {
            try {
                while (!Thread.currentThread().isInterrupted()) {
                    Thread.sleep(intervalMillis);
                    System.out.println("[HEARTBEAT] compiling... " + currentIndex.get() + "/" + total
                            + " last=" + currentKey);
                }
            } catch (InterruptedException e) {
                // close() 로 종료
                Thread.currentThread().interrupt();
            }
        }, "query-compile-heartbeat");
        t.setDaemon(true);
        t.start();
        return t;
    }

    public void setCurrent(String key, int index1Based) {
        currentKey = (key == null) ? "" : key;
        currentIndex.set(Math.max(0, index1Based));
    }

    /** Counts one finished design. A SUCCESS row whose message is INCOMPLETE counts as incomplete. */
    public void record(CompileResult r) {
        if (r == null) return;
        recorded.incrementAndGet();
        if ("SKIP".equals(r.getStatus())) {
            skip.incrementAndGet();
        } else if (INCOMPLETE.equals(r.getMessage())) {
            incomplete.incrementAndGet();
        } else {
            success.incrementAndGet();
        }
        String mode = r.getOperationMode();
        if (mode != null && !mode.isBlank()) {
            synchronized (byMode) {
                byMode.merge(mode, 1, Integer::sum);
            }
        }
    }

    public boolean isProgressDue(int logEvery) {
        int done = recorded.get();
        return done > 0 && (done % Math.max(1, logEvery) == 0 || done == total);
    }

    public void logProgress() {
        System.out.println(progressLine());
    }

    String progressLine() {
        long elapsed = (System.nanoTime() - startNs) / 1_000_000L;

        MemoryMXBean mem = ManagementFactory.getMemoryMXBean();
        MemoryUsage heap = mem.getHeapMemoryUsage();
        long usedMb = heap.getUsed() / (1024 * 1024);
        long maxMb = heap.getMax() / (1024 * 1024);

        return String.format("[PROGRESS] %d/%d %s elapsed=%dms heap=%d/%dMB last=%s",
                recorded.get(), total, counts(), elapsed, usedMb, maxMb, currentKey);
    }

    /** {@code success=2 incomplete=1 skip=0 modes={SELECT=2, UPDATE=1}} */
    public String counts() {
        String modes;
        synchronized (byMode) {
            modes = byMode.toString();
        }
        return "success=" + success.get() + " incomplete=" + incomplete.get()
                + " skip=" + skip.get() + " modes=" + modes;
    }

    public int getSuccess() {
        return success.get();
    }

    public int getIncomplete() {
        return incomplete.get();
    }

    public int getSkip() {
        return skip.get();
    }

    public Map<String, Integer> getModeCounts() {
        synchronized (byMode) {
            return new TreeMap<>(byMode);
        }
    }

    boolean isHeartbeatAlive() {
        return heartbeat != null && heartbeat.isAlive();
    }

    @Override
    public void close() {
        if (heartbeat == null) return;
        heartbeat.interrupt();
        try {
            heartbeat.join(1_000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
