package cli;

import domain.model.CompileResult;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CliProgressMonitorTest {

    @Test
    void counts_outcomes_and_modes_of_recorded_results() {
        try (CliProgressMonitor m = CliProgressMonitor.start(4, 0L)) {
            m.record(new CompileResult("SUCCESS", "g", "a", "", "SELECT", true, "Valid.", "a.csv"));
            m.record(new CompileResult("SUCCESS", "g", "b", "INCOMPLETE", "UPDATE", null, null, "b.csv"));
            m.record(new CompileResult("SUCCESS", "g", "c", "", "SELECT", true, "Valid.", "c.csv"));
            m.record(new CompileResult("SKIP", "g", "d", "DESIGN_EMPTY", "", null, null, "d.csv"));

            assertEquals(2, m.getSuccess());
            assertEquals(1, m.getIncomplete());
            assertEquals(1, m.getSkip());
            assertEquals(Map.of("SELECT", 2, "UPDATE", 1), m.getModeCounts());
            assertEquals("success=2 incomplete=1 skip=1 modes={SELECT=2, UPDATE=1}", m.counts());
        }
    }

    @Test
    void progress_is_due_every_n_and_on_the_last_design() {
        try (CliProgressMonitor m = CliProgressMonitor.start(3, 0L)) {
            assertFalse(m.isProgressDue(2));

            m.record(new CompileResult("SUCCESS", "", "a", ""));
            assertFalse(m.isProgressDue(2));

            m.record(new CompileResult("SUCCESS", "", "b", ""));
            assertTrue(m.isProgressDue(2));

            m.setCurrent("grp/c", 3);
            m.record(new CompileResult("SKIP", "grp", "c", "DESIGN_REPLAY_ERROR"));
            assertTrue(m.isProgressDue(2));
            assertTrue(m.progressLine().startsWith("[PROGRESS] 3/3 success=2 incomplete=0 skip=1"), m.progressLine());
            assertTrue(m.progressLine().endsWith("last=grp/c"), m.progressLine());
        }
    }

    @Test
    void close_stops_the_heartbeat_thread() {
        CliProgressMonitor m = CliProgressMonitor.start(1, 60_000L);
        assertTrue(m.isHeartbeatAlive());

        m.close();

        assertFalse(m.isHeartbeatAlive());
    }
}
