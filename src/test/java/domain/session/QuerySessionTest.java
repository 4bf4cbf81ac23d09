package domain.session;

import domain.model.CompileContext;
import domain.model.CompileWarning;
import domain.model.ListCompileWarningSink;
import domain.model.OperationMode;
import domain.model.WarningCode;
import domain.graph.NodeNotFoundException;
import domain.validate.DebouncedValidator;
import domain.validate.SyntaxValidator;
import domain.validate.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class QuerySessionTest {

    @Test
    void empty_canvas_renders_comment_line() {
        try (QuerySession s = new QuerySession()) {
            GenerationResult r = s.regenerate();

            assertEquals(QuerySession.NO_TABLES, r.getSql());
            assertTrue(r.isIncomplete());
        }
    }

    @Test
    void every_mutation_regenerates_full_text() {
        try (QuerySession s = new QuerySession()) {
            s.addNode("A", List.of("id", "name"));
            assertEquals("SELECT *\nFROM A", s.getSql());

            s.addNode("B", List.of("id", "aid"));
            s.addJoinEdge("A", "B", "inner join", "A.id=B.aid");
            s.selectColumn("A", "id");
            s.selectColumn("A", "name");
            assertEquals("SELECT A.id, A.name\nFROM A\nINNER JOIN B ON A.id=B.aid", s.getSql());

            s.addPredicate("where", "status", "IN", "'A','B'");
            s.setLimit(5);
            assertEquals("SELECT A.id, A.name\nFROM A\nINNER JOIN B ON A.id=B.aid\n"
                    + "WHERE status IN ('A','B')\nLIMIT 5", s.getSql());
        }
    }

    @Test
    void regeneration_is_idempotent() {
        try (QuerySession s = new QuerySession()) {
            s.addNode("A", List.of("id"));
            s.addCte("c", "SELECT 1 AS id");

            String first = s.regenerate().getSql();
            String second = s.regenerate().getSql();

            assertEquals(first, second);
            assertTrue(first.startsWith("WITH c AS (\nSELECT 1 AS id\n)\nSELECT"), first);
        }
    }

    @Test
    void failed_call_leaves_text_unchanged() {
        try (QuerySession s = new QuerySession()) {
            s.addNode("A", List.of("id"));
            String before = s.getSql();

            assertThrows(NodeNotFoundException.class, () -> s.addJoinEdge("A", "missing", "LEFT", "x"));
            assertThrows(IllegalArgumentException.class, () -> s.setOffset(-3));

            assertEquals(before, s.getSql());
        }
    }

    @Test
    void update_mode_targets_db_and_table() {
        List<CompileWarning> warnings = new ArrayList<>();
        try (QuerySession s = new QuerySession(new CompileContext("g", "d"), new ListCompileWarningSink(warnings), null)) {
            s.setLinkedServerMap(Map.of("X", "LS1"));
            s.setOperationMode(OperationMode.UPDATE);
            assertTrue(s.current().isIncomplete());

            s.addNode("S", List.of("id", "v"));
            s.addNode("X.db1.T", List.of("id", "val"));
            s.markDmlTarget("X.db1.T");
            s.addMappingEdge("S.v", "X.db1.T.val");

            String sql = s.getSql();

            assertTrue(sql.startsWith("UPDATE db1.T\nSET val=src.v\n"), sql);
            assertTrue(sql.endsWith("WHERE db1.T.id=src.id"), sql);
            assertFalse(s.current().isIncomplete());
            assertTrue(warnings.stream().anyMatch(w -> w.getCode() == WarningCode.DML_TARGET_MISSING));
        }
    }

    @Test
    void linked_sources_are_rewritten_in_select() {
        try (QuerySession s = new QuerySession()) {
            s.setLinkedServerMap(Map.of("X", "LS1"));
            s.addNode("X.db1.tbl1", List.of("id"));
            s.addNode("Y.db2.tbl2", List.of("id"));
            s.addJoinEdge("X.db1.tbl1", "Y.db2.tbl2", "LEFT", "X.db1.tbl1.id=Y.db2.tbl2.id");

            assertEquals("SELECT *\nFROM [LS1].[db1].dbo.[tbl1]\nLEFT JOIN Y.db2.tbl2 ON X.db1.tbl1.id=Y.db2.tbl2.id",
                    s.getSql());
        }
    }

    @Test
    void import_keeps_body_and_registers_ctes() {
        try (QuerySession s = new QuerySession()) {
            s.addNode("A", List.of("id"));

            s.importSql("WITH a AS (SELECT 1 AS x)\nSELECT x FROM a");

            assertTrue(s.getGraph().isEmpty());
            assertEquals(1, s.getClauses().getCtes().size());
            assertEquals("SELECT x FROM a", s.getImportedBody());
            assertEquals("WITH a AS (\nSELECT 1 AS x\n)\nSELECT x FROM a", s.getSql());
        }
    }

    @Test
    void malformed_import_changes_nothing() {
        try (QuerySession s = new QuerySession()) {
            s.addNode("A", List.of("id"));

            assertThrows(IllegalArgumentException.class, () -> s.importSql("WITH a AS (SELECT 1"));

            assertTrue(s.getGraph().hasNode("A"));
        }
    }

    @Test
    void reset_keeps_linked_map_and_mode() {
        try (QuerySession s = new QuerySession()) {
            s.setLinkedServerMap(Map.of("X", "LS1"));
            s.setOperationMode(OperationMode.DELETE);
            s.addNode("A", List.of("id"));
            s.addGroupBy("A.id");

            s.reset();

            assertTrue(s.getGraph().isEmpty());
            assertTrue(s.getClauses().getGroupBy().isEmpty());
            assertEquals(OperationMode.DELETE, s.getOperationMode());
            assertEquals("LS1", s.getLinkedServers().find("X"));
        }
    }

    @Test
    void manual_mode_defers_generation() {
        try (QuerySession s = new QuerySession()) {
            s.setAutoGenerate(false);
            s.addNode("A", List.of("id"));
            String stale = s.current().getSql();
            s.addNode("B", List.of("id"));

            assertEquals(stale, s.current().getSql());
            assertEquals("SELECT *\nFROM A\nFROM B", s.regenerate().getSql());
        }
    }

    @Test
    void run_hands_current_text_to_executor() throws Exception {
        List<String> executed = new ArrayList<>();
        try (QuerySession s = new QuerySession()) {
            s.addNode("A", List.of("id"));

            s.run(executed::add);

            assertEquals(List.of("SELECT *\nFROM A"), executed);
        }
    }

    @Test
    void burst_of_edits_is_validated_once_against_the_final_text() throws Exception {
        List<ValidationResult> seen = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(1);
        DebouncedValidator validator = new DebouncedValidator(new SyntaxValidator(), 400L, r -> {
            seen.add(r);
            done.countDown();
        });

        try (QuerySession s = new QuerySession(CompileContext.none(), null, validator)) {
            assertNull(s.getValidation());

            s.addNode("A", List.of("id"));
            s.addNode("B", List.of("id", "aid"));
            // A와 B가 끊긴 상태의 FROM 두 개는 문법 오류
            assertTrue(s.getSql().contains("FROM A\nFROM B"), s.getSql());
            s.addJoinEdge("A", "B", "INNER", "A.id=B.aid");

            assertTrue(done.await(5, TimeUnit.SECONDS), "validation did not run");
            Thread.sleep(600L);

            assertEquals(1, seen.size());
            assertTrue(seen.get(0).isValid(), seen.get(0).getMessage());
            assertSame(seen.get(0), s.getValidation());
        }
    }

    @Test
    void session_without_validator_reports_no_validation() {
        try (QuerySession s = new QuerySession()) {
            s.addNode("A", List.of("id"));
            assertNull(s.getValidation());
        }
    }
}
