package domain.convert;

import domain.clause.ClauseState;
import domain.graph.GraphModel;
import domain.graph.JoinType;
import domain.model.CompileContext;
import domain.model.CompileWarning;
import domain.model.ListCompileWarningSink;
import domain.model.OperationMode;
import domain.model.WarningCode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DmlTranslatorTest {

    private final DmlTranslator translator = new DmlTranslator(new ClauseAssembler(new FromClauseBuilder()));
    private final List<CompileWarning> warnings = new ArrayList<>();
    private final ListCompileWarningSink sink = new ListCompileWarningSink(warnings);

    private static GraphModel sourceToTarget() {
        GraphModel g = new GraphModel();
        g.addNode("S", List.of("id", "v"));
        g.addNode("T", List.of("id", "val"));
        g.setDmlTarget("T");
        g.addMappingEdge("S.v", "T.val");
        return g;
    }

    private String translate(OperationMode mode, GraphModel g) {
        return translator.translate(mode, g, new ClauseState(), CompileContext.none(), sink);
    }

    @Test
    void update_sets_mapped_columns_and_joins_on_id() {
        String sql = translate(OperationMode.UPDATE, sourceToTarget());

        assertEquals("UPDATE T\n"
                + "SET val=src.v\n"
                + "FROM (\n"
                + "SELECT *\n"
                + "FROM S\n"
                + ") AS src\n"
                + "WHERE T.id=src.id", sql);
        assertTrue(warnings.isEmpty(), warnings.toString());
    }

    @Test
    void update_with_only_id_mapped_has_nothing_to_set() {
        GraphModel g = new GraphModel();
        g.addNode("S", List.of("id"));
        g.addNode("T", List.of("id"));
        g.setDmlTarget("T");
        g.addMappingEdge("S.id", "T.id");

        String sql = translate(OperationMode.UPDATE, g);

        assertEquals("-- Only id is mapped to T => nothing to SET.", sql);
        assertEquals(WarningCode.DML_SET_EMPTY, warnings.get(0).getCode());
    }

    @Test
    void insert_lists_target_columns_over_sub_select() {
        GraphModel g = sourceToTarget();
        g.selectColumn("S", "v");

        assertEquals("INSERT INTO T (val)\nSELECT S.v\nFROM S", translate(OperationMode.INSERT, g));
    }

    @Test
    void delete_filters_by_id_in_sub_select() {
        GraphModel g = sourceToTarget();
        g.selectColumn("S", "id");

        assertEquals("DELETE FROM T\nWHERE id IN (\nSELECT S.id\nFROM S\n)", translate(OperationMode.DELETE, g));
    }

    @Test
    void target_is_excluded_from_sub_select_joins() {
        GraphModel g = sourceToTarget();
        g.addJoinEdge("S", "T", JoinType.INNER, "S.id=T.id");
        g.selectColumn("T", "val");

        String sql = translate(OperationMode.DELETE, g);

        assertFalse(sql.contains("JOIN T"), sql);
        assertFalse(sql.contains("T.val"), sql);
    }

    @Test
    void three_part_target_keeps_db_and_table() {
        GraphModel g = new GraphModel();
        g.addNode("S", List.of("v"));
        g.addNode("X.db1.tbl1", List.of("val"));
        g.setDmlTarget("X.db1.tbl1");
        g.addMappingEdge("S.v", "X.db1.tbl1.val");

        assertTrue(translate(OperationMode.INSERT, g).startsWith("INSERT INTO db1.tbl1 (val)\n"));
    }

    @Test
    void missing_target_or_mapping_yields_comment_line() {
        GraphModel g = new GraphModel();
        g.addNode("S", List.of("v"));

        assertEquals("-- No target table marked for INSERT => no INSERT.", translate(OperationMode.INSERT, g));

        g.addNode("T", List.of("val"));
        g.setDmlTarget("T");
        assertEquals("-- No column mappings to T => no DELETE.", translate(OperationMode.DELETE, g));

        assertEquals(WarningCode.DML_TARGET_MISSING, warnings.get(0).getCode());
        assertEquals(WarningCode.DML_MAPPING_MISSING, warnings.get(1).getCode());
    }

    @Test
    void select_mode_is_not_dml() {
        assertThrows(IllegalArgumentException.class, () -> translate(OperationMode.SELECT, sourceToTarget()));
    }
}
