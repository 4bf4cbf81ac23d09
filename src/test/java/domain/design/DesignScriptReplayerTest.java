package domain.design;

import domain.graph.NodeNotFoundException;
import domain.model.OperationMode;
import domain.session.QuerySession;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DesignScriptReplayerTest {

    private final DesignScriptReplayer replayer = new DesignScriptReplayer();

    private static DesignCommand cmd(int line, String name, String... args) {
        return new DesignCommand(line, name, Arrays.asList(args));
    }

    private static DesignScript script(DesignCommand... commands) {
        return new DesignScript("grp", "d1", "d1.csv", new ArrayList<>(Arrays.asList(commands)));
    }

    @Test
    void replays_select_design() {
        DesignScript s = script(
                cmd(2, "addNode", "A", "id,name"),
                cmd(3, "add_node", "B", "id, aid"),
                cmd(4, "ADD-JOIN", "A", "B", "inner", "A.id=B.aid"),
                cmd(5, "selectColumns", "A", "id,name"),
                cmd(6, "addWhere", "status", "IN", "'A','B'"),
                cmd(7, "addOrderBy", "A.name", "desc"),
                cmd(8, "setLimit", "10.0")
        );

        try (QuerySession session = new QuerySession()) {
            replayer.replay(s, session);

            assertEquals("SELECT A.id, A.name\n"
                    + "FROM A\n"
                    + "INNER JOIN B ON A.id=B.aid\n"
                    + "WHERE status IN ('A','B')\n"
                    + "ORDER BY A.name DESC\n"
                    + "LIMIT 10", session.getSql());
        }
    }

    @Test
    void replays_update_design_with_linked_server_and_window() {
        DesignScript s = script(
                cmd(2, "setLinkedServer", "X", "LS1"),
                cmd(3, "addNode", "X.db1.src", "id,v"),
                cmd(4, "addNode", "T", "id,val"),
                cmd(5, "markDmlTarget", "T"),
                cmd(6, "addMapping", "X.db1.src.v", "T.val"),
                cmd(7, "addWindowFunction", "ROW_NUMBER()", "rn", "X.db1.src.v", "X.db1.src.id DESC"),
                cmd(8, "setMode", "update")
        );

        try (QuerySession session = new QuerySession()) {
            replayer.replay(s, session);

            assertEquals(OperationMode.UPDATE, session.getOperationMode());
            assertEquals("UPDATE T\n"
                    + "SET val=src.v\n"
                    + "FROM (\n"
                    + "SELECT ROW_NUMBER() OVER (PARTITION BY X.db1.src.v ORDER BY X.db1.src.id DESC) AS rn\n"
                    + "FROM [LS1].[db1].dbo.[src]\n"
                    + ") AS src\n"
                    + "WHERE T.id=src.id", session.getSql());
        }
    }

    @Test
    void failing_row_is_reported_with_line_number() {
        DesignScript s = script(
                cmd(2, "addNode", "A", "id"),
                cmd(3, "addJoin", "A", "Z", "LEFT", "A.id=Z.id")
        );

        try (QuerySession session = new QuerySession()) {
            DesignReplayException e = assertThrows(DesignReplayException.class, () -> replayer.replay(s, session));

            assertEquals(3, e.getCommand().getLineNo());
            assertTrue(e.getMessage().startsWith("line 3 [addJoin]: "), e.getMessage());
            assertInstanceOf(NodeNotFoundException.class, e.getCause());
            assertTrue(session.getGraph().hasNode("A"));
        }
    }

    @Test
    void unknown_command_and_missing_argument_fail() {
        try (QuerySession session = new QuerySession()) {
            assertThrows(DesignReplayException.class, () -> replayer.replay(script(cmd(1, "dropEverything")), session));
            assertThrows(DesignReplayException.class, () -> replayer.replay(script(cmd(1, "addNode", " ")), session));
            assertThrows(DesignReplayException.class, () -> replayer.replay(script(cmd(1, "setLimit", "ten")), session));
        }
    }

    @Test
    void command_names_normalize() {
        assertEquals("addjoinedge", DesignCommand.normalize(" Add_Join-Edge "));

        DesignCommand c = cmd(1, "x", " a , ,b ");
        List<String> list = c.listArg(0);
        assertEquals(List.of("a", "b"), list);
        assertEquals("", c.arg(5));
    }
}
