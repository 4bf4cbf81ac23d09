package domain.output;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SqlFileNamePolicyTest {

    @Test
    void should_split_group_on_slash_and_backslash() {
        assertEquals(List.of("sales", "monthly"), SqlFileNamePolicy.groupDirs("sales/monthly"));
        assertEquals(List.of("sales", "monthly"), SqlFileNamePolicy.groupDirs("sales\\monthly"));
        assertEquals(List.of(), SqlFileNamePolicy.groupDirs(""));
    }

    @Test
    void should_drop_dot_segments_so_output_stays_under_root() {
        assertEquals(List.of("a", "b"), SqlFileNamePolicy.groupDirs("../a/./b/.."));
    }

    @Test
    void should_sanitize_design_name() {
        assertEquals("top_customers.sql", SqlFileNamePolicy.build("top customers"));
        assertEquals("unnamed.sql", SqlFileNamePolicy.build("  "));
        assertEquals("_CON.sql", SqlFileNamePolicy.build("CON"));
    }
}
