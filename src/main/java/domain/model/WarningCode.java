package domain.model;

/**
 * Standard warning codes for compilation/reporting.
 *
 * <p>Keep the set small and stable. Add codes only when the meaning is clear
 * and actionable for operators.</p>
 */
public enum WarningCode {

    /**
     * The join graph has more than one connected component, so more than one FROM block was emitted.
     */
    DISCONNECTED_JOIN_GRAPH,

    /**
     * DML generation was requested but no node is marked as the DML target.
     */
    DML_TARGET_MISSING,

    /**
     * DML generation was requested but the target has no mapping edges.
     */
    DML_MAPPING_MISSING,

    /**
     * UPDATE generation found only key (id) mappings, so the SET list is empty.
     */
    DML_SET_EMPTY,

    /**
     * A three-part table reference uses an alias that is not in the linked-server map.
     */
    UNMAPPED_LINKED_ALIAS,

    /**
     * Generated SQL did not pass the syntax check (advisory).
     */
    SYNTAX_INVALID,

    /**
     * A design script command failed while being replayed.
     */
    DESIGN_REPLAY_ERROR,

    /**
     * Design script contains no commands and is skipped.
     */
    DESIGN_EMPTY,

    /**
     * Linked-server map file was requested but not found.
     */
    LINKED_MAP_MISSING,

    /**
     * Processing time exceeded the configured slow threshold.
     */
    SLOW_DESIGN
}
