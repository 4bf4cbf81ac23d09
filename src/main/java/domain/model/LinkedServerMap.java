package domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable {@code alias -> linkedServerName} lookup used for four-part name rewriting.
 */
public final class LinkedServerMap {

    private static final LinkedServerMap EMPTY = new LinkedServerMap(Collections.emptyMap());

    private final Map<String, String> byAlias;

    private LinkedServerMap(Map<String, String> byAlias) {
        this.byAlias = byAlias;
    }

    public static LinkedServerMap empty() {
        return EMPTY;
    }

    /** Blank keys/values are dropped; keys and values are trimmed. */
    public static LinkedServerMap of(Map<String, String> raw) {
        if (raw == null || raw.isEmpty()) return EMPTY;
        Map<String, String> m = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : raw.entrySet()) {
            String k = e.getKey() == null ? "" : e.getKey().trim();
            String v = e.getValue() == null ? "" : e.getValue().trim();
            if (k.isEmpty() || v.isEmpty()) continue;
            m.put(k, v);
        }
        return m.isEmpty() ? EMPTY : new LinkedServerMap(Collections.unmodifiableMap(m));
    }

    /** @return linked server name, or null when the alias is not mapped */
    public String find(String alias) {
        if (alias == null) return null;
        return byAlias.get(alias);
    }

    public boolean isEmpty() {
        return byAlias.isEmpty();
    }

    public int size() {
        return byAlias.size();
    }

    public Map<String, String> asMap() {
        return byAlias;
    }
}
