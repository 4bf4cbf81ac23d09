package domain.clause;

/** Named common table expression. The body is opaque and kept exactly as given. */
public final class CteDefinition {

    private final String name;
    private final String body;

    public CteDefinition(String name, String body) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("CTE name is blank");
        if (body == null || body.isBlank()) throw new IllegalArgumentException("CTE body is blank: " + name);
        this.name = name.trim();
        this.body = body;
    }

    public String getName() {
        return name;
    }

    public String getBody() {
        return body;
    }

    @Override
    public String toString() {
        return name + " AS (" + body + ")";
    }
}
