package domain.design;

import java.util.Collections;
import java.util.List;

/**
 * An ordered list of commands that builds one query design.
 *
 * <p>{@code group} is the directory the script was found in (relative to the designs root),
 * {@code name} its file name without extension.</p>
 */
public final class DesignScript {

    private final String group;
    private final String name;
    private final String source;
    private final List<DesignCommand> commands;

    public DesignScript(String group, String name, String source, List<DesignCommand> commands) {
        this.group = group == null ? "" : group;
        this.name = name == null ? "" : name;
        this.source = source == null ? "" : source;
        this.commands = commands == null ? Collections.emptyList() : Collections.unmodifiableList(commands);
    }

    public String getGroup() {
        return group;
    }

    public String getName() {
        return name;
    }

    public String getSource() {
        return source;
    }

    public List<DesignCommand> getCommands() {
        return commands;
    }

    public boolean isEmpty() {
        return commands.isEmpty();
    }
}
