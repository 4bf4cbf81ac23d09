package domain.design;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * One row of a design script: a command name plus up to four positional arguments.
 */
public final class DesignCommand {

    private final int lineNo;
    private final String name;
    private final List<String> args;

    public DesignCommand(int lineNo, String name, List<String> args) {
        this.lineNo = lineNo;
        this.name = name == null ? "" : name.trim();
        List<String> a = new ArrayList<>();
        if (args != null) {
            for (String s : args) a.add(s == null ? "" : s);
        }
        this.args = Collections.unmodifiableList(a);
    }

    /** {@code add_join-edge -> addjoinedge} */
    public static String normalize(String name) {
        if (name == null) return "";
        return name.trim().toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
    }

    public String key() {
        return normalize(name);
    }

    public int getLineNo() {
        return lineNo;
    }

    public String getName() {
        return name;
    }

    public List<String> getArgs() {
        return args;
    }

    /** Trimmed argument, "" when absent. */
    public String arg(int i) {
        if (i < 0 || i >= args.size()) return "";
        return args.get(i).trim();
    }

    /** Untrimmed argument (SQL bodies keep their layout). */
    public String rawArg(int i) {
        if (i < 0 || i >= args.size()) return "";
        return args.get(i);
    }

    public String requiredArg(int i, String label) {
        String v = arg(i);
        if (v.isEmpty()) {
            throw new IllegalArgumentException(name + ": missing " + label + " (arg" + (i + 1) + ")");
        }
        return v;
    }

    public int intArg(int i, String label) {
        String v = requiredArg(i, label);
        try {
            // XLSX numeric cells may come back as "10.0"
            if (v.endsWith(".0")) v = v.substring(0, v.length() - 2);
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + ": " + label + " is not a number: " + v, e);
        }
    }

    /** Comma separated list inside one cell; blanks dropped. */
    public List<String> listArg(int i) {
        List<String> out = new ArrayList<>();
        String v = arg(i);
        if (v.isEmpty()) return out;
        for (String p : v.split(",")) {
            String t = p.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    @Override
    public String toString() {
        return "#" + lineNo + " " + name + " " + args;
    }
}
