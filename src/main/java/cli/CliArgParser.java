package cli;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * CLI argument parsing helpers.
 */
public final class CliArgParser {

    /** Options that never take the following argument as their value; use {@code --clear=false}. */
    static final Set<String> VALUELESS_FLAGS = Set.of("clear", "help", "h");

    private CliArgParser() {
    }

    public static int parseInt(String s, int def) {
        if (s == null || s.isBlank()) return def;
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: '" + s.trim() + "'", e);
        }
    }

    public static boolean parseBoolean(String s, boolean def) {
        if (s == null || s.isBlank()) return def;
        String v = s.trim()
                .toLowerCase();
        return v.equals("true") || v.equals("1") || v.equals("y") || v.equals("yes");
    }

    /**
     * Presence-style flag.
     * <ul>
     *   <li>--clear       => true</li>
     *   <li>--clear=true  => true</li>
     *   <li>--clear=false => false</li>
     * </ul>
     * Absent => {@code def}.
     */
    public static boolean flag(Map<String, String> argv, String key, boolean def) {
        if (argv == null || key == null) return def;
        if (!argv.containsKey(key)) return def;
        String raw = argv.get(key);
        if (raw == null || raw.isBlank()) return true;
        return parseBoolean(raw, true);
    }

    /**
     * Option value: command line first, then JVM system property ({@code -Dkey=value}).
     */
    public static String value(Map<String, String> argv, String key) {
        String v = (argv == null) ? null : argv.get(key);
        if (v != null && !v.isBlank()) return v.trim();
        String prop = System.getProperty(key);
        return (prop == null || prop.isBlank()) ? null : prop.trim();
    }

    /**
     * Split a path list on ',' or ';'. Blank items are dropped, order is kept.
     */
    public static List<String> parseList(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) return out;
        for (String part : raw.split("[,;]")) {
            String t = part.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    /**
     * {@code --key=value}, {@code --key value} and bare {@code --flag}. Flags in
     * {@link #VALUELESS_FLAGS} only take a value through {@code =}. Arguments that do not start
     * with "--" and are not consumed as a value are collected under {@link #POSITIONAL}, separated
     * by ';'.
     */
    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new HashMap<>();
        if (args == null) return m;

        List<String> positional = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a == null) continue;
            a = a.trim();
            if (!a.startsWith("--")) {
                if (!a.isEmpty()) positional.add(a);
                continue;
            }

            String k;
            String v;

            int eq = a.indexOf('=');
            if (eq > 2) {
                k = a.substring(2, eq)
                        .trim();
                v = a.substring(eq + 1)
                        .trim();
            } else {
                k = a.substring(2)
                        .trim();
                v = "";
                if (!VALUELESS_FLAGS.contains(k)
                        && i + 1 < args.length && args[i + 1] != null && !args[i + 1].startsWith("--")) {
                    v = args[i + 1].trim();
                    i++;
                }
            }

            if (!k.isEmpty()) m.put(k, v);
        }

        if (!positional.isEmpty()) m.put(POSITIONAL, String.join(";", positional));
        return m;
    }

    public static final String POSITIONAL = "_";
}
