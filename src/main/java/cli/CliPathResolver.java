package cli;

import domain.validate.InputValidator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/** CLI path resolver (baseDir / default cell map / estimate list). */
public final class CliPathResolver {

    private CliPathResolver() {}

    public static final String PROP_BASE_DIR = "baseDir";

    public static Path resolveBaseDir(Map<String, String> argv) {
        String bd = CliArgParser.value(argv, PROP_BASE_DIR);
        if (bd != null) {
            return resolveAgainstUserDir(bd).toAbsolutePath().normalize();
        }
        return Paths.get(".").toAbsolutePath().normalize();
    }

    /** Relative inputs are resolved against baseDir; blank stays blank. */
    public static String resolvePath(Path baseDir, String input) {
        if (input == null || input.isBlank()) return "";
        Path p = Paths.get(input.trim());
        if (!p.isAbsolute() && baseDir != null) p = baseDir.resolve(p);
        return p.toString();
    }

    public static Path resolveAgainstUserDir(String raw) {
        Path p = Paths.get(raw.trim());
        if (p.isAbsolute()) return p;
        return Paths.get(System.getProperty("user.dir")).resolve(p);
    }

    /**
     * Default cell map: "Cell Map.xlsx" in baseDir, then next to the running jar.
     *
     * @return path string, or blank when not found
     */
    public static String findDefaultCellMap(Path baseDir, String fileName) {
        if (baseDir != null) {
            Path p = baseDir.resolve(fileName);
            if (Files.isRegularFile(p)) return p.toString();
        }
        Path jarDir = jarDir();
        if (jarDir != null) {
            Path p = jarDir.resolve(fileName);
            if (Files.isRegularFile(p)) return p.toString();
        }
        return "";
    }

    private static Path jarDir() {
        try {
            var cs = CliPathResolver.class.getProtectionDomain().getCodeSource();
            if (cs == null || cs.getLocation() == null) return null;
            Path codePath = Path.of(cs.getLocation().toURI()).toAbsolutePath().normalize();
            String lower = codePath.toString().toLowerCase(Locale.ROOT);
            if (Files.isRegularFile(codePath) && lower.endsWith(".jar")) return codePath.getParent();
            return null;
        } catch (Exception e) {
            // no code source location (e.g. custom class loader): no jar dir lookup
            return null;
        }
    }

    /**
     * Spreadsheet files directly inside {@code dir}, sorted by file name. Lock files
     * ("~$name.xlsx") are skipped.
     */
    public static List<String> listEstimateFiles(Path dir) throws IOException {
        List<String> out = new ArrayList<>();
        if (dir == null || !Files.isDirectory(dir)) {
            throw new IllegalArgumentException("estimate directory not found: " + dir);
        }
        try (Stream<Path> s = Files.list(dir)) {
            s.filter(Files::isRegularFile)
                    .filter(p -> InputValidator.SPREADSHEET_EXTENSIONS.contains(InputValidator.extension(p)))
                    .filter(p -> !String.valueOf(p.getFileName()).startsWith("~$"))
                    .sorted((a, b) -> String.valueOf(a.getFileName()).compareTo(String.valueOf(b.getFileName())))
                    .forEach(p -> out.add(p.toString()));
        }
        return out;
    }

    /** Drops repeated paths, keeping the first occurrence and the input order. */
    public static List<String> dedupe(List<String> paths) {
        Set<String> seen = new LinkedHashSet<>(paths);
        return new ArrayList<>(seen);
    }
}
