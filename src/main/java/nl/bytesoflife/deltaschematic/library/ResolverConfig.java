package nl.bytesoflife.deltaschematic.library;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Where the resolver looks for symbol libraries and where it keeps its disk cache.
 * <pre>
 * ResolverConfig config = new ResolverConfig()
 *     .withLibraryDirectory(Path.of("/usr/share/kicad/symbols"))
 *     .withSymLibTable(projectDir.resolve("sym-lib-table"))
 *     .withDiskCache(Path.of(".symbol-cache"));
 * </pre>
 */
public class ResolverConfig {

    public static final List<String> SYMBOL_DIR_VARIABLES = List.of(
            "KICAD9_SYMBOL_DIR", "KICAD8_SYMBOL_DIR", "KICAD7_SYMBOL_DIR", "KICAD_SYMBOL_DIR");

    private final List<Path> libraryDirectories = new ArrayList<>();
    private final List<Path> symLibTables = new ArrayList<>();
    private final Map<String, String> pathVariables = new LinkedHashMap<>();
    private Path diskCacheDirectory;

    /**
     * Configuration from the {@code KICAD*_SYMBOL_DIR} environment variables. Each existing
     * directory is searched for {@code <nickname>.kicad_sym} and exported as a path variable.
     */
    public static ResolverConfig fromEnvironment() {
        ResolverConfig config = new ResolverConfig();
        for (String variable : SYMBOL_DIR_VARIABLES) {
            String value = System.getenv(variable);
            if (value != null && !value.isBlank() && Files.isDirectory(Path.of(value))) {
                config.withPathVariable(variable, value);
                if (!config.libraryDirectories.contains(Path.of(value))) {
                    config.withLibraryDirectory(Path.of(value));
                }
            }
        }
        return config;
    }

    public ResolverConfig withLibraryDirectory(Path directory) {
        libraryDirectories.add(directory);
        return this;
    }

    public ResolverConfig withSymLibTable(Path table) {
        symLibTables.add(table);
        return this;
    }

    public ResolverConfig withPathVariable(String name, String value) {
        pathVariables.put(name, value);
        return this;
    }

    public ResolverConfig withProjectDirectory(Path projectDirectory) {
        return withPathVariable("KIPRJMOD", projectDirectory.toString());
    }

    public ResolverConfig withDiskCache(Path directory) {
        this.diskCacheDirectory = directory;
        return this;
    }

    public List<Path> getLibraryDirectories() {
        return Collections.unmodifiableList(libraryDirectories);
    }

    public List<Path> getSymLibTables() {
        return Collections.unmodifiableList(symLibTables);
    }

    public Map<String, String> getPathVariables() {
        return Collections.unmodifiableMap(pathVariables);
    }

    public Path getDiskCacheDirectory() {
        return diskCacheDirectory;
    }

    @Override
    public String toString() {
        return "ResolverConfig{directories=" + libraryDirectories + ", tables=" + symLibTables
                + ", diskCache=" + diskCacheDirectory + "}";
    }
}
