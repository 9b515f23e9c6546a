package nl.bytesoflife.deltaschematic.library;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps a library nickname to its {@code .kicad_sym} file. sym-lib-table entries are consulted first,
 * in configuration order, then {@code <directory>/<nickname>.kicad_sym} in each library directory.
 */
public class LibraryLocator {

    private static final Logger log = LoggerFactory.getLogger(LibraryLocator.class);

    public static final String EXTENSION = ".kicad_sym";

    private final ResolverConfig config;
    private final PathVariables variables;
    private List<SymLibTable> tables;

    public LibraryLocator(ResolverConfig config) {
        this.config = config;
        this.variables = new PathVariables(config.getPathVariables());
    }

    public Optional<Path> locate(String nickname) {
        for (SymLibTable table : tables()) {
            Optional<SymLibTable.Entry> entry = table.find(nickname);
            if (entry.isPresent()) {
                Path path = Path.of(variables.expand(entry.get().uri()));
                if (Files.isRegularFile(path)) {
                    return Optional.of(path);
                }
                log.debug("sym-lib-table entry {} points to missing file {}", nickname, path);
            }
        }
        for (Path directory : config.getLibraryDirectories()) {
            Path candidate = directory.resolve(nickname + EXTENSION);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private synchronized List<SymLibTable> tables() {
        if (tables == null) {
            List<SymLibTable> loaded = new ArrayList<>();
            for (Path path : config.getSymLibTables()) {
                try {
                    loaded.add(SymLibTable.load(path));
                } catch (IOException e) {
                    throw new UncheckedIOException("Cannot read sym-lib-table " + path, e);
                }
            }
            tables = loaded;
        }
        return tables;
    }
}
