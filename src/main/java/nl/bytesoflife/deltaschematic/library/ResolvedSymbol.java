package nl.bytesoflife.deltaschematic.library;

import nl.bytesoflife.deltaschematic.model.SymbolDefinition;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flattened definition of one library id together with the library files it was built from and
 * their modification times when it was built.
 */
public final class ResolvedSymbol {

    private final LibraryId libraryId;
    private final SymbolDefinition definition;
    private final Map<Path, Long> sources;

    public ResolvedSymbol(LibraryId libraryId, SymbolDefinition definition, Map<Path, Long> sources) {
        this.libraryId = libraryId;
        this.definition = definition;
        this.sources = Collections.unmodifiableMap(new LinkedHashMap<>(sources));
    }

    public LibraryId getLibraryId() {
        return libraryId;
    }

    public SymbolDefinition getDefinition() {
        return definition;
    }

    public Map<Path, Long> getSources() {
        return sources;
    }

    public boolean isStale() {
        for (Map.Entry<Path, Long> source : sources.entrySet()) {
            Path path = source.getKey();
            if (!Files.exists(path)) {
                return true;
            }
            try {
                if (Files.getLastModifiedTime(path).toMillis() != source.getValue()) {
                    return true;
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot stat library " + path, e);
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "ResolvedSymbol{" + libraryId + ", sources=" + sources.keySet() + "}";
    }
}
