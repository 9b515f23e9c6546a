package nl.bytesoflife.deltaschematic.library;

import nl.bytesoflife.deltaschematic.SchematicException;
import nl.bytesoflife.deltaschematic.io.NodeBuilder;
import nl.bytesoflife.deltaschematic.model.SymbolDefinition;
import nl.bytesoflife.deltaschematic.sexpr.SExpressionParser;
import nl.bytesoflife.deltaschematic.sexpr.SExpressionWriter;
import nl.bytesoflife.deltaschematic.sexpr.SNode;
import nl.bytesoflife.deltaschematic.sexpr.SValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * On-disk tier: one file per library id holding the flattened symbol and the modification times of
 * the library files it came from.
 * <pre>
 * (symbol_cache_entry
 *   (format 1)
 *   (lib_id "Device:R")
 *   (sources (source "/usr/share/kicad/symbols/Device.kicad_sym" (mtime 1718000000000)))
 *   (symbol "Device:R" ...))
 * </pre>
 * Entries whose format differs or whose sources changed are stale. A corrupt entry is deleted.
 */
public class DiskSymbolCache {

    private static final Logger log = LoggerFactory.getLogger(DiskSymbolCache.class);

    public static final int FORMAT = 1;
    private static final String ENTRY_EXTENSION = ".sym_cache";

    private final Path directory;

    public DiskSymbolCache(Path directory) {
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    Path entryPath(LibraryId id) {
        return directory.resolve(URLEncoder.encode(id.toString(), StandardCharsets.UTF_8) + ENTRY_EXTENSION);
    }

    /**
     * The cached symbol for {@code id}, or empty when there is no fresh entry.
     */
    public Optional<ResolvedSymbol> load(LibraryId id) {
        Path path = entryPath(id);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        String text;
        try {
            text = Files.readString(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read symbol cache entry " + path, e);
        }
        ResolvedSymbol symbol;
        try {
            symbol = decode(id, text, path);
        } catch (SchematicException | IllegalArgumentException e) {
            log.warn("Discarding corrupt symbol cache entry {}: {}", path, e.getMessage());
            delete(path);
            return Optional.empty();
        }
        if (symbol == null || symbol.isStale()) {
            log.debug("Stale symbol cache entry {}", path);
            return Optional.empty();
        }
        log.debug("Disk cache hit for {}", id);
        return Optional.of(symbol);
    }

    public void store(ResolvedSymbol symbol) {
        Path path = entryPath(symbol.getLibraryId());
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "entry", ".tmp");
            Files.writeString(temp, SExpressionWriter.write(encode(symbol)));
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            if (temp != null) {
                delete(temp);
            }
            throw new UncheckedIOException("Cannot write symbol cache entry " + path, e);
        }
    }

    static SNode.SList encode(ResolvedSymbol symbol) {
        NodeBuilder sources = NodeBuilder.list("sources");
        for (Map.Entry<Path, Long> source : symbol.getSources().entrySet()) {
            sources.child(NodeBuilder.list("source")
                    .string(source.getKey().toString())
                    .child(NodeBuilder.list("mtime").integer(source.getValue()).build())
                    .build());
        }
        return NodeBuilder.list("symbol_cache_entry")
                .child(NodeBuilder.list("format").integer(FORMAT).build())
                .child(NodeBuilder.list("lib_id").string(symbol.getLibraryId().toString()).build())
                .child(sources.build())
                .child(symbol.getDefinition().getNode())
                .build();
    }

    static ResolvedSymbol decode(LibraryId id, String text, Path path) {
        SNode.SList root = new SExpressionParser().parseDocument(text, path.toString());
        if (!root.hasTag("symbol_cache_entry")) {
            throw new SchematicException("unexpected root '" + root.tag() + "'");
        }
        int format = root.find("format").map(node -> SValues.asInt(node.get(1)))
                .orElseThrow(() -> new SchematicException("missing format"));
        if (format != FORMAT) {
            return null;
        }
        String libId = root.find("lib_id").map(node -> node.text(1))
                .orElseThrow(() -> new SchematicException("missing lib_id"));
        if (!libId.equals(id.toString())) {
            return null;
        }
        Map<Path, Long> sources = new LinkedHashMap<>();
        SNode.SList sourcesNode = root.find("sources").orElseThrow(() -> new SchematicException("missing sources"));
        for (SNode.SList source : sourcesNode.findAll("source")) {
            long mtime = source.find("mtime").map(node -> Long.parseLong(node.text(1)))
                    .orElseThrow(() -> new SchematicException("source without mtime"));
            if (source.text(1) == null) {
                throw new SchematicException("source without path");
            }
            sources.put(Path.of(source.text(1)), mtime);
        }
        SNode.SList definition = root.find("symbol").orElseThrow(() -> new SchematicException("missing symbol"));
        return new ResolvedSymbol(id, new SymbolDefinition(definition), sources);
    }

    private static void delete(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Cannot delete {}: {}", path, e.getMessage());
        }
    }
}
