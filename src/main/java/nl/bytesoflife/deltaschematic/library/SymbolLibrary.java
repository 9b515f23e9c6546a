package nl.bytesoflife.deltaschematic.library;

import nl.bytesoflife.deltaschematic.SchematicException;
import nl.bytesoflife.deltaschematic.model.SymbolDefinition;
import nl.bytesoflife.deltaschematic.sexpr.SExpressionParser;
import nl.bytesoflife.deltaschematic.sexpr.SNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A parsed {@code .kicad_sym} file. Definitions are stored as written, unflattened and unqualified.
 */
public class SymbolLibrary {

    private static final Logger log = LoggerFactory.getLogger(SymbolLibrary.class);

    private final String nickname;
    private final Path path;
    private final long lastModified;
    private final Map<String, SymbolDefinition> symbols;

    public SymbolLibrary(String nickname, Path path, long lastModified, Map<String, SymbolDefinition> symbols) {
        this.nickname = nickname;
        this.path = path;
        this.lastModified = lastModified;
        this.symbols = new LinkedHashMap<>(symbols);
    }

    public static SymbolLibrary load(String nickname, Path path) throws IOException {
        long start = System.currentTimeMillis();
        long lastModified = Files.getLastModifiedTime(path).toMillis();
        SymbolLibrary library = parse(nickname, path, lastModified, Files.readString(path));
        log.info("Loaded symbol library {} ({} symbols) from {} in {} ms", nickname, library.size(), path,
                System.currentTimeMillis() - start);
        return library;
    }

    static SymbolLibrary parse(String nickname, Path path, long lastModified, String text) {
        SNode.SList root = new SExpressionParser().parseDocument(text, path.toString());
        if (!root.hasTag("kicad_symbol_lib")) {
            throw new SchematicException(path + ": not a symbol library (found '" + root.tag() + "')");
        }
        Map<String, SymbolDefinition> symbols = new LinkedHashMap<>();
        for (SNode.SList node : root.findAll("symbol")) {
            SymbolDefinition definition = new SymbolDefinition(node);
            symbols.put(definition.getName(), definition);
        }
        return new SymbolLibrary(nickname, path, lastModified, symbols);
    }

    public String getNickname() {
        return nickname;
    }

    public Path getPath() {
        return path;
    }

    public long getLastModified() {
        return lastModified;
    }

    public Optional<SymbolDefinition> get(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    public Map<String, SymbolDefinition> getSymbols() {
        return Collections.unmodifiableMap(symbols);
    }

    public int size() {
        return symbols.size();
    }

    @Override
    public String toString() {
        return "SymbolLibrary{" + nickname + ", " + path + ", symbols=" + symbols.size() + "}";
    }
}
