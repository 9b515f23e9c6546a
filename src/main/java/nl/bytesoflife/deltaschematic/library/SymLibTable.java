package nl.bytesoflife.deltaschematic.library;

import nl.bytesoflife.deltaschematic.SchematicException;
import nl.bytesoflife.deltaschematic.sexpr.SExpressionParser;
import nl.bytesoflife.deltaschematic.sexpr.SNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Parsed {@code sym-lib-table}: the nickname to library file mapping of a KiCad installation or
 * project.
 * <pre>
 * (sym_lib_table
 *   (version 7)
 *   (lib (name "Device")(type "KiCad")(uri "${KICAD9_SYMBOL_DIR}/Device.kicad_sym")(options "")(descr ""))
 * )
 * </pre>
 */
public class SymLibTable {

    public record Entry(String name, String type, String uri, String options, String description,
                        boolean disabled) {
    }

    private final List<Entry> entries;

    public SymLibTable(List<Entry> entries) {
        this.entries = List.copyOf(entries);
    }

    public static SymLibTable load(Path path) throws IOException {
        return parse(Files.readString(path), path.toString());
    }

    public static SymLibTable parse(String text, String sourceName) {
        SNode.SList root = new SExpressionParser().parseDocument(text, sourceName);
        if (!root.hasTag("sym_lib_table")) {
            throw new SchematicException(sourceName + ": not a sym-lib-table (found '" + root.tag() + "')");
        }
        List<Entry> entries = new ArrayList<>();
        for (SNode.SList lib : root.findAll("lib")) {
            String name = field(lib, "name");
            String uri = field(lib, "uri");
            if (name == null || uri == null) {
                throw new SchematicException(sourceName + ": library entry without name or uri: " + lib);
            }
            String type = field(lib, "type");
            entries.add(new Entry(name, type != null ? type : "KiCad", uri, orEmpty(field(lib, "options")),
                    orEmpty(field(lib, "descr")), lib.find("disabled").isPresent()));
        }
        return new SymLibTable(entries);
    }

    public List<Entry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public Optional<Entry> find(String nickname) {
        return entries.stream()
                .filter(entry -> entry.name().equals(nickname) && !entry.disabled())
                .findFirst();
    }

    private static String field(SNode.SList lib, String tag) {
        return lib.find(tag).map(node -> node.text(1)).orElse(null);
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }
}
