package nl.bytesoflife.deltaschematic.io;

import nl.bytesoflife.deltaschematic.GrammarException;
import nl.bytesoflife.deltaschematic.SchematicException;
import nl.bytesoflife.deltaschematic.UnsupportedVersionException;
import nl.bytesoflife.deltaschematic.format.FormatRules;
import nl.bytesoflife.deltaschematic.model.DocumentEntry;
import nl.bytesoflife.deltaschematic.model.HeaderField;
import nl.bytesoflife.deltaschematic.model.LibrarySymbols;
import nl.bytesoflife.deltaschematic.model.Passthrough;
import nl.bytesoflife.deltaschematic.model.SymbolDefinition;
import nl.bytesoflife.deltaschematic.model.TitleBlock;
import nl.bytesoflife.deltaschematic.sexpr.SExpressionParser;
import nl.bytesoflife.deltaschematic.sexpr.SNode;
import nl.bytesoflife.deltaschematic.sexpr.SValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns schematic text into document entries. Known top-level shapes become typed entries that
 * keep their node; everything else is kept as {@link Passthrough}.
 */
public class SchematicReader {

    private static final Logger log = LoggerFactory.getLogger(SchematicReader.class);

    private int minVersion = FormatRules.MIN_SUPPORTED_VERSION;
    private int maxVersion = FormatRules.FORMAT_VERSION;
    private boolean lenientVersion;

    private final ComponentCodec componentCodec = new ComponentCodec();
    private final WireCodec wireCodec = new WireCodec();
    private final LabelCodec labelCodec = new LabelCodec();
    private final JunctionCodec junctionCodec = new JunctionCodec();
    private final NoConnectCodec noConnectCodec = new NoConnectCodec();
    private final SheetCodec sheetCodec = new SheetCodec();
    private final TextCodec textCodec = new TextCodec();
    private final TextBoxCodec textBoxCodec = new TextBoxCodec();
    private final RectangleCodec rectangleCodec = new RectangleCodec();
    private final ImageCodec imageCodec = new ImageCodec();

    public SchematicReader withVersionRange(int min, int max) {
        this.minVersion = min;
        this.maxVersion = max;
        return this;
    }

    public SchematicReader withLenientVersion(boolean lenient) {
        this.lenientVersion = lenient;
        return this;
    }

    public List<DocumentEntry> read(String text) {
        return read(text, "<input>");
    }

    /**
     * @throws GrammarException            when the text is not a well-formed S-expression
     * @throws UnsupportedVersionException when the file format version is out of range
     */
    public List<DocumentEntry> read(String text, String sourceName) {
        long start = System.currentTimeMillis();
        SNode.SList root = new SExpressionParser().parseDocument(text, sourceName);
        if (!root.hasTag("kicad_sch")) {
            throw new GrammarException(sourceName, 1, 1, 0, "(kicad_sch ...)", "(" + root.tag() + " ...)");
        }
        checkVersion(root, sourceName);

        List<DocumentEntry> entries = new ArrayList<>(root.size());
        int passthrough = 0;
        for (int i = 1; i < root.size(); i++) {
            SNode child = root.get(i);
            if (!(child instanceof SNode.SList list)) {
                throw new GrammarException(sourceName, 1, 1, 0, "a list", "top-level atom " + child);
            }
            DocumentEntry entry = readEntry(list, sourceName);
            if (entry instanceof Passthrough) {
                passthrough++;
            }
            entries.add(entry);
        }
        log.debug("Read {}: {} entries ({} passthrough) in {}ms", sourceName, entries.size(), passthrough,
                System.currentTimeMillis() - start);
        return entries;
    }

    private DocumentEntry readEntry(SNode.SList node, String sourceName) {
        String tag = node.tag();
        if (tag == null) {
            return new Passthrough(node);
        }
        try {
            return switch (tag) {
                case "version", "generator", "generator_version", "uuid", "paper" ->
                        new HeaderField(tag, Nodes.requireText(node, 1, tag), node);
                case "title_block" -> readTitleBlock(node);
                case "lib_symbols" -> readLibrarySymbols(node);
                case "symbol" -> componentCodec.read(node);
                case "wire", "bus" -> wireCodec.read(node);
                case "label", "global_label", "hierarchical_label" -> labelCodec.read(node);
                case "junction" -> junctionCodec.read(node);
                case "no_connect" -> noConnectCodec.read(node);
                case "sheet" -> sheetCodec.read(node);
                case "text" -> textCodec.read(node);
                case "text_box" -> textBoxCodec.read(node);
                case "rectangle" -> rectangleCodec.read(node);
                case "image" -> imageCodec.read(node);
                default -> new Passthrough(node);
            };
        } catch (SchematicException | IllegalArgumentException | ArithmeticException e) {
            log.warn("{}: keeping unreadable ({} ...) verbatim: {}", sourceName, tag, e.getMessage());
            return new Passthrough(node);
        }
    }

    private void checkVersion(SNode.SList root, String sourceName) {
        SNode.SList versionNode = root.find("version").orElseThrow(
                () -> new GrammarException(sourceName, 1, 1, 0, "(version N)", "no version"));
        int version = SValues.asInt(versionNode.get(1));
        if (version < minVersion || version > maxVersion) {
            if (!lenientVersion) {
                throw new UnsupportedVersionException(sourceName, version, minVersion, maxVersion);
            }
            log.warn("{}: file format version {} is outside {}..{}, reading anyway", sourceName, version,
                    minVersion, maxVersion);
        }
    }

    static TitleBlock readTitleBlock(SNode.SList node) {
        TitleBlock block = new TitleBlock(node);
        block.setTitle(Nodes.text(node, "title"));
        block.setDate(Nodes.text(node, "date"));
        block.setRevision(Nodes.text(node, "rev"));
        block.setCompany(Nodes.text(node, "company"));
        for (SNode.SList comment : node.findAll("comment")) {
            block.setComment(SValues.asInt(comment.get(1)), comment.text(2));
        }
        block.clearModified();
        return block;
    }

    static LibrarySymbols readLibrarySymbols(SNode.SList node) {
        List<SymbolDefinition> definitions = new ArrayList<>();
        for (SNode.SList symbol : node.findAll("symbol")) {
            definitions.add(new SymbolDefinition(symbol));
        }
        return new LibrarySymbols(definitions, node);
    }
}
