package nl.bytesoflife.deltaschematic.io;

import nl.bytesoflife.deltaschematic.format.FormatDialect;
import nl.bytesoflife.deltaschematic.model.Component;
import nl.bytesoflife.deltaschematic.model.DocumentEntry;
import nl.bytesoflife.deltaschematic.model.HeaderField;
import nl.bytesoflife.deltaschematic.model.Image;
import nl.bytesoflife.deltaschematic.model.Junction;
import nl.bytesoflife.deltaschematic.model.Label;
import nl.bytesoflife.deltaschematic.model.LibrarySymbols;
import nl.bytesoflife.deltaschematic.model.NoConnect;
import nl.bytesoflife.deltaschematic.model.Passthrough;
import nl.bytesoflife.deltaschematic.model.Rectangle;
import nl.bytesoflife.deltaschematic.model.Sheet;
import nl.bytesoflife.deltaschematic.model.SymbolDefinition;
import nl.bytesoflife.deltaschematic.model.TextBox;
import nl.bytesoflife.deltaschematic.model.TextItem;
import nl.bytesoflife.deltaschematic.model.TitleBlock;
import nl.bytesoflife.deltaschematic.model.Wire;
import nl.bytesoflife.deltaschematic.sexpr.SExpressionWriter;
import nl.bytesoflife.deltaschematic.sexpr.SNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Serializes document entries in stored order. Untouched entries are written from their raw node;
 * everything goes through KiCad's layout pass at the end.
 */
public class SchematicWriter {

    private final ComponentCodec componentCodec;
    private final WireCodec wireCodec = new WireCodec();
    private final LabelCodec labelCodec;
    private final JunctionCodec junctionCodec = new JunctionCodec();
    private final NoConnectCodec noConnectCodec = new NoConnectCodec();
    private final SheetCodec sheetCodec;
    private final TextCodec textCodec;
    private final TextBoxCodec textBoxCodec;
    private final RectangleCodec rectangleCodec = new RectangleCodec();
    private final ImageCodec imageCodec = new ImageCodec();

    public SchematicWriter() {
        this(FormatDialect.CURRENT);
    }

    public SchematicWriter(FormatDialect dialect) {
        componentCodec = new ComponentCodec(dialect);
        labelCodec = new LabelCodec(dialect);
        sheetCodec = new SheetCodec(dialect);
        textCodec = new TextCodec(dialect);
        textBoxCodec = new TextBoxCodec(dialect);
    }

    public String serialize(List<DocumentEntry> entries) {
        return SExpressionWriter.write(toNode(entries));
    }

    public SNode.SList toNode(List<DocumentEntry> entries) {
        List<SNode> children = new ArrayList<>(entries.size() + 1);
        children.add(SNode.atom("kicad_sch"));
        for (DocumentEntry entry : entries) {
            children.add(write(entry));
        }
        return new SNode.SList(children);
    }

    public SNode.SList write(DocumentEntry entry) {
        if (entry instanceof Passthrough passthrough) {
            return passthrough.getNode();
        } else if (entry instanceof HeaderField field) {
            return writeHeader(field);
        } else if (entry instanceof TitleBlock block) {
            return writeTitleBlock(block);
        } else if (entry instanceof LibrarySymbols symbols) {
            return writeLibrarySymbols(symbols);
        } else if (entry instanceof Component component) {
            return componentCodec.write(component);
        } else if (entry instanceof Wire wire) {
            return wireCodec.write(wire);
        } else if (entry instanceof Label label) {
            return labelCodec.write(label);
        } else if (entry instanceof Junction junction) {
            return junctionCodec.write(junction);
        } else if (entry instanceof NoConnect noConnect) {
            return noConnectCodec.write(noConnect);
        } else if (entry instanceof Sheet sheet) {
            return sheetCodec.write(sheet);
        } else if (entry instanceof TextItem text) {
            return textCodec.write(text);
        } else if (entry instanceof TextBox box) {
            return textBoxCodec.write(box);
        } else if (entry instanceof Rectangle rectangle) {
            return rectangleCodec.write(rectangle);
        } else if (entry instanceof Image image) {
            return imageCodec.write(image);
        }
        throw new IllegalStateException("Unhandled entry " + entry);
    }

    private static SNode.SList writeHeader(HeaderField field) {
        if (field.getRaw() != null && !field.isModified()) {
            return field.getRaw();
        }
        SNode value = "version".equals(field.tag())
                ? SNode.number(field.getValue())
                : NodeBuilder.value(field.tag(), field.getValue());
        SNode.SList derived = NodeBuilder.list(field.tag()).child(value).build();
        return (SNode.SList) NodeMerger.merge(field.getRaw(), derived);
    }

    private static SNode.SList writeTitleBlock(TitleBlock block) {
        if (block.getRaw() != null && !block.isModified()) {
            return block.getRaw();
        }
        NodeBuilder builder = NodeBuilder.list("title_block");
        addIfPresent(builder, "title", block.getTitle());
        addIfPresent(builder, "date", block.getDate());
        addIfPresent(builder, "rev", block.getRevision());
        addIfPresent(builder, "company", block.getCompany());
        for (Map.Entry<Integer, String> comment : block.getComments().entrySet()) {
            builder.child(NodeBuilder.list("comment").integer(comment.getKey()).string(comment.getValue()).build());
        }
        return (SNode.SList) NodeMerger.merge(block.getRaw(), builder.build());
    }

    private static void addIfPresent(NodeBuilder builder, String tag, String value) {
        if (value != null && !value.isEmpty()) {
            builder.field(tag, value);
        }
    }

    private static SNode.SList writeLibrarySymbols(LibrarySymbols symbols) {
        if (symbols.getRaw() != null && !symbols.isModified()) {
            return symbols.getRaw();
        }
        NodeBuilder builder = NodeBuilder.list("lib_symbols");
        for (SymbolDefinition definition : symbols.definitions()) {
            builder.child(definition.getNode());
        }
        return builder.build();
    }
}
