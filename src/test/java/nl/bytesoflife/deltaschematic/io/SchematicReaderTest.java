package nl.bytesoflife.deltaschematic.io;

import nl.bytesoflife.deltaschematic.GrammarException;
import nl.bytesoflife.deltaschematic.UnsupportedVersionException;
import nl.bytesoflife.deltaschematic.model.Component;
import nl.bytesoflife.deltaschematic.model.DocumentEntry;
import nl.bytesoflife.deltaschematic.model.HeaderField;
import nl.bytesoflife.deltaschematic.model.Image;
import nl.bytesoflife.deltaschematic.model.Junction;
import nl.bytesoflife.deltaschematic.model.Label;
import nl.bytesoflife.deltaschematic.model.LibrarySymbols;
import nl.bytesoflife.deltaschematic.model.Passthrough;
import nl.bytesoflife.deltaschematic.model.Point;
import nl.bytesoflife.deltaschematic.model.Property;
import nl.bytesoflife.deltaschematic.model.Rectangle;
import nl.bytesoflife.deltaschematic.model.Sheet;
import nl.bytesoflife.deltaschematic.model.SheetInstance;
import nl.bytesoflife.deltaschematic.model.SheetPin;
import nl.bytesoflife.deltaschematic.model.TextBox;
import nl.bytesoflife.deltaschematic.model.TitleBlock;
import nl.bytesoflife.deltaschematic.model.Wire;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchematicReaderTest {

    private final SchematicReader reader = new SchematicReader();

    @Test
    void readsTypedEntriesInFileOrder() throws Exception {
        String text = Files.readString(Path.of("testdata/schematics/divider.kicad_sch"));
        List<DocumentEntry> entries = reader.read(text, "divider.kicad_sch");

        assertInstanceOf(HeaderField.class, entries.get(0));
        assertEquals("20250114", ((HeaderField) entries.get(0)).getValue());
        assertInstanceOf(TitleBlock.class, entries.get(5));
        assertEquals("Voltage divider", ((TitleBlock) entries.get(5)).getTitle());
        assertEquals("Reference fixture", ((TitleBlock) entries.get(5)).getComments().get(1));

        LibrarySymbols symbols = (LibrarySymbols) entries.get(6);
        assertEquals(List.of("Device:R"), symbols.libraryIds());

        assertEquals(1, count(entries, Junction.class));
        assertEquals(3, count(entries, Wire.class));
        assertEquals(1, count(entries, Label.class));
        assertEquals(2, count(entries, Component.class));
        assertTrue(entries.stream().anyMatch(e -> e instanceof Passthrough p && "sheet_instances".equals(p.tag())));
    }

    @Test
    void hierarchicalItemsAreLifted() throws Exception {
        String text = Files.readString(Path.of("testdata/schematics/hierarchy.kicad_sch"));
        List<DocumentEntry> entries = reader.read(text, "hierarchy.kicad_sch");

        Sheet sheet = entries.stream().filter(Sheet.class::isInstance).map(Sheet.class::cast).findFirst().orElseThrow();
        assertEquals("Filter", sheet.getName());
        assertEquals("filter.kicad_sch", sheet.getFileName());
        assertEquals(List.of("IN", "OUT"), sheet.getPins().stream().map(SheetPin::getName).toList());
        assertEquals("output", sheet.getPin("OUT").orElseThrow().getShape());
        assertEquals(List.of(new SheetInstance("hierarchy", "/4f2b8c61-7d3e-4a95-b0c8-1e6f9a2d3b74", "2")),
                sheet.getInstances());

        Label global = entries.stream()
                .filter(e -> e instanceof Label l && l.getKind() == Label.Kind.GLOBAL)
                .map(Label.class::cast)
                .findFirst().orElseThrow();
        assertEquals("input", global.getShape());
        Property refs = global.getProperties().getProperty(LabelCodec.INTERSHEET_REFS).orElseThrow();
        assertEquals("${INTERSHEET_REFS}", refs.getValue());
        assertTrue(refs.isHidden());
        assertEquals(3, count(entries, Label.class));

        TextBox box = entries.stream().filter(TextBox.class::isInstance).map(TextBox.class::cast).findFirst().orElseThrow();
        assertEquals("RC low-pass, fc = 1.6 kHz", box.getText());
        assertEquals(25.4, box.getWidth());
        assertEquals(7.62, box.getHeight());
        assertEquals("solid", box.getStroke().type());
        assertEquals("none", box.getFillType());
        assertNotNull(box.getMargins());

        Rectangle rectangle = entries.stream().filter(Rectangle.class::isInstance).map(Rectangle.class::cast)
                .findFirst().orElseThrow();
        assertEquals(new Point(127, 55.88), rectangle.getStart());
        assertEquals(new Point(160.02, 93.98), rectangle.getEnd());
        assertEquals("dash", rectangle.getStroke().type());

        Image image = entries.stream().filter(Image.class::isInstance).map(Image.class::cast).findFirst().orElseThrow();
        assertEquals(0.5, image.getScale());
        assertEquals("iVBORw0KGgoAAAANSUhEUgAAAAEAAAABCAYAAAAfFcSJAAAADUlEQVR42mP8z8BQDwAEhQGAhKmMIQAAAABJRU5ErkJggg==", image.getData());
    }

    @Test
    void componentFieldsAreLifted() throws Exception {
        String text = Files.readString(Path.of("testdata/schematics/divider.kicad_sch"));
        Component r1 = reader.read(text).stream()
                .filter(e -> e instanceof Component c && "R1".equals(c.getReference()))
                .map(Component.class::cast)
                .findFirst().orElseThrow();

        assertEquals("Device:R", r1.getLibId());
        assertEquals("10k", r1.getValue());
        assertEquals("Resistor_SMD:R_0603_1608Metric", r1.getFootprint());
        assertEquals(100.0, r1.getPosition().x());
        assertEquals(49.53, r1.getPosition().y());
        assertEquals(2, r1.getPins().size());
        assertEquals("divider", r1.getInstances().get(0).project());
        assertTrue(r1.isInBom());
        assertFalse(r1.isDnp());
        assertFalse(r1.isModified());
    }

    @Test
    void unknownTopLevelItemsArePassedThrough() {
        String text = """
                (kicad_sch (version 20250114) (generator "eeschema")
                  (bus_entry (at 1 2) (size 2.54 2.54) (stroke (width 0) (type default)) (uuid "b1"))
                  (rule_area (polyline (pts (xy 0 0) (xy 1 1))))
                )
                """;
        List<DocumentEntry> entries = reader.read(text);
        assertEquals("bus_entry", ((Passthrough) entries.get(2)).tag());
        assertEquals("rule_area", ((Passthrough) entries.get(3)).tag());
    }

    @Test
    void unreadableElementIsKeptVerbatim() {
        String text = "(kicad_sch (version 20250114) (junction (at left 1) (uuid \"j1\")))";
        List<DocumentEntry> entries = reader.read(text);
        Passthrough junction = (Passthrough) entries.get(1);
        assertEquals("(junction (at left 1) (uuid \"j1\"))", junction.getNode().toString());
    }

    @Test
    void versionOutsideRangeIsRejected() {
        String text = "(kicad_sch (version 20991231) (generator \"eeschema\"))";
        UnsupportedVersionException e = assertThrows(UnsupportedVersionException.class,
                () -> reader.read(text, "future.kicad_sch"));
        assertEquals(20991231, e.getVersion());
        assertEquals("future.kicad_sch", e.getSource());

        assertThrows(UnsupportedVersionException.class,
                () -> reader.read("(kicad_sch (version 20200101))"));
    }

    @Test
    void lenientVersionReadsAnyway() {
        List<DocumentEntry> entries = new SchematicReader().withLenientVersion(true)
                .read("(kicad_sch (version 20991231) (generator \"eeschema\"))");
        assertEquals(2, entries.size());
    }

    @Test
    void widerVersionRangeAcceptsOlderFiles() {
        List<DocumentEntry> entries = new SchematicReader().withVersionRange(20211014, 20250114)
                .read("(kicad_sch (version 20211014))");
        assertEquals(1, entries.size());
    }

    @Test
    void rootMustBeASchematic() {
        assertThrows(GrammarException.class, () -> reader.read("(kicad_pcb (version 20250114))"));
        assertThrows(GrammarException.class, () -> reader.read("(kicad_sch (generator \"eeschema\"))"));
        assertThrows(GrammarException.class, () -> reader.read("(kicad_sch (version 20250114)"));
    }

    private static long count(List<DocumentEntry> entries, Class<?> type) {
        return entries.stream().filter(type::isInstance).count();
    }
}
