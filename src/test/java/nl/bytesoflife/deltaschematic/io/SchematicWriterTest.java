package nl.bytesoflife.deltaschematic.io;

import nl.bytesoflife.deltaschematic.format.FormatDialect;
import nl.bytesoflife.deltaschematic.model.Component;
import nl.bytesoflife.deltaschematic.model.DocumentEntry;
import nl.bytesoflife.deltaschematic.model.Image;
import nl.bytesoflife.deltaschematic.model.Junction;
import nl.bytesoflife.deltaschematic.model.Label;
import nl.bytesoflife.deltaschematic.model.Point;
import nl.bytesoflife.deltaschematic.model.Property;
import nl.bytesoflife.deltaschematic.model.Rectangle;
import nl.bytesoflife.deltaschematic.model.Sheet;
import nl.bytesoflife.deltaschematic.model.TextBox;
import nl.bytesoflife.deltaschematic.model.TitleBlock;
import nl.bytesoflife.deltaschematic.sexpr.SExpressionParser;
import nl.bytesoflife.deltaschematic.sexpr.SExpressionWriter;
import nl.bytesoflife.deltaschematic.sexpr.SNode;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchematicWriterTest {

    private final SchematicReader reader = new SchematicReader();
    private final SchematicWriter writer = new SchematicWriter();

    private static String fixture(String name) throws Exception {
        return Files.readString(Path.of("testdata/schematics/" + name));
    }

    @Test
    void unmodifiedDocumentRoundTripsByteForByte() throws Exception {
        String text = fixture("divider.kicad_sch");
        assertEquals(text, writer.serialize(reader.read(text)));
    }

    @Test
    void blankDocumentRoundTrips() throws Exception {
        String text = fixture("blank.kicad_sch");
        assertEquals(text, writer.serialize(reader.read(text)));
    }

    @Test
    void hierarchicalDocumentRoundTripsByteForByte() throws Exception {
        String text = fixture("hierarchy.kicad_sch");
        assertEquals(text, writer.serialize(reader.read(text)));
    }

    @Test
    void renamedGlobalLabelChangesOnlyItsText() throws Exception {
        String text = fixture("hierarchy.kicad_sch");
        List<DocumentEntry> entries = reader.read(text);
        label(entries, Label.Kind.GLOBAL).setText("VBUS");

        assertEquals(text.replace("(global_label \"VIN\"", "(global_label \"VBUS\""), writer.serialize(entries));
    }

    @Test
    void movedHierarchicalLabelChangesOnlyItsPosition() throws Exception {
        String text = fixture("hierarchy.kicad_sch");
        List<DocumentEntry> entries = reader.read(text);
        label(entries, Label.Kind.HIERARCHICAL).setPosition(new Point(175.26, 66.04));

        assertEquals(text.replace("(at 172.72 66.04 0)", "(at 175.26 66.04 0)"), writer.serialize(entries));
    }

    @Test
    void renamedSheetChangesOnlyItsNameProperty() throws Exception {
        String text = fixture("hierarchy.kicad_sch");
        List<DocumentEntry> entries = reader.read(text);
        sheet(entries).setName("Lowpass");

        assertEquals(text.replace("\"Filter\"", "\"Lowpass\""), writer.serialize(entries));
    }

    @Test
    void renamedSheetPinChangesOnlyThatPin() throws Exception {
        String text = fixture("hierarchy.kicad_sch");
        List<DocumentEntry> entries = reader.read(text);
        sheet(entries).getPin("IN").orElseThrow().setName("FILTER_IN");

        assertEquals(text.replace("(pin \"IN\" input", "(pin \"FILTER_IN\" input"), writer.serialize(entries));
    }

    @Test
    void resizedTextBoxChangesOnlyItsSize() throws Exception {
        String text = fixture("hierarchy.kicad_sch");
        List<DocumentEntry> entries = reader.read(text);
        TextBox box = (TextBox) entries.stream().filter(TextBox.class::isInstance).findFirst().orElseThrow();
        box.setSize(30.48, 7.62);

        assertEquals(text.replace("(size 25.4 7.62)", "(size 30.48 7.62)"), writer.serialize(entries));
    }

    @Test
    void stretchedRectangleChangesOnlyItsEnd() throws Exception {
        String text = fixture("hierarchy.kicad_sch");
        List<DocumentEntry> entries = reader.read(text);
        Rectangle rectangle = (Rectangle) entries.stream().filter(Rectangle.class::isInstance).findFirst().orElseThrow();
        rectangle.setCorners(rectangle.getStart(), new Point(165.1, 93.98));

        assertEquals(text.replace("(end 160.02 93.98)", "(end 165.1 93.98)"), writer.serialize(entries));
    }

    @Test
    void movedImageKeepsItsData() throws Exception {
        String text = fixture("hierarchy.kicad_sch");
        List<DocumentEntry> entries = reader.read(text);
        Image image = (Image) entries.stream().filter(Image.class::isInstance).findFirst().orElseThrow();
        image.setPosition(new Point(63.5, 99.06));

        assertEquals(text.replace("(at 60.96 99.06)", "(at 63.5 99.06)"), writer.serialize(entries));
    }

    @Test
    void freshImageSplitsItsData() {
        Image image = new Image("im-1", new Point(10, 10), "A".repeat(100));
        assertEquals("(image (at 10 10) (uuid \"im-1\") (data \"" + "A".repeat(76) + "\" \"" + "A".repeat(24) + "\"))",
                new ImageCodec().write(image).toString());
    }

    @Test
    void freshTextBoxIsDerivedInCanonicalOrder() {
        TextBox box = new TextBox("tb-1", "Note", new Point(10, 20), 30, 10);
        assertEquals("(text_box \"Note\" (exclude_from_sim no) (at 10 20 0) (size 30 10) "
                        + "(stroke (width 0) (type solid)) (fill (type none)) "
                        + "(effects (font (size 1.27 1.27)) (justify left top)) (uuid \"tb-1\"))",
                new TextBoxCodec().write(box).toString());
    }

    @Test
    void passthroughItemsRoundTrip() throws Exception {
        SNode.SList root = new SExpressionParser().parseDocument(fixture("divider.kicad_sch"), "divider");
        List<SNode> children = new ArrayList<>(root.children());
        SExpressionParser parser = new SExpressionParser();
        children.add(7, parser.parseDocument(
                "(bus_entry (at 120 50) (size 2.54 2.54) (stroke (width 0) (type default)) (uuid \"be-1\"))", "x"));
        children.add(8, parser.parseDocument("(polyline (pts (xy 10 10) (xy 20 10) (xy 20 20) (xy 10 20) "
                + "(xy 10 10) (xy 15 15) (xy 17.5 12.5)) (stroke (width 0.254) (type dash)) (uuid \"pl-1\"))", "x"));
        String text = SExpressionWriter.write(new SNode.SList(children));

        assertEquals(text, writer.serialize(reader.read(text)));
    }

    @Test
    void valueEditChangesOnlyThatToken() throws Exception {
        String text = fixture("divider.kicad_sch");
        List<DocumentEntry> entries = reader.read(text);
        component(entries, "R1").setValue("22k");

        assertEquals(text.replace("\"10k\"", "\"22k\""), writer.serialize(entries));
    }

    @Test
    void movedJunctionChangesOnlyItsPosition() throws Exception {
        String text = fixture("divider.kicad_sch");
        List<DocumentEntry> entries = reader.read(text);
        Junction junction = (Junction) entries.stream().filter(Junction.class::isInstance).findFirst().orElseThrow();
        junction.setPosition(new Point(101.6, 57.15));

        assertEquals(text.replace("(at 100 57.15)", "(at 101.6 57.15)"), writer.serialize(entries));
    }

    @Test
    void titleEditKeepsTheRestOfTheBlock() throws Exception {
        String text = fixture("divider.kicad_sch");
        List<DocumentEntry> entries = reader.read(text);
        TitleBlock block = (TitleBlock) entries.stream().filter(TitleBlock.class::isInstance).findFirst().orElseThrow();
        block.setRevision("B");

        assertEquals(text.replace("(rev \"A\")", "(rev \"B\")"), writer.serialize(entries));
    }

    @Test
    void freshComponentIsDerivedInCanonicalOrder() {
        Component component = new Component("c-1", "Device:R", new Point(10, 20.5));
        assertEquals("(symbol (lib_id \"Device:R\") (at 10 20.5 0) (unit 1) (exclude_from_sim no) (in_bom yes) "
                        + "(on_board yes) (dnp no) (uuid \"c-1\"))",
                new ComponentCodec().write(component).toString());
    }

    @Test
    void kicad7EditKeepsKicad7Spelling() throws Exception {
        String text = fixture("divider_v7.kicad_sch");
        List<DocumentEntry> entries = reader.read(text);
        component(entries, "R1").setValue("22k");

        String written = new SchematicWriter(FormatDialect.of(20230121)).serialize(entries);

        assertTrue(written.contains("\"22k\""));
        assertFalse(written.contains("exclude_from_sim"));
        assertFalse(written.contains("(hide yes)"));
        assertFalse(written.contains("(fields_autoplaced yes)"));

        Component reread = component(reader.read(written), "R1");
        assertEquals("22k", reread.getValue());
        assertTrue(reread.isFieldsAutoplaced());
        assertTrue(reread.getProperties().getProperty("Footprint").orElseThrow().isHidden());
    }

    @Test
    void kicad8DialectWritesBooleanFlagsButBareHide() {
        Component component = new Component("c-1", "Device:R", new Point(10, 20.5));
        component.setFieldsAutoplaced(true);
        Property footprint = new Property("Footprint", "", new Point(10, 20.5), 0, null);
        footprint.setHidden(true);
        component.getProperties().add(footprint);

        assertEquals("(symbol (lib_id \"Device:R\") (at 10 20.5 0) (unit 1) (exclude_from_sim no) (in_bom yes) "
                        + "(on_board yes) (dnp no) (fields_autoplaced yes) (uuid \"c-1\") "
                        + "(property \"Footprint\" \"\" (at 10 20.5 0) (effects (font (size 1.27 1.27)) hide)))",
                new ComponentCodec(FormatDialect.of(20231120)).write(component).toString());
    }

    @Test
    void kicad7DialectDropsSimulationExclusion() {
        Component component = new Component("c-1", "Device:R", new Point(10, 20.5));
        component.setFieldsAutoplaced(true);

        assertEquals("(symbol (lib_id \"Device:R\") (at 10 20.5 0) (unit 1) (in_bom yes) (on_board yes) (dnp no) "
                        + "(fields_autoplaced) (uuid \"c-1\"))",
                new ComponentCodec(FormatDialect.of(20230121)).write(component).toString());
    }

    private static Label label(List<DocumentEntry> entries, Label.Kind kind) {
        return entries.stream()
                .filter(e -> e instanceof Label l && l.getKind() == kind)
                .map(Label.class::cast)
                .findFirst().orElseThrow();
    }

    private static Sheet sheet(List<DocumentEntry> entries) {
        return entries.stream().filter(Sheet.class::isInstance).map(Sheet.class::cast).findFirst().orElseThrow();
    }

    private static Component component(List<DocumentEntry> entries, String reference) {
        return entries.stream()
                .filter(e -> e instanceof Component c && reference.equals(c.getReference()))
                .map(Component.class::cast)
                .findFirst().orElseThrow();
    }
}
