package nl.bytesoflife.deltaschematic.collection;

import nl.bytesoflife.deltaschematic.io.LabelCodec;
import nl.bytesoflife.deltaschematic.model.Component;
import nl.bytesoflife.deltaschematic.model.Label;
import nl.bytesoflife.deltaschematic.model.Point;
import nl.bytesoflife.deltaschematic.model.Sheet;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComponentCollectionTest {

    private final ComponentCollection components = new ComponentCollection();

    private Component component(String reference, String value, double x, double y) {
        Component component = new Component(null, "Device:R", new Point(x, y));
        component.setReference(reference);
        component.setValue(value);
        return components.add(component);
    }

    @Test
    void lookupsByReferenceAndValue() {
        Component r1 = component("R1", "10k", 100, 50);
        component("R2", "10k", 100, 60);
        component("R3", "4.7k", 100, 70);

        assertEquals(r1, components.getByReference("R1").orElseThrow());
        assertEquals(2, components.findByValue("10k").size());
        assertEquals(3, components.findByLibId("Device:R").size());
        assertTrue(components.getByReference("R9").isEmpty());
        assertEquals(List.of(r1), components.findAt(new Point(100, 50)));
    }

    @Test
    void valueEditIsVisibleToTheNextLookup() {
        Component r1 = component("R1", "10k", 100, 50);
        assertEquals(1, components.findByValue("10k").size());

        r1.setValue("22k");
        assertTrue(components.findByValue("10k").isEmpty());
        assertEquals(List.of(r1), components.findByValue("22k"));
    }

    @Test
    void referenceEditIsVisibleToTheNextLookup() {
        Component r1 = component("R1", "10k", 100, 50);
        components.getByReference("R1");
        r1.setReference("R10");
        assertTrue(components.getByReference("R1").isEmpty());
        assertEquals(r1, components.getByReference("R10").orElseThrow());
    }

    @Test
    void removeByReference() {
        component("R1", "10k", 100, 50);
        assertTrue(components.removeByReference("R1"));
        assertFalse(components.removeByReference("R1"));
        assertTrue(components.isEmpty());
    }

    @Test
    void nextReferenceIsAboveTheHighestInUse() {
        component("R1", "10k", 0, 0);
        component("R3", "10k", 0, 10);
        component("C7", "100n", 0, 20);
        component("R?", "1k", 0, 30);

        assertEquals("R4", components.nextReference("R"));
        assertEquals("C8", components.nextReference("C"));
        assertEquals("U1", components.nextReference("U"));
    }

    @Test
    void nextReferenceHandlesNumbersBeyondIntRange() {
        component("R99999999999", "10k", 0, 0);
        component("R99999999999999999999", "10k", 0, 10);

        assertEquals("R100000000000000000000", components.nextReference("R"));
    }

    @Test
    void addByLibraryIdNeedsADocument() {
        assertThrows(IllegalStateException.class,
                () -> components.add("Device:R", "R1", "10k", new Point(0, 0)));
    }

    @Test
    void addByLibraryIdUsesTheFactory() {
        components.setFactory((libId, reference, value, position) -> {
            Component component = new Component(null, libId, position);
            component.setReference(reference);
            component.setValue(value);
            return component;
        });
        Component added = components.add("Device:C", "C1", "100n", new Point(10, 10));
        assertEquals(added, components.getByReference("C1").orElseThrow());
        assertEquals("Device:C", added.getLibId());
    }

    @Test
    void labelsAreRenamedTogether() {
        LabelCollection labels = new LabelCollection();
        labels.add("VOUT", new Point(0, 0));
        labels.add("VOUT", new Point(10, 0), Label.Kind.GLOBAL);
        labels.add("GND", new Point(20, 0));

        assertEquals(2, labels.rename("VOUT", "VSENSE"));
        assertEquals(2, labels.findByText("VSENSE").size());
        assertTrue(labels.findByText("VOUT").isEmpty());
        assertEquals(1, labels.findByKind(Label.Kind.GLOBAL).size());
        assertEquals("input", labels.findByKind(Label.Kind.GLOBAL).get(0).getShape());
        assertEquals("${INTERSHEET_REFS}", labels.findByKind(Label.Kind.GLOBAL).get(0).getProperties()
                .get(LabelCodec.INTERSHEET_REFS).orElseThrow());
        assertTrue(labels.findByKind(Label.Kind.LOCAL).get(0).getProperties().isEmpty());
    }

    @Test
    void sheetsGetNameAndFileFields() {
        SheetCollection sheets = new SheetCollection();
        Sheet sheet = sheets.add("Power", "power.kicad_sch", new Point(50, 50), 30, 20);

        assertEquals(sheet, sheets.getByName("Power").orElseThrow());
        assertEquals(List.of(sheet), sheets.findByFile("power.kicad_sch"));
        assertEquals(49.2884, sheet.getProperties().getProperty(Sheet.SHEET_NAME).orElseThrow().getPosition().y(), 1e-9);
        assertEquals(70.5984, sheet.getProperties().getProperty(Sheet.SHEET_FILE).orElseThrow().getPosition().y(), 1e-9);
    }

    @Test
    void textsAreFoundByContent() {
        TextCollection texts = new TextCollection();
        texts.add("Divider output", new Point(88.9, 30.48));
        assertEquals(1, texts.findByText("Divider output").size());
        assertTrue(texts.findByText("divider output").isEmpty());
    }
}
