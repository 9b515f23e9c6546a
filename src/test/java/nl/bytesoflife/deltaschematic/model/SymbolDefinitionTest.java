package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.sexpr.SExpressionParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SymbolDefinitionTest {

    private final SExpressionParser parser = new SExpressionParser();

    private static final String GATE = """
            (symbol "74xx:74LS00"
              (property "Reference" "U" (at 0 1.27 0))
              (property "Value" "74LS00" (at 0 -1.27 0))
              (symbol "74LS00_1_1"
                (pin input line (at -7.62 2.54 0) (length 5.08) (name "~") (number "1"))
                (pin output line (at 7.62 0 180) (length 5.08) (name "~") (number "3")))
              (symbol "74LS00_2_1"
                (pin input line (at -7.62 2.54 0) (length 5.08) (name "~") (number "4")))
              (symbol "74LS00_1_2"
                (pin input line (at -7.62 5.08 0) (length 5.08) (name "~") (number "1")))
              (symbol "74LS00_0_1"
                (pin power_in line (at 0 12.7 270) (length 5.08) (hide yes) (name "VCC") (number "14")))
              (symbol "74LS00_5_0"
                (pin power_in line (at 0 -12.7 90) (length 5.08) (name "GND") (number "7"))))
            """;

    private SymbolDefinition gate() {
        return new SymbolDefinition(parser.parseDocument(GATE, "inline"));
    }

    @Test
    void names() {
        SymbolDefinition definition = gate();

        assertEquals("74xx:74LS00", definition.getName());
        assertEquals("74LS00", definition.getShortName());
        assertTrue(definition.getExtendsName().isEmpty());
        assertFalse(definition.isPower());
        assertEquals("74LS00", definition.getPropertyValue("Value").orElseThrow());
        assertEquals(List.of("Reference", "Value"), List.copyOf(definition.getPropertyNodes().keySet()));
    }

    @Test
    void unitPinsIncludeSharedPinsOfFirstBodyStyle() {
        SymbolDefinition definition = gate();

        assertEquals(5, definition.getUnitCount());
        assertEquals(List.of("1", "3", "14"), numbers(definition.getPins(1)));
        assertEquals(List.of("4", "14"), numbers(definition.getPins(2)));
        assertEquals(new Point(-7.62, 2.54), definition.getPin(1, "1").orElseThrow().position());
        assertTrue(definition.getPin(2, "3").isEmpty());

        SymbolPin power = definition.getPin(1, "14").orElseThrow();
        assertEquals("VCC", power.name());
        assertEquals("power_in", power.electricalType());
        assertEquals(0, power.unit());
        assertTrue(power.hidden());
        assertEquals(List.of("14", "7"), numbers(definition.getPins(5)));
    }

    @Test
    void renameFollowsUnitPrefixes() {
        SymbolDefinition renamed = gate().renamed("74LS00_A");

        assertEquals("74LS00_A", renamed.getName());
        assertEquals(List.of("74LS00_A_1_1", "74LS00_A_2_1", "74LS00_A_1_2", "74LS00_A_0_1", "74LS00_A_5_0"),
                renamed.getUnits().stream().map(unit -> unit.text(1)).toList());
        assertEquals(List.of("1", "3", "14"), numbers(renamed.getPins(1)));
    }

    @Test
    void rejectsNonSymbolNodes() {
        assertThrows(IllegalArgumentException.class,
                () -> new SymbolDefinition(parser.parseDocument("(property \"Value\" \"R\")", "inline")));
        assertThrows(IllegalArgumentException.class,
                () -> new SymbolDefinition(parser.parseDocument("(symbol (lib_id \"Device:R\"))", "inline")));
    }

    @Test
    void malformedUnitNameFails() {
        SymbolDefinition definition = new SymbolDefinition(parser.parseDocument(
                "(symbol \"R\" (symbol \"R_a_1\" (pin passive line (at 0 0 0) (length 1) (number \"1\"))))", "inline"));

        assertThrows(IllegalArgumentException.class, definition::getPins);
    }

    private static List<String> numbers(List<SymbolPin> pins) {
        return pins.stream().map(SymbolPin::number).toList();
    }
}
