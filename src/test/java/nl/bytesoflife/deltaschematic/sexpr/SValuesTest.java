package nl.bytesoflife.deltaschematic.sexpr;

import nl.bytesoflife.deltaschematic.SchematicException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SValuesTest {

    private final SExpressionParser parser = new SExpressionParser();

    private SNode.SList parse(String text) {
        return parser.parseDocument(text, "inline");
    }

    @Test
    void booleanSpellings() {
        assertTrue(SValues.asBoolean(SNode.atom("yes")));
        assertTrue(SValues.asBoolean(SNode.string("yes")));
        assertTrue(SValues.asBoolean(SNode.atom("true")));
        assertFalse(SValues.asBoolean(SNode.atom("no")));
        assertFalse(SValues.asBoolean(SNode.string("false")));
    }

    @Test
    void nonBooleanTextIsAnError() {
        assertThrows(SchematicException.class, () -> SValues.asBoolean(SNode.atom("maybe")));
        assertThrows(SchematicException.class, () -> SValues.asBoolean(SNode.number("1")));
        assertThrows(SchematicException.class, () -> SValues.asBoolean(parse("(yes)")));
    }

    @Test
    void flagForms() {
        SNode.SList effects = parse("(effects (font (size 1 1)) (hide yes))");
        assertEquals(true, SValues.flag(effects, "hide").orElseThrow());

        assertTrue(SValues.flag(parse("(effects (hide))"), "hide", false));
        assertTrue(SValues.flag(parse("(effects (font (size 1 1)) hide)"), "hide", false));
        assertFalse(SValues.flag(parse("(symbol (dnp \"no\"))"), "dnp", true));
        assertTrue(SValues.flag(parse("(symbol)"), "dnp").isEmpty());
        assertTrue(SValues.flag(parse("(symbol)"), "in_bom", true));
    }

    @Test
    void numbersAreEquivalentWhateverTheirSpelling() {
        assertTrue(SValues.equivalent(SNode.number("100"), SNode.number("100.00")));
        assertTrue(SValues.equivalent(SNode.number("-0"), SNode.number("0")));
        assertFalse(SValues.equivalent(SNode.number("1.27"), SNode.number("1.2701")));
    }

    @Test
    void quotedAndBareSymbolsAreEquivalent() {
        assertTrue(SValues.equivalent(parse("(in_bom \"yes\")"), parse("(in_bom yes)")));
        assertFalse(SValues.equivalent(parse("(in_bom yes)"), parse("(in_bom no)")));
    }

    @Test
    void listsCompareElementByElement() {
        assertTrue(SValues.equivalent(parse("(at 100.0 49.53 0)"), parse("(at 100 49.530 0)")));
        assertFalse(SValues.equivalent(parse("(at 100 49.53)"), parse("(at 100 49.53 0)")));
        assertFalse(SValues.equivalent(parse("(at 1 2)"), SNode.atom("at")));
    }

    @Test
    void numericConversions() {
        SNode.SList at = parse("(at 1.5 2 90)");
        assertEquals(1.5, SValues.asDouble(at.get(1)));
        assertEquals(2, SValues.asInt(at.get(2)));
        assertEquals(0.0, SValues.doubleAt(at, 7, 0.0));
        assertThrows(SchematicException.class, () -> SValues.asInt(at.get(1)));
        assertThrows(SchematicException.class, () -> SValues.asDouble(SNode.string("x")));
    }
}
