package nl.bytesoflife.deltaschematic.sexpr;

import nl.bytesoflife.deltaschematic.GrammarException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SExpressionParserTest {

    private final SExpressionParser parser = new SExpressionParser();

    @Test
    void parseSimpleList() {
        List<SNode> nodes = parser.parse("(version 20250114)");
        assertEquals(1, nodes.size());
        SNode.SList list = (SNode.SList) nodes.get(0);
        assertEquals("version", list.tag());
        assertInstanceOf(SNode.SInteger.class, list.get(1));
        assertEquals(20250114L, ((SNode.SInteger) list.get(1)).value());
    }

    @Test
    void numbersKeepTheirSpelling() {
        SNode.SList list = (SNode.SList) parser.parse("(at 100.00 -0 1e2 .5)").get(0);
        assertEquals("100.00", list.text(1));
        assertInstanceOf(SNode.SFloat.class, list.get(1));
        assertEquals("-0", list.text(2));
        assertInstanceOf(SNode.SInteger.class, list.get(2));
        assertEquals("1e2", list.text(3));
        assertEquals(100.0, ((SNode.SFloat) list.get(3)).value());
        assertEquals(".5", list.text(4));
    }

    @Test
    void oversizedIntegerStaysAnAtom() {
        SNode.SList list = (SNode.SList) parser.parse("(tstamp 1234567890123456789012)").get(0);
        assertInstanceOf(SNode.SAtom.class, list.get(1));
        assertEquals("1234567890123456789012", list.text(1));
    }

    @Test
    void quotedStringsAreUnescaped() {
        SNode.SList list = (SNode.SList) parser.parse("(text \"line1\\nsay \\\"hi\\\" \\\\ done\")").get(0);
        assertInstanceOf(SNode.SString.class, list.get(1));
        assertEquals("line1\nsay \"hi\" \\ done", list.text(1));
    }

    @Test
    void quotedYesIsAStringAndBareYesIsAnAtom() {
        SNode.SList list = (SNode.SList) parser.parse("(flags yes \"yes\")").get(0);
        assertInstanceOf(SNode.SAtom.class, list.get(1));
        assertInstanceOf(SNode.SString.class, list.get(2));
    }

    @Test
    void nestedLookups() {
        SNode.SList list = (SNode.SList) parser.parse(
                "(property \"Value\" \"10k\" (at 1 2 0) (effects (font (size 1.27 1.27)) (hide yes)))").get(0);
        assertEquals("1.27", list.find("effects", "font", "size").orElseThrow().text(1));
        assertTrue(list.find("effects").orElseThrow().find("hide").isPresent());
        assertFalse(list.find("uuid").isPresent());
        assertEquals(2, list.lists().size());
    }

    @Test
    void skipComments() {
        String input = """
                # generated by hand
                (kicad_sch
                  # inner comment
                  (version 20250114))
                """;
        List<SNode> nodes = parser.parse(input);
        assertEquals(1, nodes.size());
        assertEquals(2, ((SNode.SList) nodes.get(0)).size());
    }

    @Test
    void parseEmptyInput() {
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse("   \n\n  # comment only\n  ").isEmpty());
    }

    @Test
    void unbalancedListReportsPosition() {
        GrammarException e = assertThrows(GrammarException.class,
                () -> parser.parse("(kicad_sch\n  (version 1)\n", "broken.kicad_sch"));
        assertEquals("broken.kicad_sch", e.getSource());
        assertEquals(3, e.getLine());
        assertEquals("end of input", e.getFound());
        assertTrue(e.getExpected().contains("1:1"));
    }

    @Test
    void strayCloseParenIsRejected() {
        GrammarException e = assertThrows(GrammarException.class, () -> parser.parse("(a 1))"));
        assertEquals(1, e.getLine());
        assertEquals(6, e.getColumn());
        assertEquals("')'", e.getFound());
    }

    @Test
    void unterminatedStringPointsAtItsStart() {
        GrammarException e = assertThrows(GrammarException.class, () -> parser.parse("(a\n  \"open"));
        assertEquals(2, e.getLine());
        assertEquals(3, e.getColumn());
    }

    @Test
    void documentMustHaveExactlyOneList() {
        assertThrows(GrammarException.class, () -> parser.parseDocument("(a) (b)", "two"));
        assertThrows(GrammarException.class, () -> parser.parseDocument("  ", "none"));
        assertEquals("a", parser.parseDocument("(a)", "one").tag());
    }
}
