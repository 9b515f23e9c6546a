package nl.bytesoflife.deltaschematic.io;

import nl.bytesoflife.deltaschematic.format.FormatDialect;
import nl.bytesoflife.deltaschematic.format.FormatRules;
import nl.bytesoflife.deltaschematic.format.NumberStyle;
import nl.bytesoflife.deltaschematic.model.Point;
import nl.bytesoflife.deltaschematic.sexpr.SExpressionWriter;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NodeBuilderTest {

    @Test
    void numberNodeAndChainedNumberSpellAlike() {
        assertEquals("1.5", NodeBuilder.numberNode(NumberStyle.COORDINATE, 1.50).text());
        assertEquals("(scale 1.5)", SExpressionWriter.compact(NodeBuilder.list("scale")
                .number(NumberStyle.COORDINATE, 1.50)
                .build()));
    }

    @Test
    void atRoundsToTheGrid() {
        assertEquals("(at 100.33 49.53 90)", SExpressionWriter.compact(NodeBuilder.list("symbol")
                .at(new Point(100.330001, 49.53), 90)
                .build().find("at").orElseThrow()));
    }

    @Test
    void flagIfSetFollowsTheDialect() {
        FormatDialect kicad7 = FormatDialect.of(FormatRules.MIN_SUPPORTED_VERSION);
        assertEquals("(label (fields_autoplaced yes))", SExpressionWriter.compact(NodeBuilder.list("label")
                .flagIfSet("fields_autoplaced", true, FormatDialect.CURRENT)
                .build()));
        assertEquals("(label (fields_autoplaced))", SExpressionWriter.compact(NodeBuilder.list("label")
                .flagIfSet("fields_autoplaced", true, kicad7)
                .build()));
        assertEquals("(label)", SExpressionWriter.compact(NodeBuilder.list("label")
                .flagIfSet("fields_autoplaced", false, FormatDialect.CURRENT)
                .build()));
    }
}
