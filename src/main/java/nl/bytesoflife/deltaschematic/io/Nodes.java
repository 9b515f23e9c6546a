package nl.bytesoflife.deltaschematic.io;

import nl.bytesoflife.deltaschematic.SchematicException;
import nl.bytesoflife.deltaschematic.model.Color;
import nl.bytesoflife.deltaschematic.model.Point;
import nl.bytesoflife.deltaschematic.model.Stroke;
import nl.bytesoflife.deltaschematic.sexpr.SNode;
import nl.bytesoflife.deltaschematic.sexpr.SValues;

final class Nodes {

    private Nodes() {
    }

    static String requireText(SNode.SList node, int index, String what) {
        String text = node.text(index);
        if (text == null) {
            throw new SchematicException("Missing " + what + " in (" + node.tag() + " ...)");
        }
        return text;
    }

    static SNode.SList require(SNode.SList node, String tag) {
        return node.find(tag).orElseThrow(
                () -> new SchematicException("Missing (" + tag + ") in (" + node.tag() + " ...)"));
    }

    static String uuid(SNode.SList node) {
        return node.find("uuid").map(list -> list.text(1)).orElse(null);
    }

    static String text(SNode.SList node, String tag) {
        return node.find(tag).map(list -> list.text(1)).orElse(null);
    }

    static Point point(SNode.SList xyOrAt) {
        if (xyOrAt.size() < 3) {
            throw new SchematicException("Expected x and y in " + xyOrAt);
        }
        return new Point(SValues.asDouble(xyOrAt.get(1)), SValues.asDouble(xyOrAt.get(2)));
    }

    static double angle(SNode.SList at) {
        return SValues.doubleAt(at, 3, 0);
    }

    static Color color(SNode.SList color) {
        return new Color(
                (int) SValues.asDouble(color.get(1)),
                (int) SValues.asDouble(color.get(2)),
                (int) SValues.asDouble(color.get(3)),
                SValues.doubleAt(color, 4, 0));
    }

    static Stroke stroke(SNode.SList node) {
        SNode.SList stroke = node.find("stroke").orElse(null);
        if (stroke == null) {
            return Stroke.DEFAULT;
        }
        double width = stroke.find("width").map(list -> SValues.asDouble(list.get(1))).orElse(0.0);
        String type = stroke.find("type").map(list -> list.text(1)).orElse("default");
        Color color = stroke.find("color").map(Nodes::color).orElse(null);
        return new Stroke(width, type, color);
    }
}
