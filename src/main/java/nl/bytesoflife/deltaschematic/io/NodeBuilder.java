package nl.bytesoflife.deltaschematic.io;

import nl.bytesoflife.deltaschematic.format.FormatDialect;
import nl.bytesoflife.deltaschematic.format.FormatRules;
import nl.bytesoflife.deltaschematic.format.NumberStyle;
import nl.bytesoflife.deltaschematic.model.Color;
import nl.bytesoflife.deltaschematic.model.Point;
import nl.bytesoflife.deltaschematic.model.Stroke;
import nl.bytesoflife.deltaschematic.sexpr.SNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Fluent builder for derived nodes. Quoting and number spelling come from {@link FormatRules}
 * and {@link NumberStyle}.
 */
public final class NodeBuilder {

    private final List<SNode> children = new ArrayList<>();

    private NodeBuilder(String tag) {
        children.add(SNode.atom(tag));
    }

    public static NodeBuilder list(String tag) {
        return new NodeBuilder(tag);
    }

    /**
     * Scalar for {@code field}: quoted or bare as the format table says.
     *
     * @throws IllegalArgumentException for a field the table has no quoting rule for
     */
    public static SNode value(String field, String value) {
        if (FormatRules.isBare(field)) {
            return SNode.atom(value);
        }
        if (FormatRules.isQuoted(field)) {
            return SNode.string(value);
        }
        throw new IllegalArgumentException("No quoting rule for field '" + field + "'");
    }

    public static SNode numberNode(NumberStyle style, double value) {
        return SNode.number(style.format(value));
    }

    public NodeBuilder string(String value) {
        children.add(SNode.string(value));
        return this;
    }

    public NodeBuilder symbol(String value) {
        children.add(SNode.atom(value));
        return this;
    }

    public NodeBuilder number(NumberStyle style, double value) {
        children.add(numberNode(style, value));
        return this;
    }

    public NodeBuilder integer(long value) {
        children.add(SNode.number(NumberStyle.INTEGER.format(value)));
        return this;
    }

    public NodeBuilder field(String tag, String value) {
        children.add(new SNode.SList(List.of(SNode.atom(tag), value(tag, value))));
        return this;
    }

    public NodeBuilder flag(String tag, boolean value) {
        children.add(flagNode(tag, value));
        return this;
    }

    /**
     * Adds {@code (tag yes)} only when the flag is set, or {@code (tag)} for files older than
     * KiCad 8.
     */
    public NodeBuilder flagIfSet(String tag, boolean value, FormatDialect dialect) {
        if (value) {
            children.add(dialect.writesBooleanFlags()
                    ? flagNode(tag, true)
                    : new SNode.SList(List.of(SNode.atom(tag))));
        }
        return this;
    }

    public NodeBuilder at(Point point) {
        children.add(list("at")
                .number(NumberStyle.COORDINATE, point.x())
                .number(NumberStyle.COORDINATE, point.y())
                .build());
        return this;
    }

    public NodeBuilder at(Point point, double angle) {
        children.add(list("at")
                .number(NumberStyle.COORDINATE, point.x())
                .number(NumberStyle.COORDINATE, point.y())
                .number(NumberStyle.ANGLE, angle)
                .build());
        return this;
    }

    public NodeBuilder color(Color color, NumberStyle alphaStyle) {
        children.add(colorNode(color, alphaStyle));
        return this;
    }

    public NodeBuilder stroke(Stroke stroke) {
        NodeBuilder builder = list("stroke")
                .child(list("width").number(NumberStyle.COORDINATE, stroke.width()).build())
                .child(list("type").symbol(stroke.type()).build());
        if (stroke.color() != null) {
            builder.color(stroke.color(), NumberStyle.COORDINATE);
        }
        children.add(builder.build());
        return this;
    }

    public NodeBuilder child(SNode node) {
        if (node != null) {
            children.add(node);
        }
        return this;
    }

    public NodeBuilder children(List<? extends SNode> nodes) {
        for (SNode node : nodes) {
            child(node);
        }
        return this;
    }

    public SNode.SList build() {
        return new SNode.SList(children);
    }

    static SNode.SList flagNode(String tag, boolean value) {
        return new SNode.SList(List.of(SNode.atom(tag), SNode.atom(value ? "yes" : "no")));
    }

    static SNode.SList colorNode(Color color, NumberStyle alphaStyle) {
        return list("color")
                .integer(color.red())
                .integer(color.green())
                .integer(color.blue())
                .number(alphaStyle, color.alpha())
                .build();
    }

    public static SNode.SList defaultEffects(String... justify) {
        NodeBuilder font = list("font").child(list("size")
                .number(NumberStyle.COORDINATE, 1.27)
                .number(NumberStyle.COORDINATE, 1.27)
                .build());
        NodeBuilder effects = list("effects").child(font.build());
        if (justify.length > 0) {
            NodeBuilder justifyNode = list("justify");
            for (String value : justify) {
                justifyNode.symbol(value);
            }
            effects.child(justifyNode.build());
        }
        return effects.build();
    }
}
