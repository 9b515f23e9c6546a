package nl.bytesoflife.deltaschematic.io;

import nl.bytesoflife.deltaschematic.format.NumberStyle;
import nl.bytesoflife.deltaschematic.model.Point;
import nl.bytesoflife.deltaschematic.model.Rectangle;
import nl.bytesoflife.deltaschematic.sexpr.SNode;

public class RectangleCodec implements ElementCodec<Rectangle> {

    @Override
    public Rectangle read(SNode.SList node) {
        Rectangle rectangle = new Rectangle(Nodes.uuid(node), Nodes.point(Nodes.require(node, "start")),
                Nodes.point(Nodes.require(node, "end")), node);
        rectangle.setStroke(Nodes.stroke(node));
        node.find("fill").ifPresent(fill -> {
            rectangle.setFillType(fill.find("type").map(type -> type.text(1)).orElse("none"));
            rectangle.setFillColor(fill.find("color").map(Nodes::color).orElse(null));
        });
        rectangle.clearModified();
        return rectangle;
    }

    @Override
    public SNode.SList derive(Rectangle rectangle) {
        NodeBuilder fill = NodeBuilder.list("fill")
                .child(NodeBuilder.list("type").symbol(rectangle.getFillType()).build());
        if (rectangle.getFillColor() != null) {
            fill.color(rectangle.getFillColor(), NumberStyle.COORDINATE);
        }
        return NodeBuilder.list("rectangle")
                .child(corner("start", rectangle.getStart()))
                .child(corner("end", rectangle.getEnd()))
                .stroke(rectangle.getStroke())
                .child(fill.build())
                .field("uuid", rectangle.getUuid())
                .build();
    }

    private static SNode.SList corner(String tag, Point point) {
        return NodeBuilder.list(tag)
                .number(NumberStyle.COORDINATE, point.x())
                .number(NumberStyle.COORDINATE, point.y())
                .build();
    }
}
