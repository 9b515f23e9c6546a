package nl.bytesoflife.deltaschematic.io;

import nl.bytesoflife.deltaschematic.format.NumberStyle;
import nl.bytesoflife.deltaschematic.model.Point;
import nl.bytesoflife.deltaschematic.model.Wire;
import nl.bytesoflife.deltaschematic.sexpr.SNode;

import java.util.ArrayList;
import java.util.List;

public class WireCodec implements ElementCodec<Wire> {

    @Override
    public Wire read(SNode.SList node) {
        List<Point> points = new ArrayList<>();
        for (SNode.SList xy : Nodes.require(node, "pts").findAll("xy")) {
            points.add(Nodes.point(xy));
        }
        Wire wire = new Wire(Nodes.uuid(node), Wire.Kind.fromKicadName(node.tag()), points, node);
        wire.setStroke(Nodes.stroke(node));
        wire.clearModified();
        return wire;
    }

    @Override
    public SNode.SList derive(Wire wire) {
        NodeBuilder pts = NodeBuilder.list("pts");
        for (Point point : wire.getPoints()) {
            pts.child(NodeBuilder.list("xy")
                    .number(NumberStyle.COORDINATE, point.x())
                    .number(NumberStyle.COORDINATE, point.y())
                    .build());
        }
        return NodeBuilder.list(wire.getKind().getKicadName())
                .child(pts.build())
                .stroke(wire.getStroke())
                .field("uuid", wire.getUuid())
                .build();
    }
}
