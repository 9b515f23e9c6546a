package nl.bytesoflife.deltaschematic.io;

import nl.bytesoflife.deltaschematic.format.NumberStyle;
import nl.bytesoflife.deltaschematic.model.Color;
import nl.bytesoflife.deltaschematic.model.Junction;
import nl.bytesoflife.deltaschematic.sexpr.SNode;
import nl.bytesoflife.deltaschematic.sexpr.SValues;

public class JunctionCodec implements ElementCodec<Junction> {

    @Override
    public Junction read(SNode.SList node) {
        Junction junction = new Junction(Nodes.uuid(node), Nodes.point(Nodes.require(node, "at")), node);
        node.find("diameter").ifPresent(d -> junction.setDiameter(SValues.asDouble(d.get(1))));
        junction.setColor(node.find("color").map(Nodes::color).orElse(Color.DEFAULT));
        junction.clearModified();
        return junction;
    }

    @Override
    public SNode.SList derive(Junction junction) {
        return NodeBuilder.list("junction")
                .at(junction.getPosition())
                .child(NodeBuilder.list("diameter").number(NumberStyle.COORDINATE, junction.getDiameter()).build())
                .color(junction.getColor(), NumberStyle.COORDINATE)
                .field("uuid", junction.getUuid())
                .build();
    }
}
