package nl.bytesoflife.deltaschematic.io;

import nl.bytesoflife.deltaschematic.format.FormatDialect;
import nl.bytesoflife.deltaschematic.format.NumberStyle;
import nl.bytesoflife.deltaschematic.model.TextBox;
import nl.bytesoflife.deltaschematic.sexpr.SNode;
import nl.bytesoflife.deltaschematic.sexpr.SValues;

public class TextBoxCodec implements ElementCodec<TextBox> {

    private final FormatDialect dialect;

    public TextBoxCodec() {
        this(FormatDialect.CURRENT);
    }

    public TextBoxCodec(FormatDialect dialect) {
        this.dialect = dialect;
    }

    @Override
    public TextBox read(SNode.SList node) {
        SNode.SList at = Nodes.require(node, "at");
        SNode.SList size = Nodes.require(node, "size");
        TextBox box = new TextBox(Nodes.uuid(node), Nodes.requireText(node, 1, "text box text"), Nodes.point(at),
                SValues.asDouble(size.get(1)), SValues.asDouble(size.get(2)), node);
        box.setAngle(Nodes.angle(at));
        box.setExcludeFromSim(SValues.flag(node, "exclude_from_sim", false));
        box.setStroke(Nodes.stroke(node));
        node.find("fill").ifPresent(fill -> {
            box.setFillType(fill.find("type").map(type -> type.text(1)).orElse("none"));
            box.setFillColor(fill.find("color").map(Nodes::color).orElse(null));
        });
        box.setMargins(node.find("margins").orElse(null));
        box.setEffects(node.find("effects").orElse(null));
        box.clearModified();
        return box;
    }

    @Override
    public SNode.SList derive(TextBox box) {
        NodeBuilder builder = NodeBuilder.list("text_box").string(box.getText());
        if (dialect.writesSimulationExclusion()) {
            builder.flag("exclude_from_sim", box.isExcludeFromSim());
        }
        NodeBuilder fill = NodeBuilder.list("fill").child(NodeBuilder.list("type").symbol(box.getFillType()).build());
        if (box.getFillColor() != null) {
            fill.color(box.getFillColor(), NumberStyle.COORDINATE);
        }
        SNode.SList effects = box.getEffects() != null ? box.getEffects() : NodeBuilder.defaultEffects("left", "top");
        return builder.at(box.getPosition(), box.getAngle())
                .child(NodeBuilder.list("size")
                        .number(NumberStyle.COORDINATE, box.getWidth())
                        .number(NumberStyle.COORDINATE, box.getHeight())
                        .build())
                .child(box.getMargins())
                .stroke(box.getStroke())
                .child(fill.build())
                .child(effects)
                .field("uuid", box.getUuid())
                .build();
    }
}
