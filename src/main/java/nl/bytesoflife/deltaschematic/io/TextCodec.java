package nl.bytesoflife.deltaschematic.io;

import nl.bytesoflife.deltaschematic.format.FormatDialect;
import nl.bytesoflife.deltaschematic.model.TextItem;
import nl.bytesoflife.deltaschematic.sexpr.SNode;
import nl.bytesoflife.deltaschematic.sexpr.SValues;

public class TextCodec implements ElementCodec<TextItem> {

    private final FormatDialect dialect;

    public TextCodec() {
        this(FormatDialect.CURRENT);
    }

    public TextCodec(FormatDialect dialect) {
        this.dialect = dialect;
    }

    @Override
    public TextItem read(SNode.SList node) {
        SNode.SList at = Nodes.require(node, "at");
        TextItem text = new TextItem(Nodes.uuid(node), Nodes.requireText(node, 1, "text"), Nodes.point(at), node);
        text.setAngle(Nodes.angle(at));
        text.setExcludeFromSim(SValues.flag(node, "exclude_from_sim", false));
        text.setEffects(node.find("effects").orElse(null));
        text.clearModified();
        return text;
    }

    @Override
    public SNode.SList derive(TextItem text) {
        SNode.SList effects = text.getEffects() != null
                ? text.getEffects()
                : NodeBuilder.defaultEffects("left", "bottom");
        NodeBuilder builder = NodeBuilder.list("text").string(text.getText());
        if (dialect.writesSimulationExclusion()) {
            builder.flag("exclude_from_sim", text.isExcludeFromSim());
        }
        return builder.at(text.getPosition(), text.getAngle())
                .child(effects)
                .field("uuid", text.getUuid())
                .build();
    }
}
