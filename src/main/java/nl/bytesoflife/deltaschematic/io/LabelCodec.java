package nl.bytesoflife.deltaschematic.io;

import nl.bytesoflife.deltaschematic.format.FormatDialect;
import nl.bytesoflife.deltaschematic.model.Label;
import nl.bytesoflife.deltaschematic.model.Property;
import nl.bytesoflife.deltaschematic.sexpr.SNode;
import nl.bytesoflife.deltaschematic.sexpr.SValues;

/**
 * Net labels. Global labels created in code get KiCad's hidden {@code Intersheetrefs} property.
 */
public class LabelCodec implements ElementCodec<Label> {

    public static final String INTERSHEET_REFS = "Intersheetrefs";

    private final FormatDialect dialect;

    public LabelCodec() {
        this(FormatDialect.CURRENT);
    }

    public LabelCodec(FormatDialect dialect) {
        this.dialect = dialect;
    }

    @Override
    public Label read(SNode.SList node) {
        SNode.SList at = Nodes.require(node, "at");
        Label label = new Label(Nodes.uuid(node), Label.Kind.fromKicadName(node.tag()),
                Nodes.requireText(node, 1, "label text"), Nodes.point(at), node);
        label.setAngle(Nodes.angle(at));
        label.setShape(Nodes.text(node, "shape"));
        label.setFieldsAutoplaced(SValues.flag(node, "fields_autoplaced", false));
        label.setEffects(node.find("effects").orElse(null));
        PropertyCodec.readAll(node, label.getProperties());
        label.clearModified();
        return label;
    }

    @Override
    public SNode.SList derive(Label label) {
        NodeBuilder builder = NodeBuilder.list(label.getKind().getKicadName()).string(label.getText());
        if (label.getShape() != null) {
            builder.field("shape", label.getShape());
        }
        SNode.SList effects = label.getEffects();
        if (effects == null) {
            effects = label.getKind() == Label.Kind.LOCAL
                    ? NodeBuilder.defaultEffects("left", "bottom")
                    : NodeBuilder.defaultEffects("left");
        }
        builder.at(label.getPosition(), label.getAngle())
                .flagIfSet("fields_autoplaced", label.isFieldsAutoplaced(), dialect)
                .child(effects)
                .field("uuid", label.getUuid())
                .children(PropertyCodec.writeAll(label.getProperties(), label.getPosition(), dialect));
        return builder.build();
    }

    public static Property intersheetReferences(Label label) {
        Property property = new Property(INTERSHEET_REFS, "${INTERSHEET_REFS}", label.getPosition(), 0,
                NodeBuilder.defaultEffects("left"));
        property.setHidden(true);
        return property;
    }
}
