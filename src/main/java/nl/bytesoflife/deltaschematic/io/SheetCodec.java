package nl.bytesoflife.deltaschematic.io;

import nl.bytesoflife.deltaschematic.format.FormatDialect;
import nl.bytesoflife.deltaschematic.format.NumberStyle;
import nl.bytesoflife.deltaschematic.model.Color;
import nl.bytesoflife.deltaschematic.model.Sheet;
import nl.bytesoflife.deltaschematic.model.SheetInstance;
import nl.bytesoflife.deltaschematic.model.SheetPin;
import nl.bytesoflife.deltaschematic.sexpr.SNode;
import nl.bytesoflife.deltaschematic.sexpr.SValues;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hierarchical sheet symbol with its pins and per-project page numbers.
 */
public class SheetCodec implements ElementCodec<Sheet> {

    private final FormatDialect dialect;

    public SheetCodec() {
        this(FormatDialect.CURRENT);
    }

    public SheetCodec(FormatDialect dialect) {
        this.dialect = dialect;
    }

    @Override
    public Sheet read(SNode.SList node) {
        SNode.SList size = Nodes.require(node, "size");
        Sheet sheet = new Sheet(Nodes.uuid(node), Nodes.point(Nodes.require(node, "at")),
                SValues.asDouble(size.get(1)), SValues.asDouble(size.get(2)), node);
        sheet.setExcludeFromSim(SValues.flag(node, "exclude_from_sim", false));
        sheet.setInBom(SValues.flag(node, "in_bom", true));
        sheet.setOnBoard(SValues.flag(node, "on_board", true));
        sheet.setDnp(SValues.flag(node, "dnp", false));
        sheet.setFieldsAutoplaced(SValues.flag(node, "fields_autoplaced", false));
        sheet.setStroke(Nodes.stroke(node));
        sheet.setFill(node.find("fill", "color").map(Nodes::color).orElse(Color.DEFAULT));
        PropertyCodec.readAll(node, sheet.getProperties());

        for (SNode.SList pinNode : node.findAll("pin")) {
            SNode.SList at = Nodes.require(pinNode, "at");
            SheetPin pin = new SheetPin(Nodes.uuid(pinNode), Nodes.requireText(pinNode, 1, "sheet pin name"),
                    Nodes.requireText(pinNode, 2, "sheet pin shape"), Nodes.point(at), Nodes.angle(at), pinNode);
            pin.setEffects(pinNode.find("effects").orElse(null));
            sheet.addPin(pin);
        }

        node.find("instances").ifPresent(instances -> {
            for (SNode.SList project : instances.findAll("project")) {
                for (SNode.SList path : project.findAll("path")) {
                    String page = Nodes.text(path, "page");
                    sheet.addInstance(new SheetInstance(project.text(1), path.text(1), page == null ? "" : page));
                }
            }
        });

        sheet.clearModified();
        return sheet;
    }

    @Override
    public SNode.SList derive(Sheet sheet) {
        NodeBuilder builder = NodeBuilder.list("sheet")
                .at(sheet.getPosition())
                .child(NodeBuilder.list("size")
                        .number(NumberStyle.COORDINATE, sheet.getWidth())
                        .number(NumberStyle.COORDINATE, sheet.getHeight())
                        .build());
        if (dialect.writesSheetAttributes()) {
            builder.flag("exclude_from_sim", sheet.isExcludeFromSim())
                    .flag("in_bom", sheet.isInBom())
                    .flag("on_board", sheet.isOnBoard())
                    .flag("dnp", sheet.isDnp());
        }
        builder.flagIfSet("fields_autoplaced", sheet.isFieldsAutoplaced(), dialect)
                .stroke(sheet.getStroke())
                .child(NodeBuilder.list("fill").color(sheet.getFill(), NumberStyle.FIXED_4).build())
                .field("uuid", sheet.getUuid())
                .children(PropertyCodec.writeAll(sheet.getProperties(), sheet.getPosition(), dialect));

        for (SheetPin pin : sheet.getPins()) {
            builder.child(writePin(pin));
        }
        if (!sheet.getInstances().isEmpty()) {
            builder.child(instances(sheet.getInstances()));
        }
        return builder.build();
    }

    private static SNode writePin(SheetPin pin) {
        SNode.SList effects = pin.getEffects() != null ? pin.getEffects() : NodeBuilder.defaultEffects("left");
        SNode.SList derived = NodeBuilder.list("pin")
                .string(pin.getName())
                .symbol(pin.getShape())
                .at(pin.getPosition(), pin.getAngle())
                .field("uuid", pin.getUuid())
                .child(effects)
                .build();
        return NodeMerger.merge(pin.getRaw(), derived);
    }

    private static SNode.SList instances(List<SheetInstance> instances) {
        Map<String, NodeBuilder> projects = new LinkedHashMap<>();
        for (SheetInstance instance : instances) {
            projects.computeIfAbsent(instance.project(), name -> NodeBuilder.list("project").string(name))
                    .child(NodeBuilder.list("path")
                            .string(instance.path())
                            .field("page", instance.page())
                            .build());
        }
        NodeBuilder builder = NodeBuilder.list("instances");
        for (NodeBuilder project : projects.values()) {
            builder.child(project.build());
        }
        return builder.build();
    }
}
