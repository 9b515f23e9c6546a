package nl.bytesoflife.deltaschematic.io;

import nl.bytesoflife.deltaschematic.format.FormatDialect;
import nl.bytesoflife.deltaschematic.model.Component;
import nl.bytesoflife.deltaschematic.model.ComponentPin;
import nl.bytesoflife.deltaschematic.model.Mirror;
import nl.bytesoflife.deltaschematic.model.Rotation;
import nl.bytesoflife.deltaschematic.model.SymbolInstance;
import nl.bytesoflife.deltaschematic.sexpr.SNode;
import nl.bytesoflife.deltaschematic.sexpr.SValues;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Placed symbol: {@code (symbol (lib_id "Device:R") (at x y r) ... (instances ...))}.
 */
public class ComponentCodec implements ElementCodec<Component> {

    private final FormatDialect dialect;

    public ComponentCodec() {
        this(FormatDialect.CURRENT);
    }

    public ComponentCodec(FormatDialect dialect) {
        this.dialect = dialect;
    }

    @Override
    public Component read(SNode.SList node) {
        String libId = Nodes.requireText(Nodes.require(node, "lib_id"), 1, "lib_id");
        SNode.SList at = Nodes.require(node, "at");
        Component component = new Component(Nodes.uuid(node), libId, Nodes.point(at), node);
        component.setRotation(Rotation.fromDegrees(Nodes.angle(at)));
        component.setLibName(Nodes.text(node, "lib_name"));
        component.setMirror(Mirror.fromKicadName(Nodes.text(node, "mirror")));
        node.find("unit").ifPresent(unit -> component.setUnit(SValues.asInt(unit.get(1))));
        node.find("body_style").ifPresent(style -> component.setBodyStyle(SValues.asInt(style.get(1))));
        component.setExcludeFromSim(SValues.flag(node, "exclude_from_sim", false));
        component.setInBom(SValues.flag(node, "in_bom", true));
        component.setOnBoard(SValues.flag(node, "on_board", true));
        component.setDnp(SValues.flag(node, "dnp", false));
        component.setFieldsAutoplaced(SValues.flag(node, "fields_autoplaced", false));

        PropertyCodec.readAll(node, component.getProperties());

        List<ComponentPin> pins = new ArrayList<>();
        for (SNode.SList pin : node.findAll("pin")) {
            pins.add(new ComponentPin(pin.text(1), Nodes.uuid(pin), Nodes.text(pin, "alternate")));
        }
        component.setPins(pins);

        node.find("instances").ifPresent(instances -> {
            for (SNode.SList project : instances.findAll("project")) {
                for (SNode.SList path : project.findAll("path")) {
                    int unit = path.find("unit").map(u -> SValues.asInt(u.get(1))).orElse(component.getUnit());
                    component.addInstance(new SymbolInstance(project.text(1), path.text(1),
                            referenceOf(path), unit));
                }
            }
        });

        component.clearModified();
        return component;
    }

    @Override
    public SNode.SList derive(Component component) {
        NodeBuilder builder = NodeBuilder.list("symbol");
        if (component.getLibName() != null) {
            builder.field("lib_name", component.getLibName());
        }
        builder.field("lib_id", component.getLibId())
                .at(component.getPosition(), component.getRotation().getDegrees());
        if (component.getMirror() != Mirror.NONE) {
            builder.field("mirror", component.getMirror().getKicadName());
        }
        builder.child(NodeBuilder.list("unit").integer(component.getUnit()).build());
        if (component.getBodyStyle() != null) {
            builder.child(NodeBuilder.list("body_style").integer(component.getBodyStyle()).build());
        }
        if (dialect.writesSimulationExclusion()) {
            builder.flag("exclude_from_sim", component.isExcludeFromSim());
        }
        builder.flag("in_bom", component.isInBom())
                .flag("on_board", component.isOnBoard())
                .flag("dnp", component.isDnp())
                .flagIfSet("fields_autoplaced", component.isFieldsAutoplaced(), dialect)
                .field("uuid", component.getUuid())
                .children(PropertyCodec.writeAll(component.getProperties(), component.getPosition(), dialect));

        for (ComponentPin pin : component.getPins()) {
            NodeBuilder pinNode = NodeBuilder.list("pin").string(pin.number());
            if (pin.alternate() != null) {
                pinNode.field("alternate", pin.alternate());
            }
            if (pin.uuid() != null) {
                pinNode.field("uuid", pin.uuid());
            }
            builder.child(pinNode.build());
        }

        if (!component.getInstances().isEmpty()) {
            builder.child(instances(component.getInstances()));
        }
        return builder.build();
    }

    private static String referenceOf(SNode.SList path) {
        String reference = Nodes.text(path, "reference");
        return reference == null ? "" : reference;
    }

    private static SNode.SList instances(List<SymbolInstance> instances) {
        Map<String, NodeBuilder> projects = new LinkedHashMap<>();
        for (SymbolInstance instance : instances) {
            NodeBuilder project = projects.computeIfAbsent(instance.project(),
                    name -> NodeBuilder.list("project").string(name));
            project.child(NodeBuilder.list("path")
                    .string(instance.path())
                    .field("reference", instance.reference())
                    .child(NodeBuilder.list("unit").integer(instance.unit()).build())
                    .build());
        }
        NodeBuilder builder = NodeBuilder.list("instances");
        for (NodeBuilder project : projects.values()) {
            builder.child(project.build());
        }
        return builder.build();
    }
}
