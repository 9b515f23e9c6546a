package nl.bytesoflife.deltaschematic.io;

import nl.bytesoflife.deltaschematic.format.FormatDialect;
import nl.bytesoflife.deltaschematic.model.Point;
import nl.bytesoflife.deltaschematic.model.Properties;
import nl.bytesoflife.deltaschematic.model.Property;
import nl.bytesoflife.deltaschematic.sexpr.SNode;
import nl.bytesoflife.deltaschematic.sexpr.SValues;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code (property "Name" "Value" (at x y angle) [(show_name yes)] [(do_not_autoplace yes)]
 * [(hide yes)] (effects ...))}.
 */
public final class PropertyCodec {

    private PropertyCodec() {
    }

    public static Property read(SNode.SList node) {
        String name = Nodes.requireText(node, 1, "property name");
        String value = Nodes.requireText(node, 2, "property value");
        Point position = null;
        double angle = 0;
        SNode.SList at = node.find("at").orElse(null);
        if (at != null) {
            position = Nodes.point(at);
            angle = SValues.doubleAt(at, 3, 0);
        }
        SNode.SList effects = node.find("effects").orElse(null);
        Property property = new Property(name, value, position, angle, effects, node);

        boolean hiddenInEffects = effects != null && SValues.flag(effects, "hide").orElse(false);
        boolean hidden = SValues.flag(node, "hide").orElse(false) || hiddenInEffects;
        property.setHidden(hidden);
        property.setHiddenInEffects(hiddenInEffects);
        property.setShowName(SValues.flag(node, "show_name", false));
        property.setDoNotAutoplace(SValues.flag(node, "do_not_autoplace", false));
        return property;
    }

    static void readAll(SNode.SList owner, Properties target) {
        for (SNode.SList node : owner.findAll("property")) {
            target.add(read(node));
        }
    }

    static SNode.SList write(Property property, Point ownerPosition, FormatDialect dialect) {
        Point position = property.getPosition() != null ? property.getPosition() : ownerPosition;
        NodeBuilder builder = NodeBuilder.list("property")
                .string(property.getName())
                .string(property.getValue())
                .at(position, property.getAngle())
                .flagIfSet("show_name", property.isShowName(), dialect)
                .flagIfSet("do_not_autoplace", property.isDoNotAutoplace(), dialect);
        SNode.SList effects = property.getEffects() != null ? property.getEffects() : NodeBuilder.defaultEffects();
        if (property.isHiddenInEffects() || !dialect.writesHideAsBoolean()) {
            builder.child(withHide(effects, property.isHidden(), dialect));
        } else {
            builder.flagIfSet("hide", property.isHidden(), dialect);
            builder.child(withHide(effects, false, dialect));
        }
        return (SNode.SList) NodeMerger.merge(property.getRaw(), builder.build());
    }

    static List<SNode> writeAll(Properties properties, Point ownerPosition, FormatDialect dialect) {
        List<SNode> nodes = new ArrayList<>();
        for (Property property : properties) {
            nodes.add(write(property, ownerPosition, dialect));
        }
        return nodes;
    }

    static SNode.SList withHide(SNode.SList effects, boolean hidden, FormatDialect dialect) {
        List<SNode> children = new ArrayList<>();
        for (SNode child : effects.children()) {
            boolean isHide = child instanceof SNode.SList list ? list.hasTag("hide") : "hide".equals(child.text());
            if (!isHide) {
                children.add(child);
            }
        }
        if (hidden) {
            children.add(dialect.writesHideAsBoolean() ? NodeBuilder.flagNode("hide", true) : SNode.atom("hide"));
        }
        return new SNode.SList(children);
    }
}
