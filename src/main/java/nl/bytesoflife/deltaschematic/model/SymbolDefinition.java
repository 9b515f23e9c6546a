package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.sexpr.SNode;
import nl.bytesoflife.deltaschematic.sexpr.SValues;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view of a {@code (symbol "name" ...)} definition, either straight from a library file
 * or flattened into a schematic's {@code lib_symbols} section. Unit sub-symbols are named
 * {@code <name>_<unit>_<bodyStyle>}.
 */
public final class SymbolDefinition {

    private final SNode.SList node;

    public SymbolDefinition(SNode.SList node) {
        Objects.requireNonNull(node, "node");
        if (!node.hasTag("symbol") || node.text(1) == null) {
            throw new IllegalArgumentException("Not a symbol definition: " + node.tag());
        }
        this.node = node;
    }

    public SNode.SList getNode() {
        return node;
    }

    public String getName() {
        return node.text(1);
    }

    public String getShortName() {
        return shortName(getName());
    }

    public Optional<String> getExtendsName() {
        return node.find("extends").map(list -> list.text(1));
    }

    public boolean isPower() {
        return node.find("power").isPresent();
    }

    public Optional<String> getPropertyValue(String name) {
        return Optional.ofNullable(getPropertyNodes().get(name)).map(list -> list.text(2));
    }

    public Map<String, SNode.SList> getPropertyNodes() {
        Map<String, SNode.SList> result = new LinkedHashMap<>();
        for (SNode.SList property : node.findAll("property")) {
            result.put(property.text(1), property);
        }
        return result;
    }

    public List<SNode.SList> getUnits() {
        return node.findAll("symbol");
    }

    public int getUnitCount() {
        int max = 1;
        for (SNode.SList unit : getUnits()) {
            max = Math.max(max, unitNumber(unit.text(1)));
        }
        return max;
    }

    public List<SymbolPin> getPins() {
        List<SymbolPin> pins = new ArrayList<>();
        for (SNode.SList unitNode : getUnits()) {
            int unit = unitNumber(unitNode.text(1));
            int bodyStyle = bodyStyle(unitNode.text(1));
            for (SNode.SList pin : unitNode.findAll("pin")) {
                pins.add(readPin(pin, unit, bodyStyle));
            }
        }
        return pins;
    }

    /**
     * Pins drawn for {@code unit}: its own pins plus the shared unit-0 pins, first body style only.
     */
    public List<SymbolPin> getPins(int unit) {
        List<SymbolPin> result = new ArrayList<>();
        for (SymbolPin pin : getPins()) {
            if ((pin.unit() == 0 || pin.unit() == unit) && pin.bodyStyle() <= 1) {
                result.add(pin);
            }
        }
        return result;
    }

    public Optional<SymbolPin> getPin(int unit, String number) {
        for (SymbolPin pin : getPins(unit)) {
            if (pin.number().equals(number)) {
                return Optional.of(pin);
            }
        }
        return Optional.empty();
    }

    public SymbolDefinition renamed(String newName) {
        String oldPrefix = getShortName() + "_";
        String newPrefix = shortName(newName) + "_";
        List<SNode> children = new ArrayList<>(node.children());
        children.set(1, SNode.string(newName));
        for (int i = 2; i < children.size(); i++) {
            if (children.get(i) instanceof SNode.SList child && child.hasTag("symbol")) {
                String unitName = child.text(1);
                if (unitName != null && unitName.startsWith(oldPrefix)) {
                    String renamed = newPrefix + unitName.substring(oldPrefix.length());
                    children.set(i, child.with(1, SNode.string(renamed)));
                }
            }
        }
        return new SymbolDefinition(new SNode.SList(children));
    }

    private static SymbolPin readPin(SNode.SList pin, int unit, int bodyStyle) {
        SNode.SList at = pin.find("at").orElseThrow(() -> new IllegalArgumentException("Pin without position: " + pin));
        String number = pin.find("number").map(list -> list.text(1)).orElse("");
        String name = pin.find("name").map(list -> list.text(1)).orElse("");
        double length = pin.find("length").map(list -> SValues.asDouble(list.get(1))).orElse(0.0);
        return new SymbolPin(
                number,
                name,
                pin.text(1),
                pin.text(2),
                new Point(SValues.asDouble(at.get(1)), SValues.asDouble(at.get(2))),
                SValues.doubleAt(at, 3, 0),
                length,
                unit,
                bodyStyle,
                SValues.flag(pin, "hide", false));
    }

    static String shortName(String name) {
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }

    private static int unitNumber(String unitName) {
        String[] parts = unitName.split("_");
        if (parts.length < 3) {
            return 0;
        }
        try {
            return Integer.parseInt(parts[parts.length - 2]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed unit name: " + unitName, e);
        }
    }

    private static int bodyStyle(String unitName) {
        String[] parts = unitName.split("_");
        if (parts.length < 3) {
            return 1;
        }
        try {
            return Integer.parseInt(parts[parts.length - 1]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed unit name: " + unitName, e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SymbolDefinition other)) return false;
        return SValues.equivalent(node, other.node);
    }

    @Override
    public int hashCode() {
        return getName().hashCode();
    }

    @Override
    public String toString() {
        return "SymbolDefinition{" + getName() + ", units=" + getUnits().size() + "}";
    }
}
