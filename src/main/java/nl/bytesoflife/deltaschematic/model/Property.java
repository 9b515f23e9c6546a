package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.sexpr.SNode;

import java.util.Objects;

/**
 * Named field of a symbol, sheet or label. The text effects are kept as the node they were read
 * from; the library only interprets the hide flag.
 */
public class Property {

    private final String name;
    private String value;
    private Point position;
    private double angle;
    private boolean hidden;
    private boolean hiddenInEffects;
    private boolean showName;
    private boolean doNotAutoplace;
    private SNode.SList effects;
    private final SNode.SList raw;
    private Runnable changeListener = () -> { };

    public Property(String name, String value, Point position, double angle, SNode.SList effects) {
        this(name, value, position, angle, effects, null);
    }

    public Property(String name, String value, Point position, double angle, SNode.SList effects, SNode.SList raw) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = Objects.requireNonNull(value, "value");
        this.position = position;
        this.angle = angle;
        this.effects = effects;
        this.raw = raw;
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        Objects.requireNonNull(value, "value");
        if (!value.equals(this.value)) {
            this.value = value;
            changeListener.run();
        }
    }

    public Point getPosition() {
        return position;
    }

    public void setPosition(Point position) {
        this.position = position;
        changeListener.run();
    }

    public double getAngle() {
        return angle;
    }

    public void setAngle(double angle) {
        this.angle = angle;
        changeListener.run();
    }

    public boolean isHidden() {
        return hidden;
    }

    public void setHidden(boolean hidden) {
        if (this.hidden != hidden) {
            this.hidden = hidden;
            changeListener.run();
        }
    }

    /**
     * True when the hide flag was read from (and is written back into) the {@code effects} list,
     * as KiCad 8 does. KiCad 9 writes it as a direct child of the property.
     */
    public boolean isHiddenInEffects() {
        return hiddenInEffects;
    }

    public void setHiddenInEffects(boolean hiddenInEffects) {
        this.hiddenInEffects = hiddenInEffects;
    }

    public boolean isShowName() {
        return showName;
    }

    public void setShowName(boolean showName) {
        this.showName = showName;
        changeListener.run();
    }

    public boolean isDoNotAutoplace() {
        return doNotAutoplace;
    }

    public void setDoNotAutoplace(boolean doNotAutoplace) {
        this.doNotAutoplace = doNotAutoplace;
        changeListener.run();
    }

    public SNode.SList getEffects() {
        return effects;
    }

    public void setEffects(SNode.SList effects) {
        this.effects = effects;
        changeListener.run();
    }

    public SNode.SList getRaw() {
        return raw;
    }

    void setChangeListener(Runnable changeListener) {
        this.changeListener = changeListener == null ? () -> { } : changeListener;
    }

    public Property copy() {
        Property copy = new Property(name, value, position, angle, effects, raw);
        copy.hidden = hidden;
        copy.hiddenInEffects = hiddenInEffects;
        copy.showName = showName;
        copy.doNotAutoplace = doNotAutoplace;
        return copy;
    }

    @Override
    public String toString() {
        return "Property{" + name + "=" + value + (hidden ? ", hidden" : "") + "}";
    }
}
