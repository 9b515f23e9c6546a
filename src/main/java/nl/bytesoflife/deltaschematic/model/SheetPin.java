package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.sexpr.SNode;

import java.util.Objects;
import java.util.UUID;

/**
 * Hierarchical pin on the border of a sheet symbol.
 */
public class SheetPin {

    private final String uuid;
    private String name;
    private String shape;
    private Point position;
    private double angle;
    private SNode.SList effects;
    private final SNode.SList raw;
    private Runnable changeListener = () -> { };

    public SheetPin(String uuid, String name, String shape, Point position, double angle) {
        this(uuid, name, shape, position, angle, null);
    }

    public SheetPin(String uuid, String name, String shape, Point position, double angle, SNode.SList raw) {
        this.uuid = uuid == null ? UUID.randomUUID().toString() : uuid;
        this.name = Objects.requireNonNull(name, "name");
        this.shape = Objects.requireNonNull(shape, "shape");
        this.position = Objects.requireNonNull(position, "position");
        this.angle = angle;
        this.raw = raw;
    }

    public String getUuid() {
        return uuid;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = Objects.requireNonNull(name, "name");
        changeListener.run();
    }

    public String getShape() {
        return shape;
    }

    public void setShape(String shape) {
        this.shape = Objects.requireNonNull(shape, "shape");
        changeListener.run();
    }

    public Point getPosition() {
        return position;
    }

    public void setPosition(Point position) {
        this.position = Objects.requireNonNull(position, "position");
        changeListener.run();
    }

    public double getAngle() {
        return angle;
    }

    public void setAngle(double angle) {
        this.angle = angle;
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

    @Override
    public String toString() {
        return "SheetPin{" + name + ", " + shape + " at " + position + "}";
    }
}
