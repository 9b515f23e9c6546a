package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.sexpr.SNode;
import org.locationtech.jts.geom.Envelope;

import java.util.Objects;

public final class Junction extends SchematicElement {

    private Point position;
    private double diameter;
    private Color color = Color.DEFAULT;

    public Junction(String uuid, Point position) {
        this(uuid, position, null);
    }

    public Junction(String uuid, Point position, SNode.SList raw) {
        super(uuid, raw);
        this.position = Objects.requireNonNull(position, "position");
    }

    public Point getPosition() {
        return position;
    }

    public void setPosition(Point position) {
        this.position = Objects.requireNonNull(position, "position");
        indexedFieldChanged();
    }

    public double getDiameter() {
        return diameter;
    }

    public void setDiameter(double diameter) {
        this.diameter = diameter;
        changed();
    }

    public Color getColor() {
        return color;
    }

    public void setColor(Color color) {
        this.color = Objects.requireNonNull(color, "color");
        changed();
    }

    @Override
    public String tag() {
        return "junction";
    }

    @Override
    public Envelope envelope() {
        return pointEnvelope(position);
    }

    @Override
    public String toString() {
        return "Junction{" + position + "}";
    }
}
