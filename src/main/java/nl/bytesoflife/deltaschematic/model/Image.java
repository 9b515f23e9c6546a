package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.sexpr.SNode;
import org.locationtech.jts.geom.Envelope;

import java.util.Objects;

public final class Image extends SchematicElement {

    private Point position;
    private double scale = 1;
    private String data;

    public Image(String uuid, Point position, String data) {
        this(uuid, position, data, null);
    }

    public Image(String uuid, Point position, String data, SNode.SList raw) {
        super(uuid, raw);
        this.position = Objects.requireNonNull(position, "position");
        this.data = Objects.requireNonNull(data, "data");
    }

    public Point getPosition() {
        return position;
    }

    public void setPosition(Point position) {
        this.position = Objects.requireNonNull(position, "position");
        indexedFieldChanged();
    }

    public double getScale() {
        return scale;
    }

    public void setScale(double scale) {
        this.scale = scale;
        changed();
    }

    public String getData() {
        return data;
    }

    public void setData(String data) {
        this.data = Objects.requireNonNull(data, "data");
        changed();
    }

    @Override
    public String tag() {
        return "image";
    }

    @Override
    public Envelope envelope() {
        return pointEnvelope(position);
    }

    @Override
    public String toString() {
        return "Image{at " + position + ", scale=" + scale + "}";
    }
}
