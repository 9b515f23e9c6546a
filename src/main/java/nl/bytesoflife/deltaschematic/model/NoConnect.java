package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.sexpr.SNode;
import org.locationtech.jts.geom.Envelope;

import java.util.Objects;

public final class NoConnect extends SchematicElement {

    private Point position;

    public NoConnect(String uuid, Point position) {
        this(uuid, position, null);
    }

    public NoConnect(String uuid, Point position, SNode.SList raw) {
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

    @Override
    public String tag() {
        return "no_connect";
    }

    @Override
    public Envelope envelope() {
        return pointEnvelope(position);
    }

    @Override
    public String toString() {
        return "NoConnect{" + position + "}";
    }
}
