package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.sexpr.SNode;
import org.locationtech.jts.geom.Envelope;

import java.util.Objects;

public final class Rectangle extends SchematicElement {

    public static final Stroke DEFAULT_STROKE = new Stroke(0.127, "solid", null);

    private Point start;
    private Point end;
    private Stroke stroke = DEFAULT_STROKE;
    private String fillType = "none";
    private Color fillColor;

    public Rectangle(String uuid, Point start, Point end) {
        this(uuid, start, end, null);
    }

    public Rectangle(String uuid, Point start, Point end, SNode.SList raw) {
        super(uuid, raw);
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
    }

    public Point getStart() {
        return start;
    }

    public Point getEnd() {
        return end;
    }

    public void setCorners(Point start, Point end) {
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
        indexedFieldChanged();
    }

    public Stroke getStroke() {
        return stroke;
    }

    public void setStroke(Stroke stroke) {
        this.stroke = Objects.requireNonNull(stroke, "stroke");
        changed();
    }

    public String getFillType() {
        return fillType;
    }

    public void setFillType(String fillType) {
        this.fillType = Objects.requireNonNull(fillType, "fillType");
        changed();
    }

    public Color getFillColor() {
        return fillColor;
    }

    public void setFillColor(Color fillColor) {
        this.fillColor = fillColor;
        changed();
    }

    @Override
    public String tag() {
        return "rectangle";
    }

    @Override
    public Envelope envelope() {
        return new Envelope(start.x(), end.x(), start.y(), end.y());
    }

    @Override
    public String toString() {
        return "Rectangle{" + start + " - " + end + "}";
    }
}
