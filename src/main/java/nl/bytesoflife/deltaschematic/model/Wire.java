package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.sexpr.SNode;
import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Wire or bus segment. KiCad writes exactly two points, older files may hold more.
 */
public final class Wire extends SchematicElement {

    public enum Kind {
        WIRE("wire"),
        BUS("bus");

        private final String kicadName;

        Kind(String kicadName) {
            this.kicadName = kicadName;
        }

        public String getKicadName() {
            return kicadName;
        }

        public static Kind fromKicadName(String name) {
            return switch (name) {
                case "wire" -> WIRE;
                case "bus" -> BUS;
                default -> throw new IllegalArgumentException("Unknown wire kind: " + name);
            };
        }
    }

    private final Kind kind;
    private final List<Point> points = new ArrayList<>();
    private Stroke stroke = Stroke.DEFAULT;

    public Wire(String uuid, Kind kind, List<Point> points) {
        this(uuid, kind, points, null);
    }

    public Wire(String uuid, Kind kind, List<Point> points, SNode.SList raw) {
        super(uuid, raw);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.points.addAll(points);
    }

    public Kind getKind() {
        return kind;
    }

    public List<Point> getPoints() {
        return Collections.unmodifiableList(points);
    }

    public void setPoints(List<Point> newPoints) {
        points.clear();
        points.addAll(newPoints);
        indexedFieldChanged();
    }

    public Point getStart() {
        return points.get(0);
    }

    public Point getEnd() {
        return points.get(points.size() - 1);
    }

    public Stroke getStroke() {
        return stroke;
    }

    public void setStroke(Stroke stroke) {
        this.stroke = Objects.requireNonNull(stroke, "stroke");
        changed();
    }

    public double length() {
        double total = 0;
        for (int i = 1; i < points.size(); i++) {
            total += Math.hypot(points.get(i).x() - points.get(i - 1).x(), points.get(i).y() - points.get(i - 1).y());
        }
        return total;
    }

    @Override
    public String tag() {
        return kind.getKicadName();
    }

    @Override
    public Envelope envelope() {
        Envelope envelope = new Envelope();
        for (Point p : points) {
            envelope.expandToInclude(p.x(), p.y());
        }
        return envelope;
    }

    @Override
    public String toString() {
        return "Wire{" + kind + ", " + points + "}";
    }
}
