package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.sexpr.SNode;
import org.locationtech.jts.geom.Envelope;

import java.util.Objects;

/**
 * Local, global or hierarchical net label.
 */
public final class Label extends SchematicElement {

    public enum Kind {
        LOCAL("label"),
        GLOBAL("global_label"),
        HIERARCHICAL("hierarchical_label");

        private final String kicadName;

        Kind(String kicadName) {
            this.kicadName = kicadName;
        }

        public String getKicadName() {
            return kicadName;
        }

        public static Kind fromKicadName(String name) {
            return switch (name) {
                case "label" -> LOCAL;
                case "global_label" -> GLOBAL;
                case "hierarchical_label" -> HIERARCHICAL;
                default -> throw new IllegalArgumentException("Unknown label kind: " + name);
            };
        }
    }

    private final Kind kind;
    private String text;
    private Point position;
    private double angle;
    private String shape;
    private boolean fieldsAutoplaced;
    private SNode.SList effects;
    private final Properties properties = new Properties();

    public Label(String uuid, Kind kind, String text, Point position) {
        this(uuid, kind, text, position, null);
    }

    public Label(String uuid, Kind kind, String text, Point position, SNode.SList raw) {
        super(uuid, raw);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = Objects.requireNonNull(text, "text");
        this.position = Objects.requireNonNull(position, "position");
        properties.setChangeListener(this::changed);
    }

    public Kind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = Objects.requireNonNull(text, "text");
        indexedFieldChanged();
    }

    public Point getPosition() {
        return position;
    }

    public void setPosition(Point position) {
        this.position = Objects.requireNonNull(position, "position");
        indexedFieldChanged();
    }

    public double getAngle() {
        return angle;
    }

    public void setAngle(double angle) {
        this.angle = angle;
        changed();
    }

    public String getShape() {
        return shape;
    }

    public void setShape(String shape) {
        this.shape = shape;
        changed();
    }

    public boolean isFieldsAutoplaced() {
        return fieldsAutoplaced;
    }

    public void setFieldsAutoplaced(boolean fieldsAutoplaced) {
        this.fieldsAutoplaced = fieldsAutoplaced;
        changed();
    }

    public SNode.SList getEffects() {
        return effects;
    }

    public void setEffects(SNode.SList effects) {
        this.effects = effects;
        changed();
    }

    public Properties getProperties() {
        return properties;
    }

    @Override
    public String tag() {
        return kind.getKicadName();
    }

    @Override
    public Envelope envelope() {
        return pointEnvelope(position);
    }

    @Override
    public String toString() {
        return "Label{" + kind + ", " + text + " at " + position + "}";
    }
}
