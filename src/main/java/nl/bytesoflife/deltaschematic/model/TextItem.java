package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.sexpr.SNode;
import org.locationtech.jts.geom.Envelope;

import java.util.Objects;

/**
 * Free text note: {@code (text "..." (at x y angle) ...)}.
 */
public final class TextItem extends SchematicElement {

    private String text;
    private Point position;
    private double angle;
    private boolean excludeFromSim;
    private SNode.SList effects;

    public TextItem(String uuid, String text, Point position) {
        this(uuid, text, position, null);
    }

    public TextItem(String uuid, String text, Point position, SNode.SList raw) {
        super(uuid, raw);
        this.text = Objects.requireNonNull(text, "text");
        this.position = Objects.requireNonNull(position, "position");
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

    public boolean isExcludeFromSim() {
        return excludeFromSim;
    }

    public void setExcludeFromSim(boolean excludeFromSim) {
        this.excludeFromSim = excludeFromSim;
        changed();
    }

    public SNode.SList getEffects() {
        return effects;
    }

    public void setEffects(SNode.SList effects) {
        this.effects = effects;
        changed();
    }

    @Override
    public String tag() {
        return "text";
    }

    @Override
    public Envelope envelope() {
        return pointEnvelope(position);
    }

    @Override
    public String toString() {
        return "TextItem{" + text + " at " + position + "}";
    }
}
