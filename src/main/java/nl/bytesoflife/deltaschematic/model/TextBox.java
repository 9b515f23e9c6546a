package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.sexpr.SNode;
import org.locationtech.jts.geom.Envelope;

import java.util.Objects;

/**
 * Bordered text note: {@code (text_box "..." (at x y angle) (size w h) (stroke ...) (fill ...) ...)}.
 * The position is the top left corner.
 */
public final class TextBox extends SchematicElement {

    public static final Stroke DEFAULT_STROKE = new Stroke(0, "solid", null);

    private String text;
    private Point position;
    private double angle;
    private double width;
    private double height;
    private boolean excludeFromSim;
    private Stroke stroke = DEFAULT_STROKE;
    private String fillType = "none";
    private Color fillColor;
    private SNode.SList margins;
    private SNode.SList effects;

    public TextBox(String uuid, String text, Point position, double width, double height) {
        this(uuid, text, position, width, height, null);
    }

    public TextBox(String uuid, String text, Point position, double width, double height, SNode.SList raw) {
        super(uuid, raw);
        this.text = Objects.requireNonNull(text, "text");
        this.position = Objects.requireNonNull(position, "position");
        this.width = width;
        this.height = height;
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

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public void setSize(double width, double height) {
        this.width = width;
        this.height = height;
        indexedFieldChanged();
    }

    public boolean isExcludeFromSim() {
        return excludeFromSim;
    }

    public void setExcludeFromSim(boolean excludeFromSim) {
        this.excludeFromSim = excludeFromSim;
        changed();
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

    public SNode.SList getMargins() {
        return margins;
    }

    public void setMargins(SNode.SList margins) {
        this.margins = margins;
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
        return "text_box";
    }

    @Override
    public Envelope envelope() {
        return new Envelope(position.x(), position.x() + width, position.y(), position.y() + height);
    }

    @Override
    public String toString() {
        return "TextBox{" + text + " at " + position + ", " + width + "x" + height + "}";
    }
}
