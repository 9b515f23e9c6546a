package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.sexpr.SNode;
import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Hierarchical sheet symbol. Its name and file live in the {@code Sheetname} and {@code Sheetfile}
 * properties.
 */
public final class Sheet extends SchematicElement {

    public static final String SHEET_NAME = "Sheetname";
    public static final String SHEET_FILE = "Sheetfile";

    private Point position;
    private double width;
    private double height;
    private boolean excludeFromSim;
    private boolean inBom = true;
    private boolean onBoard = true;
    private boolean dnp;
    private boolean fieldsAutoplaced;
    private Stroke stroke = new Stroke(0.1524, "solid", null);
    private Color fill = Color.DEFAULT;
    private final Properties properties = new Properties();
    private final List<SheetPin> pins = new ArrayList<>();
    private final List<SheetInstance> instances = new ArrayList<>();

    public Sheet(String uuid, Point position, double width, double height) {
        this(uuid, position, width, height, null);
    }

    public Sheet(String uuid, Point position, double width, double height, SNode.SList raw) {
        super(uuid, raw);
        this.position = Objects.requireNonNull(position, "position");
        this.width = width;
        this.height = height;
        properties.setChangeListener(this::indexedFieldChanged);
    }

    public Point getPosition() {
        return position;
    }

    public void setPosition(Point position) {
        this.position = Objects.requireNonNull(position, "position");
        indexedFieldChanged();
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

    public boolean isInBom() {
        return inBom;
    }

    public void setInBom(boolean inBom) {
        this.inBom = inBom;
        changed();
    }

    public boolean isOnBoard() {
        return onBoard;
    }

    public void setOnBoard(boolean onBoard) {
        this.onBoard = onBoard;
        changed();
    }

    public boolean isDnp() {
        return dnp;
    }

    public void setDnp(boolean dnp) {
        this.dnp = dnp;
        changed();
    }

    public boolean isFieldsAutoplaced() {
        return fieldsAutoplaced;
    }

    public void setFieldsAutoplaced(boolean fieldsAutoplaced) {
        this.fieldsAutoplaced = fieldsAutoplaced;
        changed();
    }

    public Stroke getStroke() {
        return stroke;
    }

    public void setStroke(Stroke stroke) {
        this.stroke = Objects.requireNonNull(stroke, "stroke");
        changed();
    }

    public Color getFill() {
        return fill;
    }

    public void setFill(Color fill) {
        this.fill = Objects.requireNonNull(fill, "fill");
        changed();
    }

    public Properties getProperties() {
        return properties;
    }

    public String getName() {
        return properties.getOrDefault(SHEET_NAME, "");
    }

    public void setName(String name) {
        properties.set(SHEET_NAME, name);
    }

    public String getFileName() {
        return properties.getOrDefault(SHEET_FILE, "");
    }

    public void setFileName(String fileName) {
        properties.set(SHEET_FILE, fileName);
    }

    public List<SheetPin> getPins() {
        return Collections.unmodifiableList(pins);
    }

    public Optional<SheetPin> getPin(String name) {
        return pins.stream().filter(pin -> pin.getName().equals(name)).findFirst();
    }

    public void addPin(SheetPin pin) {
        pins.add(Objects.requireNonNull(pin, "pin"));
        pin.setChangeListener(this::changed);
        changed();
    }

    public boolean removePin(String name) {
        boolean removed = pins.removeIf(pin -> pin.getName().equals(name));
        if (removed) {
            changed();
        }
        return removed;
    }

    public List<SheetInstance> getInstances() {
        return Collections.unmodifiableList(instances);
    }

    public void addInstance(SheetInstance instance) {
        instances.add(Objects.requireNonNull(instance, "instance"));
        changed();
    }

    @Override
    public String tag() {
        return "sheet";
    }

    @Override
    public Envelope envelope() {
        return new Envelope(position.x(), position.x() + width, position.y(), position.y() + height);
    }

    @Override
    public String toString() {
        return "Sheet{" + getName() + ", file=" + getFileName() + ", at=" + position + "}";
    }
}
