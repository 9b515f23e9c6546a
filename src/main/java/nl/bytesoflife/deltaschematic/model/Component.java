package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.sexpr.SNode;
import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Placed symbol: a {@code (symbol (lib_id ...) ...)} list at the top level of a schematic.
 */
public final class Component extends SchematicElement {

    public static final String REFERENCE = "Reference";
    public static final String VALUE = "Value";
    public static final String FOOTPRINT = "Footprint";
    public static final String DATASHEET = "Datasheet";
    public static final String DESCRIPTION = "Description";

    private String libId;
    private String libName;
    private Point position;
    private Rotation rotation = Rotation.R0;
    private Mirror mirror = Mirror.NONE;
    private int unit = 1;
    private Integer bodyStyle;
    private boolean excludeFromSim;
    private boolean inBom = true;
    private boolean onBoard = true;
    private boolean dnp;
    private boolean fieldsAutoplaced;
    private final Properties properties = new Properties();
    private final List<ComponentPin> pins = new ArrayList<>();
    private final List<SymbolInstance> instances = new ArrayList<>();

    public Component(String uuid, String libId, Point position) {
        this(uuid, libId, position, null);
    }

    public Component(String uuid, String libId, Point position, SNode.SList raw) {
        super(uuid, raw);
        this.libId = Objects.requireNonNull(libId, "libId");
        this.position = Objects.requireNonNull(position, "position");
        properties.setChangeListener(this::indexedFieldChanged);
    }

    public String getLibId() {
        return libId;
    }

    /**
     * @throws nl.bytesoflife.deltaschematic.ResolutionException when the document cannot resolve the
     *                                                           new symbol; the old id is kept
     */
    public void setLibId(String libId) {
        String previous = this.libId;
        this.libId = Objects.requireNonNull(libId, "libId");
        symbolKeyChanged(() -> this.libId = previous);
    }

    public String getLibName() {
        return libName;
    }

    public void setLibName(String libName) {
        String previous = this.libName;
        this.libName = libName;
        symbolKeyChanged(() -> this.libName = previous);
    }

    public String getSymbolKey() {
        return libName != null ? libName : libId;
    }

    public Point getPosition() {
        return position;
    }

    public void setPosition(Point position) {
        this.position = Objects.requireNonNull(position, "position");
        indexedFieldChanged();
    }

    public Rotation getRotation() {
        return rotation;
    }

    public void setRotation(Rotation rotation) {
        this.rotation = Objects.requireNonNull(rotation, "rotation");
        changed();
    }

    public Mirror getMirror() {
        return mirror;
    }

    public void setMirror(Mirror mirror) {
        this.mirror = Objects.requireNonNull(mirror, "mirror");
        changed();
    }

    public int getUnit() {
        return unit;
    }

    public void setUnit(int unit) {
        this.unit = unit;
        instances.replaceAll(instance -> instance.withUnit(unit));
        changed();
    }

    public Integer getBodyStyle() {
        return bodyStyle;
    }

    public void setBodyStyle(Integer bodyStyle) {
        this.bodyStyle = bodyStyle;
        changed();
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

    public Properties getProperties() {
        return properties;
    }

    public String getReference() {
        return properties.getOrDefault(REFERENCE, "");
    }

    public void setReference(String reference) {
        properties.set(REFERENCE, reference);
        instances.replaceAll(instance -> instance.withReference(reference));
        indexedFieldChanged();
    }

    public String getValue() {
        return properties.getOrDefault(VALUE, "");
    }

    public void setValue(String value) {
        properties.set(VALUE, value);
    }

    public String getFootprint() {
        return properties.getOrDefault(FOOTPRINT, "");
    }

    public void setFootprint(String footprint) {
        properties.set(FOOTPRINT, footprint);
    }

    public List<ComponentPin> getPins() {
        return Collections.unmodifiableList(pins);
    }

    public void addPin(ComponentPin pin) {
        pins.add(Objects.requireNonNull(pin, "pin"));
        changed();
    }

    public void setPins(List<ComponentPin> newPins) {
        pins.clear();
        pins.addAll(newPins);
        changed();
    }

    public List<SymbolInstance> getInstances() {
        return Collections.unmodifiableList(instances);
    }

    public void addInstance(SymbolInstance instance) {
        instances.add(Objects.requireNonNull(instance, "instance"));
        changed();
    }

    @Override
    public String tag() {
        return "symbol";
    }

    @Override
    public Envelope envelope() {
        return pointEnvelope(position);
    }

    @Override
    public String toString() {
        return "Component{" + getReference() + ", libId=" + libId + ", value=" + getValue()
                + ", at=" + position + "}";
    }
}
