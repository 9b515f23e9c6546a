package nl.bytesoflife.deltaschematic.collection;

import nl.bytesoflife.deltaschematic.model.Component;
import nl.bytesoflife.deltaschematic.model.Point;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Placed symbols, indexed by reference, value, library id, footprint and position.
 */
public class ComponentCollection extends IndexedCollection<Component> {

    public static final String REFERENCE = "reference";
    public static final String VALUE = "value";
    public static final String LIB_ID = "lib_id";
    public static final String FOOTPRINT = "footprint";

    private static final Pattern REFERENCE_NUMBER = Pattern.compile("(\\D*)(\\d+)");

    private ComponentFactory factory;

    public ComponentCollection() {
        super("components");
        singleKeyIndex(REFERENCE, Component::getReference);
        singleKeyIndex(VALUE, Component::getValue);
        singleKeyIndex(LIB_ID, Component::getLibId);
        singleKeyIndex(FOOTPRINT, Component::getFootprint);
        singleKeyIndex(POSITION, component -> component.getPosition().key());
    }

    public void setFactory(ComponentFactory factory) {
        this.factory = factory;
    }

    /**
     * Places a new symbol built from the definition of {@code libId}.
     *
     * @throws IllegalStateException when this collection is not attached to a document
     */
    public Component add(String libId, String reference, String value, Point position) {
        if (factory == null) {
            throw new IllegalStateException("Component collection is not attached to a schematic");
        }
        return add(factory.create(libId, reference, value, position));
    }

    public Optional<Component> getByReference(String reference) {
        return findFirst(REFERENCE, reference);
    }

    public List<Component> findByValue(String value) {
        return find(VALUE, value);
    }

    public List<Component> findByLibId(String libId) {
        return find(LIB_ID, libId);
    }

    public List<Component> findAt(Point position) {
        return find(POSITION, position.key());
    }

    public boolean removeByReference(String reference) {
        Optional<Component> component = getByReference(reference);
        return component.isPresent() && remove(component.get());
    }

    /**
     * Lowest free reference with the given prefix above the highest one in use, e.g. {@code R4}
     * when R1 and R3 exist.
     */
    public String nextReference(String prefix) {
        BigInteger highest = BigInteger.ZERO;
        for (Component component : this) {
            Matcher matcher = REFERENCE_NUMBER.matcher(component.getReference());
            if (matcher.matches() && matcher.group(1).equals(prefix)) {
                highest = highest.max(new BigInteger(matcher.group(2)));
            }
        }
        return prefix + highest.add(BigInteger.ONE);
    }
}
