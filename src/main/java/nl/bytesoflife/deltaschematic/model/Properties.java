package nl.bytesoflife.deltaschematic.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered mapping from property name to string value. Iteration follows insertion order, which is
 * also the order the properties are written in. Names are unique.
 */
public class Properties implements Iterable<Property> {

    private final Map<String, Property> byName = new LinkedHashMap<>();
    private Runnable changeListener = () -> { };

    public Optional<String> get(String name) {
        Property property = byName.get(name);
        return property == null ? Optional.empty() : Optional.of(property.getValue());
    }

    public String getOrDefault(String name, String defaultValue) {
        return get(name).orElse(defaultValue);
    }

    public Optional<Property> getProperty(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    /**
     * Sets the value of an existing property, or appends a new hidden one placed at its owner's
     * position.
     */
    public Property set(String name, String value) {
        Property existing = byName.get(name);
        if (existing != null) {
            existing.setValue(value);
            return existing;
        }
        Property created = new Property(name, value, null, 0, null);
        created.setHidden(true);
        add(created);
        return created;
    }

    public void add(Property property) {
        if (byName.containsKey(property.getName())) {
            throw new IllegalArgumentException("Duplicate property: " + property.getName());
        }
        byName.put(property.getName(), property);
        property.setChangeListener(this::fireChange);
        fireChange();
    }

    public boolean remove(String name) {
        Property removed = byName.remove(name);
        if (removed == null) {
            return false;
        }
        removed.setChangeListener(null);
        fireChange();
        return true;
    }

    public List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(byName.keySet()));
    }

    public Map<String, String> asMap() {
        Map<String, String> values = new LinkedHashMap<>();
        for (Property property : byName.values()) {
            values.put(property.getName(), property.getValue());
        }
        return Collections.unmodifiableMap(values);
    }

    public int size() {
        return byName.size();
    }

    public boolean isEmpty() {
        return byName.isEmpty();
    }

    @Override
    public Iterator<Property> iterator() {
        return Collections.unmodifiableCollection(byName.values()).iterator();
    }

    void setChangeListener(Runnable changeListener) {
        this.changeListener = changeListener == null ? () -> { } : changeListener;
    }

    private void fireChange() {
        changeListener.run();
    }

    @Override
    public String toString() {
        return "Properties" + asMap();
    }
}
