package nl.bytesoflife.deltaschematic.collection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Exact-match conditions on named secondary indexes, all of which must hold.
 */
public final class Criteria {

    private final Map<String, String> conditions = new LinkedHashMap<>();

    private Criteria() {
    }

    public static Criteria where(String index, String value) {
        return new Criteria().and(index, value);
    }

    public Criteria and(String index, String value) {
        conditions.put(Objects.requireNonNull(index, "index"), Objects.requireNonNull(value, "value"));
        return this;
    }

    public Map<String, String> getConditions() {
        return Collections.unmodifiableMap(conditions);
    }

    @Override
    public String toString() {
        return "Criteria" + conditions;
    }
}
