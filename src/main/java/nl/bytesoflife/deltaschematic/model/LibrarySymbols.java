package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.sexpr.SNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The {@code lib_symbols} section: one flattened definition per symbol key used by the placed
 * components. Only the symbol cache synchronizer changes it, through {@link #apply}.
 */
public final class LibrarySymbols implements DocumentEntry {

    private final Map<String, SymbolDefinition> entries = new LinkedHashMap<>();
    private final SNode.SList raw;
    private boolean modified;

    public LibrarySymbols() {
        this(List.of(), null);
    }

    public LibrarySymbols(List<SymbolDefinition> definitions, SNode.SList raw) {
        for (SymbolDefinition definition : definitions) {
            entries.put(definition.getName(), definition);
        }
        this.raw = raw;
        this.modified = raw == null;
    }

    @Override
    public String tag() {
        return "lib_symbols";
    }

    public List<String> libraryIds() {
        return Collections.unmodifiableList(new ArrayList<>(entries.keySet()));
    }

    public Optional<SymbolDefinition> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public Collection<SymbolDefinition> definitions() {
        return Collections.unmodifiableCollection(entries.values());
    }

    public int size() {
        return entries.size();
    }

    /**
     * Removes then adds entries in one step. New entries are placed in sorted key order among the
     * existing ones, which is where KiCad keeps them.
     */
    public void apply(Map<String, SymbolDefinition> additions, Collection<String> removals) {
        if (additions.isEmpty() && removals.isEmpty()) {
            return;
        }
        for (String key : removals) {
            entries.remove(key);
        }
        List<Map.Entry<String, SymbolDefinition>> ordered = new ArrayList<>(entries.entrySet());
        for (Map.Entry<String, SymbolDefinition> addition : additions.entrySet()) {
            int index = 0;
            while (index < ordered.size() && ordered.get(index).getKey().compareTo(addition.getKey()) < 0) {
                index++;
            }
            if (index < ordered.size() && ordered.get(index).getKey().equals(addition.getKey())) {
                ordered.set(index, Map.entry(addition.getKey(), addition.getValue()));
            } else {
                ordered.add(index, Map.entry(addition.getKey(), addition.getValue()));
            }
        }
        entries.clear();
        for (Map.Entry<String, SymbolDefinition> entry : ordered) {
            entries.put(entry.getKey(), entry.getValue());
        }
        modified = true;
    }

    public SNode.SList getRaw() {
        return raw;
    }

    public boolean isModified() {
        return modified;
    }

    @Override
    public String toString() {
        return "LibrarySymbols" + entries.keySet();
    }
}
