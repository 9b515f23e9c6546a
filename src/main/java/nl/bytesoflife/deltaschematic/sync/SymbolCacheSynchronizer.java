package nl.bytesoflife.deltaschematic.sync;

import nl.bytesoflife.deltaschematic.ResolutionException;
import nl.bytesoflife.deltaschematic.library.SymbolResolver;
import nl.bytesoflife.deltaschematic.model.Component;
import nl.bytesoflife.deltaschematic.model.LibrarySymbols;
import nl.bytesoflife.deltaschematic.model.SymbolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps a document's {@code lib_symbols} section equal to the set of symbol keys its components use.
 * A key is the component's {@code lib_name} when present, else its {@code lib_id}.
 * <p>
 * Synchronization is transactional: every missing definition is resolved before the section is
 * touched, so a failure leaves it as it was.
 */
public class SymbolCacheSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(SymbolCacheSynchronizer.class);

    private final SymbolResolver resolver;
    private final ResolutionPolicy policy;
    private final Set<String> unresolved = new LinkedHashSet<>();

    public SymbolCacheSynchronizer(SymbolResolver resolver, ResolutionPolicy policy) {
        this.resolver = resolver;
        this.policy = policy;
    }

    public ResolutionPolicy getPolicy() {
        return policy;
    }

    public Set<String> getUnresolved() {
        return Collections.unmodifiableSet(unresolved);
    }

    /**
     * Checks that {@code component} can be added to a document with these library symbols.
     *
     * @throws ResolutionException under {@link ResolutionPolicy#STRICT} when its symbol cannot be
     *                             resolved
     */
    public void admit(Component component, LibrarySymbols symbols) {
        String key = component.getSymbolKey();
        if (symbols.contains(key) || unresolved.contains(key)) {
            return;
        }
        try {
            resolveKey(key, component.getLibId());
        } catch (ResolutionException e) {
            if (policy == ResolutionPolicy.STRICT) {
                throw e;
            }
            log.warn("Admitting {} without a symbol definition: {}", component.getReference(), e.getMessage());
            unresolved.add(key);
        }
    }

    /**
     * Brings {@code symbols} in line with the keys {@code components} use.
     *
     * @throws ResolutionException when a new key cannot be resolved; {@code symbols} is unchanged
     */
    public SyncResult resync(Iterable<Component> components, LibrarySymbols symbols) {
        return synchronize(components, symbols, false);
    }

    /**
     * Like {@link #resync}, but keys that fail to resolve are recorded as unresolved instead of
     * failing. Used on freshly loaded documents.
     */
    public SyncResult normalize(Iterable<Component> components, LibrarySymbols symbols) {
        return synchronize(components, symbols, true);
    }

    /**
     * Records every used key missing from {@code symbols} as unresolved, leaving {@code symbols}
     * alone. Used on documents opened without normalization.
     */
    public void adoptMissing(Iterable<Component> components, LibrarySymbols symbols) {
        for (Component component : components) {
            if (!symbols.contains(component.getSymbolKey())) {
                unresolved.add(component.getSymbolKey());
            }
        }
    }

    private SyncResult synchronize(Iterable<Component> components, LibrarySymbols symbols, boolean lenient) {
        Map<String, String> used = new LinkedHashMap<>();
        for (Component component : components) {
            used.putIfAbsent(component.getSymbolKey(), component.getLibId());
        }
        unresolved.retainAll(used.keySet());

        List<String> removals = new ArrayList<>();
        for (String key : symbols.libraryIds()) {
            if (!used.containsKey(key)) {
                removals.add(key);
            }
        }

        Map<String, SymbolDefinition> additions = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : used.entrySet()) {
            String key = entry.getKey();
            if (symbols.contains(key) || unresolved.contains(key)) {
                continue;
            }
            try {
                additions.put(key, resolveKey(key, entry.getValue()));
            } catch (ResolutionException e) {
                if (!lenient) {
                    throw e;
                }
                log.warn("Symbol {} stays unresolved: {}", key, e.getMessage());
                unresolved.add(key);
            }
        }

        if (additions.isEmpty() && removals.isEmpty()) {
            return SyncResult.EMPTY;
        }
        symbols.apply(additions, removals);
        log.debug("Synchronized lib_symbols: added {}, removed {}", additions.keySet(), removals);
        return new SyncResult(new ArrayList<>(additions.keySet()), removals);
    }

    private SymbolDefinition resolveKey(String key, String libId) {
        if (resolver == null) {
            throw new ResolutionException(libId, ResolutionException.Reason.NOT_FOUND,
                    "not in lib_symbols and no symbol resolver configured");
        }
        SymbolDefinition definition = resolver.resolve(libId).getDefinition();
        return key.equals(definition.getName()) ? definition : definition.renamed(key);
    }
}
