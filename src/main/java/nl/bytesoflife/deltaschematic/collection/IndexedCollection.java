package nl.bytesoflife.deltaschematic.collection;

import nl.bytesoflife.deltaschematic.IdentityConflictException;
import nl.bytesoflife.deltaschematic.geometry.SpatialIndex;
import nl.bytesoflife.deltaschematic.model.ElementListener;
import nl.bytesoflife.deltaschematic.model.Point;
import nl.bytesoflife.deltaschematic.model.SchematicElement;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Ordered store of one element kind with a uuid index, named secondary indexes and a spatial index.
 * <p>
 * Derived indexes are rebuilt lazily: a mutation only marks them dirty and the next lookup rebuilds
 * them in one pass. Inside a batch no rebuild happens at all; lookups scan the element list instead
 * and the indexes are rebuilt once when the batch ends. The uuid identity set is maintained on every
 * insert, so duplicate detection never waits for a rebuild.
 * <p>
 * Not thread-safe; a document is mutated from one thread at a time.
 */
public abstract class IndexedCollection<T extends SchematicElement> implements Iterable<T> {

    private static final Logger log = LoggerFactory.getLogger(IndexedCollection.class);

    public static final String POSITION = "position";

    private final String name;
    private final List<T> items = new ArrayList<>();
    private final Set<String> identities = new HashSet<>();
    private final Map<String, Function<T, Collection<String>>> extractors = new LinkedHashMap<>();
    private final List<CollectionListener<T>> listeners = new ArrayList<>();
    private final ElementListener elementListener = new ElementListener() {
        @Override
        public void indexedFieldChanged(SchematicElement element) {
            markDirty();
        }

        @Override
        @SuppressWarnings("unchecked")
        public void symbolKeyChanged(SchematicElement element) {
            for (CollectionListener<T> listener : listeners) {
                listener.symbolKeyChanged((T) element);
            }
            markDirty();
        }
    };

    private Map<String, T> byUuid = new HashMap<>();
    private Map<String, Map<String, List<T>>> secondary = new HashMap<>();
    private SpatialIndex<T> spatial = new SpatialIndex<>();
    private Map<T, Integer> ordinals = new IdentityHashMap<>();

    private IndexState state = IndexState.CLEAN;
    private boolean pendingRebuild;
    private int batchDepth;
    private int rebuildCount;

    protected IndexedCollection(String name) {
        this.name = name;
    }

    protected final void index(String indexName, Function<T, Collection<String>> extractor) {
        extractors.put(indexName, extractor);
    }

    protected final void singleKeyIndex(String indexName, Function<T, String> extractor) {
        index(indexName, element -> {
            String key = extractor.apply(element);
            return key == null ? List.of() : List.of(key);
        });
    }

    public String getName() {
        return name;
    }

    public void addListener(CollectionListener<T> listener) {
        listeners.add(listener);
    }

    public void removeListener(CollectionListener<T> listener) {
        listeners.remove(listener);
    }

    /**
     * Appends an element.
     *
     * @throws IdentityConflictException if an element with the same uuid is already present
     */
    public T add(T element) {
        Objects.requireNonNull(element, "element");
        if (identities.contains(element.getUuid())) {
            throw new IdentityConflictException(name, element.getUuid());
        }
        for (CollectionListener<T> listener : listeners) {
            listener.beforeAdd(element);
        }
        items.add(element);
        identities.add(element.getUuid());
        element.setListener(elementListener);
        markDirty();
        for (CollectionListener<T> listener : listeners) {
            listener.added(element);
        }
        return element;
    }

    /**
     * Removes the element with the given uuid.
     *
     * @return false when no element has that uuid
     */
    public boolean remove(String uuid) {
        if (!identities.contains(uuid)) {
            return false;
        }
        T removed = null;
        for (Iterator<T> it = items.iterator(); it.hasNext(); ) {
            T element = it.next();
            if (element.getUuid().equals(uuid)) {
                it.remove();
                removed = element;
                break;
            }
        }
        if (removed == null) {
            return false;
        }
        identities.remove(uuid);
        removed.setListener(null);
        markDirty();
        for (CollectionListener<T> listener : listeners) {
            listener.removed(removed);
        }
        return true;
    }

    public boolean remove(T element) {
        return remove(element.getUuid());
    }

    public Optional<T> get(String uuid) {
        if (!identities.contains(uuid)) {
            return Optional.empty();
        }
        if (!indexesUsable()) {
            return items.stream().filter(e -> e.getUuid().equals(uuid)).findFirst();
        }
        return Optional.ofNullable(byUuid.get(uuid));
    }

    public boolean contains(String uuid) {
        return identities.contains(uuid);
    }

    /**
     * Elements matching every condition, in insertion order.
     *
     * @throws IllegalArgumentException for an index name this collection does not have
     */
    public List<T> find(Criteria criteria) {
        Map<String, String> conditions = criteria.getConditions();
        for (String indexName : conditions.keySet()) {
            if (!extractors.containsKey(indexName)) {
                throw new IllegalArgumentException("No index '" + indexName + "' on " + name
                        + ", available: " + extractors.keySet());
            }
        }
        if (conditions.isEmpty()) {
            return all();
        }
        if (!indexesUsable()) {
            List<T> result = new ArrayList<>();
            for (T element : items) {
                if (matches(element, conditions)) {
                    result.add(element);
                }
            }
            return result;
        }

        // Start from the smallest bucket, then filter on the remaining conditions
        List<T> smallest = null;
        for (Map.Entry<String, String> condition : conditions.entrySet()) {
            List<T> bucket = secondary.get(condition.getKey()).getOrDefault(condition.getValue(), List.of());
            if (smallest == null || bucket.size() < smallest.size()) {
                smallest = bucket;
            }
        }
        List<T> result = new ArrayList<>();
        for (T element : smallest) {
            if (matches(element, conditions)) {
                result.add(element);
            }
        }
        return result;
    }

    public List<T> find(String indexName, String value) {
        return find(Criteria.where(indexName, value));
    }

    public Optional<T> findFirst(String indexName, String value) {
        List<T> found = find(indexName, value);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    /**
     * Elements whose envelope intersects the rectangle spanned by the two corners, in insertion
     * order.
     */
    public List<T> findInRegion(Point corner1, Point corner2) {
        Envelope region = new Envelope(corner1.x(), corner2.x(), corner1.y(), corner2.y());
        List<T> hits;
        if (!indexesUsable()) {
            hits = new ArrayList<>();
            for (T element : items) {
                if (element.envelope().intersects(region)) {
                    hits.add(element);
                }
            }
            return hits;
        }
        hits = new ArrayList<>();
        for (T candidate : spatial.query(region)) {
            if (candidate.envelope().intersects(region)) {
                hits.add(candidate);
            }
        }
        hits.sort(Comparator.comparingInt(ordinals::get));
        return hits;
    }

    public List<T> findNear(Point point, double distance) {
        return findInRegion(point.translate(-distance, -distance), point.translate(distance, distance));
    }

    public Set<String> indexNames() {
        return Collections.unmodifiableSet(extractors.keySet());
    }

    public List<T> all() {
        return List.copyOf(items);
    }

    @Override
    public Iterator<T> iterator() {
        return all().iterator();
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public IndexState getState() {
        return state;
    }

    public int getRebuildCount() {
        return rebuildCount;
    }

    public void beginBatch() {
        if (batchDepth++ == 0) {
            pendingRebuild = state == IndexState.DIRTY;
            state = IndexState.BUFFERING;
        }
    }

    public void endBatch() {
        if (batchDepth == 0) {
            throw new IllegalStateException("No batch open on " + name);
        }
        if (--batchDepth == 0) {
            if (pendingRebuild) {
                rebuild();
            }
            pendingRebuild = false;
            state = IndexState.CLEAN;
        }
    }

    public boolean isBatching() {
        return batchDepth > 0;
    }

    private void markDirty() {
        if (state == IndexState.BUFFERING) {
            pendingRebuild = true;
        } else {
            state = IndexState.DIRTY;
        }
    }

    private boolean indexesUsable() {
        if (state == IndexState.BUFFERING) {
            return !pendingRebuild;
        }
        if (state == IndexState.DIRTY) {
            rebuild();
            state = IndexState.CLEAN;
        }
        return true;
    }

    private void rebuild() {
        Map<String, T> newByUuid = new HashMap<>(items.size() * 2);
        Map<String, Map<String, List<T>>> newSecondary = new HashMap<>();
        SpatialIndex<T> newSpatial = new SpatialIndex<>();
        Map<T, Integer> newOrdinals = new IdentityHashMap<>(items.size() * 2);
        for (String indexName : extractors.keySet()) {
            newSecondary.put(indexName, new HashMap<>());
        }
        for (T element : items) {
            newByUuid.put(element.getUuid(), element);
            newOrdinals.put(element, newOrdinals.size());
            for (Map.Entry<String, Function<T, Collection<String>>> extractor : extractors.entrySet()) {
                Map<String, List<T>> buckets = newSecondary.get(extractor.getKey());
                for (String key : new LinkedHashSet<>(extractor.getValue().apply(element))) {
                    buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(element);
                }
            }
            newSpatial.insert(element.envelope(), element);
        }
        byUuid = newByUuid;
        secondary = newSecondary;
        spatial = newSpatial;
        ordinals = newOrdinals;
        rebuildCount++;
        log.debug("Rebuilt indexes of {} ({} elements)", name, items.size());
    }

    private boolean matches(T element, Map<String, String> conditions) {
        for (Map.Entry<String, String> condition : conditions.entrySet()) {
            if (!extractors.get(condition.getKey()).apply(element).contains(condition.getValue())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{size=" + items.size() + ", state=" + state + "}";
    }
}
