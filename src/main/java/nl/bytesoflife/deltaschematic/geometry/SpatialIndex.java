package nl.bytesoflife.deltaschematic.geometry;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.List;

/**
 * Packed R-tree over element envelopes. Built once on first query; a changed element set needs a
 * new index.
 */
public class SpatialIndex<T> {

    private final STRtree tree = new STRtree();
    private boolean built = false;

    public void insert(Envelope envelope, T item) {
        if (built) {
            throw new IllegalStateException("Index already built");
        }
        tree.insert(envelope, item);
    }

    @SuppressWarnings("unchecked")
    public List<T> query(Envelope searchEnvelope) {
        ensureBuilt();
        return (List<T>) tree.query(searchEnvelope);
    }

    private void ensureBuilt() {
        if (!built) {
            tree.build();
            built = true;
        }
    }
}
