package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.sexpr.SNode;
import org.locationtech.jts.geom.Envelope;

import java.util.Objects;
import java.util.UUID;

/**
 * Typed schematic item with a uuid and, when it was read from a file, the node it came from.
 * An element that was never changed is written back as that node.
 */
public abstract sealed class SchematicElement implements DocumentEntry
        permits Component, Wire, Label, Junction, NoConnect, Sheet, TextItem, TextBox, Rectangle, Image {

    private final String uuid;
    private final SNode.SList raw;
    private boolean modified;
    private ElementListener listener;

    protected SchematicElement(String uuid, SNode.SList raw) {
        this.uuid = uuid == null ? UUID.randomUUID().toString() : uuid;
        this.raw = raw;
        this.modified = raw == null;
    }

    public String getUuid() {
        return uuid;
    }

    public SNode.SList getRaw() {
        return raw;
    }

    public boolean isModified() {
        return modified;
    }

    public void clearModified() {
        this.modified = raw == null;
    }

    public abstract Envelope envelope();

    public ElementListener getListener() {
        return listener;
    }

    public void setListener(ElementListener listener) {
        this.listener = listener;
    }

    protected void changed() {
        modified = true;
    }

    protected void indexedFieldChanged() {
        modified = true;
        if (listener != null) {
            listener.indexedFieldChanged(this);
        }
    }

    /**
     * Reports a changed symbol key, undoing it through {@code rollback} when the listener refuses.
     */
    protected void symbolKeyChanged(Runnable rollback) {
        if (listener != null) {
            try {
                listener.symbolKeyChanged(this);
            } catch (RuntimeException e) {
                rollback.run();
                throw e;
            }
        }
        modified = true;
    }

    protected static Envelope pointEnvelope(Point point) {
        return new Envelope(point.x(), point.x(), point.y(), point.y());
    }

    protected static <T> T requireNonNull(T value, String name) {
        return Objects.requireNonNull(value, name);
    }
}
