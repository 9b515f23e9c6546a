package nl.bytesoflife.deltaschematic.collection;

import nl.bytesoflife.deltaschematic.model.SchematicElement;

/**
 * Observes structural changes of a collection. {@link #beforeAdd} may veto an insertion by throwing;
 * the collection is then left untouched.
 */
public interface CollectionListener<T extends SchematicElement> {

    default void beforeAdd(T element) {
    }

    default void added(T element) {
    }

    default void removed(T element) {
    }

    /**
     * A member now refers to a different library symbol. Throwing vetoes the change.
     */
    default void symbolKeyChanged(T element) {
    }
}
