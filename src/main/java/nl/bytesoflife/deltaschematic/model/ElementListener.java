package nl.bytesoflife.deltaschematic.model;

@FunctionalInterface
public interface ElementListener {

    void indexedFieldChanged(SchematicElement element);

    /**
     * The element now refers to a different library symbol. Throwing vetoes the change; the
     * element restores its previous value.
     */
    default void symbolKeyChanged(SchematicElement element) {
        indexedFieldChanged(element);
    }
}
