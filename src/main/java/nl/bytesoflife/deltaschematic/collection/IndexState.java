package nl.bytesoflife.deltaschematic.collection;

/**
 * Life cycle of a collection's derived indexes.
 * <pre>
 * CLEAN --mutation--> DIRTY --read--> CLEAN
 * any --batch opened--> BUFFERING --batch closed--> CLEAN (one rebuild if anything changed)
 * </pre>
 */
public enum IndexState {
    CLEAN,
    DIRTY,
    BUFFERING
}
