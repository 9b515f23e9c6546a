package nl.bytesoflife.deltaschematic.io;

import nl.bytesoflife.deltaschematic.model.SchematicElement;
import nl.bytesoflife.deltaschematic.sexpr.SNode;

/**
 * Converts one kind of schematic element between its node and its typed form.
 */
public interface ElementCodec<T extends SchematicElement> {

    T read(SNode.SList node);

    SNode.SList derive(T element);

    /**
     * Node to write: the raw node when nothing changed, the derived node merged into the raw node
     * otherwise.
     */
    default SNode.SList write(T element) {
        if (element.getRaw() != null && !element.isModified()) {
            return element.getRaw();
        }
        return (SNode.SList) NodeMerger.merge(element.getRaw(), derive(element));
    }
}
