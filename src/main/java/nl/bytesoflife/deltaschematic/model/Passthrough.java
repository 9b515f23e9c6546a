package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.sexpr.SNode;

import java.util.Objects;

/**
 * Top-level node the typed model does not interpret, kept verbatim.
 */
public final class Passthrough implements DocumentEntry {

    private final SNode.SList node;

    public Passthrough(SNode.SList node) {
        this.node = Objects.requireNonNull(node, "node");
    }

    public SNode.SList getNode() {
        return node;
    }

    @Override
    public String tag() {
        String tag = node.tag();
        return tag == null ? "" : tag;
    }

    @Override
    public String toString() {
        return "Passthrough{" + tag() + "}";
    }
}
