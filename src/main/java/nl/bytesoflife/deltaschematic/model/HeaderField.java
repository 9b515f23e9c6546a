package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.sexpr.SNode;

import java.util.Objects;

/**
 * Single-valued document header list: {@code version}, {@code generator},
 * {@code generator_version}, {@code uuid} or {@code paper}.
 */
public final class HeaderField implements DocumentEntry {

    private final String tag;
    private String value;
    private final SNode.SList raw;
    private boolean modified;

    public HeaderField(String tag, String value) {
        this(tag, value, null);
    }

    public HeaderField(String tag, String value, SNode.SList raw) {
        this.tag = Objects.requireNonNull(tag, "tag");
        this.value = Objects.requireNonNull(value, "value");
        this.raw = raw;
        this.modified = raw == null;
    }

    @Override
    public String tag() {
        return tag;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        Objects.requireNonNull(value, "value");
        if (!value.equals(this.value)) {
            this.value = value;
            this.modified = true;
        }
    }

    public SNode.SList getRaw() {
        return raw;
    }

    public boolean isModified() {
        return modified;
    }

    @Override
    public String toString() {
        return "HeaderField{" + tag + "=" + value + "}";
    }
}
