package nl.bytesoflife.deltaschematic.sexpr;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Immutable S-expression value. Numbers keep the exact decimal text they were read with so that
 * untouched values are written back byte for byte.
 */
public sealed interface SNode permits SNode.SAtom, SNode.SString, SNode.SInteger, SNode.SFloat, SNode.SList {

    Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    Pattern FLOAT = Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][+-]?\\d+)?");

    String text();

    static SAtom atom(String value) {
        return new SAtom(value);
    }

    static SString string(String value) {
        return new SString(value);
    }

    /**
     * Builds an integer or float node from already formatted number text.
     */
    static SNode number(String text) {
        if (INTEGER.matcher(text).matches()) {
            return new SInteger(Long.parseLong(text), text);
        }
        return new SFloat(Double.parseDouble(text), text);
    }

    static SList list(String tag, SNode... children) {
        List<SNode> all = new ArrayList<>(children.length + 1);
        all.add(new SAtom(tag));
        all.addAll(List.of(children));
        return new SList(all);
    }

    record SAtom(String value) implements SNode {
        @Override
        public String text() {
            return value;
        }

        @Override
        public String toString() {
            return value;
        }
    }

    record SString(String value) implements SNode {
        @Override
        public String text() {
            return value;
        }

        @Override
        public String toString() {
            return SExpressionWriter.quote(value);
        }
    }

    record SInteger(long value, String text) implements SNode {
        @Override
        public String toString() {
            return text;
        }
    }

    record SFloat(double value, String text) implements SNode {
        public BigDecimal decimal() {
            return new BigDecimal(text);
        }

        @Override
        public String toString() {
            return text;
        }
    }

    record SList(List<SNode> children) implements SNode {

        public SList {
            children = List.copyOf(children);
        }

        @Override
        public String text() {
            return null;
        }

        public String tag() {
            if (!children.isEmpty() && children.get(0) instanceof SAtom atom) {
                return atom.value();
            }
            return null;
        }

        public boolean hasTag(String tag) {
            return tag.equals(tag());
        }

        public int size() {
            return children.size();
        }

        public SNode get(int index) {
            return children.get(index);
        }

        public String text(int index) {
            if (index >= children.size()) {
                return null;
            }
            return children.get(index).text();
        }

        public Optional<SList> find(String tag) {
            for (SNode child : children) {
                if (child instanceof SList list && list.hasTag(tag)) {
                    return Optional.of(list);
                }
            }
            return Optional.empty();
        }

        public List<SList> findAll(String tag) {
            List<SList> result = new ArrayList<>();
            for (SNode child : children) {
                if (child instanceof SList list && list.hasTag(tag)) {
                    result.add(list);
                }
            }
            return result;
        }

        /**
         * Nested lookup along a tag path, e.g. {@code find("effects", "font", "size")}.
         */
        public Optional<SList> find(String... path) {
            Optional<SList> current = Optional.of(this);
            for (String tag : path) {
                current = current.flatMap(list -> list.find(tag));
            }
            return current;
        }

        public List<SList> lists() {
            List<SList> result = new ArrayList<>();
            for (SNode child : children) {
                if (child instanceof SList list) {
                    result.add(list);
                }
            }
            return result;
        }

        public boolean containsAtom(String value) {
            for (int i = 1; i < children.size(); i++) {
                if (children.get(i) instanceof SAtom atom && atom.value().equals(value)) {
                    return true;
                }
            }
            return false;
        }

        public SList with(int index, SNode replacement) {
            List<SNode> copy = new ArrayList<>(children);
            copy.set(index, replacement);
            return new SList(copy);
        }

        @Override
        public String toString() {
            return SExpressionWriter.compact(this);
        }
    }
}
