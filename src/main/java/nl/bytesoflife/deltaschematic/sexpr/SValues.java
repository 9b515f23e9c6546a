package nl.bytesoflife.deltaschematic.sexpr;

import nl.bytesoflife.deltaschematic.SchematicException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * The one place where S-expression values are converted to Java values and compared.
 * <p>
 * KiCad writes flags as bare symbols ({@code (in_bom yes)}) but older files and hand edits may quote
 * them ({@code (in_bom "yes")}). Both spellings are the same value here. A bare {@code (hide)} with no
 * argument is the legacy spelling of {@code (hide yes)}. Text that is not a boolean spelling is an
 * error rather than {@code false}.
 */
public final class SValues {

    private SValues() {
    }

    public static boolean asBoolean(SNode node) {
        String text = node instanceof SNode.SList ? null : node.text();
        if ("yes".equals(text) || "true".equals(text)) {
            return true;
        }
        if ("no".equals(text) || "false".equals(text)) {
            return false;
        }
        throw new SchematicException("Expected a boolean (yes/no) but found " + node);
    }

    /**
     * Reads a flag child of {@code parent}: {@code (tag yes)}, {@code (tag "no")} or the legacy
     * {@code (tag)}. A bare {@code tag} symbol among the children also counts as set.
     */
    public static Optional<Boolean> flag(SNode.SList parent, String tag) {
        Optional<SNode.SList> child = parent.find(tag);
        if (child.isPresent()) {
            SNode.SList list = child.get();
            if (list.size() == 1) {
                return Optional.of(true);
            }
            return Optional.of(asBoolean(list.get(1)));
        }
        if (parent.containsAtom(tag)) {
            return Optional.of(true);
        }
        return Optional.empty();
    }

    public static boolean flag(SNode.SList parent, String tag, boolean defaultValue) {
        return flag(parent, tag).orElse(defaultValue);
    }

    public static double asDouble(SNode node) {
        if (node instanceof SNode.SInteger integer) {
            return integer.value();
        }
        if (node instanceof SNode.SFloat number) {
            return number.value();
        }
        throw new SchematicException("Expected a number but found " + node);
    }

    public static int asInt(SNode node) {
        if (node instanceof SNode.SInteger integer) {
            return Math.toIntExact(integer.value());
        }
        throw new SchematicException("Expected an integer but found " + node);
    }

    public static double doubleAt(SNode.SList list, int index, double defaultValue) {
        if (index >= list.size()) {
            return defaultValue;
        }
        return asDouble(list.get(index));
    }

    public static boolean isNumber(SNode node) {
        return node instanceof SNode.SInteger || node instanceof SNode.SFloat;
    }

    /**
     * Semantic equality: numbers compare by value whatever their spelling, a symbol equals a string
     * with the same text, lists compare element by element.
     */
    public static boolean equivalent(SNode a, SNode b) {
        if (a == b) {
            return true;
        }
        if (a instanceof SNode.SList la) {
            if (!(b instanceof SNode.SList lb) || la.size() != lb.size()) {
                return false;
            }
            List<SNode> ca = la.children();
            List<SNode> cb = lb.children();
            for (int i = 0; i < ca.size(); i++) {
                if (!equivalent(ca.get(i), cb.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (b instanceof SNode.SList) {
            return false;
        }
        if (isNumber(a) && isNumber(b)) {
            return decimal(a).compareTo(decimal(b)) == 0;
        }
        // covers a quoted "1" against the number 1 as well
        return a.text().equals(b.text());
    }

    private static BigDecimal decimal(SNode node) {
        return new BigDecimal(node.text());
    }
}
