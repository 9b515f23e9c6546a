package nl.bytesoflife.deltaschematic.io;

import nl.bytesoflife.deltaschematic.format.FormatRules;
import nl.bytesoflife.deltaschematic.sexpr.SNode;
import nl.bytesoflife.deltaschematic.sexpr.SValues;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds a freshly derived node into the node it was originally read from.
 * <p>
 * Children are matched by tag, or by tag and first argument for keyed children such as
 * {@code property} and {@code pin}. A matched child that is equivalent keeps its original spelling,
 * otherwise the two are merged recursively. Original children the model does not manage stay where
 * they are. Managed children missing from the derived node are dropped, and derived children with no
 * original counterpart are inserted after the last sibling that precedes them in the canonical order.
 */
public final class NodeMerger {

    private NodeMerger() {
    }

    public static SNode merge(SNode raw, SNode derived) {
        if (raw == null) {
            return derived;
        }
        if (SValues.equivalent(raw, derived)) {
            return raw;
        }
        if (!(raw instanceof SNode.SList rawList) || !(derived instanceof SNode.SList derivedList)) {
            return derived;
        }
        String tag = derivedList.tag();
        if (tag == null || !tag.equals(rawList.tag())) {
            return derived;
        }
        return mergeLists(tag, rawList, derivedList);
    }

    private static SNode.SList mergeLists(String tag, SNode.SList raw, SNode.SList derived) {
        int rawHead = headSize(raw);
        int derivedHead = headSize(derived);

        List<SNode> out = new ArrayList<>();
        out.add(raw.get(0));
        for (int i = 1; i < derivedHead; i++) {
            SNode value = derived.get(i);
            out.add(i < rawHead && SValues.equivalent(raw.get(i), value) ? raw.get(i) : value);
        }

        Map<String, SNode> derivedByKey = keyChildren(derived, derivedHead);
        Set<String> managed = new HashSet<>(FormatRules.childOrder(tag));
        for (SNode child : derivedByKey.values()) {
            managed.add(childTag(child));
        }

        Set<String> matched = new HashSet<>();
        Map<String, SNode> rawByKey = keyChildren(raw, rawHead);
        for (Map.Entry<String, SNode> entry : rawByKey.entrySet()) {
            SNode rawChild = entry.getValue();
            SNode derivedChild = derivedByKey.get(entry.getKey());
            if (derivedChild != null) {
                out.add(merge(rawChild, derivedChild));
                matched.add(entry.getKey());
            } else if (!managed.contains(childTag(rawChild))) {
                out.add(rawChild);
            }
        }

        for (Map.Entry<String, SNode> entry : derivedByKey.entrySet()) {
            if (!matched.contains(entry.getKey())) {
                insertByRank(tag, out, derivedHead, entry.getValue());
            }
        }
        return new SNode.SList(out);
    }

    /**
     * Inserts {@code child} after the last sibling whose canonical rank is not greater than its own,
     * or right after the head when there is none.
     */
    static void insertByRank(String parentTag, List<SNode> siblings, int headSize, SNode child) {
        int rank = FormatRules.childRank(parentTag, childTag(child));
        int index = headSize;
        if (rank < 0) {
            index = siblings.size();
        } else {
            for (int i = headSize; i < siblings.size(); i++) {
                int siblingRank = FormatRules.childRank(parentTag, childTag(siblings.get(i)));
                if (siblingRank >= 0 && siblingRank <= rank) {
                    index = i + 1;
                }
            }
        }
        siblings.add(Math.min(index, siblings.size()), child);
    }

    static int headSize(SNode.SList list) {
        int size = 0;
        while (size < list.size() && !(list.get(size) instanceof SNode.SList)) {
            size++;
        }
        return size;
    }

    private static Map<String, SNode> keyChildren(SNode.SList list, int headSize) {
        Map<String, SNode> result = new LinkedHashMap<>();
        Map<String, Integer> occurrences = new HashMap<>();
        for (int i = headSize; i < list.size(); i++) {
            SNode child = list.get(i);
            String base = baseKey(child);
            int n = occurrences.merge(base, 1, Integer::sum) - 1;
            result.put(base + "#" + n, child);
        }
        return result;
    }

    private static String baseKey(SNode child) {
        if (child instanceof SNode.SList list) {
            String tag = list.tag();
            if (tag == null) {
                return "()";
            }
            if (FormatRules.isKeyedByFirstArgument(tag) && list.text(1) != null) {
                return tag + ":" + list.text(1);
            }
            return tag;
        }
        // trailing scalar such as the legacy bare "hide"
        return "=" + child.text();
    }

    private static String childTag(SNode child) {
        if (child instanceof SNode.SList list) {
            return list.tag() == null ? "" : list.tag();
        }
        return child.text();
    }
}
