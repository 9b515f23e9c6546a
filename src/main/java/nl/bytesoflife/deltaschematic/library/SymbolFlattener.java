package nl.bytesoflife.deltaschematic.library;

import nl.bytesoflife.deltaschematic.format.FormatRules;
import nl.bytesoflife.deltaschematic.model.SymbolDefinition;
import nl.bytesoflife.deltaschematic.sexpr.SNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges a derived library symbol onto its already flattened parent.
 * <ul>
 *   <li>the result takes the child's qualified name; inherited units are renamed with it</li>
 *   <li>flags and other children the child declares replace the parent's</li>
 *   <li>child properties override same-name parent properties in place, others are appended</li>
 *   <li>units (graphics and pins) come from the child only when it declares any</li>
 * </ul>
 */
public final class SymbolFlattener {

    private SymbolFlattener() {
    }

    /**
     * A definition without {@code extends}, renamed to its qualified id.
     */
    public static SymbolDefinition qualify(SymbolDefinition definition, LibraryId id) {
        return definition.renamed(id.toString());
    }

    public static SymbolDefinition flatten(SymbolDefinition child, SymbolDefinition flattenedParent, LibraryId childId) {
        List<SNode> result = new ArrayList<>(flattenedParent.renamed(childId.toString()).getNode().children());
        List<SNode.SList> childUnits = new ArrayList<>();

        for (SNode.SList part : child.getNode().lists()) {
            String tag = part.tag();
            if (tag == null || tag.equals("extends")) {
                continue;
            }
            if (tag.equals("symbol")) {
                childUnits.add(part);
            } else if (tag.equals("property")) {
                mergeProperty(result, part);
            } else {
                replaceOrInsert(result, part);
            }
        }

        if (!childUnits.isEmpty()) {
            result.removeIf(node -> node instanceof SNode.SList list && list.hasTag("symbol"));
            for (SNode.SList unit : childUnits) {
                insertByRank(result, unit);
            }
        }
        return new SymbolDefinition(new SNode.SList(result));
    }

    private static void mergeProperty(List<SNode> result, SNode.SList property) {
        String name = property.text(1);
        int lastProperty = -1;
        for (int i = 2; i < result.size(); i++) {
            if (result.get(i) instanceof SNode.SList list && list.hasTag("property")) {
                if (name != null && name.equals(list.text(1))) {
                    result.set(i, property);
                    return;
                }
                lastProperty = i;
            }
        }
        if (lastProperty >= 0) {
            result.add(lastProperty + 1, property);
        } else {
            insertByRank(result, property);
        }
    }

    private static void replaceOrInsert(List<SNode> result, SNode.SList node) {
        for (int i = 2; i < result.size(); i++) {
            if (result.get(i) instanceof SNode.SList list && list.hasTag(node.tag())) {
                result.set(i, node);
                return;
            }
        }
        insertByRank(result, node);
    }

    private static void insertByRank(List<SNode> result, SNode.SList node) {
        int rank = FormatRules.definitionRank(node.tag());
        if (rank < 0) {
            result.add(node);
            return;
        }
        int position = 2;
        for (int i = 2; i < result.size(); i++) {
            if (result.get(i) instanceof SNode.SList list) {
                int existing = FormatRules.definitionRank(list.tag());
                if (existing >= 0 && existing <= rank) {
                    position = i + 1;
                }
            }
        }
        result.add(position, node);
    }
}
