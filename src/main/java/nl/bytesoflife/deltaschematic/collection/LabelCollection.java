package nl.bytesoflife.deltaschematic.collection;

import nl.bytesoflife.deltaschematic.io.LabelCodec;
import nl.bytesoflife.deltaschematic.model.Label;
import nl.bytesoflife.deltaschematic.model.Point;

import java.util.List;

/**
 * Local, global and hierarchical labels, indexed by text, kind and position.
 */
public class LabelCollection extends IndexedCollection<Label> {

    public static final String TEXT = "text";
    public static final String KIND = "kind";

    public LabelCollection() {
        super("labels");
        singleKeyIndex(TEXT, Label::getText);
        singleKeyIndex(KIND, label -> label.getKind().getKicadName());
        singleKeyIndex(POSITION, label -> label.getPosition().key());
    }

    public Label add(String text, Point position) {
        return add(text, position, Label.Kind.LOCAL);
    }

    public Label add(String text, Point position, Label.Kind kind) {
        Label label = new Label(null, kind, text, position);
        if (kind != Label.Kind.LOCAL) {
            label.setShape("input");
        }
        if (kind == Label.Kind.GLOBAL) {
            label.getProperties().add(LabelCodec.intersheetReferences(label));
        }
        return add(label);
    }

    public List<Label> findByText(String text) {
        return find(TEXT, text);
    }

    public List<Label> findByKind(Label.Kind kind) {
        return find(KIND, kind.getKicadName());
    }

    /**
     * Renames every label carrying {@code oldText}.
     *
     * @return number of labels renamed
     */
    public int rename(String oldText, String newText) {
        List<Label> labels = findByText(oldText);
        for (Label label : labels) {
            label.setText(newText);
        }
        return labels.size();
    }
}
