package nl.bytesoflife.deltaschematic.collection;

import nl.bytesoflife.deltaschematic.model.Point;
import nl.bytesoflife.deltaschematic.model.TextItem;

import java.util.List;

public class TextCollection extends IndexedCollection<TextItem> {

    public static final String TEXT = "text";

    public TextCollection() {
        super("texts");
        singleKeyIndex(TEXT, TextItem::getText);
        singleKeyIndex(POSITION, text -> text.getPosition().key());
    }

    public TextItem add(String text, Point position) {
        return add(new TextItem(null, text, position));
    }

    public List<TextItem> findByText(String text) {
        return find(TEXT, text);
    }
}
