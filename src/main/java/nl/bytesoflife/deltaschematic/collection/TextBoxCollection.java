package nl.bytesoflife.deltaschematic.collection;

import nl.bytesoflife.deltaschematic.model.Point;
import nl.bytesoflife.deltaschematic.model.TextBox;

import java.util.List;

public class TextBoxCollection extends IndexedCollection<TextBox> {

    public static final String TEXT = "text";

    public TextBoxCollection() {
        super("textBoxes");
        singleKeyIndex(TEXT, TextBox::getText);
        singleKeyIndex(POSITION, box -> box.getPosition().key());
    }

    public TextBox add(String text, Point position, double width, double height) {
        return add(new TextBox(null, text, position, width, height));
    }

    public List<TextBox> findByText(String text) {
        return find(TEXT, text);
    }
}
