package nl.bytesoflife.deltaschematic.collection;

import nl.bytesoflife.deltaschematic.model.Point;
import nl.bytesoflife.deltaschematic.model.Rectangle;

public class RectangleCollection extends IndexedCollection<Rectangle> {

    public RectangleCollection() {
        super("rectangles");
        singleKeyIndex(POSITION, rectangle -> rectangle.getStart().key());
    }

    public Rectangle add(Point start, Point end) {
        return add(new Rectangle(null, start, end));
    }
}
