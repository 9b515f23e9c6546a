package nl.bytesoflife.deltaschematic.collection;

import nl.bytesoflife.deltaschematic.model.Image;
import nl.bytesoflife.deltaschematic.model.Point;

public class ImageCollection extends IndexedCollection<Image> {

    public ImageCollection() {
        super("images");
        singleKeyIndex(POSITION, image -> image.getPosition().key());
    }

    public Image add(Point position, double scale, String data) {
        Image image = new Image(null, position, data);
        image.setScale(scale);
        return add(image);
    }
}
