package nl.bytesoflife.deltaschematic.collection;

import nl.bytesoflife.deltaschematic.model.NoConnect;
import nl.bytesoflife.deltaschematic.model.Point;

import java.util.List;

public class NoConnectCollection extends IndexedCollection<NoConnect> {

    public NoConnectCollection() {
        super("no_connects");
        singleKeyIndex(POSITION, noConnect -> noConnect.getPosition().key());
    }

    public NoConnect add(Point position) {
        return add(new NoConnect(null, position));
    }

    public List<NoConnect> findAt(Point position) {
        return find(POSITION, position.key());
    }
}
