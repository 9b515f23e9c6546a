package nl.bytesoflife.deltaschematic.collection;

import nl.bytesoflife.deltaschematic.model.Junction;
import nl.bytesoflife.deltaschematic.model.Point;

import java.util.List;

public class JunctionCollection extends IndexedCollection<Junction> {

    public JunctionCollection() {
        super("junctions");
        singleKeyIndex(POSITION, junction -> junction.getPosition().key());
    }

    public Junction add(Point position) {
        return add(new Junction(null, position));
    }

    public List<Junction> findAt(Point position) {
        return find(POSITION, position.key());
    }
}
