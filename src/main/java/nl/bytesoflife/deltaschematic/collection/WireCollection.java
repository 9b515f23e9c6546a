package nl.bytesoflife.deltaschematic.collection;

import nl.bytesoflife.deltaschematic.model.Point;
import nl.bytesoflife.deltaschematic.model.Wire;

import java.util.List;

/**
 * Wires and buses, indexed by the position of either end and by kind.
 */
public class WireCollection extends IndexedCollection<Wire> {

    public static final String ENDPOINT = "endpoint";
    public static final String KIND = "kind";

    public WireCollection() {
        super("wires");
        index(ENDPOINT, wire -> List.of(wire.getStart().key(), wire.getEnd().key()));
        singleKeyIndex(KIND, wire -> wire.getKind().getKicadName());
    }

    public Wire add(Point start, Point end) {
        return add(new Wire(null, Wire.Kind.WIRE, List.of(start, end)));
    }

    public Wire addBus(Point start, Point end) {
        return add(new Wire(null, Wire.Kind.BUS, List.of(start, end)));
    }

    public List<Wire> findByEndpoint(Point point) {
        return find(ENDPOINT, point.key());
    }

    public List<Wire> findByKind(Wire.Kind kind) {
        return find(KIND, kind.getKicadName());
    }
}
