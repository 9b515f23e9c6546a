package nl.bytesoflife.deltaschematic.collection;

import nl.bytesoflife.deltaschematic.model.Component;
import nl.bytesoflife.deltaschematic.model.Point;

@FunctionalInterface
public interface ComponentFactory {

    Component create(String libId, String reference, String value, Point position);
}
