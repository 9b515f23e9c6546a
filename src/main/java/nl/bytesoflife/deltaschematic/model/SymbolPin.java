package nl.bytesoflife.deltaschematic.model;

/**
 * Pin of a library symbol, in library coordinates (Y up). Unit 0 pins belong to every unit.
 */
public record SymbolPin(
        String number,
        String name,
        String electricalType,
        String graphicStyle,
        Point position,
        double angle,
        double length,
        int unit,
        int bodyStyle,
        boolean hidden
) {
}
