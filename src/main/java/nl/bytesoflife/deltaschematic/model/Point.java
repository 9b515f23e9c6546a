package nl.bytesoflife.deltaschematic.model;

import nl.bytesoflife.deltaschematic.format.NumberStyle;

/**
 * Schematic coordinate in millimetres, Y pointing down.
 */
public record Point(double x, double y) {

    public Point translate(double dx, double dy) {
        return new Point(x + dx, y + dy);
    }

    public String key() {
        return NumberStyle.COORDINATE.format(x) + "," + NumberStyle.COORDINATE.format(y);
    }

    @Override
    public String toString() {
        return "(" + NumberStyle.COORDINATE.format(x) + ", " + NumberStyle.COORDINATE.format(y) + ")";
    }
}
