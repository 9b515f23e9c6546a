package nl.bytesoflife.deltaschematic.geometry;

import nl.bytesoflife.deltaschematic.model.Component;
import nl.bytesoflife.deltaschematic.model.Mirror;
import nl.bytesoflife.deltaschematic.model.Point;
import nl.bytesoflife.deltaschematic.model.Rotation;
import nl.bytesoflife.deltaschematic.model.SymbolPin;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.util.AffineTransformation;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Maps library coordinates (Y up, relative to the symbol origin) to schematic coordinates (Y down)
 * for a placed symbol: flip Y, rotate counter-clockwise on screen, mirror, then move to the symbol
 * position.
 */
public final class PinGeometry {

    private static final double[] SINE = {0, 1, 0, -1};
    private static final double[] COSINE = {1, 0, -1, 0};

    private PinGeometry() {
    }

    public static Point pinPosition(Component component, SymbolPin pin) {
        return toSchematic(pin.position(), component.getPosition(), component.getRotation(), component.getMirror());
    }

    public static Point toSchematic(Point libraryPoint, Point origin, Rotation rotation, Mirror mirror) {
        Coordinate result = new Coordinate();
        placement(origin, rotation, mirror).transform(new Coordinate(libraryPoint.x(), libraryPoint.y()), result);
        return new Point(round(result.x), round(result.y));
    }

    static AffineTransformation placement(Point origin, Rotation rotation, Mirror mirror) {
        AffineTransformation transformation = AffineTransformation.scaleInstance(1, -1);
        // Screen counter-clockwise is clockwise in Y-down coordinates; quarter turns stay exact
        int quarterTurns = rotation.getDegrees() / 90;
        transformation.rotate(-SINE[quarterTurns], COSINE[quarterTurns]);
        if (mirror == Mirror.X) {
            transformation.scale(1, -1);
        } else if (mirror == Mirror.Y) {
            transformation.scale(-1, 1);
        }
        return transformation.translate(origin.x(), origin.y());
    }

    private static double round(double value) {
        double rounded = BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).doubleValue();
        return rounded == 0 ? 0 : rounded;
    }
}
