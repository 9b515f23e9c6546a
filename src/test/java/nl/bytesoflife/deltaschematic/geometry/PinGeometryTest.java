package nl.bytesoflife.deltaschematic.geometry;

import nl.bytesoflife.deltaschematic.model.Component;
import nl.bytesoflife.deltaschematic.model.Mirror;
import nl.bytesoflife.deltaschematic.model.Point;
import nl.bytesoflife.deltaschematic.model.Rotation;
import nl.bytesoflife.deltaschematic.model.SymbolPin;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PinGeometryTest {

    private static final Point ORIGIN = new Point(50, 50);
    private static final Point UP = new Point(0, 3.81);

    private static SymbolPin pin(String number, double x, double y) {
        return new SymbolPin(number, "~", "passive", "line", new Point(x, y), 0, 1.27, 1, 1, false);
    }

    @Test
    void resistorPinsLandOnTheirWires() {
        Component r1 = new Component(null, "Device:R", new Point(100, 49.53));
        assertEquals(new Point(100, 45.72), PinGeometry.pinPosition(r1, pin("1", 0, 3.81)));
        assertEquals(new Point(100, 53.34), PinGeometry.pinPosition(r1, pin("2", 0, -3.81)));
    }

    @Test
    void rotationIsCounterClockwiseOnScreen() {
        assertEquals(new Point(50, 46.19), PinGeometry.toSchematic(UP, ORIGIN, Rotation.R0, Mirror.NONE));
        assertEquals(new Point(46.19, 50), PinGeometry.toSchematic(UP, ORIGIN, Rotation.R90, Mirror.NONE));
        assertEquals(new Point(50, 53.81), PinGeometry.toSchematic(UP, ORIGIN, Rotation.R180, Mirror.NONE));
        assertEquals(new Point(53.81, 50), PinGeometry.toSchematic(UP, ORIGIN, Rotation.R270, Mirror.NONE));
    }

    @Test
    void mirrorsApplyAfterRotation() {
        Point offset = new Point(2.54, 1.27);
        assertEquals(new Point(52.54, 48.73), PinGeometry.toSchematic(offset, ORIGIN, Rotation.R0, Mirror.NONE));
        assertEquals(new Point(52.54, 51.27), PinGeometry.toSchematic(offset, ORIGIN, Rotation.R0, Mirror.X));
        assertEquals(new Point(47.46, 48.73), PinGeometry.toSchematic(offset, ORIGIN, Rotation.R0, Mirror.Y));
        // rotated to (-1.27, -2.54) first, then flipped vertically
        assertEquals(new Point(48.73, 52.54), PinGeometry.toSchematic(offset, ORIGIN, Rotation.R90, Mirror.X));
    }

    @Test
    void resultIsRoundedToTheGrid() {
        Point third = PinGeometry.toSchematic(new Point(1.0 / 3, 0), new Point(0, 0), Rotation.R0, Mirror.NONE);
        assertEquals(0.3333, third.x());
        Point origin = PinGeometry.toSchematic(new Point(0, 0), new Point(0, 0), Rotation.R180, Mirror.NONE);
        assertEquals("(0, 0)", origin.toString());
        assertEquals(0, Double.compare(origin.x(), 0.0));
    }

    @Test
    void rotationFromDegrees() {
        assertEquals(Rotation.R90, Rotation.fromDegrees(90.0));
        assertEquals(Rotation.R90, Rotation.fromDegrees(450));
        assertEquals(Rotation.R270, Rotation.fromDegrees(-90));
        assertThrows(IllegalArgumentException.class, () -> Rotation.fromDegrees(45));
        assertThrows(IllegalArgumentException.class, () -> Rotation.fromDegrees(90.5));
    }
}
