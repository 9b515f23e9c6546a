package nl.bytesoflife.deltaschematic.model;

public enum Rotation {
    R0(0),
    R90(90),
    R180(180),
    R270(270);

    private final int degrees;

    Rotation(int degrees) {
        this.degrees = degrees;
    }

    public int getDegrees() {
        return degrees;
    }

    public static Rotation fromDegrees(double degrees) {
        long normalized = Math.round(degrees) % 360;
        if (normalized < 0) {
            normalized += 360;
        }
        if (Math.abs(degrees - Math.round(degrees)) > 1e-9) {
            throw new IllegalArgumentException("Rotation must be a multiple of 90 degrees: " + degrees);
        }
        return switch ((int) normalized) {
            case 0 -> R0;
            case 90 -> R90;
            case 180 -> R180;
            case 270 -> R270;
            default -> throw new IllegalArgumentException("Rotation must be a multiple of 90 degrees: " + degrees);
        };
    }
}
