package nl.bytesoflife.deltaschematic.model;

public record Stroke(double width, String type, Color color) {

    public static final Stroke DEFAULT = new Stroke(0, "default", null);

    public Stroke withWidth(double newWidth) {
        return new Stroke(newWidth, type, color);
    }

    public Stroke withType(String newType) {
        return new Stroke(width, newType, color);
    }
}
