package nl.bytesoflife.deltaschematic.model;

public record Color(int red, int green, int blue, double alpha) {

    public static final Color DEFAULT = new Color(0, 0, 0, 0);

    public boolean isDefault() {
        return red == 0 && green == 0 && blue == 0 && alpha == 0;
    }
}
