package nl.bytesoflife.deltaschematic.model;

public enum Mirror {
    NONE(null),
    X("x"),
    Y("y");

    private final String kicadName;

    Mirror(String kicadName) {
        this.kicadName = kicadName;
    }

    public String getKicadName() {
        return kicadName;
    }

    public static Mirror fromKicadName(String name) {
        if (name == null) {
            return NONE;
        }
        return switch (name) {
            case "x" -> X;
            case "y" -> Y;
            default -> throw new IllegalArgumentException("Unknown mirror axis: " + name);
        };
    }
}
