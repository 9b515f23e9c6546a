package nl.bytesoflife.deltaschematic;

public class UnsupportedVersionException extends SchematicException {

    private final String source;
    private final int version;
    private final int minSupported;
    private final int maxSupported;

    public UnsupportedVersionException(String source, int version, int minSupported, int maxSupported) {
        super(String.format("%s: file format version %d is outside the supported range %d..%d",
                source, version, minSupported, maxSupported));
        this.source = source;
        this.version = version;
        this.minSupported = minSupported;
        this.maxSupported = maxSupported;
    }

    public String getSource() {
        return source;
    }

    public int getVersion() {
        return version;
    }

    public int getMinSupported() {
        return minSupported;
    }

    public int getMaxSupported() {
        return maxSupported;
    }
}
