package nl.bytesoflife.deltaschematic;

/**
 * Base of every failure raised by the schematic engine.
 */
public class SchematicException extends RuntimeException {

    public SchematicException(String message) {
        super(message);
    }

    public SchematicException(String message, Throwable cause) {
        super(message, cause);
    }
}
