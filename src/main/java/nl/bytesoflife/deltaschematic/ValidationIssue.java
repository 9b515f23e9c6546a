package nl.bytesoflife.deltaschematic;

/**
 * Consistency problem found by {@link Schematic#validate()}.
 */
public class ValidationIssue {

    public enum Code {
        DUPLICATE_REFERENCE,
        MISSING_SYMBOL,
        STALE_SYMBOL,
        DUPLICATE_UUID,
        DEGENERATE_WIRE,
        EMPTY_LABEL
    }

    private final Severity severity;
    private final Code code;
    private final String elementUuid;
    private final String message;

    public ValidationIssue(Severity severity, Code code, String elementUuid, String message) {
        this.severity = severity;
        this.code = code;
        this.elementUuid = elementUuid;
        this.message = message;
    }

    public Severity getSeverity() { return severity; }
    public Code getCode() { return code; }
    public String getElementUuid() { return elementUuid; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(severity).append("] ").append(code).append(": ").append(message);
        if (elementUuid != null) {
            sb.append(" (").append(elementUuid).append(")");
        }
        return sb.toString();
    }
}
