package nl.bytesoflife.deltaschematic;

import java.util.List;

/**
 * A library identifier could not be turned into a flattened symbol definition.
 */
public class ResolutionException extends SchematicException {

    public enum Reason {
        NOT_FOUND,
        CYCLE,
        INVALID_ID
    }

    private final String libraryId;
    private final Reason reason;
    private final List<String> chain;

    public ResolutionException(String libraryId, Reason reason, List<String> chain, String detail) {
        super(buildMessage(libraryId, reason, chain, detail));
        this.libraryId = libraryId;
        this.reason = reason;
        this.chain = List.copyOf(chain);
    }

    public ResolutionException(String libraryId, Reason reason, String detail) {
        this(libraryId, reason, List.of(libraryId), detail);
    }

    private static String buildMessage(String libraryId, Reason reason, List<String> chain, String detail) {
        StringBuilder sb = new StringBuilder();
        sb.append("Cannot resolve symbol '").append(libraryId).append("' (").append(reason).append(")");
        if (chain.size() > 1) {
            sb.append(" via ").append(String.join(" -> ", chain));
        }
        if (detail != null && !detail.isEmpty()) {
            sb.append(": ").append(detail);
        }
        return sb.toString();
    }

    public String getLibraryId() {
        return libraryId;
    }

    public Reason getReason() {
        return reason;
    }

    public List<String> getChain() {
        return chain;
    }
}
