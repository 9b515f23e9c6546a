package nl.bytesoflife.deltaschematic;

public class IdentityConflictException extends SchematicException {

    private final String collection;
    private final String uuid;

    public IdentityConflictException(String collection, String uuid) {
        super("Duplicate uuid " + uuid + " in " + collection);
        this.collection = collection;
        this.uuid = uuid;
    }

    public String getCollection() {
        return collection;
    }

    public String getUuid() {
        return uuid;
    }
}
