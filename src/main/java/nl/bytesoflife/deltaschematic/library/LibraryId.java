package nl.bytesoflife.deltaschematic.library;

import nl.bytesoflife.deltaschematic.ResolutionException;

/**
 * Library-qualified symbol identifier, {@code Device:R}.
 */
public record LibraryId(String library, String name) {

    public static LibraryId parse(String id) {
        if (id == null) {
            throw new ResolutionException("null", ResolutionException.Reason.INVALID_ID, "no identifier");
        }
        int colon = id.indexOf(':');
        if (colon <= 0 || colon == id.length() - 1) {
            throw new ResolutionException(id, ResolutionException.Reason.INVALID_ID,
                    "expected <library>:<symbol>");
        }
        return new LibraryId(id.substring(0, colon), id.substring(colon + 1));
    }

    public LibraryId sibling(String symbolName) {
        return new LibraryId(library, symbolName);
    }

    @Override
    public String toString() {
        return library + ":" + name;
    }
}
