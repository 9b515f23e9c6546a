package nl.bytesoflife.deltaschematic.sync;

import java.util.List;

public record SyncResult(List<String> added, List<String> removed) {

    public static final SyncResult EMPTY = new SyncResult(List.of(), List.of());

    public SyncResult {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty();
    }
}
