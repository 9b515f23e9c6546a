package nl.bytesoflife.deltaschematic.collection;

/**
 * Open batch of mutations. Index rebuilds and symbol cache synchronization wait until the outermost
 * scope closes. Must be closed on the thread that opened it.
 * <pre>
 * try (BatchScope batch = schematic.batch()) {
 *     ...
 * }
 * </pre>
 */
public final class BatchScope implements AutoCloseable {

    private final Thread owner = Thread.currentThread();
    private final Runnable onClose;
    private boolean closed;

    public BatchScope(Runnable onClose) {
        this.onClose = onClose;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        if (Thread.currentThread() != owner) {
            throw new IllegalStateException("Batch opened on " + owner.getName() + " closed on "
                    + Thread.currentThread().getName());
        }
        closed = true;
        onClose.run();
    }
}
