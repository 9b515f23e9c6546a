package nl.bytesoflife.deltaschematic.library;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory tier shared by every document that resolves symbols through it: flattened symbols by
 * library id, plus parsed library files by path.
 * <p>
 * The cache is reference counted. Its creator holds the first reference; each additional holder
 * calls {@link #retain()} and every holder eventually calls {@link #release()}. The last release
 * clears the cache, after which it can no longer be used.
 */
public class SymbolCache {

    private static final Logger log = LoggerFactory.getLogger(SymbolCache.class);

    private final ConcurrentMap<String, CompletableFuture<ResolvedSymbol>> symbols = new ConcurrentHashMap<>();
    private final ConcurrentMap<Path, SymbolLibrary> libraries = new ConcurrentHashMap<>();
    private final AtomicInteger references = new AtomicInteger(1);

    public SymbolCache retain() {
        references.updateAndGet(count -> {
            if (count <= 0) {
                throw new IllegalStateException("Symbol cache already released");
            }
            return count + 1;
        });
        return this;
    }

    public void release() {
        int remaining = references.updateAndGet(count -> {
            if (count <= 0) {
                throw new IllegalStateException("Symbol cache released too often");
            }
            return count - 1;
        });
        if (remaining == 0) {
            log.debug("Releasing symbol cache ({} symbols, {} libraries)", symbols.size(), libraries.size());
            symbols.clear();
            libraries.clear();
        }
    }

    public int getReferenceCount() {
        return references.get();
    }

    public boolean isReleased() {
        return references.get() <= 0;
    }

    public int size() {
        return symbols.size();
    }

    /**
     * Slot for {@code id}: the existing in-flight or completed computation, or {@code candidate} when
     * this call installed it. The caller owning the candidate must complete it.
     */
    CompletableFuture<ResolvedSymbol> slot(String id, CompletableFuture<ResolvedSymbol> candidate) {
        ensureOpen();
        CompletableFuture<ResolvedSymbol> existing = symbols.putIfAbsent(id, candidate);
        return existing != null ? existing : candidate;
    }

    void evict(String id, CompletableFuture<ResolvedSymbol> future) {
        symbols.remove(id, future);
    }

    SymbolLibrary library(String nickname, Path path) {
        ensureOpen();
        return libraries.compute(path, (key, cached) -> {
            try {
                long lastModified = Files.getLastModifiedTime(key).toMillis();
                if (cached != null && cached.getLastModified() == lastModified) {
                    return cached;
                }
                return SymbolLibrary.load(nickname, key);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read symbol library " + key, e);
            }
        });
    }

    public void invalidate() {
        symbols.clear();
    }

    private void ensureOpen() {
        if (isReleased()) {
            throw new IllegalStateException("Symbol cache already released");
        }
    }

    @Override
    public String toString() {
        return "SymbolCache{symbols=" + symbols.size() + ", libraries=" + libraries.size()
                + ", references=" + references.get() + "}";
    }
}
