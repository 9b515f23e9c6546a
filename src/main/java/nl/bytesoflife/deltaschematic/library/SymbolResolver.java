package nl.bytesoflife.deltaschematic.library;

import nl.bytesoflife.deltaschematic.ResolutionException;
import nl.bytesoflife.deltaschematic.model.SymbolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Turns library ids into flattened symbol definitions through three tiers: the shared in-memory
 * {@link SymbolCache}, the optional {@link DiskSymbolCache}, and the library files found by the
 * {@link LibraryLocator}.
 * <p>
 * Thread-safe. Concurrent calls for one id share a single computation; a failed computation is not
 * remembered, so the next call tries again.
 */
public class SymbolResolver implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SymbolResolver.class);

    private final ResolverConfig config;
    private final SymbolCache cache;
    private final LibraryLocator locator;
    private final DiskSymbolCache disk;
    private volatile boolean closed;

    public SymbolResolver(ResolverConfig config) {
        this(config, new SymbolCache(), false);
    }

    public SymbolResolver(ResolverConfig config, SymbolCache sharedCache) {
        this(config, sharedCache, true);
    }

    private SymbolResolver(ResolverConfig config, SymbolCache cache, boolean retain) {
        this.config = config;
        this.cache = retain ? cache.retain() : cache;
        this.locator = new LibraryLocator(config);
        this.disk = config.getDiskCacheDirectory() != null ? new DiskSymbolCache(config.getDiskCacheDirectory()) : null;
    }

    public ResolverConfig getConfig() {
        return config;
    }

    public SymbolCache getCache() {
        return cache;
    }

    public ResolvedSymbol resolve(String libraryId) {
        return resolve(LibraryId.parse(libraryId));
    }

    /**
     * @throws ResolutionException when the symbol or its library is missing, or its
     *                             {@code extends} chain loops
     * @throws java.io.UncheckedIOException when a library or disk cache file cannot be read
     */
    public ResolvedSymbol resolve(LibraryId id) {
        String key = id.toString();
        while (true) {
            CompletableFuture<ResolvedSymbol> candidate = new CompletableFuture<>();
            CompletableFuture<ResolvedSymbol> slot = cache.slot(key, candidate);
            if (slot == candidate) {
                try {
                    ResolvedSymbol resolved = compute(id);
                    candidate.complete(resolved);
                    return resolved;
                } catch (RuntimeException | Error e) {
                    cache.evict(key, candidate);
                    candidate.completeExceptionally(e);
                    throw e;
                }
            }
            ResolvedSymbol existing = await(slot);
            if (!existing.isStale()) {
                log.debug("Memory cache hit for {}", key);
                return existing;
            }
            log.debug("Library of {} changed, rebuilding", key);
            cache.evict(key, slot);
        }
    }

    private ResolvedSymbol compute(LibraryId id) {
        if (disk != null) {
            Optional<ResolvedSymbol> stored = disk.load(id);
            if (stored.isPresent()) {
                return stored.get();
            }
        }

        SymbolLibrary library = library(id);
        SymbolDefinition definition = checkChain(id, library);

        ResolvedSymbol resolved;
        Optional<String> parentName = definition.getExtendsName();
        if (parentName.isPresent()) {
            ResolvedSymbol parent = resolve(id.sibling(parentName.get()));
            Map<Path, Long> sources = new LinkedHashMap<>(parent.getSources());
            sources.put(library.getPath(), library.getLastModified());
            resolved = new ResolvedSymbol(id,
                    SymbolFlattener.flatten(definition, parent.getDefinition(), id), sources);
        } else {
            resolved = new ResolvedSymbol(id, SymbolFlattener.qualify(definition, id),
                    Map.of(library.getPath(), library.getLastModified()));
        }
        log.debug("Resolved {} from {}", id, library.getPath());

        if (disk != null) {
            disk.store(resolved);
        }
        return resolved;
    }

    private SymbolLibrary library(LibraryId id) {
        Path path = locator.locate(id.library()).orElseThrow(() -> new ResolutionException(id.toString(),
                ResolutionException.Reason.NOT_FOUND, "library '" + id.library() + "' not found"));
        return cache.library(id.library(), path);
    }

    /**
     * Walks the {@code extends} chain of {@code id} inside its library before anything is merged.
     *
     * @return the unflattened definition of {@code id}
     */
    private static SymbolDefinition checkChain(LibraryId id, SymbolLibrary library) {
        Set<String> visited = new LinkedHashSet<>();
        String name = id.name();
        SymbolDefinition first = null;
        while (true) {
            String qualified = id.library() + ":" + name;
            if (!visited.add(qualified)) {
                List<String> chain = new ArrayList<>(visited);
                chain.add(qualified);
                throw new ResolutionException(id.toString(), ResolutionException.Reason.CYCLE, chain,
                        "extends chain loops");
            }
            Optional<SymbolDefinition> definition = library.get(name);
            if (definition.isEmpty()) {
                throw new ResolutionException(id.toString(), ResolutionException.Reason.NOT_FOUND,
                        new ArrayList<>(visited), "no symbol '" + name + "' in " + library.getPath());
            }
            if (first == null) {
                first = definition.get();
            }
            Optional<String> parent = definition.get().getExtendsName();
            if (parent.isEmpty()) {
                return first;
            }
            name = parent.get();
        }
    }

    private static ResolvedSymbol await(CompletableFuture<ResolvedSymbol> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for symbol resolution", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new CompletionException(cause);
        }
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            cache.release();
        }
    }

    @Override
    public String toString() {
        return "SymbolResolver{" + config + ", " + cache + "}";
    }
}
