package nl.bytesoflife.deltaschematic.sync;

import nl.bytesoflife.deltaschematic.ResolutionException;
import nl.bytesoflife.deltaschematic.library.ResolverConfig;
import nl.bytesoflife.deltaschematic.library.SymbolResolver;
import nl.bytesoflife.deltaschematic.model.Component;
import nl.bytesoflife.deltaschematic.model.LibrarySymbols;
import nl.bytesoflife.deltaschematic.model.Point;
import nl.bytesoflife.deltaschematic.model.SymbolDefinition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SymbolCacheSynchronizerTest {

    private final SymbolResolver resolver = new SymbolResolver(
            new ResolverConfig().withLibraryDirectory(Path.of("testdata/libraries")));
    private final LibrarySymbols symbols = new LibrarySymbols();
    private final List<Component> components = new ArrayList<>();

    @AfterEach
    void closeResolver() {
        resolver.close();
    }

    private Component place(String libId) {
        Component component = new Component(null, libId, new Point(0, components.size() * 10.0));
        components.add(component);
        return component;
    }

    @Test
    void usedKeysAreAddedInSortedOrder() {
        SymbolCacheSynchronizer synchronizer = new SymbolCacheSynchronizer(resolver, ResolutionPolicy.STRICT);
        place("Device:R");
        place("Device:C");
        place("Device:R");

        SyncResult result = synchronizer.resync(components, symbols);

        assertEquals(List.of("Device:R", "Device:C"), result.added());
        assertTrue(result.removed().isEmpty());
        assertEquals(List.of("Device:C", "Device:R"), symbols.libraryIds());
        assertEquals("Device:C", symbols.get("Device:C").orElseThrow().getName());
    }

    @Test
    void unusedKeysAreRemoved() {
        SymbolCacheSynchronizer synchronizer = new SymbolCacheSynchronizer(resolver, ResolutionPolicy.STRICT);
        place("Device:R");
        Component capacitor = place("Device:C");
        synchronizer.resync(components, symbols);

        components.remove(capacitor);
        SyncResult result = synchronizer.resync(components, symbols);

        assertEquals(List.of("Device:C"), result.removed());
        assertEquals(List.of("Device:R"), symbols.libraryIds());
        assertTrue(synchronizer.resync(components, symbols).isEmpty());
    }

    @Test
    void lastUserRemovedEmptiesTheSection() {
        SymbolCacheSynchronizer synchronizer = new SymbolCacheSynchronizer(resolver, ResolutionPolicy.STRICT);
        Component resistor = place("Device:R");
        synchronizer.resync(components, symbols);
        components.remove(resistor);

        synchronizer.resync(components, symbols);
        assertEquals(0, symbols.size());
    }

    @Test
    void failedResolutionLeavesTheSectionUntouched() {
        SymbolCacheSynchronizer synchronizer = new SymbolCacheSynchronizer(resolver, ResolutionPolicy.STRICT);
        Component capacitor = place("Device:C");
        synchronizer.resync(components, symbols);

        components.remove(capacitor);
        place("Device:R");
        place("Loop:A");

        ResolutionException e = assertThrows(ResolutionException.class, () -> synchronizer.resync(components, symbols));
        assertEquals(ResolutionException.Reason.CYCLE, e.getReason());
        assertEquals(List.of("Device:C"), symbols.libraryIds());
    }

    @Test
    void libNameIsTheKey() {
        SymbolCacheSynchronizer synchronizer = new SymbolCacheSynchronizer(resolver, ResolutionPolicy.STRICT);
        place("Device:R").setLibName("R_1");

        synchronizer.resync(components, symbols);

        SymbolDefinition definition = symbols.get("R_1").orElseThrow();
        assertEquals("R_1", definition.getName());
        assertEquals(List.of("R_1_0_1", "R_1_1_1"),
                definition.getUnits().stream().map(unit -> unit.text(1)).toList());
        assertFalse(symbols.contains("Device:R"));
    }

    @Test
    void strictAdmitRejectsUnknownSymbols() {
        SymbolCacheSynchronizer synchronizer = new SymbolCacheSynchronizer(resolver, ResolutionPolicy.STRICT);
        Component ghost = new Component(null, "Nope:Ghost", new Point(0, 0));

        ResolutionException e = assertThrows(ResolutionException.class, () -> synchronizer.admit(ghost, symbols));
        assertEquals(ResolutionException.Reason.NOT_FOUND, e.getReason());
        assertTrue(synchronizer.getUnresolved().isEmpty());
    }

    @Test
    void lenientAdmitRecordsUnresolvedKeys() {
        SymbolCacheSynchronizer synchronizer = new SymbolCacheSynchronizer(resolver, ResolutionPolicy.ALLOW_UNRESOLVED);
        Component ghost = place("Nope:Ghost");
        synchronizer.admit(ghost, symbols);
        assertEquals(Set.of("Nope:Ghost"), synchronizer.getUnresolved());

        place("Device:R");
        SyncResult result = synchronizer.resync(components, symbols);
        assertEquals(List.of("Device:R"), result.added());
        assertFalse(symbols.contains("Nope:Ghost"));

        components.remove(ghost);
        synchronizer.resync(components, symbols);
        assertTrue(synchronizer.getUnresolved().isEmpty());
    }

    @Test
    void normalizeKeepsGoingPastFailures() {
        SymbolCacheSynchronizer synchronizer = new SymbolCacheSynchronizer(resolver, ResolutionPolicy.STRICT);
        place("Loop:Orphan");
        place("Device:R");

        SyncResult result = synchronizer.normalize(components, symbols);

        assertEquals(List.of("Device:R"), result.added());
        assertEquals(Set.of("Loop:Orphan"), synchronizer.getUnresolved());
    }

    @Test
    void withoutResolverOnlyPresentKeysAreUsable() {
        SymbolCacheSynchronizer synchronizer = new SymbolCacheSynchronizer(null, ResolutionPolicy.STRICT);
        SymbolDefinition r = resolver.resolve("Device:R").getDefinition();
        symbols.apply(Map.of("Device:R", r), List.of());

        synchronizer.admit(place("Device:R"), symbols);
        ResolutionException e = assertThrows(ResolutionException.class,
                () -> synchronizer.admit(new Component(null, "Device:C", new Point(0, 0)), symbols));
        assertTrue(e.getMessage().contains("no symbol resolver"));
    }

    @Test
    void adoptMissingMarksKeysWithoutTouchingTheSection() {
        SymbolCacheSynchronizer synchronizer = new SymbolCacheSynchronizer(resolver, ResolutionPolicy.STRICT);
        place("Device:R");
        synchronizer.adoptMissing(components, symbols);

        assertEquals(Set.of("Device:R"), synchronizer.getUnresolved());
        assertEquals(0, symbols.size());
    }
}
