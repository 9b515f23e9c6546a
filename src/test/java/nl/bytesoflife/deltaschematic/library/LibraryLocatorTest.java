package nl.bytesoflife.deltaschematic.library;

import nl.bytesoflife.deltaschematic.SchematicException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LibraryLocatorTest {

    private static final Path LIBRARIES = Path.of("testdata/libraries");

    @TempDir
    Path tempDir;

    @Test
    void parseSymLibTable() {
        SymLibTable table = SymLibTable.parse("""
                (sym_lib_table
                  (version 7)
                  (lib (name "Device")(type "KiCad")(uri "${KICAD9_SYMBOL_DIR}/Device.kicad_sym")(options "")(descr "Basic devices"))
                  (lib (name "Old")(type "KiCad")(uri "/nowhere/Old.kicad_sym")(options "")(descr "")(disabled))
                )
                """, "sym-lib-table");

        assertEquals(2, table.getEntries().size());
        SymLibTable.Entry device = table.find("Device").orElseThrow();
        assertEquals("${KICAD9_SYMBOL_DIR}/Device.kicad_sym", device.uri());
        assertEquals("Basic devices", device.description());
        assertTrue(table.find("Old").isEmpty());
        assertTrue(table.getEntries().get(1).disabled());
    }

    @Test
    void symLibTableNeedsItsRoot() {
        assertThrows(SchematicException.class, () -> SymLibTable.parse("(fp_lib_table)", "fp-lib-table"));
        assertThrows(SchematicException.class, () -> SymLibTable.parse("(sym_lib_table (lib (name \"X\")))", "t"));
    }

    @Test
    void tableEntriesAreExpandedAndWinOverDirectories() throws Exception {
        Path table = tempDir.resolve("sym-lib-table");
        Files.writeString(table, "(sym_lib_table (version 7)\n"
                + "  (lib (name \"Parts\")(type \"KiCad\")(uri \"${KIPRJMOD}/libs/Device.kicad_sym\")(options \"\")(descr \"\"))\n"
                + ")\n");
        Path projectLibs = Files.createDirectories(tempDir.resolve("libs"));
        Files.copy(LIBRARIES.resolve("Device.kicad_sym"), projectLibs.resolve("Device.kicad_sym"));

        LibraryLocator locator = new LibraryLocator(new ResolverConfig()
                .withSymLibTable(table)
                .withProjectDirectory(tempDir)
                .withLibraryDirectory(LIBRARIES));

        assertEquals(projectLibs.resolve("Device.kicad_sym"), locator.locate("Parts").orElseThrow());
        assertEquals(LIBRARIES.resolve("74xx.kicad_sym"), locator.locate("74xx").orElseThrow());
        assertTrue(locator.locate("Nope").isEmpty());
    }

    @Test
    void entryPointingNowhereFallsBackToDirectories() throws Exception {
        Path table = tempDir.resolve("sym-lib-table");
        Files.writeString(table, "(sym_lib_table (lib (name \"Device\")(uri \"/does/not/exist.kicad_sym\")))");

        LibraryLocator locator = new LibraryLocator(new ResolverConfig()
                .withSymLibTable(table)
                .withLibraryDirectory(LIBRARIES));

        assertEquals(LIBRARIES.resolve("Device.kicad_sym"), locator.locate("Device").orElseThrow());
    }

    @Test
    void libraryFileNeedsItsRoot() throws Exception {
        Path bogus = tempDir.resolve("Bogus.kicad_sym");
        Files.writeString(bogus, "(kicad_sch (version 20250114))");
        assertThrows(SchematicException.class, () -> SymbolLibrary.load("Bogus", bogus));
    }

    @Test
    void libraryListsItsSymbols() throws Exception {
        SymbolLibrary library = SymbolLibrary.load("74xx", LIBRARIES.resolve("74xx.kicad_sym"));
        assertEquals(3, library.size());
        assertTrue(library.get("7400").isPresent());
        assertEquals("74LS00", library.get("7400").orElseThrow().getExtendsName().orElseThrow());
    }
}
