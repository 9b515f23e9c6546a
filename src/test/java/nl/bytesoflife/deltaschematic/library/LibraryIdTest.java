package nl.bytesoflife.deltaschematic.library;

import nl.bytesoflife.deltaschematic.ResolutionException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LibraryIdTest {

    @Test
    void parseSplitsAtTheFirstColon() {
        LibraryId id = LibraryId.parse("Device:R");
        assertEquals("Device", id.library());
        assertEquals("R", id.name());
        assertEquals("Device:R", id.toString());

        assertEquals("Odd:Name:With:Colons", LibraryId.parse("Odd:Name:With:Colons").toString());
        assertEquals("Name:With:Colons", LibraryId.parse("Odd:Name:With:Colons").name());
    }

    @Test
    void malformedIdsAreRejected() {
        for (String bad : new String[]{"R", ":R", "Device:", ""}) {
            ResolutionException e = assertThrows(ResolutionException.class, () -> LibraryId.parse(bad));
            assertEquals(ResolutionException.Reason.INVALID_ID, e.getReason());
        }
        assertThrows(ResolutionException.class, () -> LibraryId.parse(null));
    }

    @Test
    void siblingStaysInTheLibrary() {
        assertEquals(new LibraryId("74xx", "74LS00"), LibraryId.parse("74xx:7400").sibling("74LS00"));
    }

    @Test
    void explicitPathVariablesWinOverTheEnvironment() {
        PathVariables variables = new PathVariables(Map.of("LIBS", "/opt/libs"),
                name -> "LIBS".equals(name) ? "/from/env" : "HOME".equals(name) ? "/home/me" : null);

        assertEquals("/opt/libs/Device.kicad_sym", variables.expand("${LIBS}/Device.kicad_sym"));
        assertEquals("/home/me/x", variables.expand("${HOME}/x"));
        assertEquals("${NOPE}/x.kicad_sym", variables.expand("${NOPE}/x.kicad_sym"));
        assertEquals("plain/path", variables.expand("plain/path"));
    }

    @Test
    void expansionKeepsDollarSignsInValues() {
        PathVariables variables = new PathVariables(Map.of("WEIRD", "/a$b"), name -> null);
        assertEquals("/a$b/c", variables.expand("${WEIRD}/c"));
    }
}
