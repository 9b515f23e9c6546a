package nl.bytesoflife.deltaschematic.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PropertiesTest {

    private final Properties properties = new Properties();

    @Test
    void keepsInsertionOrder() {
        properties.add(new Property("Reference", "R1", new Point(1, 2), 0, null));
        properties.add(new Property("Value", "10k", new Point(1, 4), 0, null));
        properties.set("MPN", "RC0603FR-0710KL");

        assertEquals(List.of("Reference", "Value", "MPN"), properties.names());
        assertEquals(Map.of("Reference", "R1", "Value", "10k", "MPN", "RC0603FR-0710KL"), properties.asMap());
    }

    @Test
    void setCreatesHiddenProperty() {
        Property created = properties.set("MPN", "X");

        assertTrue(created.isHidden());
        assertSame(created, properties.set("MPN", "Y"));
        assertEquals("Y", properties.get("MPN").orElseThrow());
    }

    @Test
    void duplicateNameRejected() {
        properties.add(new Property("Value", "10k", null, 0, null));

        assertThrows(IllegalArgumentException.class, () -> properties.add(new Property("Value", "1k", null, 0, null)));
    }

    @Test
    void changesReachListener() {
        AtomicInteger changes = new AtomicInteger();
        properties.setChangeListener(changes::incrementAndGet);

        Property value = properties.set("Value", "10k");
        value.setValue("22k");
        properties.remove("Value");
        value.setValue("ignored");

        assertEquals(3, changes.get());
        assertFalse(properties.remove("Value"));
        assertEquals("fallback", properties.getOrDefault("Value", "fallback"));
    }
}
