package nl.bytesoflife.deltaschematic.collection;

import nl.bytesoflife.deltaschematic.io.NodeBuilder;
import nl.bytesoflife.deltaschematic.model.Point;
import nl.bytesoflife.deltaschematic.model.Property;
import nl.bytesoflife.deltaschematic.model.Sheet;

import java.util.List;
import java.util.Optional;

/**
 * Hierarchical sheet symbols, indexed by sheet name and file name.
 */
public class SheetCollection extends IndexedCollection<Sheet> {

    public static final String NAME = "name";
    public static final String FILE = "file";

    // Field offsets eeschema uses for a new sheet
    private static final double NAME_OFFSET = -0.7116;
    private static final double FILE_OFFSET = 0.5984;

    public SheetCollection() {
        super("sheets");
        singleKeyIndex(NAME, Sheet::getName);
        singleKeyIndex(FILE, Sheet::getFileName);
    }

    public Sheet add(String name, String fileName, Point position, double width, double height) {
        Sheet sheet = new Sheet(null, position, width, height);
        sheet.getProperties().add(new Property(Sheet.SHEET_NAME, name,
                position.translate(0, NAME_OFFSET), 0, NodeBuilder.defaultEffects("left", "bottom")));
        sheet.getProperties().add(new Property(Sheet.SHEET_FILE, fileName,
                position.translate(0, height + FILE_OFFSET), 0, NodeBuilder.defaultEffects("left", "top")));
        return add(sheet);
    }

    public Optional<Sheet> getByName(String name) {
        return findFirst(NAME, name);
    }

    public List<Sheet> findByFile(String fileName) {
        return find(FILE, fileName);
    }
}
