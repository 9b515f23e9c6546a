package nl.bytesoflife.deltaschematic;

import nl.bytesoflife.deltaschematic.collection.BatchScope;
import nl.bytesoflife.deltaschematic.collection.CollectionListener;
import nl.bytesoflife.deltaschematic.collection.ComponentCollection;
import nl.bytesoflife.deltaschematic.collection.ImageCollection;
import nl.bytesoflife.deltaschematic.collection.IndexedCollection;
import nl.bytesoflife.deltaschematic.collection.JunctionCollection;
import nl.bytesoflife.deltaschematic.collection.LabelCollection;
import nl.bytesoflife.deltaschematic.collection.NoConnectCollection;
import nl.bytesoflife.deltaschematic.collection.RectangleCollection;
import nl.bytesoflife.deltaschematic.collection.SheetCollection;
import nl.bytesoflife.deltaschematic.collection.TextBoxCollection;
import nl.bytesoflife.deltaschematic.collection.TextCollection;
import nl.bytesoflife.deltaschematic.collection.WireCollection;
import nl.bytesoflife.deltaschematic.format.FormatDialect;
import nl.bytesoflife.deltaschematic.format.FormatRules;
import nl.bytesoflife.deltaschematic.geometry.PinGeometry;
import nl.bytesoflife.deltaschematic.io.PropertyCodec;
import nl.bytesoflife.deltaschematic.io.SchematicReader;
import nl.bytesoflife.deltaschematic.io.SchematicWriter;
import nl.bytesoflife.deltaschematic.model.Component;
import nl.bytesoflife.deltaschematic.model.ComponentPin;
import nl.bytesoflife.deltaschematic.model.DocumentEntry;
import nl.bytesoflife.deltaschematic.model.HeaderField;
import nl.bytesoflife.deltaschematic.model.Image;
import nl.bytesoflife.deltaschematic.model.Junction;
import nl.bytesoflife.deltaschematic.model.Label;
import nl.bytesoflife.deltaschematic.model.LibrarySymbols;
import nl.bytesoflife.deltaschematic.model.Mirror;
import nl.bytesoflife.deltaschematic.model.NoConnect;
import nl.bytesoflife.deltaschematic.model.Point;
import nl.bytesoflife.deltaschematic.model.Property;
import nl.bytesoflife.deltaschematic.model.Rectangle;
import nl.bytesoflife.deltaschematic.model.Rotation;
import nl.bytesoflife.deltaschematic.model.SchematicElement;
import nl.bytesoflife.deltaschematic.model.Sheet;
import nl.bytesoflife.deltaschematic.model.SheetInstance;
import nl.bytesoflife.deltaschematic.model.SymbolDefinition;
import nl.bytesoflife.deltaschematic.model.SymbolInstance;
import nl.bytesoflife.deltaschematic.model.SymbolPin;
import nl.bytesoflife.deltaschematic.model.TextBox;
import nl.bytesoflife.deltaschematic.model.TextItem;
import nl.bytesoflife.deltaschematic.model.TitleBlock;
import nl.bytesoflife.deltaschematic.model.Wire;
import nl.bytesoflife.deltaschematic.sexpr.SNode;
import nl.bytesoflife.deltaschematic.sexpr.SValues;
import nl.bytesoflife.deltaschematic.sync.SymbolCacheSynchronizer;
import nl.bytesoflife.deltaschematic.sync.SyncResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * A KiCad schematic document: the ordered list of top-level entries plus typed, indexed views of
 * its elements. Adding or removing components keeps the embedded symbol cache ({@code lib_symbols})
 * equal to the set of symbols in use.
 * <pre>
 * try (Schematic schematic = Schematic.open(path, new SchematicOptions().withResolver(resolver))) {
 *     schematic.components().getByReference("R1").ifPresent(r -> r.setValue("4.7k"));
 *     schematic.save();
 * }
 * </pre>
 * Not thread-safe.
 */
public class Schematic implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Schematic.class);

    private static final String DEFAULT_PROJECT = "untitled";

    private final List<DocumentEntry> entries;
    private final SchematicOptions options;
    private final SymbolCacheSynchronizer synchronizer;

    private final ComponentCollection components = new ComponentCollection();
    private final WireCollection wires = new WireCollection();
    private final LabelCollection labels = new LabelCollection();
    private final JunctionCollection junctions = new JunctionCollection();
    private final NoConnectCollection noConnects = new NoConnectCollection();
    private final SheetCollection sheets = new SheetCollection();
    private final TextCollection texts = new TextCollection();
    private final TextBoxCollection textBoxes = new TextBoxCollection();
    private final RectangleCollection rectangles = new RectangleCollection();
    private final ImageCollection images = new ImageCollection();
    private final List<IndexedCollection<?>> collections = List.of(components, wires, labels, junctions,
            noConnects, sheets, texts, textBoxes, rectangles, images);

    private LibrarySymbols librarySymbols;
    private Path path;
    private int batchDepth;
    private Thread batchOwner;
    private boolean syncPending;
    private boolean closed;

    private Schematic(List<DocumentEntry> entries, SchematicOptions options, Path path) {
        this.entries = new ArrayList<>(entries);
        this.options = options;
        this.path = path;
        this.synchronizer = new SymbolCacheSynchronizer(options.getResolver(), options.getResolutionPolicy());

        for (DocumentEntry entry : this.entries) {
            if (entry instanceof LibrarySymbols symbols) {
                librarySymbols = symbols;
            } else if (entry instanceof SchematicElement element) {
                load(element);
            }
        }
        if (librarySymbols == null) {
            librarySymbols = new LibrarySymbols();
            this.entries.add(headerEnd(), librarySymbols);
        }

        if (options.isNormalizeOnOpen()) {
            synchronizer.normalize(components, librarySymbols);
        } else {
            synchronizer.adoptMissing(components, librarySymbols);
        }
        attachListeners();
        if (options.getResolver() != null) {
            options.getResolver().getCache().retain();
        }
    }

    public static Schematic open(Path path) throws IOException {
        return open(path, new SchematicOptions());
    }

    /**
     * @throws GrammarException            when the file is not well-formed
     * @throws UnsupportedVersionException when the file format version is out of range
     */
    public static Schematic open(Path path, SchematicOptions options) throws IOException {
        long start = System.currentTimeMillis();
        String text = Files.readString(path);
        Schematic schematic = new Schematic(reader(options).read(text, path.toString()), options, path);
        log.info("Opened {} ({} components, {} wires) in {} ms", path, schematic.components.size(),
                schematic.wires.size(), System.currentTimeMillis() - start);
        return schematic;
    }

    public static Schematic parse(String text) {
        return parse(text, new SchematicOptions());
    }

    public static Schematic parse(String text, SchematicOptions options) {
        return new Schematic(reader(options).read(text, "<input>"), options, null);
    }

    public static Schematic createBlank() {
        return createBlank(new SchematicOptions());
    }

    /**
     * An empty A4 sheet as a new document in eeschema looks.
     */
    public static Schematic createBlank(SchematicOptions options) {
        String text = "(kicad_sch\n"
                + "\t(version " + FormatRules.FORMAT_VERSION + ")\n"
                + "\t(generator \"" + FormatRules.GENERATOR + "\")\n"
                + "\t(generator_version \"" + FormatRules.GENERATOR_VERSION + "\")\n"
                + "\t(uuid \"" + UUID.randomUUID() + "\")\n"
                + "\t(paper \"A4\")\n"
                + "\t(lib_symbols)\n"
                + "\t(sheet_instances\n"
                + "\t\t(path \"/\"\n"
                + "\t\t\t(page \"1\")\n"
                + "\t\t)\n"
                + "\t)\n"
                + "\t(embedded_fonts no)\n"
                + ")\n";
        return new Schematic(reader(options).read(text, "<blank>"), options, null);
    }

    private static SchematicReader reader(SchematicOptions options) {
        return new SchematicReader()
                .withVersionRange(options.getMinVersion(), options.getMaxVersion())
                .withLenientVersion(options.isLenientVersion());
    }

    // Collections

    public ComponentCollection components() {
        return components;
    }

    public WireCollection wires() {
        return wires;
    }

    public LabelCollection labels() {
        return labels;
    }

    public JunctionCollection junctions() {
        return junctions;
    }

    public NoConnectCollection noConnects() {
        return noConnects;
    }

    public SheetCollection sheets() {
        return sheets;
    }

    public TextCollection texts() {
        return texts;
    }

    public TextBoxCollection textBoxes() {
        return textBoxes;
    }

    public RectangleCollection rectangles() {
        return rectangles;
    }

    public ImageCollection images() {
        return images;
    }

    public LibrarySymbols librarySymbols() {
        return librarySymbols;
    }

    public List<DocumentEntry> getEntries() {
        return List.copyOf(entries);
    }

    // Header

    public int getVersion() {
        return header("version").map(field -> Integer.parseInt(field.getValue())).orElse(0);
    }

    public String getGenerator() {
        return header("generator").map(HeaderField::getValue).orElse(null);
    }

    public String getGeneratorVersion() {
        return header("generator_version").map(HeaderField::getValue).orElse(null);
    }

    public String getUuid() {
        return header("uuid").map(HeaderField::getValue).orElse(null);
    }

    public String getPaper() {
        return header("paper").map(HeaderField::getValue).orElse(null);
    }

    public void setPaper(String paper) {
        Optional<HeaderField> field = header("paper");
        if (field.isPresent()) {
            field.get().setValue(paper);
        } else {
            entries.add(headerEnd(), new HeaderField("paper", paper));
        }
    }

    public Optional<TitleBlock> getTitleBlock() {
        for (DocumentEntry entry : entries) {
            if (entry instanceof TitleBlock block) {
                return Optional.of(block);
            }
        }
        return Optional.empty();
    }

    public TitleBlock titleBlock() {
        return getTitleBlock().orElseGet(() -> {
            TitleBlock block = new TitleBlock();
            entries.add(headerEnd(), block);
            return block;
        });
    }

    public Optional<Path> getPath() {
        return Optional.ofNullable(path);
    }

    private Optional<HeaderField> header(String tag) {
        for (DocumentEntry entry : entries) {
            if (entry instanceof HeaderField field && field.tag().equals(tag)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    private int headerEnd() {
        int end = 0;
        for (int i = 0; i < entries.size(); i++) {
            DocumentEntry entry = entries.get(i);
            if (entry instanceof HeaderField || entry instanceof TitleBlock) {
                end = i + 1;
            }
        }
        return end;
    }

    // Batching and synchronization

    /**
     * Opens a batch: index rebuilds and symbol cache synchronization wait until the outermost scope
     * is closed. Scopes nest and belong to the calling thread.
     */
    public BatchScope batch() {
        ensureOpen();
        Thread current = Thread.currentThread();
        if (batchDepth == 0) {
            batchOwner = current;
            for (IndexedCollection<?> collection : collections) {
                collection.beginBatch();
            }
        } else if (batchOwner != current) {
            throw new IllegalStateException("Batch is owned by " + batchOwner.getName());
        }
        batchDepth++;
        return new BatchScope(this::endBatch);
    }

    public boolean isBatching() {
        return batchDepth > 0;
    }

    private void endBatch() {
        if (--batchDepth > 0) {
            return;
        }
        batchOwner = null;
        for (IndexedCollection<?> collection : collections) {
            collection.endBatch();
        }
        if (syncPending) {
            syncPending = false;
            resync();
        }
    }

    /**
     * Brings {@code lib_symbols} in line with the components.
     *
     * @throws ResolutionException when a needed symbol cannot be resolved; nothing is changed then
     */
    public SyncResult resync() {
        return synchronizer.resync(components, librarySymbols);
    }

    public Set<String> getUnresolvedSymbols() {
        return synchronizer.getUnresolved();
    }

    private void requestSync() {
        if (batchDepth > 0) {
            syncPending = true;
        } else {
            resync();
        }
    }

    // Geometry

    /**
     * Schematic position of a pin of a placed component, from the component's cached definition.
     */
    public Optional<Point> pinPosition(Component component, String pinNumber) {
        return librarySymbols.get(component.getSymbolKey())
                .flatMap(definition -> definition.getPin(component.getUnit(), pinNumber))
                .map(pin -> PinGeometry.pinPosition(component, pin));
    }

    public Map<String, Point> pinPositions(Component component) {
        Map<String, Point> positions = new LinkedHashMap<>();
        librarySymbols.get(component.getSymbolKey()).ifPresent(definition -> {
            for (SymbolPin pin : definition.getPins(component.getUnit())) {
                positions.putIfAbsent(pin.number(), PinGeometry.pinPosition(component, pin));
            }
        });
        return positions;
    }

    // Validation

    public List<ValidationIssue> validate() {
        List<ValidationIssue> issues = new ArrayList<>();

        Map<String, List<Component>> byReference = new HashMap<>();
        Set<String> usedKeys = new LinkedHashSet<>();
        for (Component component : components) {
            usedKeys.add(component.getSymbolKey());
            String reference = component.getReference();
            List<Component> sameReference = byReference.computeIfAbsent(reference, r -> new ArrayList<>());
            // Units of one multi-unit part share their reference; unannotated references end in '?'
            boolean clash = !reference.endsWith("?") && sameReference.stream().anyMatch(other ->
                    other.getUnit() == component.getUnit() || !other.getLibId().equals(component.getLibId()));
            if (clash) {
                issues.add(new ValidationIssue(Severity.ERROR, ValidationIssue.Code.DUPLICATE_REFERENCE,
                        component.getUuid(), "Reference " + reference + " is used more than once"));
            }
            sameReference.add(component);
            if (!librarySymbols.contains(component.getSymbolKey())) {
                issues.add(new ValidationIssue(Severity.ERROR, ValidationIssue.Code.MISSING_SYMBOL,
                        component.getUuid(), "No lib_symbols entry for " + component.getSymbolKey()));
            }
        }
        for (String key : librarySymbols.libraryIds()) {
            if (!usedKeys.contains(key)) {
                issues.add(new ValidationIssue(Severity.WARNING, ValidationIssue.Code.STALE_SYMBOL, null,
                        "lib_symbols entry " + key + " is not used by any component"));
            }
        }

        Set<String> uuids = new LinkedHashSet<>();
        for (IndexedCollection<?> collection : collections) {
            for (SchematicElement element : collection) {
                if (!uuids.add(element.getUuid())) {
                    issues.add(new ValidationIssue(Severity.ERROR, ValidationIssue.Code.DUPLICATE_UUID,
                            element.getUuid(), "uuid is shared with an element of another kind"));
                }
            }
        }

        for (Wire wire : wires) {
            if (wire.getPoints().size() < 2) {
                issues.add(new ValidationIssue(Severity.ERROR, ValidationIssue.Code.DEGENERATE_WIRE,
                        wire.getUuid(), "Wire has " + wire.getPoints().size() + " point(s)"));
            }
        }
        for (Label label : labels) {
            if (label.getText().isEmpty()) {
                issues.add(new ValidationIssue(Severity.WARNING, ValidationIssue.Code.EMPTY_LABEL,
                        label.getUuid(), "Label at " + label.getPosition() + " has no text"));
            }
        }
        return issues;
    }

    // Persistence

    public String serialize() {
        return new SchematicWriter(FormatDialect.of(getVersion())).serialize(entries);
    }

    /**
     * Writes the document back to the file it was opened from.
     *
     * @throws IllegalStateException when the document was not opened from a file
     */
    public void save() throws IOException {
        if (path == null) {
            throw new IllegalStateException("Schematic has no file; use save(Path)");
        }
        save(path);
    }

    /**
     * Writes the document through a temporary file in the target directory that replaces the target
     * in one move.
     */
    public void save(Path target) throws IOException {
        ensureOpen();
        if (batchDepth > 0) {
            throw new IllegalStateException("Cannot save while a batch is open");
        }
        long start = System.currentTimeMillis();
        resync();
        String text = serialize();

        Path directory = target.toAbsolutePath().getParent();
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, text);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        this.path = target;
        log.info("Saved {} in {} ms", target, System.currentTimeMillis() - start);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (options.getResolver() != null) {
            options.getResolver().getCache().release();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Schematic is closed");
        }
    }

    // Wiring of collections to the entry list

    private void load(SchematicElement element) {
        if (element instanceof Component component) {
            components.add(component);
        } else if (element instanceof Wire wire) {
            wires.add(wire);
        } else if (element instanceof Label label) {
            labels.add(label);
        } else if (element instanceof Junction junction) {
            junctions.add(junction);
        } else if (element instanceof NoConnect noConnect) {
            noConnects.add(noConnect);
        } else if (element instanceof Sheet sheet) {
            sheets.add(sheet);
        } else if (element instanceof TextItem text) {
            texts.add(text);
        } else if (element instanceof TextBox box) {
            textBoxes.add(box);
        } else if (element instanceof Rectangle rectangle) {
            rectangles.add(rectangle);
        } else if (element instanceof Image image) {
            images.add(image);
        }
    }

    private void attachListeners() {
        components.setFactory(this::createComponent);
        components.addListener(new CollectionListener<>() {
            @Override
            public void beforeAdd(Component component) {
                ensureOpen();
                synchronizer.admit(component, librarySymbols);
                if (component.getInstances().isEmpty()) {
                    component.addInstance(new SymbolInstance(projectName(), rootPath(),
                            component.getReference(), component.getUnit()));
                }
            }

            @Override
            public void added(Component component) {
                insertEntry(component);
                requestSync();
            }

            @Override
            public void removed(Component component) {
                removeEntry(component);
                requestSync();
            }

            @Override
            public void symbolKeyChanged(Component component) {
                synchronizer.admit(component, librarySymbols);
                requestSync();
            }
        });
        sheets.addListener(new CollectionListener<>() {
            @Override
            public void beforeAdd(Sheet sheet) {
                ensureOpen();
                if (sheet.getInstances().isEmpty()) {
                    sheet.addInstance(new SheetInstance(projectName(), rootPath(),
                            String.valueOf(sheets.size() + 2)));
                }
            }

            @Override
            public void added(Sheet sheet) {
                insertEntry(sheet);
            }

            @Override
            public void removed(Sheet sheet) {
                removeEntry(sheet);
            }
        });
        attachEntryListener(wires);
        attachEntryListener(labels);
        attachEntryListener(junctions);
        attachEntryListener(noConnects);
        attachEntryListener(texts);
        attachEntryListener(textBoxes);
        attachEntryListener(rectangles);
        attachEntryListener(images);
    }

    private <T extends SchematicElement> void attachEntryListener(IndexedCollection<T> collection) {
        collection.addListener(new CollectionListener<>() {
            @Override
            public void beforeAdd(T element) {
                ensureOpen();
            }

            @Override
            public void added(T element) {
                insertEntry(element);
            }

            @Override
            public void removed(T element) {
                removeEntry(element);
            }
        });
    }

    private void insertEntry(SchematicElement element) {
        int rank = FormatRules.topLevelRank(element.tag());
        int lastAtOrBefore = -1;
        int firstRanked = -1;
        for (int i = 0; i < entries.size(); i++) {
            DocumentEntry entry = entries.get(i);
            if (entry == element) {
                continue;
            }
            int existing = FormatRules.topLevelRank(entry.tag());
            if (existing < 0) {
                continue;
            }
            if (firstRanked < 0) {
                firstRanked = i;
            }
            if (existing <= rank) {
                lastAtOrBefore = i;
            }
        }
        int position;
        if (lastAtOrBefore >= 0) {
            position = lastAtOrBefore + 1;
        } else if (firstRanked >= 0) {
            position = firstRanked;
        } else {
            position = entries.indexOf(librarySymbols) + 1;
        }
        entries.add(position, element);
    }

    private void removeEntry(SchematicElement element) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i) == element) {
                entries.remove(i);
                return;
            }
        }
    }

    private String rootPath() {
        String uuid = getUuid();
        return uuid != null ? "/" + uuid : "/";
    }

    private String projectName() {
        if (options.getProjectName() != null) {
            return options.getProjectName();
        }
        for (Component component : components) {
            for (SymbolInstance instance : component.getInstances()) {
                return instance.project();
            }
        }
        for (Sheet sheet : sheets) {
            for (SheetInstance instance : sheet.getInstances()) {
                return instance.project();
            }
        }
        if (path != null) {
            String fileName = path.getFileName().toString();
            int dot = fileName.lastIndexOf('.');
            return dot > 0 ? fileName.substring(0, dot) : fileName;
        }
        return DEFAULT_PROJECT;
    }

    private Component createComponent(String libId, String reference, String value, Point position) {
        SymbolDefinition definition = definitionFor(libId);
        Component component = new Component(null, libId, position);
        SNode.SList node = definition.getNode();
        component.setExcludeFromSim(SValues.flag(node, "exclude_from_sim", false));
        component.setInBom(SValues.flag(node, "in_bom", true));
        component.setOnBoard(SValues.flag(node, "on_board", true));

        for (SNode.SList propertyNode : definition.getPropertyNodes().values()) {
            Property library = PropertyCodec.read(propertyNode);
            String text = switch (library.getName()) {
                case Component.REFERENCE -> reference;
                case Component.VALUE -> value;
                default -> library.getValue();
            };
            Point offset = library.getPosition() != null ? library.getPosition() : new Point(0, 0);
            Property property = new Property(library.getName(), text,
                    PinGeometry.toSchematic(offset, position, Rotation.R0, Mirror.NONE), library.getAngle(),
                    library.getEffects());
            property.setHidden(library.isHidden());
            property.setHiddenInEffects(library.isHiddenInEffects());
            property.setShowName(library.isShowName());
            property.setDoNotAutoplace(library.isDoNotAutoplace());
            component.getProperties().add(property);
        }
        if (!component.getProperties().contains(Component.REFERENCE)) {
            component.setReference(reference);
        }
        if (!component.getProperties().contains(Component.VALUE)) {
            component.setValue(value);
        }

        Set<String> numbers = new LinkedHashSet<>();
        for (SymbolPin pin : definition.getPins(1)) {
            if (numbers.add(pin.number())) {
                component.addPin(new ComponentPin(pin.number(), UUID.randomUUID().toString()));
            }
        }
        return component;
    }

    private SymbolDefinition definitionFor(String libId) {
        Optional<SymbolDefinition> embedded = librarySymbols.get(libId);
        if (embedded.isPresent()) {
            return embedded.get();
        }
        if (options.getResolver() == null) {
            throw new ResolutionException(libId, ResolutionException.Reason.NOT_FOUND,
                    "not in lib_symbols and no symbol resolver configured");
        }
        return options.getResolver().resolve(libId).getDefinition();
    }

    @Override
    public String toString() {
        return "Schematic{" + (path != null ? path : "<unsaved>") + ", components=" + components.size()
                + ", wires=" + wires.size() + ", labels=" + labels.size() + "}";
    }
}
