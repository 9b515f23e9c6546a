package nl.bytesoflife.deltaschematic;

import nl.bytesoflife.deltaschematic.format.FormatRules;
import nl.bytesoflife.deltaschematic.library.SymbolResolver;
import nl.bytesoflife.deltaschematic.sync.ResolutionPolicy;

/**
 * How a schematic is opened and kept consistent.
 * <pre>
 * Schematic schematic = Schematic.open(path, new SchematicOptions()
 *     .withResolver(resolver)
 *     .withProjectName("amplifier"));
 * </pre>
 */
public class SchematicOptions {

    private SymbolResolver resolver;
    private String projectName;
    private int minVersion = FormatRules.MIN_SUPPORTED_VERSION;
    private int maxVersion = FormatRules.FORMAT_VERSION;
    private boolean lenientVersion;
    private boolean normalizeOnOpen = true;
    private ResolutionPolicy resolutionPolicy = ResolutionPolicy.STRICT;

    public SchematicOptions withResolver(SymbolResolver resolver) {
        this.resolver = resolver;
        return this;
    }

    public SchematicOptions withProjectName(String projectName) {
        this.projectName = projectName;
        return this;
    }

    public SchematicOptions withVersionRange(int min, int max) {
        this.minVersion = min;
        this.maxVersion = max;
        return this;
    }

    public SchematicOptions withLenientVersion(boolean lenient) {
        this.lenientVersion = lenient;
        return this;
    }

    /**
     * Whether opening a document brings its {@code lib_symbols} in line with its components,
     * dropping unused entries and adding resolvable missing ones.
     */
    public SchematicOptions withNormalizeOnOpen(boolean normalize) {
        this.normalizeOnOpen = normalize;
        return this;
    }

    public SchematicOptions withResolutionPolicy(ResolutionPolicy policy) {
        this.resolutionPolicy = policy;
        return this;
    }

    public SymbolResolver getResolver() {
        return resolver;
    }

    public String getProjectName() {
        return projectName;
    }

    public int getMinVersion() {
        return minVersion;
    }

    public int getMaxVersion() {
        return maxVersion;
    }

    public boolean isLenientVersion() {
        return lenientVersion;
    }

    public boolean isNormalizeOnOpen() {
        return normalizeOnOpen;
    }

    public ResolutionPolicy getResolutionPolicy() {
        return resolutionPolicy;
    }
}
