package nl.bytesoflife.deltaschematic.format;

/**
 * The spelling eeschema used for a given file format version. Modified elements are written in the
 * dialect of the document they belong to, so a KiCad 7 file stays readable by KiCad 7.
 */
public record FormatDialect(int version) {

    public static final FormatDialect CURRENT = new FormatDialect(FormatRules.FORMAT_VERSION);

    /**
     * Dialect for a document header version; a missing version (0) means the current format.
     */
    public static FormatDialect of(int version) {
        return version <= 0 ? CURRENT : new FormatDialect(version);
    }

    public boolean writesSimulationExclusion() {
        return version >= FormatRules.SIMULATION_EXCLUSION_VERSION;
    }

    public boolean writesBooleanFlags() {
        return version >= FormatRules.BOOLEAN_FLAGS_VERSION;
    }

    public boolean writesSheetAttributes() {
        return version >= FormatRules.SHEET_ATTRIBUTES_VERSION;
    }

    public boolean writesHideAsBoolean() {
        return version >= FormatRules.HIDE_BOOLEAN_VERSION;
    }
}
