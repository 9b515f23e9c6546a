package nl.bytesoflife.deltaschematic.format;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Formatting table for KiCad schematic files, version {@value #FORMAT_VERSION} (KiCad 9).
 * <p>
 * Every rule that decides how a derived value is spelled or where a derived child is placed lives
 * here; {@code docs/format-rules.md} is the human-readable copy of this class. When KiCad changes its
 * serializer, bump {@link #FORMAT_VERSION} and update both.
 */
public final class FormatRules {

    public static final int FORMAT_VERSION = 20250114;
    public static final String GENERATOR = "eeschema";
    public static final String GENERATOR_VERSION = "9.0";

    public static final int MIN_SUPPORTED_VERSION = 20230121;

    // Versions at which eeschema changed how it writes the fields the model derives
    public static final int SIMULATION_EXCLUSION_VERSION = 20230409;
    public static final int BOOLEAN_FLAGS_VERSION = 20231120;
    public static final int SHEET_ATTRIBUTES_VERSION = 20240602;
    public static final int HIDE_BOOLEAN_VERSION = 20241004;

    private static final Set<String> QUOTED = Set.of(
            "uuid", "lib_id", "lib_name", "property", "generator", "generator_version", "paper",
            "label", "global_label", "hierarchical_label", "text", "project", "path", "reference",
            "page", "pin", "name", "number", "title", "date", "rev", "company", "comment", "face",
            "alternate", "symbol", "extends");

    private static final Set<String> BARE = Set.of(
            "in_bom", "on_board", "dnp", "exclude_from_sim", "fields_autoplaced", "hide", "show_name",
            "do_not_autoplace", "bold", "italic", "embedded_fonts", "type", "justify", "shape", "mirror",
            "pin_electrical_type", "pin_graphic_style");

    /** Canonical child order per list tag; children not listed are never reordered or dropped. */
    private static final Map<String, List<String>> CHILD_ORDER = Map.ofEntries(
            Map.entry("kicad_sch", List.of("version", "generator", "generator_version", "uuid", "paper",
                    "title_block", "lib_symbols")),
            Map.entry("symbol", List.of("lib_name", "lib_id", "at", "mirror", "unit", "body_style",
                    "exclude_from_sim", "in_bom", "on_board", "dnp", "fields_autoplaced", "uuid", "property",
                    "pin", "instances")),
            Map.entry("property", List.of("id", "at", "show_name", "do_not_autoplace", "hide", "effects")),
            Map.entry("effects", List.of("font", "justify", "href", "hide")),
            Map.entry("font", List.of("face", "size", "thickness", "bold", "italic", "color", "line_spacing")),
            Map.entry("pin", List.of("alternate", "at", "uuid", "effects")),
            Map.entry("instances", List.of("project")),
            Map.entry("project", List.of("path")),
            Map.entry("path", List.of("reference", "unit", "page")),
            Map.entry("wire", List.of("pts", "stroke", "uuid")),
            Map.entry("bus", List.of("pts", "stroke", "uuid")),
            Map.entry("pts", List.of("xy")),
            Map.entry("stroke", List.of("width", "type", "color")),
            Map.entry("junction", List.of("at", "diameter", "color", "uuid")),
            Map.entry("no_connect", List.of("at", "uuid")),
            Map.entry("label", List.of("shape", "at", "fields_autoplaced", "effects", "uuid", "property")),
            Map.entry("global_label", List.of("shape", "at", "fields_autoplaced", "effects", "uuid", "property")),
            Map.entry("hierarchical_label", List.of("shape", "at", "fields_autoplaced", "effects", "uuid",
                    "property")),
            Map.entry("text", List.of("exclude_from_sim", "at", "effects", "uuid")),
            Map.entry("text_box", List.of("exclude_from_sim", "at", "size", "margins", "stroke", "fill", "effects",
                    "uuid")),
            Map.entry("sheet", List.of("at", "size", "exclude_from_sim", "in_bom", "on_board", "dnp",
                    "fields_autoplaced", "stroke", "fill", "uuid", "property", "pin", "instances")),
            Map.entry("fill", List.of("type", "color")),
            Map.entry("rectangle", List.of("start", "end", "stroke", "fill", "uuid")),
            Map.entry("image", List.of("at", "scale", "uuid", "data")),
            Map.entry("title_block", List.of("title", "date", "rev", "company", "comment")));

    private static final Set<String> KEYED_BY_FIRST_ARGUMENT = Set.of(
            "property", "pin", "project", "path", "comment");

    /**
     * KiCad writes schematic items grouped by item type, then by uuid. Lower rank comes first.
     */
    private static final Map<String, Integer> TOP_LEVEL_RANK = Map.ofEntries(
            Map.entry("junction", 1),
            Map.entry("no_connect", 2),
            Map.entry("bus_entry", 3),
            Map.entry("wire", 5),
            Map.entry("bus", 5),
            Map.entry("polyline", 6),
            Map.entry("rectangle", 6),
            Map.entry("circle", 6),
            Map.entry("arc", 6),
            Map.entry("bezier", 6),
            Map.entry("image", 7),
            Map.entry("text_box", 8),
            Map.entry("text", 9),
            Map.entry("table", 10),
            Map.entry("label", 11),
            Map.entry("global_label", 12),
            Map.entry("hierarchical_label", 13),
            Map.entry("rule_area", 14),
            Map.entry("netclass_flag", 15),
            Map.entry("symbol", 17),
            Map.entry("sheet", 19));

    private static final List<String> DEFINITION_ORDER = List.of("extends", "power", "pin_numbers", "pin_names",
            "exclude_from_sim", "in_bom", "on_board", "property", "symbol", "embedded_fonts");

    private FormatRules() {
    }

    public static boolean isQuoted(String field) {
        return QUOTED.contains(field);
    }

    public static boolean isBare(String field) {
        return BARE.contains(field);
    }

    public static List<String> childOrder(String tag) {
        return CHILD_ORDER.getOrDefault(tag, List.of());
    }

    /**
     * Position of {@code childTag} in the canonical order of {@code parentTag}, or -1 when unranked.
     */
    public static int childRank(String parentTag, String childTag) {
        return childOrder(parentTag).indexOf(childTag);
    }

    public static int definitionRank(String childTag) {
        return DEFINITION_ORDER.indexOf(childTag);
    }

    public static boolean isKeyedByFirstArgument(String tag) {
        return KEYED_BY_FIRST_ARGUMENT.contains(tag);
    }

    public static int topLevelRank(String tag) {
        return TOP_LEVEL_RANK.getOrDefault(tag, -1);
    }
}
