package nl.bytesoflife.deltaschematic.model;

/**
 * One top-level node of a schematic document, in file order. Typed entries can be edited; a
 * {@link Passthrough} can only be written back as it was read.
 */
public sealed interface DocumentEntry permits SchematicElement, Passthrough, HeaderField, TitleBlock, LibrarySymbols {

    String tag();
}
