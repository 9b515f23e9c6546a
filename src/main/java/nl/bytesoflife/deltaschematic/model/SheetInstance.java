package nl.bytesoflife.deltaschematic.model;

public record SheetInstance(String project, String path, String page) {
}
