package nl.bytesoflife.deltaschematic;

public enum Severity {
    ERROR,
    WARNING
}
