package nl.bytesoflife.deltaschematic.model;

public record SymbolInstance(String project, String path, String reference, int unit) {

    public SymbolInstance withReference(String newReference) {
        return new SymbolInstance(project, path, newReference, unit);
    }

    public SymbolInstance withUnit(int newUnit) {
        return new SymbolInstance(project, path, reference, newUnit);
    }
}
