package nl.bytesoflife.deltaschematic.sync;

/**
 * What happens to a component whose symbol cannot be resolved.
 */
public enum ResolutionPolicy {
    STRICT,
    ALLOW_UNRESOLVED
}
