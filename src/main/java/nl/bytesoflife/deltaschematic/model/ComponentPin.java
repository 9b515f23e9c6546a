package nl.bytesoflife.deltaschematic.model;

/**
 * Per-instance pin entry of a placed symbol: {@code (pin "1" (uuid "..."))}. The alternate is the
 * selected alternate pin function, or null.
 */
public record ComponentPin(String number, String uuid, String alternate) {

    public ComponentPin(String number, String uuid) {
        this(number, uuid, null);
    }
}
