package nl.bytesoflife.deltaschematic.format;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * How a freshly derived number is spelled. Numbers read from a file keep their original text and
 * never pass through here.
 */
public enum NumberStyle {
    /** Millimetre values on the 100 nm grid: at most 4 decimals, no trailing zeros. */
    COORDINATE(0, 4),
    ANGLE(0, 4),
    INTEGER(0, 0),
    FIXED_4(4, 4);

    private final int minDecimals;
    private final int maxDecimals;

    NumberStyle(int minDecimals, int maxDecimals) {
        this.minDecimals = minDecimals;
        this.maxDecimals = maxDecimals;
    }

    public String format(double value) {
        BigDecimal rounded = BigDecimal.valueOf(value).setScale(maxDecimals, RoundingMode.HALF_UP);
        if (rounded.signum() == 0) {
            rounded = BigDecimal.ZERO.setScale(maxDecimals);
        }
        if (minDecimals < maxDecimals) {
            rounded = rounded.stripTrailingZeros();
            if (rounded.scale() < minDecimals) {
                rounded = rounded.setScale(minDecimals);
            }
        }
        String text = rounded.toPlainString();
        return "-0".equals(text) ? "0" : text;
    }

    public int getMinDecimals() {
        return minDecimals;
    }

    public int getMaxDecimals() {
        return maxDecimals;
    }
}
