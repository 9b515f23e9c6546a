package nl.bytesoflife.deltaschematic;

/**
 * Malformed S-expression text: unbalanced parentheses, an unterminated string or a stray token.
 * Aborts the whole load.
 */
public class GrammarException extends SchematicException {

    private final String source;
    private final int line;
    private final int column;
    private final int offset;
    private final String expected;
    private final String found;

    public GrammarException(String source, int line, int column, int offset, String expected, String found) {
        super(String.format("%s:%d:%d: expected %s but found %s", source, line, column, expected, found));
        this.source = source;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.expected = expected;
        this.found = found;
    }

    public String getSource() {
        return source;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }
}
