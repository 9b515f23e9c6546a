package nl.bytesoflife.deltaschematic.sexpr;

/**
 * Serializes {@link SNode} trees the way KiCad's own formatter does: a compact single-space
 * rendering followed by the {@link #prettify(String)} layout pass.
 */
public final class SExpressionWriter {

    private static final char INDENT = '\t';
    private static final String XY_PREFIX = "(xy ";
    private static final int XY_COLUMN_LIMIT = 99;
    private static final int TOKEN_WRAP_COLUMN = 72;

    private SExpressionWriter() {
    }

    public static String write(SNode node) {
        return prettify(compact(node));
    }

    public static String compact(SNode node) {
        StringBuilder sb = new StringBuilder();
        appendCompact(sb, node);
        return sb.toString();
    }

    private static void appendCompact(StringBuilder sb, SNode node) {
        if (node instanceof SNode.SList list) {
            sb.append('(');
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) sb.append(' ');
                appendCompact(sb, list.get(i));
            }
            sb.append(')');
        } else if (node instanceof SNode.SString string) {
            sb.append(quote(string.value()));
        } else {
            sb.append(node.text());
        }
    }

    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                default -> sb.append(c);
            }
        }
        sb.append('"');
        return sb.toString();
    }

    /**
     * KiCad layout pass over compact text. Every list opens on its own tab-indented line except
     * runs of {@code (xy ...)} lists, which share a line up to column 99. A list closes inline
     * unless it contained a nested list or was wrapped at column 72. The result ends with a newline.
     */
    public static String prettify(String source) {
        StringBuilder out = new StringBuilder(source.length() + source.length() / 4);

        int listDepth = 0;
        char lastNonWhitespace = 0;
        boolean inQuote = false;
        boolean hasInsertedSpace = false;
        boolean inMultiLineList = false;
        boolean inXY = false;
        int column = 0;
        int backslashCount = 0;

        int length = source.length();
        for (int cursor = 0; cursor < length; cursor++) {
            char c = source.charAt(cursor);

            if (isWhitespace(c) && !inQuote) {
                char next = nextNonWhitespace(source, cursor);
                if (!hasInsertedSpace
                        && listDepth > 0
                        && lastNonWhitespace != '('
                        && next != ')'
                        && next != '(') {
                    if (inXY || column < TOKEN_WRAP_COLUMN) {
                        out.append(' ');
                        column++;
                    } else {
                        newline(out, listDepth);
                        column = listDepth;
                        inMultiLineList = true;
                    }
                    hasInsertedSpace = true;
                }
                continue;
            }

            hasInsertedSpace = false;

            if (c == '(' && !inQuote) {
                boolean currentIsXY = source.startsWith(XY_PREFIX, cursor);

                if (out.length() == 0) {
                    out.append('(');
                    column++;
                } else if (inXY && currentIsXY && column < XY_COLUMN_LIMIT) {
                    out.append(" (");
                    column += 2;
                } else {
                    newline(out, listDepth);
                    out.append('(');
                    column = listDepth + 1;
                }

                inXY = currentIsXY;
                listDepth++;
            } else if (c == ')' && !inQuote) {
                if (listDepth > 0) {
                    listDepth--;
                }
                if (lastNonWhitespace == ')' || inMultiLineList) {
                    newline(out, listDepth);
                    out.append(')');
                    column = listDepth + 1;
                    inMultiLineList = false;
                } else {
                    out.append(')');
                    column++;
                }
            } else {
                // a quote preceded by an odd number of backslashes is escaped
                if (c == '\\') {
                    backslashCount++;
                } else if (c == '"' && (backslashCount & 1) == 0) {
                    inQuote = !inQuote;
                }
                if (c != '\\') {
                    backslashCount = 0;
                }
                out.append(c);
                column++;
            }

            lastNonWhitespace = c;
        }

        out.append('\n');
        return out.toString();
    }

    private static void newline(StringBuilder out, int depth) {
        out.append('\n');
        for (int i = 0; i < depth; i++) {
            out.append(INDENT);
        }
    }

    private static char nextNonWhitespace(String source, int from) {
        for (int i = from; i < source.length(); i++) {
            char c = source.charAt(i);
            if (!isWhitespace(c)) {
                return c;
            }
        }
        return 0;
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }
}
