package nl.bytesoflife.deltaschematic.sexpr;

import nl.bytesoflife.deltaschematic.GrammarException;

import java.util.ArrayList;
import java.util.List;

public class SExpressionParser {

    private static final int MAX_LONG_DIGITS = 18;

    private String input;
    private String source;
    private int pos;

    public List<SNode> parse(String text) {
        return parse(text, "<input>");
    }

    public List<SNode> parse(String text, String sourceName) {
        this.input = text;
        this.source = sourceName;
        this.pos = 0;
        List<SNode> nodes = new ArrayList<>();
        while (pos < input.length()) {
            skipWhitespaceAndComments();
            if (pos >= input.length()) break;
            if (input.charAt(pos) == '(') {
                nodes.add(parseList());
            } else {
                throw error("'('", describeToken());
            }
        }
        return nodes;
    }

    public SNode.SList parseDocument(String text, String sourceName) {
        List<SNode> nodes = parse(text, sourceName);
        if (nodes.isEmpty()) {
            throw error("'('", "end of input");
        }
        if (nodes.size() > 1) {
            throw new GrammarException(source, 1, 1, 0, "a single top-level list", nodes.size() + " top-level lists");
        }
        return (SNode.SList) nodes.get(0);
    }

    private SNode.SList parseList() {
        int open = pos;
        expect('(');
        List<SNode> children = new ArrayList<>();
        while (pos < input.length()) {
            skipWhitespaceAndComments();
            if (pos >= input.length()) {
                break;
            }
            char c = input.charAt(pos);
            if (c == ')') {
                pos++;
                return new SNode.SList(children);
            } else if (c == '(') {
                children.add(parseList());
            } else if (c == '"') {
                children.add(parseQuotedString());
            } else {
                children.add(parseAtom());
            }
        }
        GrammarException unbalanced = error("')'", "end of input");
        throw new GrammarException(source, unbalanced.getLine(), unbalanced.getColumn(), unbalanced.getOffset(),
                "')' closing the list opened at " + location(open), "end of input");
    }

    private SNode.SString parseQuotedString() {
        int start = pos;
        expect('"');
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '"') {
                pos++;
                return new SNode.SString(sb.toString());
            }
            if (c == '\\' && pos + 1 < input.length()) {
                pos++;
                char escaped = input.charAt(pos);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
            pos++;
        }
        pos = start;
        throw error("closing '\"'", "end of input in string starting here");
    }

    private SNode parseAtom() {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '(' || c == ')' || c == '"' || Character.isWhitespace(c)) {
                break;
            }
            pos++;
        }
        if (pos == start) {
            throw error("atom", describeToken());
        }
        String token = input.substring(start, pos);
        if (SNode.INTEGER.matcher(token).matches()) {
            if (digitCount(token) <= MAX_LONG_DIGITS) {
                return new SNode.SInteger(Long.parseLong(token), token);
            }
            return new SNode.SAtom(token);
        }
        if (SNode.FLOAT.matcher(token).matches()) {
            return new SNode.SFloat(Double.parseDouble(token), token);
        }
        return new SNode.SAtom(token);
    }

    private static int digitCount(String token) {
        return token.startsWith("-") || token.startsWith("+") ? token.length() - 1 : token.length();
    }

    private void skipWhitespaceAndComments() {
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '#') {
                while (pos < input.length() && input.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                break;
            }
        }
    }

    private void expect(char expected) {
        if (pos >= input.length() || input.charAt(pos) != expected) {
            throw error("'" + expected + "'", describeToken());
        }
        pos++;
    }

    private String describeToken() {
        if (pos >= input.length()) {
            return "end of input";
        }
        return "'" + input.charAt(pos) + "'";
    }

    private String location(int offset) {
        int[] lc = lineAndColumn(offset);
        return lc[0] + ":" + lc[1];
    }

    private int[] lineAndColumn(int offset) {
        int line = 1;
        int column = 1;
        for (int i = 0; i < offset && i < input.length(); i++) {
            if (input.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return new int[]{line, column};
    }

    private GrammarException error(String expected, String found) {
        int[] lc = lineAndColumn(pos);
        return new GrammarException(source, lc[0], lc[1], pos, expected, found);
    }
}
