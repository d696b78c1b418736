package org.schemadiff.format.protobuf;

import org.schemadiff.exception.SchemaParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Splits {@code .proto} source into tokens, dropping whitespace and comments.
 */
final class ProtoTokenizer {

    enum Type {
        IDENT,
        NUMBER,
        STRING,
        SYMBOL,
        EOF
    }

    record Token(Type type, String text, int line, int column) {

        boolean is(String value) {
            return type != Type.STRING && text.equals(value);
        }

        String position() {
            return line + ":" + column;
        }
    }

    private final String source;
    private int pos;
    private int line = 1;
    private int column = 1;

    private ProtoTokenizer(String source) {
        this.source = source;
    }

    static List<Token> tokenize(String source) throws SchemaParseException {
        return new ProtoTokenizer(source).run();
    }

    private List<Token> run() throws SchemaParseException {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= source.length()) {
                tokens.add(new Token(Type.EOF, "<eof>", line, column));
                return tokens;
            }
            int startLine = line;
            int startColumn = column;
            char c = source.charAt(pos);
            if (Character.isLetter(c) || c == '_' || (c == '.' && pos + 1 < source.length()
                    && (Character.isLetter(source.charAt(pos + 1)) || source.charAt(pos + 1) == '_'))) {
                tokens.add(new Token(Type.IDENT, readWhile(ch -> Character.isLetterOrDigit(ch) || ch == '_' || ch == '.'),
                        startLine, startColumn));
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1)))) {
                tokens.add(new Token(Type.NUMBER, readWhile(ch -> Character.isLetterOrDigit(ch) || ch == '.'
                        || ch == '+' && isExponent() || ch == '-' && isExponent()), startLine, startColumn));
            } else if (c == '"' || c == '\'') {
                tokens.add(new Token(Type.STRING, readString(c), startLine, startColumn));
            } else if ("{}[]()<>=;,-+:".indexOf(c) >= 0) {
                advance();
                tokens.add(new Token(Type.SYMBOL, String.valueOf(c), startLine, startColumn));
            } else {
                throw new SchemaParseException("Unexpected character '" + c + "' at " + startLine + ":" + startColumn);
            }
        }
    }

    private boolean isExponent() {
        char previous = source.charAt(pos - 1);
        return previous == 'e' || previous == 'E';
    }

    private void skipWhitespaceAndComments() throws SchemaParseException {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c)) {
                advance();
            } else if (source.startsWith("//", pos)) {
                while (pos < source.length() && source.charAt(pos) != '\n') advance();
            } else if (source.startsWith("/*", pos)) {
                int startLine = line;
                int end = source.indexOf("*/", pos + 2);
                if (end < 0) {
                    throw new SchemaParseException("Unterminated block comment starting at line " + startLine);
                }
                while (pos < end + 2) advance();
            } else {
                return;
            }
        }
    }

    private String readWhile(IntPredicate accept) {
        int start = pos;
        while (pos < source.length() && accept.test(source.charAt(pos))) {
            advance();
        }
        return source.substring(start, pos);
    }

    private String readString(char quote) throws SchemaParseException {
        int startLine = line;
        advance();
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == quote) {
                advance();
                return sb.toString();
            }
            if (c == '\n') {
                break;
            }
            if (c == '\\' && pos + 1 < source.length()) {
                advance();
                char escaped = source.charAt(pos);
                sb.append(switch (escaped) {
                    case 'n' -> '\n';
                    case 't' -> '\t';
                    case 'r' -> '\r';
                    default -> escaped;
                });
                advance();
                continue;
            }
            sb.append(c);
            advance();
        }
        throw new SchemaParseException("Unterminated string literal on line " + startLine);
    }

    private void advance() {
        if (source.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }
}
