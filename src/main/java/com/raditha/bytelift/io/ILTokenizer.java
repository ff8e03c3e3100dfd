package com.raditha.bytelift.io;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits IL text into tokens. Punctuation ({@code { } ( ) , @}) stands alone, string literals are
 * unescaped, {@code ///} lines become documentation tokens, {@code //} lines are dropped and every
 * other run of non-blank characters is a word.
 */
final class ILTokenizer {

    enum Kind {
        WORD,
        STRING,
        PUNCT,
        DOC,
        EOF
    }

    record Token(Kind kind, String text, int line, int column) {

        boolean is(String punctOrWord) {
            return (kind == Kind.PUNCT || kind == Kind.WORD) && text.equals(punctOrWord);
        }

        String describe() {
            return switch (kind) {
                case EOF -> "end of input";
                case STRING -> "string literal";
                case DOC -> "documentation comment";
                default -> "'" + text + "'";
            };
        }
    }

    private static final String PUNCTUATION = "{}(),@";

    private final String text;
    private int pos;
    private int line = 1;
    private int column = 1;

    ILTokenizer(String text) {
        this.text = text;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipBlanks();
            if (pos >= text.length()) {
                tokens.add(new Token(Kind.EOF, "", line, column));
                return tokens;
            }
            int startLine = line;
            int startColumn = column;
            char c = text.charAt(pos);
            if (text.startsWith("///", pos)) {
                advance(3);
                tokens.add(new Token(Kind.DOC, restOfLine().strip(), startLine, startColumn));
            } else if (text.startsWith("//", pos)) {
                restOfLine();
            } else if (PUNCTUATION.indexOf(c) >= 0) {
                advance(1);
                tokens.add(new Token(Kind.PUNCT, String.valueOf(c), startLine, startColumn));
            } else if (c == '"') {
                tokens.add(new Token(Kind.STRING, readString(startLine, startColumn), startLine, startColumn));
            } else {
                int start = pos;
                while (pos < text.length() && isWordChar(text.charAt(pos))) {
                    advance(1);
                }
                tokens.add(new Token(Kind.WORD, text.substring(start, pos), startLine, startColumn));
            }
        }
    }

    private static boolean isWordChar(char c) {
        return !Character.isWhitespace(c) && PUNCTUATION.indexOf(c) < 0 && c != '"';
    }

    private String readString(int startLine, int startColumn) {
        advance(1);
        StringBuilder sb = new StringBuilder();
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '"') {
                advance(1);
                return sb.toString();
            }
            if (c == '\n') {
                break;
            }
            if (c == '\\') {
                if (pos + 1 >= text.length()) {
                    break;
                }
                char escaped = text.charAt(pos + 1);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    default -> throw new ILParseException("Unknown escape \\" + escaped, line, column);
                }
                advance(2);
            } else {
                sb.append(c);
                advance(1);
            }
        }
        throw new ILParseException("Unterminated string literal", startLine, startColumn);
    }

    private String restOfLine() {
        int start = pos;
        while (pos < text.length() && text.charAt(pos) != '\n') {
            advance(1);
        }
        return text.substring(start, pos);
    }

    private void skipBlanks() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            advance(1);
        }
    }

    private void advance(int count) {
        for (int i = 0; i < count; i++) {
            if (text.charAt(pos) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            pos++;
        }
    }
}
