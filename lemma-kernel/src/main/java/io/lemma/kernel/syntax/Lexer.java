package io.lemma.kernel.syntax;

import io.lemma.core.engine.EngineSyntaxException;
import java.util.ArrayList;
import java.util.List;

/// Splits step and expression text into {@link Token}s.
///
/// Newlines and `;` both separate steps. `->`/`→` and `/\`/`∧` are accepted
/// interchangeably.
final class Lexer {

    private final String source;
    private int pos;

    private Lexer(String source) {
        this.source = source;
    }

    static List<Token> tokenize(String source) throws EngineSyntaxException {
        return new Lexer(source).run();
    }

    private List<Token> run() throws EngineSyntaxException {
        List<Token> tokens = new ArrayList<>();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            int start = pos;
            if (c == '\n' || c == ';') {
                pos++;
                tokens.add(new Token(Token.Type.SEMI, String.valueOf(c), start));
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '(') {
                pos++;
                tokens.add(new Token(Token.Type.LPAREN, "(", start));
            } else if (c == ')') {
                pos++;
                tokens.add(new Token(Token.Type.RPAREN, ")", start));
            } else if (c == '|') {
                pos++;
                tokens.add(new Token(Token.Type.BAR, "|", start));
            } else if (c == '→' || source.startsWith("->", pos)) {
                pos += c == '→' ? 1 : 2;
                tokens.add(new Token(Token.Type.ARROW, "→", start));
            } else if (c == '∧' || source.startsWith("/\\", pos)) {
                pos += c == '∧' ? 1 : 2;
                tokens.add(new Token(Token.Type.AND, "∧", start));
            } else if (c == '?') {
                pos++;
                String name = identifier();
                if (name.isEmpty()) {
                    throw error("expected metavariable name after '?'", start);
                }
                tokens.add(new Token(Token.Type.MVAR, name, start));
            } else if (c == '"') {
                tokens.add(new Token(Token.Type.STRING, string(), start));
            } else if (Character.isDigit(c)) {
                while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    pos++;
                }
                tokens.add(new Token(Token.Type.NUMBER, source.substring(start, pos), start));
            } else if (isIdentifierStart(c)) {
                tokens.add(new Token(Token.Type.IDENT, identifier(), start));
            } else {
                throw error("unexpected character '" + c + "'", start);
            }
        }
        tokens.add(new Token(Token.Type.EOF, "", source.length()));
        return tokens;
    }

    private String identifier() {
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            boolean dotted =
                    c == '.'
                            && pos > start
                            && pos + 1 < source.length()
                            && isIdentifierStart(source.charAt(pos + 1));
            if (isIdentifierPart(c) || dotted) {
                pos++;
            } else {
                break;
            }
        }
        return source.substring(start, pos);
    }

    private String string() throws EngineSyntaxException {
        int start = pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == '"') {
                return sb.toString();
            }
            if (c == '\\' && pos < source.length()) {
                c = source.charAt(pos++);
            }
            sb.append(c);
        }
        throw error("unterminated string literal", start);
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '\'';
    }

    private static EngineSyntaxException error(String message, int offset) {
        return new EngineSyntaxException(message + " at offset " + offset);
    }
}
