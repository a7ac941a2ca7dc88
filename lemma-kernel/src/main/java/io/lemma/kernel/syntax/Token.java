package io.lemma.kernel.syntax;

/// A lexical token with its source offset.
///
/// @param type token kind
/// @param text token text; for strings the unquoted contents, for metavariables the
///     name without `?`
/// @param offset zero-based character offset in the source
record Token(Type type, String text, int offset) {

    enum Type {
        IDENT,
        NUMBER,
        MVAR,
        STRING,
        LPAREN,
        RPAREN,
        ARROW,
        AND,
        BAR,
        SEMI,
        EOF
    }

    boolean is(Type expected) {
        return type == expected;
    }

    boolean isKeyword(String keyword) {
        return type == Type.IDENT && text.equals(keyword);
    }

    String describe() {
        return switch (type) {
            case EOF -> "end of input";
            case SEMI -> "end of step";
            case STRING -> "\"" + text + "\"";
            case MVAR -> "'?" + text + "'";
            default -> "'" + text + "'";
        };
    }
}
