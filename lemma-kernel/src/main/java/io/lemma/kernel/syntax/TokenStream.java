package io.lemma.kernel.syntax;

import io.lemma.core.engine.EngineSyntaxException;
import java.util.List;

/// Cursor over a token list shared by the term and tactic parsers.
///
/// Also tracks how deeply the parsers have nested. Terms and tactics are printed,
/// compared, unified and executed recursively, so the depth is capped at
/// {@link #MAX_DEPTH} while parsing.
final class TokenStream {

    /// Maximum nesting of parentheses, arrow and conjunction chains, application
    /// spines and tactic combinators in one parse.
    static final int MAX_DEPTH = 512;

    private final List<Token> tokens;
    private int index;
    private int depth;

    TokenStream(List<Token> tokens) {
        this.tokens = tokens;
    }

    Token peek() {
        return tokens.get(index);
    }

    Token next() {
        Token token = tokens.get(index);
        if (!token.is(Token.Type.EOF)) {
            index++;
        }
        return token;
    }

    boolean accept(Token.Type type) {
        if (peek().is(type)) {
            next();
            return true;
        }
        return false;
    }

    Token expect(Token.Type type, String what) throws EngineSyntaxException {
        Token token = peek();
        if (!token.is(type)) {
            throw unexpected(token, what);
        }
        return next();
    }

    /// Opens one nesting level.
    ///
    /// @throws EngineSyntaxException if the nesting exceeds {@link #MAX_DEPTH}
    void enter() throws EngineSyntaxException {
        if (++depth > MAX_DEPTH) {
            throw new EngineSyntaxException(
                    "expression nested too deeply (limit "
                            + MAX_DEPTH
                            + ") at offset "
                            + peek().offset());
        }
    }

    void exit(int levels) {
        depth -= levels;
    }

    void skipSeparators() {
        while (accept(Token.Type.SEMI)) {
            // consecutive separators are insignificant
        }
    }

    static EngineSyntaxException unexpected(Token token, String expected) {
        return new EngineSyntaxException(
                "unexpected "
                        + token.describe()
                        + "; expected "
                        + expected
                        + " at offset "
                        + token.offset());
    }
}
