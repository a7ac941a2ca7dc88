package io.lemma.kernel.syntax;

import io.lemma.core.engine.EngineSyntaxException;
import io.lemma.kernel.term.Term;

/// Recursive-descent parser for kernel terms.
///
/// ```
/// expr := conj ('→' expr)?
/// conj := app ('∧' conj)?
/// app  := atom atom*
/// atom := IDENT | NUMBER | '?' IDENT | '(' expr ')'
/// ```
public final class TermParser {

    private TermParser() {}

    /// Parses a complete expression.
    ///
    /// @param text expression source, not null
    /// @return parsed term, never null
    /// @throws EngineSyntaxException if the text is not exactly one expression
    public static Term parse(String text) throws EngineSyntaxException {
        TokenStream tokens = new TokenStream(Lexer.tokenize(text));
        Term term = parseExpression(tokens);
        Token trailing = tokens.peek();
        if (!trailing.is(Token.Type.EOF)) {
            throw TokenStream.unexpected(trailing, "end of expression");
        }
        return term;
    }

    static Term parseExpression(TokenStream tokens) throws EngineSyntaxException {
        Term domain = parseConjunction(tokens);
        if (tokens.accept(Token.Type.ARROW)) {
            tokens.enter();
            Term codomain = parseExpression(tokens);
            tokens.exit(1);
            return new Term.Arrow(domain, codomain);
        }
        return domain;
    }

    private static Term parseConjunction(TokenStream tokens) throws EngineSyntaxException {
        Term left = parseApplication(tokens);
        if (tokens.accept(Token.Type.AND)) {
            tokens.enter();
            Term right = parseConjunction(tokens);
            tokens.exit(1);
            return new Term.And(left, right);
        }
        return left;
    }

    private static Term parseApplication(TokenStream tokens) throws EngineSyntaxException {
        Term term = parseAtom(tokens);
        int spine = 0;
        while (startsAtom(tokens.peek())) {
            // each argument nests the head one App deeper
            tokens.enter();
            spine++;
            term = new Term.App(term, parseAtom(tokens));
        }
        tokens.exit(spine);
        return term;
    }

    private static Term parseAtom(TokenStream tokens) throws EngineSyntaxException {
        Token token = tokens.peek();
        switch (token.type()) {
            case IDENT, NUMBER -> {
                tokens.next();
                return new Term.Const(token.text());
            }
            case MVAR -> {
                tokens.next();
                return new Term.MVar(token.text());
            }
            case LPAREN -> {
                tokens.next();
                tokens.enter();
                Term inner = parseExpression(tokens);
                tokens.expect(Token.Type.RPAREN, "')'");
                tokens.exit(1);
                return inner;
            }
            default -> throw TokenStream.unexpected(token, "term");
        }
    }

    private static boolean startsAtom(Token token) {
        return switch (token.type()) {
            case IDENT, NUMBER, MVAR, LPAREN -> true;
            default -> false;
        };
    }
}
