package io.lemma.kernel.syntax;

import io.lemma.core.engine.EngineSyntaxException;
import io.lemma.kernel.tactic.Tactic;
import java.util.ArrayList;
import java.util.List;

/// Parser for step text.
///
/// ```
/// seq    := tactic ((';' | newline) tactic)*
/// tactic := 'exact' expr | 'apply' expr | 'intro' IDENT*
///         | 'assumption' | 'constructor' | 'trivial' | 'sorry' | 'admit' | 'skip'
///         | 'fail' STRING? | 'first' ('|' tactic)+ | 'repeat' tactic | '(' seq ')'
/// ```
public final class TacticParser {

    private TacticParser() {}

    /// Parses a complete step.
    ///
    /// @param text step source, not null
    /// @return parsed tactic; a single tactic is not wrapped in a sequence
    /// @throws EngineSyntaxException if the text is empty or malformed
    public static Tactic parse(String text) throws EngineSyntaxException {
        TokenStream tokens = new TokenStream(Lexer.tokenize(text));
        tokens.skipSeparators();
        if (tokens.peek().is(Token.Type.EOF)) {
            throw new EngineSyntaxException("empty step");
        }
        Tactic tactic = parseSequence(tokens);
        Token trailing = tokens.peek();
        if (!trailing.is(Token.Type.EOF)) {
            throw TokenStream.unexpected(trailing, "end of step");
        }
        return tactic;
    }

    private static Tactic parseSequence(TokenStream tokens) throws EngineSyntaxException {
        List<Tactic> steps = new ArrayList<>();
        tokens.skipSeparators();
        steps.add(parseTactic(tokens));
        while (tokens.peek().is(Token.Type.SEMI)) {
            tokens.skipSeparators();
            if (tokens.peek().is(Token.Type.EOF) || tokens.peek().is(Token.Type.RPAREN)) {
                break;
            }
            steps.add(parseTactic(tokens));
        }
        return steps.size() == 1 ? steps.get(0) : new Tactic.Seq(steps);
    }

    private static Tactic parseTactic(TokenStream tokens) throws EngineSyntaxException {
        Token token = tokens.next();
        if (token.is(Token.Type.LPAREN)) {
            tokens.enter();
            Tactic inner = parseSequence(tokens);
            tokens.expect(Token.Type.RPAREN, "')'");
            tokens.exit(1);
            return inner;
        }
        if (!token.is(Token.Type.IDENT)) {
            throw TokenStream.unexpected(token, "tactic");
        }
        return switch (token.text()) {
            case "exact" -> new Tactic.Exact(TermParser.parseExpression(tokens));
            case "apply" -> new Tactic.Apply(TermParser.parseExpression(tokens));
            case "intro" -> new Tactic.Intro(parseNames(tokens));
            case "assumption" -> new Tactic.Assumption();
            case "constructor" -> new Tactic.Constructor();
            case "trivial" -> new Tactic.Trivial();
            case "sorry", "admit" -> new Tactic.Admit();
            case "skip" -> new Tactic.Skip();
            case "fail" ->
                    new Tactic.Fail(
                            tokens.peek().is(Token.Type.STRING)
                                    ? tokens.next().text()
                                    : "failed");
            case "first" -> new Tactic.First(parseAlternatives(tokens));
            case "repeat" -> new Tactic.Repeat(parseNested(tokens));
            default ->
                    throw new EngineSyntaxException(
                            "unknown tactic '" + token.text() + "' at offset " + token.offset());
        };
    }

    private static Tactic parseNested(TokenStream tokens) throws EngineSyntaxException {
        tokens.enter();
        Tactic tactic = parseTactic(tokens);
        tokens.exit(1);
        return tactic;
    }

    private static List<String> parseNames(TokenStream tokens) throws EngineSyntaxException {
        List<String> names = new ArrayList<>();
        while (tokens.peek().is(Token.Type.IDENT)) {
            Token name = tokens.next();
            if (name.text().contains(".")) {
                throw new EngineSyntaxException(
                        "invalid binder name '" + name.text() + "' at offset " + name.offset());
            }
            names.add(name.text());
        }
        return names;
    }

    private static List<Tactic> parseAlternatives(TokenStream tokens)
            throws EngineSyntaxException {
        List<Tactic> alternatives = new ArrayList<>();
        tokens.expect(Token.Type.BAR, "'|'");
        alternatives.add(parseNested(tokens));
        while (tokens.accept(Token.Type.BAR)) {
            alternatives.add(parseNested(tokens));
        }
        return alternatives;
    }
}
