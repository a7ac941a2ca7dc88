package io.lemma.core.engine;

/// Parsed form of an expression, produced by {@link ProofEngine#parseExpression(String)}.
public interface ExpressionSyntax {}
