package io.lemma.core.engine;

/// Parsed form of a step (tactic) text, produced by {@link ProofEngine#parseStep(String)}.
///
/// The session never inspects it; it is handed back to the same engine for execution.
public interface StepSyntax {}
