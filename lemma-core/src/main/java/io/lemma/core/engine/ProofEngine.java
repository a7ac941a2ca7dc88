package io.lemma.core.engine;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Capability interface of the proof-construction engine driven by a session.
///
/// An engine exposes exactly one mutable "current" context. Branching is simulated by
/// the caller: it captures {@link Snapshot}s and restores them before every operation
/// that reads or mutates goal state. The engine never resets its context implicitly
/// between calls.
///
/// ### Contracts
/// - {@link #restore(Snapshot)} is the only way to move the current context to another
///   checkpoint
/// - Query methods ({@link #currentGoals()}, {@link #accumulatedDiagnostics()},
///   {@link #resolveGlobalName(String)}, {@link #currentSourcePosition()}) never mutate
/// - Parse methods never mutate
///
/// @implNote Implementations are **not thread-safe**. A single session thread owns
/// the engine for its whole lifetime.
///
/// @see io.lemma.core.session.EngineProofSession for the restore-before-act driver
/// @see io.lemma.core.engine.spi.EngineProvider for engine discovery
public interface ProofEngine {

    /// Replaces the current context with the given checkpoint.
    ///
    /// @param snapshot a snapshot previously produced by this engine, not null
    /// @throws EngineFaultException if the snapshot was not produced by this engine
    void restore(Snapshot snapshot);

    /// Captures the current context.
    ///
    /// @return immutable snapshot, never null
    Snapshot captureSnapshot();

    /// Returns the open goals of the current context.
    ///
    /// @return goal views in goal order, never null
    List<GoalView> currentGoals();

    /// Parses step text in the current context.
    ///
    /// @param text step source text, not null
    /// @return parsed step, never null
    /// @throws EngineSyntaxException if the text is not a well-formed step
    StepSyntax parseStep(String text) throws EngineSyntaxException;

    /// Executes a parsed step against the current context.
    ///
    /// @param step a step returned by {@link #parseStep(String)}, not null
    /// @param budget maximum number of engine computation steps, `0` for unlimited
    /// @throws StepFailedException if execution fails or exceeds the budget
    void executeStep(StepSyntax step, long budget) throws StepFailedException;

    /// Returns every diagnostic logged in the current context, oldest first.
    ///
    /// @return diagnostics, never null
    List<Diagnostic> accumulatedDiagnostics();

    /// Discharges every open goal of the current context without proof.
    void admitAllOpenGoals();

    /// Builds a fresh context whose goals are the given obligations, with an empty local
    /// context, and makes it current.
    ///
    /// @param goals obligations in goal order, not null
    /// @return snapshot of the new context, never null
    /// @throws EngineSyntaxException if a goal type cannot be parsed
    /// @throws ElaborationFailedException if a goal type is not a well-formed type
    Snapshot buildContext(List<GoalSpec> goals)
            throws EngineSyntaxException, ElaborationFailedException;

    /// Resolves a possibly dotted name against the global environment.
    ///
    /// @param name name to resolve, not null
    /// @return candidates, most specific first, never null (empty if unknown)
    List<NameCandidate> resolveGlobalName(String name);

    /// Parses an expression in the current context.
    ///
    /// @param text expression source text, not null
    /// @return parsed expression, never null
    /// @throws EngineSyntaxException if the text is not a well-formed expression
    ExpressionSyntax parseExpression(String text) throws EngineSyntaxException;

    /// Attempts to unify two parsed expressions.
    ///
    /// The returned map contains every metavariable occurring in either expression, in
    /// order of first occurrence, mapped to its pretty-printed solution or to `null`
    /// when the unifier leaves it unassigned.
    ///
    /// @param lhs left expression, not null
    /// @param rhs right expression, not null
    /// @return the unifier, or empty if none exists
    /// @throws ElaborationFailedException if either expression cannot be elaborated
    Optional<Map<String, String>> unify(ExpressionSyntax lhs, ExpressionSyntax rhs)
            throws ElaborationFailedException;

    /// Returns the source position of the ambient context, if attached to a source.
    ///
    /// @return position, or empty
    Optional<SourcePosition> currentSourcePosition();
}
