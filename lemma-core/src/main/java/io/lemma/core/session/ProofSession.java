package io.lemma.core.session;

import io.lemma.core.engine.Diagnostic;
import io.lemma.core.engine.GoalSpec;
import io.lemma.core.engine.GoalView;
import io.lemma.core.engine.NameCandidate;
import io.lemma.core.engine.SourcePosition;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Capability set every concrete proof session provides to the protocol layer.
///
/// Each operation that takes a node id (`sid`) acts on the engine state captured at
/// that node and never on whatever state a previous operation left behind. Node ids are
/// the ones returned by {@link #applyStep}, {@link #newState} and {@link #giveUp}; the
/// root is id 0.
///
/// All failures are reported as {@link io.lemma.core.exception.ProofSessionException}.
///
/// @implNote Implementations are **not thread-safe**. Requests are processed strictly
/// one at a time.
///
/// @see EngineProofSession
public interface ProofSession {

    /// Parses and executes a step on node `sid` and records the result as a new node.
    ///
    /// The call is atomic: on any failure the tree is unchanged.
    ///
    /// @param sid node to apply the step to
    /// @param step step source text, not null
    /// @param budget maximum engine computation steps, `0` for unlimited
    /// @return id of the new child node
    /// @throws io.lemma.core.exception.ProofSessionException `INVALID_PARAMS`,
    ///     `STEP_PARSE` or `STEP_EXECUTION`
    int applyStep(int sid, String step, long budget);

    /// Returns the open goals at node `sid`.
    ///
    /// @param sid node to inspect
    /// @return goal views, never null
    List<GoalView> queryState(int sid);

    /// Returns the diagnostics accumulated at node `sid`.
    ///
    /// @param sid node to inspect
    /// @return diagnostics, oldest first, never null
    List<Diagnostic> queryMessages(int sid);

    /// Resolves a global name in the context of node `sid`.
    ///
    /// @param sid node providing the context
    /// @param name possibly dotted name, not null
    /// @return candidates, never null
    List<NameCandidate> resolveName(int sid, String name);

    /// Unifies two expressions in the context of node `sid`.
    ///
    /// @param sid node providing the context
    /// @param lhs left expression text, not null
    /// @param rhs right expression text, not null
    /// @return metavariable assignment (values may be null for unassigned metavariables),
    ///     or empty when no unifier exists
    /// @throws io.lemma.core.exception.ProofSessionException `EXPRESSION_PARSE` or
    ///     `ELABORATION`
    Optional<Map<String, String>> unify(int sid, String lhs, String rhs);

    /// Creates a fresh proof state from explicit obligations as a child of the root.
    ///
    /// @param goals obligations, not null
    /// @return id of the new node
    int newState(List<GoalSpec> goals);

    /// Admits every open goal at node `sid` and records the result as a new node.
    ///
    /// @param sid node whose goals are abandoned
    /// @return id of the new child node
    int giveUp(int sid);

    /// Finishes the session at node `sid`. No node is appended.
    ///
    /// @param sid node the proof is finished at
    void commit(int sid);

    /// Returns the source position of the ambient context.
    ///
    /// @return position, or empty when not attached to a source
    Optional<SourcePosition> position();

    /// Returns whether the session still accepts operations.
    ///
    /// @return false once {@link #commit(int)} succeeded
    boolean isRunning();
}
