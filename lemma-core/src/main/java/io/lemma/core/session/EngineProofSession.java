package io.lemma.core.session;

import io.lemma.core.engine.Diagnostic;
import io.lemma.core.engine.ElaborationFailedException;
import io.lemma.core.engine.EngineSyntaxException;
import io.lemma.core.engine.ExpressionSyntax;
import io.lemma.core.engine.GoalSpec;
import io.lemma.core.engine.GoalView;
import io.lemma.core.engine.NameCandidate;
import io.lemma.core.engine.ProofEngine;
import io.lemma.core.engine.Snapshot;
import io.lemma.core.engine.SourcePosition;
import io.lemma.core.engine.StepFailedException;
import io.lemma.core.engine.StepSyntax;
import io.lemma.core.exception.ProofSessionException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// {@link ProofSession} backed by a single mutable {@link ProofEngine}.
///
/// Branching is simulated with snapshots: every node-addressing operation first
/// restores the addressed node's snapshot, then talks to the engine. The session root
/// is captured from the engine's ambient state when the session is attached.
///
/// ### Step atomicity
/// {@link #applyStep} restores the pre-step snapshot on every failure path, including
/// steps that complete but leave error diagnostics behind, so the node tree never holds
/// a partially applied step.
///
/// @implNote **Not thread-safe**.
public class EngineProofSession implements ProofSession {

    private static final Logger logger = Logger.getLogger(EngineProofSession.class.getName());

    private final ProofEngine engine;
    private final SessionState state;

    /// Attaches a session to an engine, capturing its current context as the root.
    ///
    /// @param engine engine in its ambient starting state, not null
    public EngineProofSession(ProofEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.state = new SessionState(Node.root(engine.captureSnapshot()));
    }

    @Override
    public int applyStep(int sid, String step, long budget) {
        Objects.requireNonNull(step, "step must not be null");
        Snapshot before = restore(sid);

        StepSyntax syntax;
        try {
            syntax = engine.parseStep(step);
        } catch (EngineSyntaxException e) {
            throw ProofSessionException.stepParse(e.getMessage(), e);
        }

        int logged = engine.accumulatedDiagnostics().size();
        try {
            engine.executeStep(syntax, budget);
        } catch (StepFailedException e) {
            engine.restore(before);
            logger.fine("Step failed on node " + sid + ": " + e.getMessage());
            throw ProofSessionException.stepExecution(e.getMessages());
        } catch (RuntimeException e) {
            try {
                engine.restore(before);
            } catch (RuntimeException restoreFailure) {
                e.addSuppressed(restoreFailure);
            }
            throw e;
        }

        List<String> errors = newErrors(logged);
        if (!errors.isEmpty()) {
            engine.restore(before);
            logger.fine("Step on node " + sid + " logged " + errors.size() + " errors");
            throw ProofSessionException.stepExecution(errors);
        }

        int id = state.append(new Node(engine.captureSnapshot(), sid, step));
        logger.fine("Step applied: " + sid + " -> " + id);
        return id;
    }

    private List<String> newErrors(int alreadyLogged) {
        List<Diagnostic> diagnostics = engine.accumulatedDiagnostics();
        return diagnostics.subList(Math.min(alreadyLogged, diagnostics.size()), diagnostics.size())
                .stream()
                .filter(Diagnostic::isError)
                .map(Diagnostic::message)
                .toList();
    }

    @Override
    public List<GoalView> queryState(int sid) {
        restore(sid);
        return engine.currentGoals();
    }

    @Override
    public List<Diagnostic> queryMessages(int sid) {
        restore(sid);
        return engine.accumulatedDiagnostics();
    }

    @Override
    public List<NameCandidate> resolveName(int sid, String name) {
        Objects.requireNonNull(name, "name must not be null");
        restore(sid);
        return engine.resolveGlobalName(name);
    }

    @Override
    public Optional<Map<String, String>> unify(int sid, String lhs, String rhs) {
        restore(sid);
        ExpressionSyntax left = parseExpression(lhs);
        ExpressionSyntax right = parseExpression(rhs);
        try {
            return engine.unify(left, right);
        } catch (ElaborationFailedException e) {
            throw ProofSessionException.elaboration(e.getMessage(), e);
        }
    }

    private ExpressionSyntax parseExpression(String text) {
        try {
            return engine.parseExpression(Objects.requireNonNull(text, "expression text"));
        } catch (EngineSyntaxException e) {
            throw ProofSessionException.expressionParse(e.getMessage(), e);
        }
    }

    @Override
    public int newState(List<GoalSpec> goals) {
        Objects.requireNonNull(goals, "goals must not be null");
        Snapshot snapshot;
        try {
            snapshot = engine.buildContext(goals);
        } catch (EngineSyntaxException e) {
            throw ProofSessionException.expressionParse(e.getMessage(), e);
        } catch (ElaborationFailedException e) {
            throw ProofSessionException.elaboration(e.getMessage(), e);
        }
        int id = state.append(Node.administrative(snapshot, SessionState.ROOT));
        logger.fine("New state with " + goals.size() + " goals: " + id);
        return id;
    }

    @Override
    public int giveUp(int sid) {
        restore(sid);
        engine.admitAllOpenGoals();
        int id = state.append(Node.administrative(engine.captureSnapshot(), sid));
        logger.fine("Goals admitted: " + sid + " -> " + id);
        return id;
    }

    @Override
    public void commit(int sid) {
        restore(sid);
        if (state.stop()) {
            logger.info("Session committed at node " + sid);
        }
    }

    @Override
    public Optional<SourcePosition> position() {
        return engine.currentSourcePosition();
    }

    @Override
    public boolean isRunning() {
        return state.isRunning();
    }

    /// Returns the node tree of this session.
    ///
    /// @return live session state, never null
    public SessionState getState() {
        return state;
    }

    private Snapshot restore(int sid) {
        Snapshot snapshot = state.lookup(sid).snapshot();
        engine.restore(snapshot);
        return snapshot;
    }
}
