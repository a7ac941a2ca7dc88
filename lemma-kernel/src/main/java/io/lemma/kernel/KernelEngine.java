package io.lemma.kernel;

import io.lemma.core.LemmaConfig;
import io.lemma.core.engine.Diagnostic;
import io.lemma.core.engine.ElaborationFailedException;
import io.lemma.core.engine.EngineFaultException;
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
import io.lemma.kernel.state.Goal;
import io.lemma.kernel.state.KernelSnapshot;
import io.lemma.kernel.state.KernelState;
import io.lemma.kernel.syntax.TacticParser;
import io.lemma.kernel.syntax.TermParser;
import io.lemma.kernel.tactic.StepBudget;
import io.lemma.kernel.tactic.Tactic;
import io.lemma.kernel.tactic.TacticException;
import io.lemma.kernel.tactic.TacticInterpreter;
import io.lemma.kernel.term.Environment;
import io.lemma.kernel.term.Term;
import io.lemma.kernel.term.Unifier;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/// Reference {@link ProofEngine}: a small first-order kernel with implication,
/// conjunction and a handful of tactics.
///
/// The ambient starting state has no goals and an empty log. Snapshots are
/// {@link KernelSnapshot}s tagged with the owning engine, so restoring a snapshot from
/// another engine instance is detected as an {@link EngineFaultException}.
///
/// @implNote **Not thread-safe**.
/// @see TacticInterpreter for tactic semantics
public class KernelEngine implements ProofEngine {

    private static final Logger logger = Logger.getLogger(KernelEngine.class.getName());

    private static final AtomicLong INSTANCES = new AtomicLong();

    private final long id = INSTANCES.incrementAndGet();
    private final Environment environment;
    private final SourcePosition position;
    private final List<String> openNamespaces;
    private KernelState state = new KernelState();

    /// Creates an engine with the standard environment and default configuration.
    public KernelEngine() {
        this(Environment.standard(), new LemmaConfig());
    }

    /// Creates an engine.
    ///
    /// @param environment global declarations, not null
    /// @param config supplies the ambient source position and open namespaces, not null
    public KernelEngine(Environment environment, LemmaConfig config) {
        this.environment = environment;
        this.position = config.getSourcePosition();
        this.openNamespaces = config.getOpenNamespaces();
    }

    @Override
    public void restore(Snapshot snapshot) {
        if (!(snapshot instanceof KernelSnapshot kernelSnapshot)
                || kernelSnapshot.owner() != id) {
            throw new EngineFaultException("Snapshot was not produced by this engine: " + snapshot);
        }
        state = KernelState.from(kernelSnapshot);
    }

    @Override
    public Snapshot captureSnapshot() {
        return state.capture(id);
    }

    @Override
    public List<GoalView> currentGoals() {
        return state.getGoals().stream().map(Goal::toView).toList();
    }

    @Override
    public StepSyntax parseStep(String text) throws EngineSyntaxException {
        return TacticParser.parse(text);
    }

    @Override
    public void executeStep(StepSyntax step, long budget) throws StepFailedException {
        if (!(step instanceof Tactic tactic)) {
            throw new EngineFaultException("Step was not parsed by this engine: " + step);
        }
        StepBudget stepBudget = new StepBudget(budget);
        try {
            new TacticInterpreter(environment, position, state, stepBudget).run(tactic);
        } catch (TacticException e) {
            throw new StepFailedException(e.getMessage());
        } finally {
            logger.finer("Step used " + stepBudget.getUsed() + " of budget " + budget);
        }
    }

    @Override
    public List<Diagnostic> accumulatedDiagnostics() {
        return state.getMessages();
    }

    @Override
    public void admitAllOpenGoals() {
        if (state.hasGoals()) {
            state.clearGoals();
            state.log(Diagnostic.warning(TacticInterpreter.SORRY_WARNING, position));
        }
    }

    @Override
    public Snapshot buildContext(List<GoalSpec> goals)
            throws EngineSyntaxException, ElaborationFailedException {
        List<Goal> built = new ArrayList<>();
        for (GoalSpec spec : goals) {
            Term type = TermParser.parse(spec.type());
            Set<String> metavariables = new LinkedHashSet<>();
            Unifier.collectMetavariables(type, metavariables);
            if (!metavariables.isEmpty()) {
                throw new ElaborationFailedException(
                        "type of goal '"
                                + spec.name()
                                + "' contains metavariables: ?"
                                + String.join(", ?", metavariables));
            }
            built.add(new Goal(spec.name(), List.of(), type));
        }
        state = new KernelState(built);
        return captureSnapshot();
    }

    @Override
    public List<NameCandidate> resolveGlobalName(String name) {
        return environment.resolve(name, openNamespaces);
    }

    @Override
    public ExpressionSyntax parseExpression(String text) throws EngineSyntaxException {
        return TermParser.parse(text);
    }

    @Override
    public Optional<Map<String, String>> unify(ExpressionSyntax lhs, ExpressionSyntax rhs)
            throws ElaborationFailedException {
        Term left = elaborate(lhs);
        Term right = elaborate(rhs);
        return Unifier.unify(left, right);
    }

    private Term elaborate(ExpressionSyntax expression) throws ElaborationFailedException {
        if (!(expression instanceof Term term)) {
            throw new EngineFaultException(
                    "Expression was not parsed by this engine: " + expression);
        }
        rejectHigherOrder(term);
        return term;
    }

    private void rejectHigherOrder(Term term) throws ElaborationFailedException {
        if (term instanceof Term.App app) {
            if (app.function() instanceof Term.MVar m) {
                throw new ElaborationFailedException(
                        "higher-order metavariable application is not supported: "
                                + term.pretty()
                                + " (?"
                                + m.name()
                                + " applied to arguments)");
            }
            rejectHigherOrder(app.function());
            rejectHigherOrder(app.argument());
        } else if (term instanceof Term.Arrow arrow) {
            rejectHigherOrder(arrow.domain());
            rejectHigherOrder(arrow.codomain());
        } else if (term instanceof Term.And and) {
            rejectHigherOrder(and.left());
            rejectHigherOrder(and.right());
        }
    }

    @Override
    public Optional<SourcePosition> currentSourcePosition() {
        return Optional.ofNullable(position);
    }
}
