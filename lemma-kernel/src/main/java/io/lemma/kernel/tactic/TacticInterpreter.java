package io.lemma.kernel.tactic;

import io.lemma.core.engine.Diagnostic;
import io.lemma.core.engine.SourcePosition;
import io.lemma.kernel.state.Goal;
import io.lemma.kernel.state.KernelState;
import io.lemma.kernel.state.LocalDecl;
import io.lemma.kernel.term.Environment;
import io.lemma.kernel.term.Term;
import java.util.ArrayList;
import java.util.List;

/// Evaluates {@link Tactic}s against a {@link KernelState}, in place.
///
/// ### Failure model
/// - A failing tactic throws {@link TacticException}; the state may be partially
///   modified and the caller is responsible for restoring it
/// - `exact` with a well-formed term of the wrong type does not throw: it logs an error
///   diagnostic and admits the goal, so the rest of the step can proceed
/// - {@link BudgetExceededException} is never caught by combinators
///
/// @implNote **Not thread-safe**. One interpreter per step execution.
public final class TacticInterpreter {

    private static final Term TRUE = new Term.Const("True");
    public static final String SORRY_WARNING = "declaration uses 'sorry'";

    private final TypeChecker typeChecker;
    private final SourcePosition position;
    private final KernelState state;
    private final StepBudget budget;

    /// Creates an interpreter for one step.
    ///
    /// @param environment global declarations, not null
    /// @param position ambient source position attached to diagnostics, may be null
    /// @param state state to mutate, not null
    /// @param budget budget for this step, not null
    public TacticInterpreter(
            Environment environment,
            SourcePosition position,
            KernelState state,
            StepBudget budget) {
        this.typeChecker = new TypeChecker(environment);
        this.position = position;
        this.state = state;
        this.budget = budget;
    }

    /// Runs a tactic.
    ///
    /// @param tactic tactic to run, not null
    /// @throws TacticException if the tactic fails or the budget is exceeded
    public void run(Tactic tactic) throws TacticException {
        budget.tick();
        if (tactic instanceof Tactic.Seq seq) {
            for (Tactic step : seq.steps()) {
                run(step);
            }
        } else if (tactic instanceof Tactic.First first) {
            runFirst(first);
        } else if (tactic instanceof Tactic.Repeat repeat) {
            runRepeat(repeat);
        } else if (tactic instanceof Tactic.Fail fail) {
            throw new TacticException(fail.message());
        } else if (!(tactic instanceof Tactic.Skip)) {
            runOnMainGoal(tactic, mainGoal());
        }
    }

    private void runOnMainGoal(Tactic tactic, Goal goal) throws TacticException {
        if (tactic instanceof Tactic.Exact exact) {
            exact(exact.term(), goal);
        } else if (tactic instanceof Tactic.Apply apply) {
            apply(apply.term(), goal);
        } else if (tactic instanceof Tactic.Intro intro) {
            intro(intro.names(), goal);
        } else if (tactic instanceof Tactic.Assumption) {
            if (!closeByAssumption(goal)) {
                throw new TacticException(
                        "assumption failed: no hypothesis of type " + goal.target().pretty());
            }
        } else if (tactic instanceof Tactic.Constructor) {
            constructor(goal);
        } else if (tactic instanceof Tactic.Trivial) {
            if (goal.target().equals(TRUE)) {
                state.closeMainGoal();
            } else if (!closeByAssumption(goal)) {
                throw new TacticException("trivial failed on target " + goal.target().pretty());
            }
        } else if (tactic instanceof Tactic.Admit) {
            state.closeMainGoal();
            state.log(Diagnostic.warning(SORRY_WARNING, position));
        } else {
            throw new IllegalStateException("Unhandled tactic: " + tactic);
        }
    }

    private void exact(Term term, Goal goal) throws TacticException {
        Term type = typeChecker.infer(term, goal);
        if (!type.equals(goal.target())) {
            state.log(
                    Diagnostic.error(
                            "type mismatch: "
                                    + term.pretty()
                                    + " has type "
                                    + type.pretty()
                                    + " but is expected to have type "
                                    + goal.target().pretty(),
                            position));
        }
        state.closeMainGoal();
    }

    private void apply(Term term, Goal goal) throws TacticException {
        Term type = typeChecker.infer(term, goal);
        List<Term> premises = new ArrayList<>();
        Term conclusion = type;
        while (!conclusion.equals(goal.target())) {
            if (!(conclusion instanceof Term.Arrow arrow)) {
                throw new TacticException(
                        "apply failed: the conclusion of "
                                + type.pretty()
                                + " does not match the target "
                                + goal.target().pretty());
            }
            premises.add(arrow.domain());
            conclusion = arrow.codomain();
        }
        List<Goal> subgoals = new ArrayList<>();
        for (int i = 0; i < premises.size(); i++) {
            String name =
                    premises.size() == 1 || goal.name().isEmpty()
                            ? goal.name()
                            : goal.name() + "_" + (i + 1);
            subgoals.add(goal.withTarget(premises.get(i)).withName(name));
        }
        state.replaceMainGoal(subgoals);
    }

    private void intro(List<String> names, Goal goal) throws TacticException {
        List<String> binders = names.isEmpty() ? List.of(state.freshName("h")) : names;
        Goal current = goal;
        for (String binder : binders) {
            if (!(current.target() instanceof Term.Arrow arrow)) {
                throw new TacticException(
                        "intro failed: target "
                                + current.target().pretty()
                                + " is not an implication");
            }
            current = current.introduce(new LocalDecl(binder, arrow.domain()), arrow.codomain());
        }
        state.replaceMainGoal(List.of(current));
    }

    private boolean closeByAssumption(Goal goal) {
        for (int i = goal.context().size() - 1; i >= 0; i--) {
            if (goal.context().get(i).type().equals(goal.target())) {
                state.closeMainGoal();
                return true;
            }
        }
        return false;
    }

    private void constructor(Goal goal) throws TacticException {
        if (goal.target() instanceof Term.And and) {
            state.replaceMainGoal(
                    List.of(
                            goal.withTarget(and.left()).withName("left"),
                            goal.withTarget(and.right()).withName("right")));
        } else if (goal.target().equals(TRUE)) {
            state.closeMainGoal();
        } else {
            throw new TacticException("constructor failed on target " + goal.target().pretty());
        }
    }

    private void runFirst(Tactic.First first) throws TacticException {
        TacticException last = null;
        for (Tactic alternative : first.alternatives()) {
            KernelState saved = state.copy();
            try {
                run(alternative);
                return;
            } catch (BudgetExceededException e) {
                throw e;
            } catch (TacticException e) {
                state.assign(saved);
                last = e;
            }
        }
        throw new TacticException("all alternatives failed, last: " + last.getMessage());
    }

    private void runRepeat(Tactic.Repeat repeat) throws TacticException {
        while (true) {
            KernelState saved = state.copy();
            try {
                run(repeat.body());
            } catch (BudgetExceededException e) {
                throw e;
            } catch (TacticException e) {
                state.assign(saved);
                return;
            }
        }
    }

    private Goal mainGoal() throws TacticException {
        if (!state.hasGoals()) {
            throw new TacticException("no goals to be proved");
        }
        return state.mainGoal();
    }
}
