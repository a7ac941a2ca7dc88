package io.lemma.kernel.state;

import io.lemma.core.engine.Diagnostic;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/// The kernel's mutable current context: open goals, message log and the fresh-name
/// counter.
///
/// @implNote **Not thread-safe**. Tactics mutate it in place; {@link #copy()} and
/// {@link #assign(KernelState)} give tactics like `first` local backtracking.
public final class KernelState {

    private final List<Goal> goals;
    private final List<Diagnostic> messages;
    private int fresh;

    public KernelState() {
        this(List.of(), List.of(), 0);
    }

    public KernelState(List<Goal> goals) {
        this(goals, List.of(), 0);
    }

    private KernelState(List<Goal> goals, List<Diagnostic> messages, int fresh) {
        this.goals = new ArrayList<>(goals);
        this.messages = new ArrayList<>(messages);
        this.fresh = fresh;
    }

    public static KernelState from(KernelSnapshot snapshot) {
        return new KernelState(snapshot.goals(), snapshot.messages(), snapshot.fresh());
    }

    public KernelSnapshot capture(long owner) {
        return new KernelSnapshot(owner, goals, messages, fresh);
    }

    public KernelState copy() {
        return new KernelState(goals, messages, fresh);
    }

    /// Overwrites this state with the contents of `other`.
    public void assign(KernelState other) {
        goals.clear();
        goals.addAll(other.goals);
        messages.clear();
        messages.addAll(other.messages);
        fresh = other.fresh;
    }

    public List<Goal> getGoals() {
        return List.copyOf(goals);
    }

    public boolean hasGoals() {
        return !goals.isEmpty();
    }

    /// Returns the main goal.
    ///
    /// @throws NoSuchElementException if no goals remain
    public Goal mainGoal() {
        if (goals.isEmpty()) {
            throw new NoSuchElementException("no goals");
        }
        return goals.get(0);
    }

    /// Replaces the main goal by zero or more subgoals, in order.
    public void replaceMainGoal(List<Goal> subgoals) {
        mainGoal();
        goals.remove(0);
        goals.addAll(0, subgoals);
    }

    public void closeMainGoal() {
        replaceMainGoal(List.of());
    }

    public void clearGoals() {
        goals.clear();
    }

    public List<Diagnostic> getMessages() {
        return List.copyOf(messages);
    }

    public void log(Diagnostic diagnostic) {
        messages.add(diagnostic);
    }

    /// Returns a name based on `base` that no hypothesis of the main goal uses.
    public String freshName(String base) {
        Goal goal = mainGoal();
        String candidate = base;
        while (goal.lookup(candidate).isPresent()) {
            candidate = base + "_" + (++fresh);
        }
        return candidate;
    }
}
