package io.lemma.kernel.tactic;

/// Cooperative ceiling on tactic evaluations for one step.
///
/// Every tactic evaluation, including each iteration of `repeat` and each alternative
/// tried by `first`, consumes one unit. A limit of `0` is unlimited.
public final class StepBudget {

    private final long limit;
    private long used;

    public StepBudget(long limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("budget must not be negative");
        }
        this.limit = limit;
    }

    public static StepBudget unlimited() {
        return new StepBudget(0);
    }

    /// Consumes one unit.
    ///
    /// @throws BudgetExceededException if the limit is exceeded
    public void tick() throws BudgetExceededException {
        used++;
        if (limit > 0 && used > limit) {
            throw new BudgetExceededException(limit);
        }
    }

    public long getUsed() {
        return used;
    }
}
