package io.lemma.kernel.tactic;

import java.io.Serial;

/// The step budget ran out. Not caught by `first` or `repeat`: it aborts the whole step.
public class BudgetExceededException extends TacticException {

    @Serial private static final long serialVersionUID = -8839123450982211750L;

    public BudgetExceededException(long budget) {
        super("maximum step budget of " + budget + " exceeded");
    }
}
