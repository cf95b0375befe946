package io.meteredbatch.budget;

import java.util.Locale;

/**
 * Raised by the cost meter on the accrual that brings the running total to or past the budget.
 */
public class BudgetExceededException extends RuntimeException {
    private final double currentCost;
    private final double budgetLimit;

    public BudgetExceededException(double currentCost, double budgetLimit) {
        super(String.format(Locale.ROOT, "Budget exceeded: $%.2f / $%.2f", currentCost, budgetLimit));
        this.currentCost = currentCost;
        this.budgetLimit = budgetLimit;
    }

    public double currentCost() { return currentCost; }
    public double budgetLimit() { return budgetLimit; }
}
