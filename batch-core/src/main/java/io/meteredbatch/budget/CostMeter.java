package io.meteredbatch.budget;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Accumulates metered usage into a cost ledger and enforces an optional budget.
 *
 * <p>Cost is accrued before the budget check: the record that crosses the ceiling is kept in the
 * ledger and then signalled to its caller with {@link BudgetExceededException}. There is no
 * rollback. Totals compare against the budget with {@link #EPSILON} tolerance.
 */
public class CostMeter {
    private static final Logger log = LoggerFactory.getLogger(CostMeter.class);

    public static final double EPSILON = 1e-9;

    private final Map<String, Double> unitPrices;
    private final double budgetLimit;

    private final Map<String, CostLedger.Entry> entries = new HashMap<>();
    private double total;
    private boolean exceeded;

    /**
     * @param unitPrices  price per unit for each usage kind
     * @param budgetLimit ceiling in currency units; {@code <= 0} means unlimited
     */
    public CostMeter(Map<String, Double> unitPrices, double budgetLimit) {
        for (Map.Entry<String, Double> e : unitPrices.entrySet()) {
            if (e.getValue() == null || e.getValue() < 0) {
                throw new IllegalArgumentException("price for '" + e.getKey() + "' must be >= 0");
            }
        }
        this.unitPrices = Map.copyOf(unitPrices);
        this.budgetLimit = Math.max(0, budgetLimit);
    }

    public static CostMeter unlimited(Map<String, Double> unitPrices) {
        return new CostMeter(unitPrices, 0);
    }

    /**
     * Adds {@code quantity * price(kind)} to the ledger.
     *
     * @throws BudgetExceededException if the total now meets or exceeds the budget
     * @throws IllegalArgumentException for an unpriced kind or a negative quantity
     */
    public void record(String kind, long quantity) {
        Double price = unitPrices.get(kind);
        if (price == null) {
            throw new IllegalArgumentException("no unit price configured for usage kind '" + kind + "'");
        }
        if (quantity < 0) {
            throw new IllegalArgumentException("quantity must be >= 0: " + quantity);
        }
        double cost = quantity * price;
        double current;
        boolean crossed;
        synchronized (this) {
            entries.merge(kind, new CostLedger.Entry(1, quantity, cost), (a, b) -> a.plus(quantity, cost));
            total += cost;
            current = total;
            crossed = budgetLimit > 0 && current + EPSILON >= budgetLimit;
            if (crossed) exceeded = true;
        }
        if (log.isDebugEnabled()) {
            log.debug("Recorded {} x {} = ${}", quantity, kind, String.format(Locale.ROOT, "%.4f", cost));
        }
        if (crossed) {
            throw new BudgetExceededException(current, budgetLimit);
        }
    }

    public synchronized boolean isExceeded() {
        return exceeded;
    }

    public synchronized double total() {
        return total;
    }

    public double budgetLimit() {
        return budgetLimit;
    }

    public double unitPrice(String kind) {
        Double p = unitPrices.get(kind);
        return p == null ? 0.0 : p;
    }

    public synchronized CostLedger snapshot() {
        return new CostLedger(entries, total, budgetLimit);
    }

    /** Progress display like {@code $12.50/$50.00}. */
    public synchronized String progress() {
        return budgetLimit > 0
                ? String.format(Locale.ROOT, "$%.2f/$%.2f", total, budgetLimit)
                : String.format(Locale.ROOT, "$%.2f", total);
    }

    public synchronized void reset() {
        entries.clear();
        total = 0;
        exceeded = false;
    }
}
