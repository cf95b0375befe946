package io.meteredbatch.budget;

import java.util.Locale;
import java.util.Map;

/**
 * Immutable snapshot of the cost meter.
 *
 * @param entries     per-kind accumulators
 * @param total       running total across all kinds
 * @param budgetLimit ceiling, or 0 when no budget is set
 */
public record CostLedger(Map<String, Entry> entries, double total, double budgetLimit) {

    public record Entry(long count, long units, double cost) {
        Entry plus(long quantity, double addedCost) {
            return new Entry(count + 1, units + quantity, cost + addedCost);
        }
    }

    public CostLedger {
        entries = Map.copyOf(entries);
    }

    public boolean hasBudget() {
        return budgetLimit > 0;
    }

    public double budgetRemaining() {
        return hasBudget() ? budgetLimit - total : Double.POSITIVE_INFINITY;
    }

    public double budgetUsedPercent() {
        return hasBudget() ? total / budgetLimit * 100.0 : 0.0;
    }

    public Entry entry(String kind) {
        return entries.getOrDefault(kind, new Entry(0, 0, 0.0));
    }

    public String describe() {
        StringBuilder sb = new StringBuilder("[COST SUMMARY]");
        entries.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> sb.append(String.format(Locale.ROOT, "%n  %s: $%.4f (%d calls, %d units)",
                        e.getKey(), e.getValue().cost(), e.getValue().count(), e.getValue().units())));
        sb.append(String.format(Locale.ROOT, "%n  Total: $%.2f", total));
        if (hasBudget()) {
            sb.append(String.format(Locale.ROOT, "%n  Budget: $%.2f / $%.2f (%.1f%%)", total, budgetLimit, budgetUsedPercent()));
            sb.append(String.format(Locale.ROOT, "%n  Remaining: $%.2f", budgetRemaining()));
        }
        return sb.toString();
    }
}
