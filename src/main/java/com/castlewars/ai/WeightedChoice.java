package com.castlewars.ai;

import java.util.Map;
import java.util.NavigableMap;
import java.util.Random;

/**
 * Weighted random pick over a strategy table. A draw in [1, total] selects the first
 * threshold it does not exceed, so each action wins with exactly its share of the total.
 */
public class WeightedChoice {
    private final NavigableMap<Integer, OpponentAction> thresholds;
    private final int total;

    public WeightedChoice(StrategyTable table) {
        this.thresholds = table.toThresholds();
        this.total = table.total();
    }

    public OpponentAction choose(Random random) {
        if (total == 0) throw new IllegalStateException("Nothing to choose from");
        return select(random.nextInt(total) + 1);
    }

    OpponentAction select(int draw) {
        if (draw < 1 || draw > total) {
            throw new IllegalArgumentException("Draw " + draw + " outside [1, " + total + "]");
        }
        Map.Entry<Integer, OpponentAction> entry = thresholds.ceilingEntry(draw);
        return entry.getValue();
    }

    public NavigableMap<Integer, OpponentAction> getThresholds() { return thresholds; }
    public int getTotal() { return total; }
}
