package com.castlewars.ai;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.function.ToIntFunction;

public class StrategyTable {
    private final Map<OpponentAction, Integer> percentages;

    private StrategyTable(Map<OpponentAction, Integer> percentages) {
        int total = 0;
        for (int percent : percentages.values()) {
            if (percent <= 0) throw new IllegalArgumentException("Percentage must be positive: " + percent);
            total += percent;
        }
        if (total > 100) {
            throw new IllegalArgumentException("Strategy percentages exceed 100: " + total);
        }
        this.percentages = Collections.unmodifiableMap(percentages);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<OpponentAction, Integer> getPercentages() { return percentages; }

    public int total() {
        int total = 0;
        for (int percent : percentages.values()) total += percent;
        return total;
    }

    public boolean isEmpty() { return percentages.isEmpty(); }

    public StrategyTable affordable(long gold, ToIntFunction<OpponentAction> cost) {
        Map<OpponentAction, Integer> filtered = new LinkedHashMap<>();
        for (Map.Entry<OpponentAction, Integer> entry : percentages.entrySet()) {
            if (cost.applyAsInt(entry.getKey()) <= gold) {
                filtered.put(entry.getKey(), entry.getValue());
            }
        }
        return new StrategyTable(filtered);
    }

    /**
     * Cumulative thresholds for weighted selection: actions sorted by ascending
     * percentage, each mapped from the running total. Equal percentages are taken
     * last-listed first.
     * <p>
     * {spawn:35, income:30, unit_hp:10, unit_dmg:10, unit_attack_speed:10, unit_regen:5}
     * becomes {5:unit_regen, 15:unit_attack_speed, 25:unit_dmg, 35:unit_hp, 65:income, 100:spawn}.
     */
    public NavigableMap<Integer, OpponentAction> toThresholds() {
        List<Map.Entry<OpponentAction, Integer>> entries = new ArrayList<>(percentages.entrySet());
        Collections.reverse(entries);
        // stable sort, so ties stay last-listed first
        entries.sort((a, b) -> Integer.compare(a.getValue(), b.getValue()));

        NavigableMap<Integer, OpponentAction> thresholds = new TreeMap<>();
        int running = 0;
        for (Map.Entry<OpponentAction, Integer> entry : entries) {
            running += entry.getValue();
            thresholds.put(running, entry.getKey());
        }
        return thresholds;
    }

    @Override
    public String toString() {
        return percentages.toString();
    }

    public static class Builder {
        private final Map<OpponentAction, Integer> percentages = new LinkedHashMap<>();

        public Builder with(OpponentAction action, int percent) {
            percentages.put(action, percent);
            return this;
        }

        public StrategyTable build() {
            return new StrategyTable(new LinkedHashMap<>(percentages));
        }
    }
}
