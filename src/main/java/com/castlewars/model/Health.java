package com.castlewars.model;

/**
 * Health pool shared by units and castles. Current health always stays within [0, max].
 */
public class Health {
    private int current;
    private int max;
    private int regenPerTurn;

    public Health(int max, int regenPerTurn) {
        if (max <= 0) throw new IllegalArgumentException("Max health must be positive: " + max);
        this.max = max;
        this.current = max;
        this.regenPerTurn = regenPerTurn;
    }

    public void damage(int amount) {
        this.current -= amount;
        if (this.current < 0) this.current = 0;
    }

    public void regenerate() {
        if (current < max) {
            current += regenPerTurn;
            if (current > max) current = max;
        }
    }

    // Current health is left untouched
    public void raiseMax(int amount) { this.max += amount; }

    public void raiseRegen(int amount) { this.regenPerTurn += amount; }

    public int getCurrent() { return current; }
    public int getMax() { return max; }
    public int getRegenPerTurn() { return regenPerTurn; }
}
