package com.castlewars.service;

/**
 * How many of an item to buy: an exact count, or as many as current gold allows.
 */
public final class Quantity {
    private static final Quantity MAX = new Quantity(0, true);

    private final int count;
    private final boolean max;

    private Quantity(int count, boolean max) {
        this.count = count;
        this.max = max;
    }

    public static Quantity of(int count) {
        if (count <= 0) throw new IllegalArgumentException("Count must be positive: " + count);
        return new Quantity(count, false);
    }

    public static Quantity max() {
        return MAX;
    }

    public int getCount() { return count; }
    public boolean isMax() { return max; }

    @Override
    public String toString() {
        return max ? "max" : String.valueOf(count);
    }
}
