package com.castlewars.model;

public enum UnitAttribute {
    HEALTH("hp", 5, 100),
    DAMAGE("dmg", 1, 100),
    ATTACK_SPEED("attack_speed", 0.1, 100),
    REGEN("regen", 1, 100);

    private final String key;
    private final double delta;
    private final int price;

    UnitAttribute(String key, double delta, int price) {
        this.key = key;
        this.delta = delta;
        this.price = price;
    }

    public String getKey() { return key; }
    public double getDelta() { return delta; }
    public int getPrice() { return price; }

    public static UnitAttribute fromKey(String key) {
        for (UnitAttribute attribute : values()) {
            if (attribute.key.equalsIgnoreCase(key) || attribute.name().equalsIgnoreCase(key)) {
                return attribute;
            }
        }
        throw new IllegalArgumentException("Unknown unit attribute: " + key);
    }
}
