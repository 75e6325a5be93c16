package com.castlewars.model;

public enum CastleAttribute {
    INCOME("income", 10, 100),
    DAMAGE("dmg", 5, 300),
    REGEN("regen", 10, 200),
    HEALTH("hp", 1000, 500);

    private final String key;
    private final int delta;
    private final int price;

    CastleAttribute(String key, int delta, int price) {
        this.key = key;
        this.delta = delta;
        this.price = price;
    }

    public String getKey() { return key; }
    public int getDelta() { return delta; }
    public int getPrice() { return price; }

    public static CastleAttribute fromKey(String key) {
        for (CastleAttribute attribute : values()) {
            if (attribute.key.equalsIgnoreCase(key) || attribute.name().equalsIgnoreCase(key)) {
                return attribute;
            }
        }
        throw new IllegalArgumentException("Unknown castle attribute: " + key);
    }
}
