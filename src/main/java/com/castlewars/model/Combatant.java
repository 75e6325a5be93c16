package com.castlewars.model;

public interface Combatant extends Target {

    int getMaxHealth();

    int getRegenPerTurn();

    void applyDamage(int amount);

    void regenerate();
}
