package com.castlewars.model;

import java.util.List;

public class Castle implements Combatant {
    private final Side owner;
    private final int position;
    private final int facingDirection;
    private final double damageTaken;
    private final Health health;
    private int attackDamage;
    private Army target;

    public Castle(Side owner, int position, int health, double damageTaken) {
        this.owner = owner;
        this.position = position;
        this.facingDirection = owner.getDirection();
        this.damageTaken = damageTaken;
        this.health = new Health(health, 0);
    }

    public boolean hasTarget() {
        if (target != null && target.getHealth() == 0) {
            target = null;
        }
        return target != null;
    }

    public boolean acquireTarget(List<Army> enemyArmies) {
        target = Army.findLiveAt(position, enemyArmies);
        if (target == null) {
            target = Army.findLiveAt(position + facingDirection, enemyArmies);
        }
        return target != null;
    }

    public int attack() {
        if (target == null) return 0;

        int dealt = 0;
        for (Unit unit : target.getUnits()) {
            unit.applyDamage(attackDamage);
            dealt += attackDamage;
        }
        if (target.getHealth() == 0) {
            target = null;
        }
        return dealt;
    }

    /**
     * Applies the mitigated share of {@code amount}, rounded half up. Never less than one point.
     */
    @Override
    public void applyDamage(int amount) {
        int mitigated = (int) Math.round(amount * damageTaken);
        if (mitigated <= 0) {
            mitigated = 1;
        }
        health.damage(mitigated);
    }

    @Override
    public void regenerate() {
        health.regenerate();
    }

    public void raiseAttackDamage(int amount) { this.attackDamage += amount; }
    public void raiseRegen(int amount) { health.raiseRegen(amount); }
    public void raiseMaxHealth(int amount) { health.raiseMax(amount); }

    @Override public int getHealth() { return health.getCurrent(); }
    @Override public int getMaxHealth() { return health.getMax(); }
    @Override public int getRegenPerTurn() { return health.getRegenPerTurn(); }

    public Side getOwner() { return owner; }
    public int getPosition() { return position; }
    public int getFacingDirection() { return facingDirection; }
    public int getAttackDamage() { return attackDamage; }
    public Army getTarget() { return target; }
}
