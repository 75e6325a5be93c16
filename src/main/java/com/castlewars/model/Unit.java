package com.castlewars.model;

public class Unit implements Combatant {
    private final Side owner;
    private final Health health;
    private final int damage;
    private final int speed;
    private final double attackInterval;
    private final double attackRateThreshold;
    private final int goldReward;

    private double attackRate;
    // Lookup only, never owned
    private Combatant target;

    public Unit(Side owner, int health, int damage, int speed, double attackInterval,
                int regen, int goldReward, double attackRateThreshold) {
        this.owner = owner;
        this.health = new Health(health, regen);
        this.damage = damage;
        this.speed = speed;
        this.attackInterval = attackInterval;
        this.goldReward = goldReward;
        this.attackRateThreshold = attackRateThreshold;
        this.attackRate = Math.max(attackRateThreshold, attackInterval);
    }

    /**
     * Hits the target once per full threshold stored in the accumulator. If no hit
     * lands, the accumulator grows by the attack interval instead.
     *
     * @return raw damage dealt during this call
     */
    public int attack() {
        if (!hasLiveTarget()) {
            throw new IllegalStateException("Unit attacked without a live target");
        }
        int dealt = 0;
        while (attackRate >= attackRateThreshold) {
            target.applyDamage(damage);
            dealt += damage;
            attackRate -= attackRateThreshold;
        }
        if (dealt == 0) {
            attackRate += attackInterval;
        }
        return dealt;
    }

    public void refreshAttackRate() {
        this.attackRate = Math.max(attackRateThreshold, attackInterval);
    }

    public boolean hasLiveTarget() {
        return target != null && target.getHealth() > 0;
    }

    @Override
    public void applyDamage(int amount) {
        health.damage(amount);
    }

    @Override
    public void regenerate() {
        health.regenerate();
    }

    @Override public int getHealth() { return health.getCurrent(); }
    @Override public int getMaxHealth() { return health.getMax(); }
    @Override public int getRegenPerTurn() { return health.getRegenPerTurn(); }

    public Side getOwner() { return owner; }
    public int getDamage() { return damage; }
    public int getSpeed() { return speed; }
    public double getAttackInterval() { return attackInterval; }
    public double getAttackRate() { return attackRate; }
    public int getGoldReward() { return goldReward; }
    public Combatant getTarget() { return target; }
    public void setTarget(Combatant target) { this.target = target; }
}
