package com.castlewars.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunable constants of a match. Defaults reproduce the classic game.
 * Per-level upgrade deltas and prices are fixed on the attribute enums instead.
 */
@ConfigurationProperties(prefix = "castlewars")
public class GameProperties {

    // --- BATTLEFIELD & TIME ---
    private int distance = 70;
    private int ticksPerTurn = 15;
    private int spawnRateInTurns = 3;

    // --- CASTLE ---
    private int castleHealth = 10000;
    private double castleDamageTaken = 0.1;

    // --- ECONOMY ---
    private long startingGold = 1000;
    private int unitPrice = 5;
    private int killReward = 1;
    private int upgradeGoldReward = 1;
    private int landIncome = 10;
    private int spawnCost = 200;

    // --- UNITS ---
    private double attackRateThreshold = 5;
    private final UnitDefaults unit = new UnitDefaults();

    // Null means a fresh seed per game
    private Long randomSeed;

    private String[] allowedOrigins = {"*"};

    public static class UnitDefaults {
        private int health = 5;
        private int damage = 1;
        private int speed = 1;
        private double attackInterval = 1.0;
        private int regen = 0;

        public int getHealth() { return health; }
        public void setHealth(int health) { this.health = health; }
        public int getDamage() { return damage; }
        public void setDamage(int damage) { this.damage = damage; }
        public int getSpeed() { return speed; }
        public void setSpeed(int speed) { this.speed = speed; }
        public double getAttackInterval() { return attackInterval; }
        public void setAttackInterval(double attackInterval) { this.attackInterval = attackInterval; }
        public int getRegen() { return regen; }
        public void setRegen(int regen) { this.regen = regen; }
    }

    public int getDistance() { return distance; }
    public void setDistance(int distance) { this.distance = distance; }
    public int getTicksPerTurn() { return ticksPerTurn; }
    public void setTicksPerTurn(int ticksPerTurn) { this.ticksPerTurn = ticksPerTurn; }
    public int getSpawnRateInTurns() { return spawnRateInTurns; }
    public void setSpawnRateInTurns(int spawnRateInTurns) { this.spawnRateInTurns = spawnRateInTurns; }
    public int getCastleHealth() { return castleHealth; }
    public void setCastleHealth(int castleHealth) { this.castleHealth = castleHealth; }
    public double getCastleDamageTaken() { return castleDamageTaken; }
    public void setCastleDamageTaken(double castleDamageTaken) { this.castleDamageTaken = castleDamageTaken; }
    public long getStartingGold() { return startingGold; }
    public void setStartingGold(long startingGold) { this.startingGold = startingGold; }
    public int getUnitPrice() { return unitPrice; }
    public void setUnitPrice(int unitPrice) { this.unitPrice = unitPrice; }
    public int getKillReward() { return killReward; }
    public void setKillReward(int killReward) { this.killReward = killReward; }
    public int getUpgradeGoldReward() { return upgradeGoldReward; }
    public void setUpgradeGoldReward(int upgradeGoldReward) { this.upgradeGoldReward = upgradeGoldReward; }
    public int getLandIncome() { return landIncome; }
    public void setLandIncome(int landIncome) { this.landIncome = landIncome; }
    public int getSpawnCost() { return spawnCost; }
    public void setSpawnCost(int spawnCost) { this.spawnCost = spawnCost; }
    public double getAttackRateThreshold() { return attackRateThreshold; }
    public void setAttackRateThreshold(double attackRateThreshold) { this.attackRateThreshold = attackRateThreshold; }
    public UnitDefaults getUnit() { return unit; }
    public Long getRandomSeed() { return randomSeed; }
    public void setRandomSeed(Long randomSeed) { this.randomSeed = randomSeed; }
    public String[] getAllowedOrigins() { return allowedOrigins; }
    public void setAllowedOrigins(String[] allowedOrigins) { this.allowedOrigins = allowedOrigins; }
}
