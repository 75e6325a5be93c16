package com.castlewars.model;

import com.castlewars.config.GameProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One side of the match: castle, armies and economy.
 * Gold never goes negative; every purchase is either fully applied or not at all.
 */
public class Player {
    private final Side side;
    private final GameProperties properties;
    private final Castle castle;
    private final List<Army> armies = new ArrayList<>();

    // --- ECONOMY ---
    private long gold;
    private long goldEarned;
    private long income = 0;
    private long castleIncome = 0;
    private int spawnSlots = 0;
    private int unitPrice;
    private int unitGoldReward;

    // --- STATISTICS ---
    private int kills = 0;
    private int deaths = 0;
    private long damageDealtToUnits = 0;
    private long damageDealtToCastle = 0;

    // --- UNIT UPGRADES ---
    private final Map<UnitAttribute, Integer> unitLevels = new EnumMap<>(UnitAttribute.class);
    private int unitHealth;
    private int unitDamage;
    private double unitAttackInterval;
    private int unitRegen;

    // --- CASTLE UPGRADES ---
    private final Map<CastleAttribute, Integer> castleLevels = new EnumMap<>(CastleAttribute.class);

    public Player(Side side, GameProperties properties) {
        this.side = side;
        this.properties = properties;
        this.castle = new Castle(side, side.castlePosition(properties.getDistance()),
                properties.getCastleHealth(), properties.getCastleDamageTaken());
        this.gold = properties.getStartingGold();
        this.goldEarned = properties.getStartingGold();
        this.unitPrice = properties.getUnitPrice();
        this.unitGoldReward = properties.getKillReward();

        for (UnitAttribute attribute : UnitAttribute.values()) unitLevels.put(attribute, 0);
        for (CastleAttribute attribute : CastleAttribute.values()) castleLevels.put(attribute, 0);
        refreshUnitStats();
    }

    public List<Unit> spawnUnits() {
        List<Unit> units = new ArrayList<>();
        for (int i = 0; i < spawnSlots; i++) {
            if (gold < unitPrice) break;
            units.add(new Unit(side, unitHealth, unitDamage, properties.getUnit().getSpeed(),
                    unitAttackInterval, unitRegen, unitGoldReward, properties.getAttackRateThreshold()));
            gold -= unitPrice;
        }
        return units;
    }

    public void addArmy(Army army) {
        armies.add(army);
    }

    // --- PURCHASES ---

    public boolean buildSpawnSlots(int count) {
        requirePositive(count);
        long cost = (long) properties.getSpawnCost() * count;
        if (gold < cost) return false;

        spawnSlots += count;
        gold -= cost;
        return true;
    }

    public int buildMaxSpawnSlots() {
        int count = (int) (gold / properties.getSpawnCost());
        if (count > 0) buildSpawnSlots(count);
        return count;
    }

    /**
     * Raises a unit attribute for future spawns. Each level also raises the unit
     * price and the reward the enemy gets for killing one.
     *
     * @return false without any change if gold does not cover {@code count} levels
     */
    public boolean upgradeUnitAttribute(UnitAttribute attribute, int count) {
        requirePositive(count);
        long cost = (long) attribute.getPrice() * count;
        if (gold < cost) return false;

        unitLevels.merge(attribute, count, Integer::sum);
        refreshUnitStats();
        gold -= cost;
        unitPrice += count * properties.getUpgradeGoldReward();
        unitGoldReward += count * properties.getUpgradeGoldReward();
        return true;
    }

    public int upgradeMaxUnitAttribute(UnitAttribute attribute) {
        int count = (int) (gold / attribute.getPrice());
        if (count > 0) upgradeUnitAttribute(attribute, count);
        return count;
    }

    public boolean upgradeCastleAttribute(CastleAttribute attribute, int count) {
        requirePositive(count);
        long cost = (long) attribute.getPrice() * count;
        if (gold < cost) return false;

        castleLevels.merge(attribute, count, Integer::sum);
        int amount = attribute.getDelta() * count;
        switch (attribute) {
            case INCOME:
                castleIncome += amount;
                income += amount;
                break;
            case DAMAGE:
                castle.raiseAttackDamage(amount);
                break;
            case REGEN:
                castle.raiseRegen(amount);
                break;
            case HEALTH:
                castle.raiseMaxHealth(amount);
                break;
        }
        gold -= cost;
        return true;
    }

    public int upgradeMaxCastleAttribute(CastleAttribute attribute) {
        int count = (int) (gold / attribute.getPrice());
        if (count > 0) upgradeCastleAttribute(attribute, count);
        return count;
    }

    private void refreshUnitStats() {
        GameProperties.UnitDefaults base = properties.getUnit();
        unitHealth = base.getHealth() + (int) Math.round(getUnitLevel(UnitAttribute.HEALTH) * UnitAttribute.HEALTH.getDelta());
        unitDamage = base.getDamage() + (int) Math.round(getUnitLevel(UnitAttribute.DAMAGE) * UnitAttribute.DAMAGE.getDelta());
        unitAttackInterval = base.getAttackInterval() + getUnitLevel(UnitAttribute.ATTACK_SPEED) * UnitAttribute.ATTACK_SPEED.getDelta();
        unitRegen = base.getRegen() + (int) Math.round(getUnitLevel(UnitAttribute.REGEN) * UnitAttribute.REGEN.getDelta());
    }

    private static void requirePositive(int count) {
        if (count <= 0) throw new IllegalArgumentException("Count must be positive: " + count);
    }

    // --- GOLD & INCOME ---

    public void receiveGold(long amount) {
        this.gold += amount;
        this.goldEarned += amount;
    }

    public void collectIncome() {
        receiveGold(income);
    }

    public int getLandExtent() {
        int extent = 0;
        for (Army army : armies) {
            int advanced = (army.getPosition() - castle.getPosition()) * side.getDirection();
            if (advanced > extent) extent = advanced;
        }
        return extent;
    }

    public void updateIncome() {
        this.income = castleIncome + (long) properties.getLandIncome() * getLandExtent();
    }

    // --- ARMIES ---

    public void mergeArmies(Army absorbed, Army survivor) {
        absorbed.transferUnitsTo(survivor);
        armies.remove(absorbed);
    }

    public boolean resolveArmyCollisions(Army army) {
        for (Army other : armies) {
            if (other != army && other.getPosition() == army.getPosition()) {
                mergeArmies(army, other);
                return true;
            }
        }
        return false;
    }

    public void purgeDead() {
        for (Army army : armies) {
            deaths += army.purgeDeadMembers();
        }
        purgeEmptyArmies();
    }

    public void purgeEmptyArmies() {
        armies.removeIf(Army::isEmpty);
    }

    public void regenerate() {
        for (Army army : armies) {
            army.regenerateMembers();
        }
        castle.regenerate();
    }

    // --- STATISTICS ---

    public void addKills(int count) { this.kills += count; }
    public void recordUnitDamage(int amount) { this.damageDealtToUnits += amount; }
    public void recordCastleDamage(int amount) { this.damageDealtToCastle += amount; }

    // Getters
    public Side getSide() { return side; }
    public Castle getCastle() { return castle; }
    public List<Army> getArmies() { return Collections.unmodifiableList(armies); }
    public long getGold() { return gold; }
    public long getGoldEarned() { return goldEarned; }
    public long getIncome() { return income; }
    public long getCastleIncome() { return castleIncome; }
    public int getSpawnSlots() { return spawnSlots; }
    public int getUnitPrice() { return unitPrice; }
    public int getUnitGoldReward() { return unitGoldReward; }
    public long getGoldNeededToSpawnAll() { return (long) unitPrice * spawnSlots; }
    public int getKills() { return kills; }
    public int getDeaths() { return deaths; }
    public long getDamageDealtToUnits() { return damageDealtToUnits; }
    public long getDamageDealtToCastle() { return damageDealtToCastle; }
    public int getUnitLevel(UnitAttribute attribute) { return unitLevels.get(attribute); }
    public int getCastleLevel(CastleAttribute attribute) { return castleLevels.get(attribute); }
    public int getUnitHealth() { return unitHealth; }
    public int getUnitDamage() { return unitDamage; }
    public double getUnitAttackInterval() { return unitAttackInterval; }
    public int getUnitRegen() { return unitRegen; }

    public int getTotalUnitLevel() {
        int total = 0;
        for (int level : unitLevels.values()) total += level;
        return total;
    }
}
