package com.castlewars.snapshot;

import com.castlewars.model.CastleAttribute;
import com.castlewars.model.Player;
import com.castlewars.model.UnitAttribute;

/**
 * Upgrade levels and effective values of one player, as either side may see them.
 */
public final class UpgradeSummary {
    public final int unitHealth;
    public final int unitHealthLevel;
    public final int unitDamage;
    public final int unitDamageLevel;
    public final double unitAttackSpeed;
    public final int unitAttackSpeedLevel;
    public final int unitRegen;
    public final int unitRegenLevel;
    public final long castleIncome;
    public final int castleIncomeLevel;
    public final int castleDamage;
    public final int castleDamageLevel;
    public final int castleRegen;
    public final int castleRegenLevel;
    public final int castleMaxHealth;
    public final int castleHealthLevel;
    public final int spawnSlots;

    private UpgradeSummary(Player p) {
        this.unitHealth = p.getUnitHealth();
        this.unitHealthLevel = p.getUnitLevel(UnitAttribute.HEALTH);
        this.unitDamage = p.getUnitDamage();
        this.unitDamageLevel = p.getUnitLevel(UnitAttribute.DAMAGE);
        this.unitAttackSpeed = p.getUnitAttackInterval();
        this.unitAttackSpeedLevel = p.getUnitLevel(UnitAttribute.ATTACK_SPEED);
        this.unitRegen = p.getUnitRegen();
        this.unitRegenLevel = p.getUnitLevel(UnitAttribute.REGEN);
        this.castleIncome = p.getCastleIncome();
        this.castleIncomeLevel = p.getCastleLevel(CastleAttribute.INCOME);
        this.castleDamage = p.getCastle().getAttackDamage();
        this.castleDamageLevel = p.getCastleLevel(CastleAttribute.DAMAGE);
        this.castleRegen = p.getCastle().getRegenPerTurn();
        this.castleRegenLevel = p.getCastleLevel(CastleAttribute.REGEN);
        this.castleMaxHealth = p.getCastle().getMaxHealth();
        this.castleHealthLevel = p.getCastleLevel(CastleAttribute.HEALTH);
        this.spawnSlots = p.getSpawnSlots();
    }

    public static UpgradeSummary of(Player player) {
        return new UpgradeSummary(player);
    }

    public int totalUnitLevel() {
        return unitHealthLevel + unitDamageLevel + unitAttackSpeedLevel + unitRegenLevel;
    }
}
