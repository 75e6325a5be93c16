package com.castlewars.ai;

import com.castlewars.config.GameProperties;
import com.castlewars.model.CastleAttribute;
import com.castlewars.model.Player;
import com.castlewars.model.UnitAttribute;

public enum OpponentAction {
    SPAWN,
    INCOME,
    UNIT_HEALTH,
    UNIT_DAMAGE,
    UNIT_ATTACK_SPEED,
    UNIT_REGEN,
    CASTLE_DAMAGE,
    CASTLE_REGEN,
    CASTLE_HEALTH;

    public int cost(GameProperties properties) {
        switch (this) {
            case SPAWN: return properties.getSpawnCost();
            case INCOME: return CastleAttribute.INCOME.getPrice();
            case UNIT_HEALTH: return UnitAttribute.HEALTH.getPrice();
            case UNIT_DAMAGE: return UnitAttribute.DAMAGE.getPrice();
            case UNIT_ATTACK_SPEED: return UnitAttribute.ATTACK_SPEED.getPrice();
            case UNIT_REGEN: return UnitAttribute.REGEN.getPrice();
            case CASTLE_DAMAGE: return CastleAttribute.DAMAGE.getPrice();
            case CASTLE_REGEN: return CastleAttribute.REGEN.getPrice();
            case CASTLE_HEALTH: return CastleAttribute.HEALTH.getPrice();
            default: throw new IllegalStateException("Unhandled action " + this);
        }
    }

    public boolean apply(Player player) {
        switch (this) {
            case SPAWN: return player.buildSpawnSlots(1);
            case INCOME: return player.upgradeCastleAttribute(CastleAttribute.INCOME, 1);
            case UNIT_HEALTH: return player.upgradeUnitAttribute(UnitAttribute.HEALTH, 1);
            case UNIT_DAMAGE: return player.upgradeUnitAttribute(UnitAttribute.DAMAGE, 1);
            case UNIT_ATTACK_SPEED: return player.upgradeUnitAttribute(UnitAttribute.ATTACK_SPEED, 1);
            case UNIT_REGEN: return player.upgradeUnitAttribute(UnitAttribute.REGEN, 1);
            case CASTLE_DAMAGE: return player.upgradeCastleAttribute(CastleAttribute.DAMAGE, 1);
            case CASTLE_REGEN: return player.upgradeCastleAttribute(CastleAttribute.REGEN, 1);
            case CASTLE_HEALTH: return player.upgradeCastleAttribute(CastleAttribute.HEALTH, 1);
            default: throw new IllegalStateException("Unhandled action " + this);
        }
    }

    public static int cheapest(GameProperties properties) {
        int min = Integer.MAX_VALUE;
        for (OpponentAction action : values()) {
            min = Math.min(min, action.cost(properties));
        }
        return min;
    }
}
