package com.castlewars.ai;

import com.castlewars.model.Player;
import com.castlewars.model.UnitAttribute;
import com.castlewars.snapshot.UpgradeSummary;

import static com.castlewars.ai.OpponentAction.*;

/**
 * Picks the opponent's percentage table for the current situation. Rules are checked
 * top to bottom and a matching rule replaces whatever table was chosen before it.
 */
public class StrategySelector {

    static final StrategyTable BASELINE = StrategyTable.builder()
            .with(SPAWN, 25).with(INCOME, 45).with(UNIT_HEALTH, 10).with(UNIT_DAMAGE, 10)
            .with(UNIT_ATTACK_SPEED, 10).build();

    static final StrategyTable FIRST_SPAWN = StrategyTable.builder().with(SPAWN, 100).build();

    // --- INCOME TIERS ---
    static final StrategyTable INCOME_BELOW_500 = StrategyTable.builder()
            .with(INCOME, 70).with(SPAWN, 20).with(UNIT_HEALTH, 5).with(UNIT_DAMAGE, 3)
            .with(UNIT_ATTACK_SPEED, 1).with(UNIT_REGEN, 1).build();
    static final StrategyTable INCOME_BELOW_5000 = StrategyTable.builder()
            .with(INCOME, 90).with(SPAWN, 5).with(UNIT_HEALTH, 2).with(UNIT_DAMAGE, 1)
            .with(UNIT_ATTACK_SPEED, 1).with(UNIT_REGEN, 1).build();
    static final StrategyTable INCOME_BELOW_10000 = StrategyTable.builder()
            .with(INCOME, 60).with(SPAWN, 10).with(UNIT_HEALTH, 10).with(UNIT_DAMAGE, 10)
            .with(UNIT_ATTACK_SPEED, 9).with(UNIT_REGEN, 1).build();

    static final StrategyTable UNIT_CATCH_UP = StrategyTable.builder()
            .with(SPAWN, 30).with(INCOME, 35).with(UNIT_HEALTH, 15).with(UNIT_DAMAGE, 10)
            .with(UNIT_ATTACK_SPEED, 10).build();
    static final StrategyTable MANY_SPAWNS = StrategyTable.builder()
            .with(SPAWN, 10).with(INCOME, 45).with(UNIT_HEALTH, 15).with(UNIT_DAMAGE, 15)
            .with(UNIT_ATTACK_SPEED, 10).with(UNIT_REGEN, 5).build();

    // --- ENEMY UNIT POWER ---
    static final StrategyTable ENEMY_ABOVE_200 = StrategyTable.builder()
            .with(SPAWN, 10).with(INCOME, 50).with(UNIT_HEALTH, 10).with(UNIT_DAMAGE, 10)
            .with(UNIT_ATTACK_SPEED, 10).with(UNIT_REGEN, 10).build();
    static final StrategyTable ENEMY_ABOVE_500 = StrategyTable.builder()
            .with(SPAWN, 10).with(INCOME, 45).with(UNIT_HEALTH, 10).with(UNIT_DAMAGE, 10)
            .with(UNIT_ATTACK_SPEED, 10).with(UNIT_REGEN, 10).with(CASTLE_HEALTH, 5).build();
    static final StrategyTable ENEMY_ABOVE_1000 = StrategyTable.builder()
            .with(SPAWN, 20).with(INCOME, 40).with(UNIT_HEALTH, 10).with(UNIT_DAMAGE, 10)
            .with(UNIT_ATTACK_SPEED, 10).with(CASTLE_HEALTH, 10).build();
    static final StrategyTable ENEMY_ABOVE_2000 = StrategyTable.builder()
            .with(SPAWN, 20).with(INCOME, 30).with(UNIT_HEALTH, 10).with(UNIT_DAMAGE, 10)
            .with(UNIT_ATTACK_SPEED, 10).with(CASTLE_DAMAGE, 5).with(CASTLE_HEALTH, 15).build();

    static final StrategyTable SAVE_FOR_SPAWN = StrategyTable.builder().with(INCOME, 100).build();

    // --- CASTLE RESCUE ---
    static final StrategyTable CASTLE_SCRATCHED = StrategyTable.builder()
            .with(SPAWN, 10).with(INCOME, 10).with(UNIT_HEALTH, 10).with(UNIT_DAMAGE, 10)
            .with(UNIT_ATTACK_SPEED, 10).with(CASTLE_DAMAGE, 40).with(CASTLE_REGEN, 10).build();
    static final StrategyTable CASTLE_BELOW_90 = StrategyTable.builder()
            .with(SPAWN, 1).with(INCOME, 1).with(UNIT_HEALTH, 1).with(UNIT_DAMAGE, 1)
            .with(UNIT_ATTACK_SPEED, 1).with(UNIT_REGEN, 1).with(CASTLE_DAMAGE, 70)
            .with(CASTLE_REGEN, 19).with(CASTLE_HEALTH, 5).build();
    static final StrategyTable CASTLE_BELOW_40 = StrategyTable.builder()
            .with(SPAWN, 10).with(INCOME, 5).with(UNIT_HEALTH, 5).with(UNIT_DAMAGE, 5)
            .with(UNIT_ATTACK_SPEED, 5).with(UNIT_REGEN, 5).with(CASTLE_DAMAGE, 25)
            .with(CASTLE_REGEN, 20).with(CASTLE_HEALTH, 20).build();

    private final int baseCastleHealth;

    public StrategySelector(int baseCastleHealth) {
        this.baseCastleHealth = baseCastleHealth;
    }

    public StrategyTable choose(Player self, UpgradeSummary enemy, int turnsToSpawn) {
        StrategyTable table = BASELINE;

        // first match only within this group
        if (self.getSpawnSlots() == 0) {
            table = FIRST_SPAWN;
        } else if (self.getIncome() < 500) {
            table = INCOME_BELOW_500;
        } else if (self.getIncome() < 5000) {
            table = INCOME_BELOW_5000;
        } else if (self.getIncome() < 10000) {
            table = INCOME_BELOW_10000;
        } else if (self.getUnitLevel(UnitAttribute.HEALTH) < 4) {
            table = UNIT_CATCH_UP;
        } else if (self.getSpawnSlots() > 2) {
            table = MANY_SPAWNS;
        }

        int enemyUnitLevel = enemy.totalUnitLevel();
        if (enemyUnitLevel > 200) table = ENEMY_ABOVE_200;
        if (enemyUnitLevel > 500) table = ENEMY_ABOVE_500;
        if (enemyUnitLevel > 1000) table = ENEMY_ABOVE_1000;
        if (enemyUnitLevel > 2000) table = ENEMY_ABOVE_2000;

        if (turnsToSpawn > 0) table = SAVE_FOR_SPAWN;

        int castleHealth = self.getCastle().getHealth();
        if (castleHealth < baseCastleHealth) table = CASTLE_SCRATCHED;
        if (castleHealth < baseCastleHealth * 0.9) table = CASTLE_BELOW_90;
        if (castleHealth < baseCastleHealth * 0.4) table = CASTLE_BELOW_40;

        return table;
    }
}
