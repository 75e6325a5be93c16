package com.castlewars.model;

import com.castlewars.config.GameProperties;
import com.castlewars.engine.CastleWarsGame;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class PlayerTest {

    private GameProperties props;
    private CastleWarsGame game;
    private Player player;

    @BeforeEach
    void setUp() {
        props = new GameProperties();
        props.setDistance(10);
        game = new CastleWarsGame(props, new Random(3));
        player = game.getHuman();
    }

    @Test
    void testStartingState() {
        assertEquals(1000, player.getGold());
        assertEquals(1000, player.getGoldEarned());
        assertEquals(0, player.getIncome());
        assertEquals(0, player.getSpawnSlots());
        assertEquals(5, player.getUnitPrice());
        assertEquals(0, player.getCastle().getPosition());
        assertEquals(11, game.getComputer().getCastle().getPosition());
        assertEquals(10000, player.getCastle().getHealth());
    }

    @Test
    @DisplayName("Spawn slots are bought all at once or not at all")
    void testBuildSpawnSlotsAtomic() {
        assertFalse(player.buildSpawnSlots(6), "6 x 200 exceeds 1000 gold");
        assertEquals(1000, player.getGold());
        assertEquals(0, player.getSpawnSlots());

        assertTrue(player.buildSpawnSlots(2));
        assertEquals(600, player.getGold());
        assertEquals(2, player.getSpawnSlots());
    }

    @Test
    void testBuildMaxSpawnSlots() {
        player.receiveGold(150);
        assertEquals(5, player.buildMaxSpawnSlots());
        assertEquals(150, player.getGold());
        assertEquals(0, new Player(Side.COMPUTER, zeroGold()).buildMaxSpawnSlots());
    }

    @Test
    void testNonPositiveCountRejected() {
        assertThrows(IllegalArgumentException.class, () -> player.buildSpawnSlots(0));
        assertThrows(IllegalArgumentException.class, () -> player.upgradeUnitAttribute(UnitAttribute.HEALTH, -1));
        assertThrows(IllegalArgumentException.class, () -> player.upgradeCastleAttribute(CastleAttribute.INCOME, 0));
    }

    @Test
    @DisplayName("Unit upgrades raise stats, unit price and kill reward")
    void testUnitUpgrade() {
        assertTrue(player.upgradeUnitAttribute(UnitAttribute.HEALTH, 2));
        assertEquals(800, player.getGold());
        assertEquals(2, player.getUnitLevel(UnitAttribute.HEALTH));
        assertEquals(15, player.getUnitHealth());
        assertEquals(7, player.getUnitPrice());
        assertEquals(3, player.getUnitGoldReward());

        assertTrue(player.upgradeUnitAttribute(UnitAttribute.ATTACK_SPEED, 3));
        assertEquals(1.3, player.getUnitAttackInterval(), 1e-9);
        assertEquals(10, player.getUnitPrice());
        assertEquals(5, player.getTotalUnitLevel());
    }

    @Test
    void testUnitUpgradeInsufficientGold() {
        assertFalse(player.upgradeUnitAttribute(UnitAttribute.DAMAGE, 11));
        assertEquals(1000, player.getGold());
        assertEquals(0, player.getUnitLevel(UnitAttribute.DAMAGE));
        assertEquals(1, player.getUnitDamage());
        assertEquals(5, player.getUnitPrice());
    }

    @Test
    void testUpgradeMaxUnitAttribute() {
        player.receiveGold(50);
        assertEquals(10, player.upgradeMaxUnitAttribute(UnitAttribute.REGEN));
        assertEquals(50, player.getGold());
        assertEquals(10, player.getUnitRegen());
    }

    @Test
    @DisplayName("Spawned units carry the current upgrade values")
    void testSpawnUsesUpgrades() {
        player.buildSpawnSlots(1);
        player.upgradeUnitAttribute(UnitAttribute.DAMAGE, 1);

        List<Unit> units = player.spawnUnits();
        assertEquals(1, units.size());
        assertEquals(2, units.get(0).getDamage());
        assertEquals(2, units.get(0).getGoldReward());
        assertEquals(800 - 100 - 6, player.getGold());
    }

    @Test
    @DisplayName("Spawning stops when gold runs short of the unit price")
    void testSpawnLimitedByGold() {
        player.buildSpawnSlots(5);
        assertEquals(0, player.getGold());
        assertTrue(player.spawnUnits().isEmpty());

        player.receiveGold(12);
        assertEquals(2, player.spawnUnits().size());
        assertEquals(2, player.getGold());
        assertEquals(25, player.getGoldNeededToSpawnAll());
    }

    @Test
    void testCastleIncomeUpgrade() {
        assertTrue(player.upgradeCastleAttribute(CastleAttribute.INCOME, 3));
        assertEquals(700, player.getGold());
        assertEquals(30, player.getIncome());
        assertEquals(30, player.getCastleIncome());

        player.collectIncome();
        assertEquals(730, player.getGold());
        assertEquals(1030, player.getGoldEarned());
    }

    @Test
    @DisplayName("Castle health upgrade raises the maximum only")
    void testCastleHealthUpgrade() {
        player.getCastle().applyDamage(10000);
        assertTrue(player.upgradeCastleAttribute(CastleAttribute.HEALTH, 2));
        assertEquals(9000, player.getCastle().getHealth());
        assertEquals(12000, player.getCastle().getMaxHealth());
        assertEquals(2, player.getCastleLevel(CastleAttribute.HEALTH));
    }

    @Test
    void testCastleDamageAndRegenUpgrade() {
        assertTrue(player.upgradeCastleAttribute(CastleAttribute.DAMAGE, 1));
        assertTrue(player.upgradeCastleAttribute(CastleAttribute.REGEN, 2));
        assertEquals(5, player.getCastle().getAttackDamage());
        assertEquals(20, player.getCastle().getRegenPerTurn());
        assertEquals(300, player.getGold());
        assertFalse(player.upgradeCastleAttribute(CastleAttribute.HEALTH, 1));
        assertEquals(300, player.getGold());
    }

    @Test
    @DisplayName("Income follows the furthest army plus castle income")
    void testLandIncome() {
        player.upgradeCastleAttribute(CastleAttribute.INCOME, 1);
        player.addArmy(new Army(Side.PLAYER, 2, Arrays.asList(unit()), game, new Random(1)));
        player.addArmy(new Army(Side.PLAYER, 6, Arrays.asList(unit()), game, new Random(1)));
        assertEquals(6, player.getLandExtent());

        player.updateIncome();
        assertEquals(10 + 60, player.getIncome());

        Player computer = game.getComputer();
        computer.addArmy(new Army(Side.COMPUTER, 8, Arrays.asList(unit()), game, new Random(1)));
        assertEquals(3, computer.getLandExtent());
        computer.updateIncome();
        assertEquals(30, computer.getIncome());
    }

    @Test
    void testResolveArmyCollisions() {
        Army first = new Army(Side.PLAYER, 4, Arrays.asList(unit()), game, new Random(1));
        Army second = new Army(Side.PLAYER, 4, Arrays.asList(unit(), unit()), game, new Random(1));
        Army elsewhere = new Army(Side.PLAYER, 5, Arrays.asList(unit()), game, new Random(1));
        player.addArmy(first);
        player.addArmy(second);
        player.addArmy(elsewhere);

        assertFalse(player.resolveArmyCollisions(elsewhere));
        assertTrue(player.resolveArmyCollisions(second));
        assertEquals(2, player.getArmies().size());
        assertEquals(3, first.getUnits().size());
        assertFalse(player.getArmies().contains(second));
    }

    @Test
    @DisplayName("Purging counts deaths and drops emptied armies")
    void testPurgeDead() {
        Unit doomed = unit();
        Army army = new Army(Side.PLAYER, 4, Arrays.asList(doomed), game, new Random(1));
        player.addArmy(army);
        doomed.applyDamage(5);

        player.purgeDead();
        assertEquals(1, player.getDeaths());
        assertTrue(player.getArmies().isEmpty());
        assertEquals(1, game.getComputer().getKills());
        assertEquals(1001, game.getComputer().getGold());
    }

    private static Unit unit() {
        return new Unit(Side.PLAYER, 5, 1, 1, 1.0, 0, 1, 5);
    }

    private GameProperties zeroGold() {
        GameProperties poor = new GameProperties();
        poor.setStartingGold(0);
        return poor;
    }
}
