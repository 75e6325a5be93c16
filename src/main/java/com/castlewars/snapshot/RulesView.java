package com.castlewars.snapshot;

import com.castlewars.config.GameProperties;
import com.castlewars.model.CastleAttribute;
import com.castlewars.model.UnitAttribute;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Price list and timing rules of a match, the data behind the in-game help.
 */
public final class RulesView {
    public final int distance;
    public final int ticksPerTurn;
    public final int spawnRateInTurns;
    public final double attackRateThreshold;
    public final int attacksPerTurn;
    public final int unitPrice;
    public final int upgradeGoldReward;
    public final int landIncome;
    public final int spawnCost;
    public final List<UpgradeRule> unitUpgrades;
    public final List<UpgradeRule> castleUpgrades;

    public static final class UpgradeRule {
        public final String attribute;
        public final double delta;
        public final int price;

        UpgradeRule(String attribute, double delta, int price) {
            this.attribute = attribute;
            this.delta = delta;
            this.price = price;
        }
    }

    private RulesView(GameProperties p) {
        this.distance = p.getDistance();
        this.ticksPerTurn = p.getTicksPerTurn();
        this.spawnRateInTurns = p.getSpawnRateInTurns();
        this.attackRateThreshold = p.getAttackRateThreshold();
        this.attacksPerTurn = (int) (p.getTicksPerTurn() / p.getAttackRateThreshold());
        this.unitPrice = p.getUnitPrice();
        this.upgradeGoldReward = p.getUpgradeGoldReward();
        this.landIncome = p.getLandIncome();
        this.spawnCost = p.getSpawnCost();

        List<UpgradeRule> units = new ArrayList<>();
        for (UnitAttribute a : UnitAttribute.values()) {
            units.add(new UpgradeRule(a.getKey(), a.getDelta(), a.getPrice()));
        }
        this.unitUpgrades = Collections.unmodifiableList(units);

        List<UpgradeRule> castle = new ArrayList<>();
        for (CastleAttribute a : CastleAttribute.values()) {
            castle.add(new UpgradeRule(a.getKey(), a.getDelta(), a.getPrice()));
        }
        this.castleUpgrades = Collections.unmodifiableList(castle);
    }

    public static RulesView of(GameProperties properties) {
        return new RulesView(properties);
    }
}
