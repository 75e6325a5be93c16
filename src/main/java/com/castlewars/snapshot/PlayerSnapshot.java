package com.castlewars.snapshot;

import com.castlewars.model.Army;
import com.castlewars.model.Player;
import com.castlewars.model.Side;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only view of one side: economy, castle, armies and statistics.
 */
public final class PlayerSnapshot {
    public final Side side;
    public final long gold;
    public final long income;
    public final int spawnSlots;
    public final int unitPrice;
    public final long goldNeededToSpawnAll;
    public final int landExtent;
    public final int castleHealth;
    public final int castleMaxHealth;
    public final List<ArmySnapshot> armies;
    public final UpgradeSummary upgrades;

    // statistics
    public final int kills;
    public final int deaths;
    public final long goldEarned;
    public final long damageDealtToUnits;
    public final long damageDealtToCastle;

    public PlayerSnapshot(Player p) {
        this.side = p.getSide();
        this.gold = p.getGold();
        this.income = p.getIncome();
        this.spawnSlots = p.getSpawnSlots();
        this.unitPrice = p.getUnitPrice();
        this.goldNeededToSpawnAll = p.getGoldNeededToSpawnAll();
        this.landExtent = p.getLandExtent();
        this.castleHealth = p.getCastle().getHealth();
        this.castleMaxHealth = p.getCastle().getMaxHealth();
        List<ArmySnapshot> views = new ArrayList<>();
        for (Army army : p.getArmies()) {
            views.add(new ArmySnapshot(army));
        }
        this.armies = Collections.unmodifiableList(views);
        this.upgrades = UpgradeSummary.of(p);
        this.kills = p.getKills();
        this.deaths = p.getDeaths();
        this.goldEarned = p.getGoldEarned();
        this.damageDealtToUnits = p.getDamageDealtToUnits();
        this.damageDealtToCastle = p.getDamageDealtToCastle();
    }
}
