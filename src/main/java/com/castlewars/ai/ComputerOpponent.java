package com.castlewars.ai;

import com.castlewars.config.GameProperties;
import com.castlewars.model.Player;
import com.castlewars.snapshot.UpgradeSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

public class ComputerOpponent {
    private static final Logger LOGGER = LoggerFactory.getLogger(ComputerOpponent.class);

    private final Player self;
    private final Player enemy;
    private final GameProperties properties;
    private final StrategySelector selector;
    private final Random random;

    public ComputerOpponent(Player self, Player enemy, GameProperties properties, Random random) {
        this.self = self;
        this.enemy = enemy;
        this.properties = properties;
        this.selector = new StrategySelector(properties.getCastleHealth());
        this.random = random;
    }

    /**
     * Keeps buying while the projected gold at the next spawn still covers all spawn slots.
     *
     * @return number of purchases made
     */
    public int makeTurn(int turnsToSpawn) {
        int purchases = 0;
        while (hasSurplusForSpawn(turnsToSpawn)) {
            if (!act(turnsToSpawn)) break;
            purchases++;
        }
        return purchases;
    }

    boolean hasSurplusForSpawn(int turnsToSpawn) {
        long spawnCost = self.getGoldNeededToSpawnAll();
        return self.getGold() + (self.getIncome() * turnsToSpawn + 1) > spawnCost;
    }

    boolean act(int turnsToSpawn) {
        if (self.getGold() < OpponentAction.cheapest(properties)) return false;

        StrategyTable table = selector.choose(self, UpgradeSummary.of(enemy), turnsToSpawn);
        StrategyTable affordable = table.affordable(self.getGold(), action -> action.cost(properties));
        if (affordable.isEmpty()) return false;

        OpponentAction choice = new WeightedChoice(affordable).choose(random);
        boolean applied = choice.apply(self);
        if (!applied) {
            throw new IllegalStateException("Affordable action " + choice + " was rejected");
        }
        LOGGER.debug("Opponent bought {} (gold left {}, table {})", choice, self.getGold(), table);
        return true;
    }
}
