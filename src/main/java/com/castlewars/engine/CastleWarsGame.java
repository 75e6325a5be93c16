package com.castlewars.engine;

import com.castlewars.ai.ComputerOpponent;
import com.castlewars.config.GameProperties;
import com.castlewars.model.Army;
import com.castlewars.model.Castle;
import com.castlewars.model.Player;
import com.castlewars.model.Roster;
import com.castlewars.model.Side;
import com.castlewars.model.Unit;
import com.castlewars.snapshot.BattleSnapshot;
import com.castlewars.snapshot.PlayerSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * One match between the human player and the computer. Owns both players and runs
 * turns: income, spawning, a fixed number of ticks of movement and combat, then regeneration.
 */
public class CastleWarsGame implements Roster {
    private static final Logger LOGGER = LoggerFactory.getLogger(CastleWarsGame.class);

    private final GameProperties properties;
    private final Random random;
    private final Map<Side, Player> players = new EnumMap<>(Side.class);
    private final ComputerOpponent opponent;

    // Starts full so the first finished turn spawns
    private int spawnCounter;
    private int turn = 0;
    private Side winner;

    public CastleWarsGame(GameProperties properties, Random random) {
        this.properties = properties;
        this.random = random;
        for (Side side : Side.values()) {
            players.put(side, new Player(side, properties));
        }
        this.opponent = new ComputerOpponent(getComputer(), getHuman(), properties, random);
        this.spawnCounter = properties.getSpawnRateInTurns();
    }

    @Override
    public Player getPlayer(Side side) {
        return players.get(side);
    }

    public Player getHuman() { return players.get(Side.PLAYER); }
    public Player getComputer() { return players.get(Side.COMPUTER); }

    public BattleSnapshot endTurn(TickListener listener) {
        requireRunning();
        int purchases = opponent.makeTurn(getTurnsToSpawn());
        LOGGER.debug("Turn {}: opponent made {} purchases", turn + 1, purchases);
        return finishTurn(listener);
    }

    public BattleSnapshot finishTurn(TickListener listener) {
        requireRunning();
        turn++;
        for (Player player : players.values()) {
            player.collectIncome();
        }
        spawnArmies();

        int ticks = properties.getTicksPerTurn();
        for (int tick = 1; tick <= ticks; tick++) {
            runTick();
            if (checkGameOver()) {
                BattleSnapshot last = snapshot(tick);
                listener.onTick(last);
                return last;
            }
            for (Player player : players.values()) {
                player.updateIncome();
            }
            listener.onTick(snapshot(tick));
        }

        for (Player player : players.values()) {
            player.regenerate();
        }
        return snapshot(ticks);
    }

    void spawnArmies() {
        if (spawnCounter < properties.getSpawnRateInTurns()) {
            spawnCounter++;
            return;
        }
        spawnCounter = 0;
        for (Player player : players.values()) {
            List<Unit> units = player.spawnUnits();
            if (units.isEmpty()) continue;

            Side side = player.getSide();
            player.addArmy(new Army(side, player.getCastle().getPosition(), units, this, random));
            LOGGER.debug("{} spawned {} units", side, units.size());
        }
    }

    /**
     * One tick: each side in turn fights or marches with every army, then its castle
     * fires. Dead units and empty armies are removed once both sides have acted.
     */
    void runTick() {
        for (Side side : Side.values()) {
            Player player = players.get(side);
            List<Army> enemyArmies = getEnemyOf(side).getArmies();

            for (Army army : new ArrayList<>(player.getArmies())) {
                if (army.isEmpty()) continue;

                // an enemy army is preferred over the castle whenever one is in reach
                if (army.hasTarget() && army.getCurrentTarget() instanceof Castle) {
                    army.acquireTarget(enemyArmies);
                }
                if (army.hasTarget() || army.acquireTarget(enemyArmies)) {
                    army.fight();
                } else {
                    army.move();
                    army.refreshAttackRate();
                    player.resolveArmyCollisions(army);
                }
            }

            Castle castle = player.getCastle();
            if (castle.hasTarget() || castle.acquireTarget(enemyArmies)) {
                player.recordUnitDamage(castle.attack());
            }
        }

        for (Player player : players.values()) {
            player.purgeDead();
        }
    }

    private boolean checkGameOver() {
        if (getHuman().getCastle().getHealth() == 0) {
            winner = Side.COMPUTER;
        } else if (getComputer().getCastle().getHealth() == 0) {
            winner = Side.PLAYER;
        }
        if (winner != null) {
            LOGGER.info("Game over on turn {}: {} wins", turn, winner);
            return true;
        }
        return false;
    }

    private void requireRunning() {
        if (winner != null) throw new IllegalStateException("Game is already over");
    }

    public int getTurnsToSpawn() {
        return properties.getSpawnRateInTurns() - spawnCounter;
    }

    public BattleSnapshot snapshot() {
        return snapshot(0);
    }

    private BattleSnapshot snapshot(int tick) {
        return new BattleSnapshot(turn, tick, getTurnsToSpawn(), properties.getDistance(), winner,
                new PlayerSnapshot(getHuman()), new PlayerSnapshot(getComputer()));
    }

    public boolean isOver() { return winner != null; }
    public Side getWinner() { return winner; }
    public int getTurn() { return turn; }
    public GameProperties getProperties() { return properties; }
}
