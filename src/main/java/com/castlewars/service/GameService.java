package com.castlewars.service;

import com.castlewars.config.GameProperties;
import com.castlewars.engine.CastleWarsGame;
import com.castlewars.engine.TickListener;
import com.castlewars.model.CastleAttribute;
import com.castlewars.model.Player;
import com.castlewars.model.UnitAttribute;
import com.castlewars.snapshot.BattleSnapshot;
import com.castlewars.snapshot.UpgradeSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds one match per connected session and exposes the action API the client drives it with.
 */
@Service
public class GameService {
    private static final Logger LOGGER = LoggerFactory.getLogger(GameService.class);

    private final Map<String, CastleWarsGame> games = new ConcurrentHashMap<>();
    private final GameProperties properties;

    public GameService(GameProperties properties) {
        this.properties = properties;
    }

    public CastleWarsGame onPlayerConnect(String sessionId) {
        Long seed = properties.getRandomSeed();
        Random random = seed != null ? new Random(seed) : new Random();
        CastleWarsGame game = new CastleWarsGame(properties, random);
        games.put(sessionId, game);
        LOGGER.info("New game for session {}", sessionId);
        return game;
    }

    public void onPlayerDisconnect(String sessionId) {
        games.remove(sessionId);
    }

    public CastleWarsGame getGame(String sessionId) {
        return games.get(sessionId);
    }

    public BattleSnapshot snapshot(String sessionId) {
        CastleWarsGame game = games.get(sessionId);
        if (game == null) return null;
        synchronized (game) {
            return game.snapshot();
        }
    }

    public TurnResult endTurn(String sessionId, TickListener listener) {
        CastleWarsGame game = games.get(sessionId);
        if (game == null) return TurnResult.rejected(ActionResult.NO_GAME);
        synchronized (game) {
            if (game.isOver()) return TurnResult.rejected(ActionResult.GAME_OVER);
            return TurnResult.played(game.endTurn(listener));
        }
    }

    public ActionResult buildSpawn(String sessionId, Quantity quantity) {
        return purchase(sessionId, player -> {
            if (quantity.isMax()) return player.buildMaxSpawnSlots();
            return player.buildSpawnSlots(quantity.getCount()) ? quantity.getCount() : 0;
        });
    }

    public ActionResult upgradeUnit(String sessionId, UnitAttribute attribute, Quantity quantity) {
        return purchase(sessionId, player -> {
            if (quantity.isMax()) return player.upgradeMaxUnitAttribute(attribute);
            return player.upgradeUnitAttribute(attribute, quantity.getCount()) ? quantity.getCount() : 0;
        });
    }

    public ActionResult upgradeCastle(String sessionId, CastleAttribute attribute, Quantity quantity) {
        return purchase(sessionId, player -> {
            if (quantity.isMax()) return player.upgradeMaxCastleAttribute(attribute);
            return player.upgradeCastleAttribute(attribute, quantity.getCount()) ? quantity.getCount() : 0;
        });
    }

    public UpgradeSummary opponentStats(String sessionId) {
        CastleWarsGame game = games.get(sessionId);
        if (game == null) return null;
        synchronized (game) {
            return UpgradeSummary.of(game.getComputer());
        }
    }

    private ActionResult purchase(String sessionId, Purchase purchase) {
        CastleWarsGame game = games.get(sessionId);
        if (game == null) return ActionResult.rejected(ActionResult.NO_GAME);
        synchronized (game) {
            if (game.isOver()) return ActionResult.rejected(ActionResult.GAME_OVER);
            int bought = purchase.apply(game.getHuman());
            if (bought == 0) return ActionResult.rejected(ActionResult.INSUFFICIENT_FUNDS);
            return ActionResult.accepted(bought);
        }
    }

    @FunctionalInterface
    private interface Purchase {
        int apply(Player player);
    }
}
