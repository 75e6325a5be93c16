package com.castlewars.handler;

import com.castlewars.model.CastleAttribute;
import com.castlewars.model.UnitAttribute;
import com.castlewars.service.ActionResult;
import com.castlewars.service.GameService;
import com.castlewars.service.Quantity;
import com.castlewars.service.TurnResult;
import com.castlewars.snapshot.BattleSnapshot;
import com.castlewars.snapshot.UpgradeSummary;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;

/**
 * JSON command channel for one match per connection. Replies with state snapshots,
 * one per simulated tick while a turn plays out.
 */
@Component
public class GameWebSocketHandler extends TextWebSocketHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(GameWebSocketHandler.class);

    private final GameService gameService;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public GameWebSocketHandler(GameService gameService) {
        this.gameService = gameService;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        gameService.onPlayerConnect(session.getId());

        // Send initial state
        sendState(session, "state", gameService.snapshot(session.getId()));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) throws Exception {
        gameService.onPlayerDisconnect(session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        String sessionId = session.getId();
        JsonNode json;
        String action;
        try {
            json = objectMapper.readTree(message.getPayload());
            action = json.path("action").asText();
        } catch (IOException e) {
            LOGGER.warn("Malformed message from {}: {}", sessionId, e.getMessage());
            sendRejected(session, "bad_request", null);
            return;
        }

        try {
            if ("end_turn".equals(action)) {
                TurnResult result = gameService.endTurn(sessionId, snapshot -> sendTick(session, snapshot));
                if (!result.played) {
                    sendRejected(session, result.reason, action);
                } else if (result.last.winner != null) {
                    sendState(session, "game_over", result.last);
                } else {
                    sendState(session, "turn_finished", result.last);
                }
            }
            else if ("build_spawn".equals(action)) {
                reply(session, action, gameService.buildSpawn(sessionId, parseQuantity(json)));
            }
            else if ("upgrade_unit".equals(action)) {
                UnitAttribute attribute = UnitAttribute.fromKey(json.path("attribute").asText());
                reply(session, action, gameService.upgradeUnit(sessionId, attribute, parseQuantity(json)));
            }
            else if ("upgrade_castle".equals(action)) {
                CastleAttribute attribute = CastleAttribute.fromKey(json.path("attribute").asText());
                reply(session, action, gameService.upgradeCastle(sessionId, attribute, parseQuantity(json)));
            }
            else if ("opponent_stats".equals(action)) {
                UpgradeSummary stats = gameService.opponentStats(sessionId);
                ObjectNode msg = objectMapper.createObjectNode();
                msg.put("event", "opponent_stats");
                msg.set("stats", objectMapper.valueToTree(stats));
                send(session, msg);
            }
            else if ("state".equals(action)) {
                sendState(session, "state", gameService.snapshot(sessionId));
            }
            else {
                LOGGER.warn("Unknown action '{}' from {}", action, sessionId);
                sendRejected(session, "bad_request", action);
            }
        } catch (IllegalArgumentException e) {
            LOGGER.warn("Rejected '{}' from {}: {}", action, sessionId, e.getMessage());
            sendRejected(session, "bad_request", action);
        }
    }

    /** "count" is a positive whole number, a string of digits, or "max"; absent means one. */
    static Quantity parseQuantity(JsonNode json) {
        JsonNode count = json.get("count");
        if (count == null || count.isNull()) return Quantity.of(1);
        if (count.isIntegralNumber() && count.canConvertToInt()) return Quantity.of(count.intValue());
        if (count.isTextual()) {
            String text = count.asText().trim();
            if ("max".equalsIgnoreCase(text)) return Quantity.max();
            try {
                return Quantity.of(Integer.parseInt(text));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid count: " + count, e);
            }
        }
        throw new IllegalArgumentException("Invalid count: " + count);
    }

    // Send failures must not abort a turn in progress
    private void sendTick(WebSocketSession session, BattleSnapshot snapshot) {
        try {
            sendState(session, "tick", snapshot);
        } catch (IOException e) {
            LOGGER.warn("Dropped tick for {}: {}", session.getId(), e.getMessage());
        }
    }

    private void reply(WebSocketSession session, String action, ActionResult result) throws IOException {
        if (!result.accepted) {
            sendRejected(session, result.reason, action);
            return;
        }
        ObjectNode msg = objectMapper.createObjectNode();
        msg.put("event", "action_accepted");
        msg.put("action", action);
        msg.put("purchased", result.purchased);
        msg.set("state", objectMapper.valueToTree(gameService.snapshot(session.getId())));
        send(session, msg);
    }

    private void sendRejected(WebSocketSession session, String reason, String action) throws IOException {
        ObjectNode msg = objectMapper.createObjectNode();
        msg.put("event", "action_rejected");
        msg.put("reason", reason);
        if (action != null) msg.put("action", action);
        send(session, msg);
    }

    private void sendState(WebSocketSession session, String event, BattleSnapshot snapshot) throws IOException {
        ObjectNode msg = objectMapper.createObjectNode();
        msg.put("event", event);
        msg.set("state", objectMapper.valueToTree(snapshot));
        send(session, msg);
    }

    private void send(WebSocketSession session, ObjectNode msg) throws IOException {
        if (!session.isOpen()) return;
        // Synchronize write to prevent TEXT_PARTIAL_WRITING
        synchronized (session) {
            session.sendMessage(new TextMessage(msg.toString()));
        }
    }
}
