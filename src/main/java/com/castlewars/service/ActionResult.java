package com.castlewars.service;

/**
 * Outcome of a player action. Rejected actions leave the game untouched.
 */
public final class ActionResult {
    public static final String INSUFFICIENT_FUNDS = "insufficient_funds";
    public static final String GAME_OVER = "game_over";
    public static final String NO_GAME = "no_game";

    public final boolean accepted;
    public final int purchased;
    public final String reason;

    private ActionResult(boolean accepted, int purchased, String reason) {
        this.accepted = accepted;
        this.purchased = purchased;
        this.reason = reason;
    }

    public static ActionResult accepted(int purchased) {
        return new ActionResult(true, purchased, null);
    }

    public static ActionResult rejected(String reason) {
        return new ActionResult(false, 0, reason);
    }
}
