package com.castlewars.service;

import com.castlewars.snapshot.BattleSnapshot;

/**
 * Outcome of ending a turn: the state after the last tick played, or the reason no turn was played.
 */
public final class TurnResult {
    public final boolean played;
    public final BattleSnapshot last;
    public final String reason;

    private TurnResult(boolean played, BattleSnapshot last, String reason) {
        this.played = played;
        this.last = last;
        this.reason = reason;
    }

    public static TurnResult played(BattleSnapshot last) {
        return new TurnResult(true, last, null);
    }

    public static TurnResult rejected(String reason) {
        return new TurnResult(false, null, reason);
    }
}
