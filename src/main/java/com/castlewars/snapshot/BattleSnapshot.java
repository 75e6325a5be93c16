package com.castlewars.snapshot;

import com.castlewars.model.Side;

/**
 * Everything a renderer needs for one frame: both sides plus turn bookkeeping.
 */
public final class BattleSnapshot {
    public final int turn;
    public final int tick;
    public final int turnsToSpawn;
    public final int distance;
    public final Side winner;
    public final PlayerSnapshot player;
    public final PlayerSnapshot computer;

    public BattleSnapshot(int turn, int tick, int turnsToSpawn, int distance, Side winner,
                          PlayerSnapshot player, PlayerSnapshot computer) {
        this.turn = turn;
        this.tick = tick;
        this.turnsToSpawn = turnsToSpawn;
        this.distance = distance;
        this.winner = winner;
        this.player = player;
        this.computer = computer;
    }
}
