package com.castlewars.model;

public interface Roster {

    Player getPlayer(Side side);

    default Player getEnemyOf(Side side) {
        return getPlayer(side.opponent());
    }
}
