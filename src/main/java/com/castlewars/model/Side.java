package com.castlewars.model;

public enum Side {
    PLAYER(1),
    COMPUTER(-1);

    private final int direction;

    Side(int direction) {
        this.direction = direction;
    }

    public int getDirection() { return direction; }

    public Side opponent() {
        return this == PLAYER ? COMPUTER : PLAYER;
    }

    public int castlePosition(int distance) {
        return this == PLAYER ? 0 : distance + 1;
    }
}
