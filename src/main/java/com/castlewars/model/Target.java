package com.castlewars.model;

public interface Target {

    int getHealth();

    default boolean isAlive() {
        return getHealth() > 0;
    }
}
