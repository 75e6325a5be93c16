package com.castlewars.engine;

import com.castlewars.snapshot.BattleSnapshot;

@FunctionalInterface
public interface TickListener {

    TickListener NONE = snapshot -> { };

    void onTick(BattleSnapshot snapshot);
}
