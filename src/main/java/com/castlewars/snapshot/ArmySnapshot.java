package com.castlewars.snapshot;

import com.castlewars.model.Army;

public final class ArmySnapshot {
    public final int position;
    public final int units;
    public final int health;
    public final boolean fighting;

    public ArmySnapshot(Army army) {
        this.position = army.getPosition();
        this.units = army.getUnits().size();
        this.health = army.getHealth();
        this.fighting = army.getCurrentTarget() != null;
    }
}
