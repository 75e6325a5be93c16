package com.castlewars.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

public class Army implements Target {
    private final Side side;
    private final int movementDirection;
    private final Roster roster;
    private final Random random;
    private final List<Unit> units = new ArrayList<>();

    private int position;
    // Reserved for per-army speed upgrades
    private final int speed = 1;
    private Target currentTarget;

    public Army(Side side, int position, List<Unit> units, Roster roster, Random random) {
        if (units.isEmpty()) throw new IllegalArgumentException("Army needs at least one unit");
        this.side = side;
        this.position = position;
        this.movementDirection = side.getDirection();
        this.units.addAll(units);
        this.roster = roster;
        this.random = random;
    }

    public static Army findLiveAt(int position, List<Army> armies) {
        for (Army army : armies) {
            if (army.position == position && army.isAlive()) return army;
        }
        return null;
    }

    public void move() {
        position += movementDirection * speed;
    }

    public Castle getEnemyCastle() {
        return roster.getEnemyOf(side).getCastle();
    }

    public boolean isCastleInRange() {
        return Math.abs(position - getEnemyCastle().getPosition()) <= 1;
    }

    public boolean hasTarget() {
        if (currentTarget != null && currentTarget.getHealth() == 0) {
            currentTarget = null;
        }
        return currentTarget != null;
    }

    /**
     * Picks what to fight. Order: an enemy army in this cell, an enemy army in the
     * next cell, then the enemy castle if adjacent. Enemy armies always win over the castle.
     *
     * @return true if a target was acquired
     */
    public boolean acquireTarget(List<Army> enemyArmies) {
        Army enemy = findLiveAt(position, enemyArmies);
        if (enemy == null) {
            enemy = findLiveAt(position + movementDirection, enemyArmies);
        }
        if (enemy != null) {
            currentTarget = enemy;
            for (Unit unit : units) {
                unit.setTarget(enemy.drawLiveUnit(random));
            }
            return true;
        }
        if (isCastleInRange()) {
            Castle castle = getEnemyCastle();
            currentTarget = castle;
            for (Unit unit : units) {
                unit.setTarget(castle);
            }
            return true;
        }
        currentTarget = null;
        return false;
    }

    public void copyTargetFrom(Target other) {
        if (other instanceof Army) {
            Army enemy = (Army) other;
            if (!enemy.isAlive()) return;
            for (Unit unit : units) {
                unit.setTarget(enemy.drawLiveUnit(random));
            }
        } else if (other instanceof Castle) {
            for (Unit unit : units) {
                unit.setTarget((Castle) other);
            }
        }
    }

    public void refreshUnitsTargets() {
        if (!hasTarget() || !(currentTarget instanceof Army)) return;

        Army enemy = (Army) currentTarget;
        for (Unit unit : units) {
            if (!unit.hasLiveTarget() && !(unit.getTarget() instanceof Castle)) {
                unit.setTarget(enemy.drawLiveUnit(random));
            }
        }
    }

    public void fight() {
        Player owner = roster.getPlayer(side);
        for (Unit unit : units) {
            if (!unit.hasLiveTarget()) continue;
            boolean atCastle = unit.getTarget() instanceof Castle;
            int dealt = unit.attack();
            if (atCastle) {
                owner.recordCastleDamage(dealt);
            } else {
                owner.recordUnitDamage(dealt);
            }
        }
        refreshUnitsTargets();
    }

    public void refreshAttackRate() {
        for (Unit unit : units) {
            unit.refreshAttackRate();
        }
    }

    public void regenerateMembers() {
        for (Unit unit : units) {
            unit.regenerate();
        }
    }

    /**
     * Removes dead members, paying each one's reward to the enemy player and
     * crediting the enemy with the kills.
     *
     * @return number of members removed
     */
    public int purgeDeadMembers() {
        Player enemy = roster.getEnemyOf(side);
        List<Unit> alive = new ArrayList<>();
        int dead = 0;
        for (Unit unit : units) {
            if (unit.getHealth() > 0) {
                alive.add(unit);
            } else {
                enemy.receiveGold(unit.getGoldReward());
                dead++;
            }
        }
        units.clear();
        units.addAll(alive);
        enemy.addKills(dead);
        return dead;
    }

    public void transferUnitsTo(Army survivor) {
        copyTargetFrom(survivor.currentTarget);
        survivor.units.addAll(units);
        units.clear();
        currentTarget = null;
    }

    Unit drawLiveUnit(Random random) {
        List<Unit> alive = new ArrayList<>();
        for (Unit unit : units) {
            if (unit.getHealth() > 0) alive.add(unit);
        }
        if (alive.isEmpty()) {
            throw new IllegalStateException("No live unit to target in army at " + position);
        }
        return alive.get(random.nextInt(alive.size()));
    }

    @Override
    public int getHealth() {
        int total = 0;
        for (Unit unit : units) {
            total += unit.getHealth();
        }
        return total;
    }

    public boolean isEmpty() { return units.isEmpty(); }

    public Side getSide() { return side; }
    public int getPosition() { return position; }
    public int getMovementDirection() { return movementDirection; }
    public int getSpeed() { return speed; }
    public Target getCurrentTarget() { return currentTarget; }
    public List<Unit> getUnits() { return Collections.unmodifiableList(units); }
}
