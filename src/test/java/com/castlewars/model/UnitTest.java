package com.castlewars.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UnitTest {

    private static Unit unit(int health, int damage, double attackInterval) {
        return new Unit(Side.PLAYER, health, damage, 1, attackInterval, 0, 1, 5);
    }

    @Test
    @DisplayName("First hit spends the full threshold, then the accumulator refills by the interval")
    void testAttackAccumulatorCycle() {
        Unit attacker = unit(5, 1, 1.0);
        Unit target = unit(5, 1, 1.0);
        attacker.setTarget(target);

        assertEquals(5.0, attacker.getAttackRate(), 1e-9, "Accumulator starts at the threshold");
        assertEquals(1, attacker.attack());
        assertEquals(4, target.getHealth());
        assertEquals(0.0, attacker.getAttackRate(), 1e-9);

        for (int i = 1; i <= 5; i++) {
            assertEquals(0, attacker.attack(), "No hit while the accumulator is below the threshold");
            assertEquals(i, attacker.getAttackRate(), 1e-9);
        }
        assertEquals(4, target.getHealth());

        assertEquals(1, attacker.attack(), "Accumulator reached the threshold again");
        assertEquals(3, target.getHealth());
        assertEquals(0.0, attacker.getAttackRate(), 1e-9);
    }

    @Test
    @DisplayName("Surplus in the accumulator gives several hits in one call")
    void testMultipleHitsPerCall() {
        Unit attacker = unit(5, 2, 12.0);
        Unit target = unit(50, 1, 1.0);
        attacker.setTarget(target);

        assertEquals(12.0, attacker.getAttackRate(), 1e-9, "Starts at max(threshold, interval)");
        assertEquals(4, attacker.attack(), "12 -> 7 -> 2: two hits of 2");
        assertEquals(46, target.getHealth());
        assertEquals(2.0, attacker.getAttackRate(), 1e-9);

        assertEquals(0, attacker.attack());
        assertEquals(14.0, attacker.getAttackRate(), 1e-9);
        assertEquals(4, attacker.attack());
        assertEquals(42, target.getHealth());
    }

    @Test
    @DisplayName("Refreshing resets the accumulator without carrying surplus")
    void testRefreshAttackRate() {
        Unit attacker = unit(5, 1, 1.0);
        attacker.setTarget(unit(5, 1, 1.0));
        attacker.attack();
        attacker.attack();
        assertEquals(1.0, attacker.getAttackRate(), 1e-9);

        attacker.refreshAttackRate();
        assertEquals(5.0, attacker.getAttackRate(), 1e-9);
    }

    @Test
    void testHasLiveTarget() {
        Unit attacker = unit(5, 1, 1.0);
        assertFalse(attacker.hasLiveTarget(), "No target set");

        Unit target = unit(5, 1, 1.0);
        attacker.setTarget(target);
        assertTrue(attacker.hasLiveTarget());

        target.applyDamage(5);
        assertFalse(attacker.hasLiveTarget(), "Dead target does not count");
        assertThrows(IllegalStateException.class, attacker::attack);
    }
}
