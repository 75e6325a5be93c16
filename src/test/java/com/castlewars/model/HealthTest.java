package com.castlewars.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HealthTest {

    @Test
    @DisplayName("Damage clamps at zero")
    void testDamageClampsAtZero() {
        Health health = new Health(10, 0);
        health.damage(4);
        assertEquals(6, health.getCurrent());
        health.damage(100);
        assertEquals(0, health.getCurrent(), "Health must never go negative");
    }

    @Test
    @DisplayName("Regeneration clamps at max")
    void testRegenerationClampsAtMax() {
        Health health = new Health(10, 3);
        health.damage(2);
        health.regenerate();
        assertEquals(10, health.getCurrent(), "Regen must stop at max health");
        health.regenerate();
        assertEquals(10, health.getCurrent());
    }

    @Test
    @DisplayName("Any sequence of damage and regen stays within bounds")
    void testMixedSequenceStaysInBounds() {
        Health health = new Health(20, 7);
        int[] hits = {3, 0, 25, 1, 9, 2, 40, 0, 5};
        for (int hit : hits) {
            health.damage(hit);
            assertTrue(health.getCurrent() >= 0 && health.getCurrent() <= health.getMax());
            health.regenerate();
            assertTrue(health.getCurrent() >= 0 && health.getCurrent() <= health.getMax());
        }
    }

    @Test
    @DisplayName("Raising max health leaves current health alone")
    void testRaiseMaxKeepsCurrent() {
        Health health = new Health(100, 0);
        health.damage(30);
        health.raiseMax(1000);
        assertEquals(70, health.getCurrent());
        assertEquals(1100, health.getMax());
    }

    @Test
    void testNonPositiveMaxRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Health(0, 0));
    }
}
