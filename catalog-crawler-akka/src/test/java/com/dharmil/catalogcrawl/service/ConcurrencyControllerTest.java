package com.dharmil.catalogcrawl.service;

import com.dharmil.catalogcrawl.model.DownshiftMeta;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConcurrencyControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void downshiftsOnceWhenFailureRateExceedsThreshold() {
        ConcurrencyController controller = new ConcurrencyController(4, 0.30, 0.5, 10, clock);

        Optional<DownshiftMeta> downshift = controller.observe(19, 9);

        assertTrue(downshift.isPresent());
        DownshiftMeta meta = downshift.get();
        assertEquals(4, meta.oldLimit());
        assertEquals(2, meta.newLimit());
        assertEquals("fail_rate>0.32", meta.trigger());
        assertEquals(NOW, meta.timestamp());
        assertEquals(2, controller.currentLimit());
        assertTrue(controller.state().downshifted());

        assertTrue(controller.observe(19, 20).isEmpty());
        assertEquals(2, controller.currentLimit());
    }

    @Test
    void waitsForMinimumSample() {
        ConcurrencyController controller = new ConcurrencyController(4, 0.30, 0.5, 10, clock);
        assertTrue(controller.observe(0, 9).isEmpty());
        assertFalse(controller.downshifted());
        assertTrue(controller.observe(1, 9).isPresent());
    }

    @Test
    void rateAtThresholdDoesNotDownshift() {
        ConcurrencyController controller = new ConcurrencyController(4, 0.30, 0.5, 10, clock);
        assertTrue(controller.observe(7, 3).isEmpty());
        assertEquals(4, controller.currentLimit());
    }

    @Test
    void limitNeverDropsBelowOne() {
        ConcurrencyController controller = new ConcurrencyController(1, 0.30, 0.5, 1, clock);
        DownshiftMeta meta = controller.observe(0, 5).orElseThrow();
        assertEquals(1, meta.oldLimit());
        assertEquals(1, meta.newLimit());
        assertEquals("fail_rate>1.00", meta.trigger());
    }

    @Test
    void rejectsFactorOutsideOpenUnitInterval() {
        assertThrows(IllegalArgumentException.class, () -> new ConcurrencyController(4, 0.3, 1.0, 10, clock));
        assertThrows(IllegalArgumentException.class, () -> new ConcurrencyController(0, 0.3, 0.5, 10, clock));
    }
}
