package com.qqsuccubus.pubsub.core.subscribe;

import com.qqsuccubus.pubsub.core.metrics.DeliveryMetrics;
import com.qqsuccubus.pubsub.core.metrics.MetricsNames;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DeliveryMonitor on virtual time.
 */
class DeliveryMonitorTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");
    private static final Duration INTERVAL = Duration.ofSeconds(10);
    private static final Duration IDLE_THRESHOLD = Duration.ofSeconds(30);

    private VirtualTimeScheduler scheduler;
    private SimpleMeterRegistry registry;
    private DeliveryMonitor monitor;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        registry = new SimpleMeterRegistry();
        monitor = new DeliveryMonitor(INTERVAL, IDLE_THRESHOLD, scheduler,
            Clock.fixed(NOW, ZoneOffset.UTC), new DeliveryMetrics(registry));
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    private double checks(String channel, String result) {
        return registry.get(MetricsNames.MONITOR_CHECKS_TOTAL)
            .tag("channel", channel)
            .tag("result", result)
            .counter()
            .count();
    }

    @Test
    @DisplayName("Idle channel is checked on every tick")
    void testIdleChannelChecked() {
        StubChecker checker = new StubChecker("idle", NOW.minus(Duration.ofMinutes(1)));

        Disposable watch = monitor.watch(checker);
        scheduler.advanceTimeBy(Duration.ofSeconds(30));

        assertEquals(3, checker.checks.get());
        assertEquals(3.0, checks("idle", "ok"));
        watch.dispose();
    }

    @Test
    @DisplayName("Nothing happens before the first interval elapses")
    void testNoCheckBeforeFirstTick() {
        StubChecker checker = new StubChecker("idle", Instant.EPOCH);

        Disposable watch = monitor.watch(checker);
        scheduler.advanceTimeBy(Duration.ofSeconds(9));

        assertEquals(0, checker.checks.get());
        watch.dispose();
    }

    @Test
    @DisplayName("Recently active channel is not checked")
    void testActiveChannelSkipped() {
        StubChecker checker = new StubChecker("busy", NOW.minus(Duration.ofSeconds(5)));

        Disposable watch = monitor.watch(checker);
        scheduler.advanceTimeBy(Duration.ofMinutes(1));

        assertEquals(0, checker.checks.get());
        watch.dispose();
    }

    @Test
    @DisplayName("Failed check is counted and the loop keeps running")
    void testFailingCheckKeepsLoopAlive() {
        StubChecker checker = new StubChecker("broken", Instant.EPOCH);
        checker.failure = new IllegalStateException("store unavailable");

        Disposable watch = monitor.watch(checker);
        scheduler.advanceTimeBy(Duration.ofSeconds(20));

        assertEquals(2, checker.checks.get());
        assertEquals(2.0, checks("broken", "failed"));
        assertFalse(watch.isDisposed());

        checker.failure = null;
        scheduler.advanceTimeBy(INTERVAL);

        assertEquals(3, checker.checks.get());
        assertEquals(1.0, checks("broken", "ok"));
        watch.dispose();
    }

    @Test
    @DisplayName("Disposing the watch stops further checks")
    void testDisposeStopsLoop() {
        StubChecker checker = new StubChecker("idle", Instant.EPOCH);

        Disposable watch = monitor.watch(checker);
        scheduler.advanceTimeBy(INTERVAL);
        watch.dispose();
        scheduler.advanceTimeBy(Duration.ofMinutes(5));

        assertEquals(1, checker.checks.get());
    }

    @Test
    void testNonPositiveIntervalRejected() {
        DeliveryMetrics metrics = DeliveryMetrics.inMemory();

        assertThrows(IllegalArgumentException.class,
            () -> new DeliveryMonitor(Duration.ZERO, IDLE_THRESHOLD, metrics));
        assertThrows(IllegalArgumentException.class,
            () -> new DeliveryMonitor(Duration.ofSeconds(-1), IDLE_THRESHOLD, metrics));
    }

    private static class StubChecker implements IMessageDeliveryChecker {
        final String channel;
        final Instant lastActivityAt;
        final AtomicInteger checks = new AtomicInteger();
        volatile RuntimeException failure;

        StubChecker(String channel, Instant lastActivityAt) {
            this.channel = channel;
            this.lastActivityAt = lastActivityAt;
        }

        @Override
        public String getChannel() {
            return channel;
        }

        @Override
        public MissedMessagesReport checkForMissedMessages() {
            checks.incrementAndGet();
            if (failure != null) {
                throw failure;
            }
            return MissedMessagesReport.none(channel);
        }

        @Override
        public Instant getLastActivityAt() {
            return lastActivityAt;
        }
    }
}
