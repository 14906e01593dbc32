package com.qqsuccubus.pubsub.core.subscribe;

import com.qqsuccubus.pubsub.core.metrics.DeliveryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Periodic missed-message check for idle channels.
 * <p>
 * Every {@code checkInterval} the monitor looks at {@link IMessageDeliveryChecker#getLastActivityAt()}
 * and runs {@link IMessageDeliveryChecker#checkForMissedMessages()} once the channel has been
 * quiet for at least {@code idleThreshold}. Checks block on the message store, so ticks run
 * on a scheduler that allows blocking (bounded elastic by default).
 * </p>
 * <p>
 * A failed check is logged and counted; the loop keeps running until disposed.
 * </p>
 */
public class DeliveryMonitor {
    private static final Logger log = LoggerFactory.getLogger(DeliveryMonitor.class);

    private final Duration checkInterval;
    private final Duration idleThreshold;
    private final Scheduler scheduler;
    private final Clock clock;
    private final DeliveryMetrics metrics;

    public DeliveryMonitor(Duration checkInterval,
                           Duration idleThreshold,
                           Scheduler scheduler,
                           Clock clock,
                           DeliveryMetrics metrics) {
        if (checkInterval.isZero() || checkInterval.isNegative()) {
            throw new IllegalArgumentException("checkInterval must be positive: " + checkInterval);
        }
        this.checkInterval = checkInterval;
        this.idleThreshold = idleThreshold;
        this.scheduler = scheduler;
        this.clock = clock;
        this.metrics = metrics;
    }

    public DeliveryMonitor(Duration checkInterval, Duration idleThreshold, DeliveryMetrics metrics) {
        this(checkInterval, idleThreshold, Schedulers.boundedElastic(), Clock.systemUTC(), metrics);
    }

    /**
     * Starts watching a channel.
     *
     * @param checker Checker returned by the subscriber
     * @return Disposable stopping the loop
     */
    public Disposable watch(IMessageDeliveryChecker checker) {
        log.info("Watching channel '{}' every {} (idle threshold {})",
            checker.getChannel(), checkInterval, idleThreshold);

        return Flux.interval(checkInterval, checkInterval, scheduler)
            .filter(tick -> isIdle(checker))
            .concatMap(tick -> check(checker))
            .subscribe();
    }

    private boolean isIdle(IMessageDeliveryChecker checker) {
        Instant lastActivityAt = checker.getLastActivityAt();
        return Duration.between(lastActivityAt, clock.instant()).compareTo(idleThreshold) >= 0;
    }

    private Mono<MissedMessagesReport> check(IMessageDeliveryChecker checker) {
        return Mono.fromCallable(checker::checkForMissedMessages)
            .doOnNext(report -> metrics.recordCheck(checker.getChannel(), true))
            .onErrorResume(err -> {
                metrics.recordCheck(checker.getChannel(), false);
                log.error("Missed-message check failed for channel '{}'", checker.getChannel(), err);
                return Mono.empty();
            });
    }
}
