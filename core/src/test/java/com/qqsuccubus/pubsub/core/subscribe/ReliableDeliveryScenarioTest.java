package com.qqsuccubus.pubsub.core.subscribe;

import com.qqsuccubus.pubsub.core.model.Message;
import com.qqsuccubus.pubsub.core.msg.MessageParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Publisher, subscriber and store wired together in memory.
 */
class ReliableDeliveryScenarioTest {

    private static final String CHANNEL = "events";

    private InMemoryMessageBroker broker;
    private ReliableSubscriber subscriber;
    private RecordingMessageHandler handler;

    @BeforeEach
    void setUp() {
        broker = new InMemoryMessageBroker();
        subscriber = new ReliableSubscriber(broker, new MessageParser(), broker);
        handler = new RecordingMessageHandler();
    }

    @Test
    @DisplayName("Messages published before subscribing are delivered by the first check")
    void testMessagesPublishedBeforeSubscribe() {
        broker.publish(CHANNEL, "a");
        broker.publish(CHANNEL, "b");
        broker.publish(CHANNEL, "c");

        IMessageDeliveryChecker checker = subscriber.subscribe(CHANNEL, handler);
        MissedMessagesReport report = checker.checkForMissedMessages();

        assertEquals(List.of("missed:1", "missed:2", "missed:3"), handler.events);
        assertEquals(3, report.getMessagesCount());
        assertEquals(3, report.getLastMessageId());
    }

    @Test
    @DisplayName("Second check finds nothing and redelivers nothing")
    void testSecondCheckIsEmpty() {
        broker.publish(CHANNEL, "a");
        broker.publish(CHANNEL, "b");
        IMessageDeliveryChecker checker = subscriber.subscribe(CHANNEL, handler);
        checker.checkForMissedMessages();

        MissedMessagesReport report = checker.checkForMissedMessages();

        assertEquals(MissedMessagesReport.none(CHANNEL), report);
        assertEquals(2, handler.events.size());
    }

    @Test
    @DisplayName("Lost broadcasts are recovered from the store when the next message arrives")
    void testLostBroadcastRecovered() {
        subscriber.subscribe(CHANNEL, handler);
        broker.publish(CHANNEL, "m1");
        broker.storeOnly(CHANNEL, "m2");
        broker.storeOnly(CHANNEL, "m3");
        broker.publish(CHANNEL, "m4");

        assertEquals(List.of("expected:1", "missed:2", "missed:3", "expected:4"), handler.events);
        assertEquals(List.of(1L, 2L, 3L, 4L), handler.deliveredIds());
    }

    @Test
    @DisplayName("Expired gap is reported as missing and delivery continues")
    void testExpiredGapReported() {
        subscriber.subscribe(CHANNEL, handler);
        broker.publish(CHANNEL, "m1");
        for (int i = 2; i <= 4; i++) {
            long id = broker.storeOnly(CHANNEL, "m" + i);
            broker.expire(CHANNEL, id);
        }
        broker.publish(CHANNEL, "m5");
        broker.publish(CHANNEL, "m6");

        assertEquals(List.of("expected:1", "missing:3", "expected:5", "expected:6"), handler.events);
    }

    @Test
    @DisplayName("Redelivered broadcast is reported as a duplicate")
    void testRedeliveryIsDuplicate() {
        subscriber.subscribe(CHANNEL, handler);
        broker.publish(CHANNEL, "m1");
        broker.publish(CHANNEL, "m2");

        broker.deliverRaw(CHANNEL, "2:m2");

        assertEquals(List.of("expected:1", "expected:2", "duplicated:2"), handler.events);
    }

    @Test
    @DisplayName("Live delivery preserves order")
    void testOrderedDelivery() {
        subscriber.subscribe(CHANNEL, handler);

        for (int i = 1; i <= 50; i++) {
            broker.publish(CHANNEL, "m" + i);
        }

        List<Long> expected = LongStream.rangeClosed(1, 50).boxed().collect(Collectors.toList());
        assertEquals(expected, handler.deliveredIds());
        assertTrue(handler.events.stream().allMatch(e -> e.startsWith("expected:")));
    }

    @Test
    @DisplayName("Stored messages read back in id order with their content")
    void testStoredMessagesReadBack() {
        broker.publish(CHANNEL, "first");
        broker.publish(CHANNEL, "with:separator");
        broker.publish(CHANNEL, "");

        StepVerifier.create(broker.getMessages(CHANNEL, 1))
            .expectNext(new Message(1, "first"))
            .expectNext(new Message(2, "with:separator"))
            .expectNext(new Message(3, ""))
            .verifyComplete();
    }
}
