package com.qqsuccubus.pubsub.core.subscribe;

import com.qqsuccubus.pubsub.core.metrics.DeliveryMetrics;
import com.qqsuccubus.pubsub.core.model.Message;
import com.qqsuccubus.pubsub.core.msg.IMessageParser;
import com.qqsuccubus.pubsub.core.validation.MessageValidator;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps one {@link MessageProcessor} per subscribed channel and feeds it from the transport.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Reject pattern channels and second handlers for a channel</li>
 *   <li>Open the transport subscription together with the channel's validator and processor</li>
 *   <li>Parse raw payloads, drop malformed ones, process the rest</li>
 * </ul>
 * </p>
 * <p>
 * A failure raised while processing is logged and rethrown to the transport, so broken
 * handlers surface loudly instead of being swallowed.
 * </p>
 */
public class ReliableSubscriber implements IReliableSubscriber {
    private static final Logger log = LoggerFactory.getLogger(ReliableSubscriber.class);

    private final IPubSubTransport transport;
    private final IMessageParser parser;
    private final IMessageLoader loader;
    private final DeliveryMetrics metrics;
    private final Clock clock;

    // Active subscriptions: channel -> subscription
    private final Map<String, ChannelSubscription> subscriptions = new ConcurrentHashMap<>();

    public ReliableSubscriber(IPubSubTransport transport,
                              IMessageParser parser,
                              IMessageLoader loader,
                              DeliveryMetrics metrics,
                              Clock clock) {
        this.transport = transport;
        this.parser = parser;
        this.loader = loader;
        this.metrics = metrics;
        this.clock = clock;
    }

    public ReliableSubscriber(IPubSubTransport transport, IMessageParser parser, IMessageLoader loader) {
        this(transport, parser, loader, DeliveryMetrics.inMemory(), Clock.systemUTC());
    }

    @Override
    public IMessageDeliveryChecker subscribe(String channel, IMessageHandler handler) {
        ensureNotPatternBasedChannel(channel);

        AtomicReference<MessageProcessor> created = new AtomicReference<>();
        subscriptions.computeIfAbsent(channel, name -> {
            MessageProcessor processor = createMessageProcessor(name, handler);
            Disposable handle = transport.subscribe(name, raw -> handleMessage(name, raw, processor));
            created.set(processor);
            return new ChannelSubscription(processor, handle);
        });

        MessageProcessor processor = created.get();
        if (processor == null) {
            throw new DuplicateSubscriptionException(channel);
        }

        log.info("Subscribed reliably to channel '{}'", channel);
        return processor;
    }

    @Override
    public void unsubscribe(String channel) {
        ChannelSubscription subscription = subscriptions.remove(channel);
        if (subscription == null) {
            return;
        }
        subscription.getHandle().dispose();
        log.info("Unsubscribed from channel '{}'", channel);
    }

    @Override
    public void unsubscribeAll() {
        for (String channel : Set.copyOf(subscriptions.keySet())) {
            unsubscribe(channel);
        }
    }

    @Override
    public Optional<IMessageDeliveryChecker> getDeliveryChecker(String channel) {
        return Optional.ofNullable(subscriptions.get(channel)).map(ChannelSubscription::getProcessor);
    }

    @Override
    public Set<String> getSubscribedChannels() {
        return Set.copyOf(subscriptions.keySet());
    }

    private void handleMessage(String channel, String rawMessage, IMessageProcessor processor) {
        try {
            Optional<Message> parsed = parser.tryParse(rawMessage);
            if (parsed.isEmpty()) {
                onInvalidMessageFormat(channel);
                return;
            }

            processor.processMessage(parsed.get());
        } catch (RuntimeException e) {
            log.error("Received message processing failed in channel '{}'", channel, e);
            throw e;
        }
    }

    private void onInvalidMessageFormat(String channel) {
        metrics.recordInvalidFormat(channel);
        log.warn("Invalid message format in channel '{}', message dropped", channel);
    }

    private MessageProcessor createMessageProcessor(String channel, IMessageHandler handler) {
        return new MessageProcessor(channel, new MessageValidator(), loader, handler, metrics, clock);
    }

    private static void ensureNotPatternBasedChannel(String channel) {
        if (channel.indexOf('*') < 0) {
            return;
        }
        throw new UnsupportedOperationException(
            "Subscribing to a pattern-based channel (channel name contains '*') is not supported");
    }

    @Value
    private static class ChannelSubscription {
        MessageProcessor processor;
        Disposable handle;
    }
}
