package com.qqsuccubus.pubsub.core.subscribe;

import com.qqsuccubus.pubsub.core.model.Message;
import com.qqsuccubus.pubsub.core.msg.WireFormat;
import com.qqsuccubus.pubsub.core.publish.IReliablePublisher;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-memory stand-in for the Redis store and pub/sub channels.
 * <p>
 * Publishing delivers synchronously on the caller's thread. Messages can be stored without
 * a broadcast (lost delivery) and expired by id to simulate retention.
 * </p>
 */
class InMemoryMessageBroker implements IReliablePublisher, IMessageLoader, IPubSubTransport {

    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final Map<String, NavigableMap<Long, String>> stored = new ConcurrentHashMap<>();
    private final Map<String, List<Consumer<String>>> subscribers = new ConcurrentHashMap<>();
    private final AtomicLong loads = new AtomicLong();

    @Override
    public long publish(String channel, String content, Duration ttl) {
        long id = storeOnly(channel, content);
        deliverRaw(channel, WireFormat.encode(id, content));
        return id;
    }

    @Override
    public long publish(String channel, String content) {
        return publish(channel, content, Duration.ofMinutes(10));
    }

    @Override
    public Mono<Long> publishAsync(String channel, String content, Duration ttl) {
        return Mono.fromCallable(() -> publish(channel, content, ttl));
    }

    @Override
    public Mono<Long> publishAsync(String channel, String content) {
        return Mono.fromCallable(() -> publish(channel, content));
    }

    /**
     * Assigns an id and stores the content, without broadcasting it.
     */
    long storeOnly(String channel, String content) {
        long id = counters.computeIfAbsent(channel, c -> new AtomicLong()).incrementAndGet();
        stored.computeIfAbsent(channel, c -> new ConcurrentSkipListMap<>()).put(id, content);
        return id;
    }

    void expire(String channel, long id) {
        NavigableMap<Long, String> messages = stored.get(channel);
        if (messages != null) {
            messages.remove(id);
        }
    }

    void deliverRaw(String channel, String raw) {
        for (Consumer<String> consumer : subscribers.getOrDefault(channel, List.of())) {
            consumer.accept(raw);
        }
    }

    int activeSubscriptions(String channel) {
        return subscribers.getOrDefault(channel, List.of()).size();
    }

    long loadCount() {
        return loads.get();
    }

    @Override
    public Flux<Message> getMessages(String channel, long fromId, long toId) {
        return Flux.defer(() -> {
            loads.incrementAndGet();
            NavigableMap<Long, String> messages = stored.get(channel);
            if (messages == null || fromId > toId) {
                return Flux.empty();
            }
            List<Message> result = new ArrayList<>();
            messages.subMap(fromId, true, toId, true)
                .forEach((id, content) -> result.add(new Message(id, content)));
            return Flux.fromIterable(result);
        });
    }

    @Override
    public Disposable subscribe(String channel, Consumer<String> rawMessages) {
        List<Consumer<String>> consumers = subscribers.computeIfAbsent(channel, c -> new CopyOnWriteArrayList<>());
        consumers.add(rawMessages);
        return () -> consumers.remove(rawMessages);
    }
}
