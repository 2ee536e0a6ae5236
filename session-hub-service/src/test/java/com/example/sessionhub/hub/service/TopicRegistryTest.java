package com.example.sessionhub.hub.service;

import com.example.sessionhub.shared.protocol.OutputStream;
import com.example.sessionhub.shared.protocol.ServerMessage;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TopicRegistryTest {

    private final UUID session = UUID.randomUUID();

    @Test
    void createsTopicOnFirstSubscribe() {
        TopicRegistry registry = new TopicRegistry(8);
        assertThat(registry.contains(session)).isFalse();

        TopicSubscription subscription = registry.subscribe(session);

        assertThat(registry.contains(session)).isTrue();
        assertThat(registry.subscriberCount(session)).isEqualTo(1);
        assertThat(subscription.getSessionId()).isEqualTo(session);
    }

    @Test
    void publishWithoutSubscribersLeavesNoTopicBehind() {
        TopicRegistry registry = new TopicRegistry(8);

        registry.publish(session, output("nobody listens"));

        assertThat(registry.contains(session)).isFalse();
        assertThat(registry.topicCount()).isZero();
    }

    @Test
    void deliversInPublishOrder() {
        TopicRegistry registry = new TopicRegistry(16);
        TopicSubscription subscription = registry.subscribe(session);

        for (int i = 0; i < 10; i++) {
            registry.publish(session, output("line-" + i));
        }
        subscription.close();

        StepVerifier.create(subscription.events().map(event -> ((ServerMessage.Output) event).content()))
                .expectNext("line-0", "line-1", "line-2", "line-3", "line-4",
                        "line-5", "line-6", "line-7", "line-8", "line-9")
                .verifyComplete();
    }

    @Test
    void onlyDeliversEventsPublishedAfterSubscribing() {
        TopicRegistry registry = new TopicRegistry(8);
        TopicSubscription early = registry.subscribe(session);
        registry.publish(session, output("before"));

        TopicSubscription late = registry.subscribe(session);
        registry.publish(session, output("after"));
        early.close();
        late.close();

        StepVerifier.create(early.events()).expectNext(output("before"), output("after")).verifyComplete();
        StepVerifier.create(late.events()).expectNext(output("after")).verifyComplete();
    }

    @Test
    void slowSubscriberLosesOldestEvents() {
        TopicRegistry registry = new TopicRegistry(2);
        TopicSubscription subscription = registry.subscribe(session);

        registry.publish(session, output("1"));
        registry.publish(session, output("2"));
        registry.publish(session, output("3"));
        subscription.close();

        assertThat(subscription.droppedCount()).isEqualTo(1);
        StepVerifier.create(subscription.events()).expectNext(output("2"), output("3")).verifyComplete();
    }

    @Test
    void removeIfOrphanedKeepsTopicsWithSubscribers() {
        TopicRegistry registry = new TopicRegistry(8);
        TopicSubscription subscription = registry.subscribe(session);

        assertThat(registry.removeIfOrphaned(session)).isFalse();
        assertThat(registry.contains(session)).isTrue();

        subscription.close();

        assertThat(registry.removeIfOrphaned(session)).isTrue();
        assertThat(registry.removeIfOrphaned(session)).isFalse();
        assertThat(registry.contains(session)).isFalse();
    }

    @Test
    void removeOrphansSweepsOnlyUnsubscribedTopics() {
        TopicRegistry registry = new TopicRegistry(8);
        UUID watched = UUID.randomUUID();
        registry.subscribe(watched);
        registry.getOrCreateSender(session);

        assertThat(registry.topicCount()).isEqualTo(2);
        assertThat(registry.removeOrphans()).isEqualTo(1);
        assertThat(registry.sessionIds()).containsExactly(watched);
    }

    @Test
    void senderOutlivesReclamationOfItsTopic() {
        TopicRegistry registry = new TopicRegistry(8);
        TopicSender sender = registry.getOrCreateSender(session);
        assertThat(sender.hasSubscribers()).isFalse();

        registry.removeIfOrphaned(session);
        TopicSubscription subscription = registry.subscribe(session);
        sender.publish(output("still routed"));
        subscription.close();

        assertThat(sender.getSessionId()).isEqualTo(session);
        StepVerifier.create(subscription.events()).expectNext(output("still routed")).verifyComplete();
    }

    @Test
    void closedSubscriptionStopsReceiving() {
        TopicRegistry registry = new TopicRegistry(8);
        TopicSubscription subscription = registry.subscribe(session);
        subscription.close();
        subscription.close();

        registry.publish(session, output("late"));

        assertThat(subscription.isDisposed()).isTrue();
        assertThat(registry.subscriberCount(session)).isZero();
        StepVerifier.create(subscription.events()).verifyComplete();
    }

    @Test
    void concurrentReclaimNeverDropsATopicWithAttachedHandles() throws Exception {
        TopicRegistry registry = new TopicRegistry(8);
        int subscribers = 4;
        int rounds = 2_000;
        ExecutorService executor = Executors.newFixedThreadPool(subscribers + 1);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean running = new AtomicBoolean(true);
        AtomicInteger lostTopics = new AtomicInteger();
        try {
            Future<?> reaper = executor.submit(() -> {
                start.await();
                while (running.get()) {
                    registry.removeIfOrphaned(session);
                    registry.removeOrphans();
                }
                return null;
            });
            List<Future<?>> workers = new ArrayList<>();
            for (int i = 0; i < subscribers; i++) {
                workers.add(executor.submit(() -> {
                    start.await();
                    for (int round = 0; round < rounds; round++) {
                        TopicSubscription subscription = registry.subscribe(session);
                        registry.publish(session, output("round-" + round));
                        if (!registry.contains(session) || registry.subscriberCount(session) == 0) {
                            lostTopics.incrementAndGet();
                        }
                        subscription.close();
                        registry.removeIfOrphaned(session);
                    }
                    return null;
                }));
            }

            start.countDown();
            for (Future<?> worker : workers) {
                worker.get(30, TimeUnit.SECONDS);
            }
            running.set(false);
            reaper.get(30, TimeUnit.SECONDS);
        } finally {
            running.set(false);
            executor.shutdownNow();
        }

        assertThat(lostTopics).hasValue(0);
        registry.removeIfOrphaned(session);
        assertThat(registry.topicCount()).isZero();
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new TopicRegistry(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private ServerMessage output(String content) {
        return new ServerMessage.Output(session, OutputStream.STDOUT, content);
    }
}
