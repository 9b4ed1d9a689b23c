package com.cortexplatform.core.event;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private MeterRegistry meterRegistry;
    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        eventBus = new EventBus(256, meterRegistry);
    }

    private static Event input(String user, String conversation, String content) {
        return Event.of(EventTypes.INPUT, user, conversation, Map.of("content", content));
    }

    @Nested
    @DisplayName("Publishing")
    class PublishTests {

        @Test
        @DisplayName("should assign increasing sequence numbers per conversation")
        void assignsSequencePerConversation() {
            Event first = eventBus.publish(input("u1", "c1", "a"));
            Event second = eventBus.publish(input("u1", "c1", "b"));
            Event other = eventBus.publish(input("u1", "c2", "c"));
            Event otherUser = eventBus.publish(input("u2", "c1", "d"));

            assertThat(first.sequence()).isEqualTo(1);
            assertThat(second.sequence()).isEqualTo(2);
            assertThat(other.sequence()).isEqualTo(1);
            assertThat(otherUser.sequence()).isEqualTo(1);
            assertThat(second.createdAt()).isNotNull();
        }

        @Test
        @DisplayName("should ignore a sequence supplied by the publisher")
        void overridesSuppliedSequence() {
            eventBus.publish(input("u1", "c1", "a"));

            Event forged = new Event(EventTypes.INPUT, "u1", "c1", Map.of(), 99L, null);
            assertThat(eventBus.publish(forged).sequence()).isEqualTo(2);
        }

        @Test
        @DisplayName("should succeed without subscribers")
        void publishWithoutSubscribers() {
            Event published = eventBus.publish(input("u1", "c1", "nobody listens"));

            assertThat(published.sequence()).isEqualTo(1);
            assertThat(meterRegistry.counter("cortex.eventbus.published").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should reject publishing after close")
        void rejectsAfterClose() {
            eventBus.close();

            assertThatThrownBy(() -> eventBus.publish(input("u1", "c1", "late")))
                    .isInstanceOf(BusClosedException.class);
            assertThatThrownBy(() -> eventBus.subscribe(Set.of(EventTypes.INPUT), null))
                    .isInstanceOf(BusClosedException.class);
        }

        @Test
        @DisplayName("should expose an immutable payload")
        void payloadIsImmutable() {
            Event published = eventBus.publish(input("u1", "c1", "x"));

            assertThatThrownBy(() -> published.payload().put("content", "changed"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("Routing")
    class RoutingTests {

        @Test
        @DisplayName("should deliver only subscribed event types")
        void filtersByType() {
            EventSubscription outputs = eventBus.subscribe(Set.of(EventTypes.OUTPUT), null);

            eventBus.publish(input("u1", "c1", "ignored"));
            eventBus.publish(Event.of(EventTypes.OUTPUT, "u1", "c1", Map.of("content", "delivered")));

            assertThat(outputs.size()).isEqualTo(1);
            StepVerifier.create(outputs.next())
                    .assertNext(event -> assertThat(event.payloadString("content")).isEqualTo("delivered"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deliver only the filtered user's events")
        void filtersByUser() {
            EventSubscription u1 = eventBus.subscribe(Set.of(EventTypes.INPUT), "u1");
            EventSubscription all = eventBus.subscribe(Set.of(EventTypes.INPUT), null);

            eventBus.publish(input("u1", "c1", "mine"));
            eventBus.publish(input("u2", "c1", "theirs"));

            assertThat(u1.size()).isEqualTo(1);
            assertThat(all.size()).isEqualTo(2);
            assertThat(eventBus.subscriptionCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should complete a pending read when an event arrives")
        void pendingReadReceivesEvent() {
            EventSubscription subscription = eventBus.subscribe(Set.of(EventTypes.INPUT), null);

            StepVerifier.create(subscription.next())
                    .expectSubscription()
                    .then(() -> eventBus.publish(input("u1", "c1", "later")))
                    .assertNext(event -> assertThat(event.payloadString("content")).isEqualTo("later"))
                    .expectComplete()
                    .verify(Duration.ofSeconds(1));
        }

        @Test
        @DisplayName("should reject a second concurrent read")
        void rejectsConcurrentReads() {
            EventSubscription subscription = eventBus.subscribe(Set.of(EventTypes.INPUT), null);
            subscription.next().subscribe();

            StepVerifier.create(subscription.next())
                    .expectError(IllegalStateException.class)
                    .verify(Duration.ofSeconds(1));
        }

        @Test
        @DisplayName("should keep an event taken for a reader that cancels before receiving it")
        void cancelledReadKeepsEvent() {
            EventSubscription subscription = eventBus.subscribe(Set.of(EventTypes.INPUT), null);
            eventBus.publish(input("u1", "c1", "first"));
            eventBus.publish(input("u1", "c1", "second"));

            // Given a read that took the head event but never requested it
            StepVerifier.create(subscription.next(), 0)
                    .expectSubscription()
                    .thenCancel()
                    .verify(Duration.ofSeconds(1));

            // Then the event is back at the head, neither lost nor counted as dropped
            assertThat(subscription.size()).isEqualTo(2);
            assertThat(subscription.droppedCount()).isZero();
            StepVerifier.create(subscription.asFlux().take(2).map(Event::sequence))
                    .expectNext(1L, 2L)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should count an undelivered event as dropped when newer events filled the queue")
        void cancelledReadIntoFullQueue() {
            EventSubscription single = eventBus.subscribe(Set.of(EventTypes.INPUT), null, 1);
            eventBus.publish(input("u1", "c1", "first"));

            StepVerifier.create(single.next(), 0)
                    .expectSubscription()
                    .then(() -> eventBus.publish(input("u1", "c1", "second")))
                    .thenCancel()
                    .verify(Duration.ofSeconds(1));

            assertThat(single.droppedCount()).isEqualTo(1);
            StepVerifier.create(single.next())
                    .assertNext(event -> assertThat(event.payloadString("content")).isEqualTo("second"))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Overflow")
    class OverflowTests {

        @Test
        @DisplayName("should keep the newest 256 of 1000 events and count 744 drops")
        void dropsOldestWhenFull() {
            EventSubscription subscription = eventBus.subscribe(Set.of(EventTypes.INPUT), null);

            for (int i = 0; i < 1000; i++) {
                eventBus.publish(input("u1", "c1", "event-" + i));
            }

            assertThat(subscription.size()).isEqualTo(256);
            assertThat(subscription.droppedCount()).isEqualTo(744);
            assertThat(meterRegistry.counter("cortex.eventbus.dropped").count()).isEqualTo(744.0);

            List<Event> retained = subscription.asFlux().take(256).collectList().block(Duration.ofSeconds(1));
            assertThat(retained).hasSize(256);
            assertThat(retained.get(0).sequence()).isEqualTo(745);
            assertThat(retained.get(255).sequence()).isEqualTo(1000);
        }

        @Test
        @DisplayName("should honour a per-subscription capacity")
        void perSubscriptionCapacity() {
            EventSubscription small = eventBus.subscribe(Set.of(EventTypes.INPUT), null, 2);

            eventBus.publish(input("u1", "c1", "1"));
            eventBus.publish(input("u1", "c1", "2"));
            eventBus.publish(input("u1", "c1", "3"));

            assertThat(small.size()).isEqualTo(2);
            assertThat(small.droppedCount()).isEqualTo(1);
            StepVerifier.create(small.next())
                    .assertNext(event -> assertThat(event.sequence()).isEqualTo(2))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Ordering")
    class OrderingTests {

        @Test
        @DisplayName("should deliver each conversation in sequence order under concurrent publishers")
        void perConversationOrderUnderConcurrency() throws InterruptedException {
            EventSubscription subscription = eventBus.subscribe(Set.of(EventTypes.INPUT), null, 10_000);
            int threads = 4;
            int perThread = 500;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            try {
                for (int t = 0; t < threads; t++) {
                    String conversation = "c" + (t % 2);
                    executor.submit(() -> {
                        start.await();
                        for (int i = 0; i < perThread; i++) {
                            eventBus.publish(input("u1", conversation, "x"));
                        }
                        return null;
                    });
                }
                start.countDown();
                executor.shutdown();
                assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
            } finally {
                executor.shutdownNow();
            }

            List<Event> received = subscription.asFlux().take(threads * perThread).collectList()
                    .block(Duration.ofSeconds(5));
            assertThat(received).hasSize(threads * perThread);

            List<Long> c0 = new ArrayList<>();
            List<Long> c1 = new ArrayList<>();
            received.forEach(e -> (e.conversationId().equals("c0") ? c0 : c1).add(e.sequence()));
            assertThat(c0).isSorted().doesNotHaveDuplicates().hasSize(1000);
            assertThat(c1).isSorted().doesNotHaveDuplicates().hasSize(1000);
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should stop delivery after unsubscribe and tolerate repeated calls")
        void unsubscribeIsIdempotent() {
            EventSubscription subscription = eventBus.subscribe(Set.of(EventTypes.INPUT), null);

            eventBus.unsubscribe(subscription);
            eventBus.unsubscribe(subscription);
            eventBus.publish(input("u1", "c1", "after"));

            assertThat(subscription.isClosed()).isTrue();
            assertThat(subscription.size()).isZero();
            assertThat(eventBus.subscriptionCount()).isZero();
            StepVerifier.create(subscription.next()).verifyComplete();
        }

        @Test
        @DisplayName("should end pending reads when the bus closes")
        void closeEndsSubscriptions() {
            EventSubscription subscription = eventBus.subscribe(Set.of(EventTypes.INPUT), null);

            StepVerifier.create(subscription.asFlux())
                    .expectSubscription()
                    .then(() -> eventBus.publish(input("u1", "c1", "before close")))
                    .expectNextCount(1)
                    .then(eventBus::close)
                    .expectComplete()
                    .verify(Duration.ofSeconds(1));

            assertThat(eventBus.isClosed()).isTrue();
        }
    }
}
