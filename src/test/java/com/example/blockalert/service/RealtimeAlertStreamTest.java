package com.example.blockalert.service;

import com.example.blockalert.exception.NetworkUnavailableException;
import com.example.blockalert.model.Alert;
import com.example.blockalert.util.DbTime;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RealtimeAlertStreamTest {

    private final RealtimeAlertStream stream = new RealtimeAlertStream();

    @Test
    void shouldRouteAlertToReceiverAndSender() {
        Alert alert = alert("alice", "bob");

        StepVerifier.create(stream.incoming("bob").take(1))
                .then(() -> stream.publish(alert))
                .expectNext(alert)
                .verifyComplete();

        StepVerifier.create(stream.outgoing("alice").take(1))
                .then(() -> stream.publish(alert))
                .expectNext(alert)
                .verifyComplete();
    }

    @Test
    void shouldNotDeliverOtherUsersAlerts() {
        StepVerifier.create(stream.incoming("carol"))
                .then(() -> stream.publish(alert("alice", "bob")))
                .expectNoEvent(Duration.ofMillis(100))
                .thenCancel()
                .verify();
    }

    @Test
    void shouldDeliverSameIdEveryTimeItChanges() {
        Alert created = alert("alice", "bob");
        Alert read = created.toBuilder().readAt(created.getCreatedAt().plusSeconds(5)).build();

        StepVerifier.create(stream.incoming("bob").take(2))
                .then(() -> {
                    stream.publish(created);
                    stream.publish(read);
                })
                .expectNext(created, read)
                .verifyComplete();
    }

    @Test
    void shouldUnregisterOnCancel() {
        Disposable subscription = stream.incoming("bob").subscribe();
        assertThat(stream.subscriberCount()).isEqualTo(1);

        subscription.dispose();

        assertThat(stream.subscriberCount()).isZero();
    }

    @Test
    void shouldTerminateSubscriptionsWithNetworkError() {
        StepVerifier.create(stream.incoming("bob"))
                .then(() -> stream.failSubscriptions("bob", new IllegalStateException("socket closed")))
                .expectError(NetworkUnavailableException.class)
                .verify(Duration.ofSeconds(1));

        assertThat(stream.subscriberCount()).isZero();
    }

    @Test
    void shouldKeepNewSubscriptionWhileAnotherIsCancelled() throws Exception {
        for (int i = 0; i < 200; i++) {
            String receiver = "bob-" + i;
            Disposable leaving = stream.incoming(receiver).subscribe();
            List<Alert> received = new CopyOnWriteArrayList<>();
            CountDownLatch go = new CountDownLatch(1);

            CompletableFuture<Void> cancel = CompletableFuture.runAsync(() -> {
                awaitQuietly(go);
                leaving.dispose();
            });
            CompletableFuture<Disposable> join = CompletableFuture.supplyAsync(() -> {
                awaitQuietly(go);
                return stream.incoming(receiver).subscribe(received::add);
            });
            go.countDown();
            cancel.get(5, TimeUnit.SECONDS);
            Disposable joined = join.get(5, TimeUnit.SECONDS);

            Alert alert = alert("alice", receiver);
            stream.publish(alert);

            assertThat(received).containsExactly(alert);
            joined.dispose();
        }
        assertThat(stream.subscriberCount()).isZero();
    }

    private void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Alert alert(String sender, String receiver) {
        return Alert.builder()
                .id(UUID.randomUUID())
                .senderId(sender)
                .receiverId(receiver)
                .plateHash("b".repeat(64))
                .createdAt(DbTime.now())
                .build();
    }
}
