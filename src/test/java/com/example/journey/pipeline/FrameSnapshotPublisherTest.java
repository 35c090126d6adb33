package com.example.journey.pipeline;

import com.example.journey.dto.FrameSnapshot;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class FrameSnapshotPublisherTest {

    private final FrameSnapshotPublisher publisher = new FrameSnapshotPublisher();

    @Test
    void latestIsEmptyUntilFirstPublish() {
        assertThat(publisher.latest()).isEmpty();
        FrameSnapshot snapshot = snapshot(1);
        publisher.publish(snapshot);
        assertThat(publisher.latest()).containsSame(snapshot);
    }

    @Test
    void awaitChangeTimesOutWithoutNewSnapshot() throws InterruptedException {
        FrameSnapshot snapshot = snapshot(1);
        publisher.publish(snapshot);

        assertThat(publisher.awaitChange(snapshot, Duration.ofMillis(50))).isEmpty();
        assertThat(publisher.awaitChange(null, Duration.ofMillis(50))).containsSame(snapshot);
    }

    @Test
    void awaitChangeWakesOnPublish() throws Exception {
        FrameSnapshot first = snapshot(1);
        publisher.publish(first);

        CompletableFuture<Optional<FrameSnapshot>> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return publisher.awaitChange(first, Duration.ofSeconds(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        });

        Thread.sleep(50);
        FrameSnapshot second = snapshot(2);
        publisher.publish(second);

        assertThat(waiter.get(5, TimeUnit.SECONDS)).containsSame(second);
    }

    @Test
    void resetClearsLatest() throws InterruptedException {
        publisher.publish(snapshot(1));
        publisher.reset();

        assertThat(publisher.latest()).isEmpty();
        assertThat(publisher.awaitChange(null, Duration.ofMillis(20))).isEmpty();
    }

    private static FrameSnapshot snapshot(long frameNumber) {
        return FrameSnapshot.builder().frameNumber(frameNumber).build();
    }
}
