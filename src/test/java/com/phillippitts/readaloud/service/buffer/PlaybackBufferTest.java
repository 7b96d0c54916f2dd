package com.phillippitts.readaloud.service.buffer;

import com.phillippitts.readaloud.domain.AudioArtifact;
import com.phillippitts.readaloud.util.CancellationSignal;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class PlaybackBufferTest {

    private final CancellationSignal cancellation = new CancellationSignal();
    private final BufferOccupancy occupancy = new BufferOccupancy(4, cancellation);
    private final PlaybackBuffer buffer = new PlaybackBuffer(3, 2, occupancy, cancellation);

    private static AudioArtifact ready(int index) {
        return AudioArtifact.ready(index, Path.of("chunk-" + index + ".wav"), Duration.ofMillis(100));
    }

    @Test
    void shouldDequeueInArrivalOrderAndDecrementOccupancy() throws Exception {
        // Arrange
        occupancy.increment();
        occupancy.increment();
        buffer.accept(ready(0));
        buffer.accept(ready(1));

        // Act
        AudioArtifact first = buffer.dequeue().orElseThrow();

        // Assert
        assertThat(first.index()).isZero();
        assertThat(buffer.size()).isEqualTo(1);
        assertThat(occupancy.get()).isEqualTo(1);
    }

    @Test
    void shouldReturnEmptyOnceClosedAndDrained() throws Exception {
        // Arrange
        buffer.accept(ready(0));
        buffer.close();

        // Act & Assert
        assertThat(buffer.dequeue()).isPresent();
        assertThat(buffer.dequeue()).isEmpty();
    }

    @Test
    void shouldWaitForLowWatermarkBeforeReportingReady() throws Exception {
        // Arrange
        buffer.accept(ready(0));
        CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return buffer.awaitLowWatermark();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        });

        // Act
        await().during(Duration.ofMillis(50)).atMost(Duration.ofSeconds(1)).until(() -> !waiter.isDone());
        buffer.accept(ready(1));

        // Assert
        assertThat(waiter.get(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void shouldStopWaitingForLowWatermarkWhenClosed() throws Exception {
        // Arrange
        buffer.accept(ready(0));
        buffer.close();

        // Act & Assert
        assertThat(buffer.awaitLowWatermark()).isTrue();
        buffer.dequeue();
        assertThat(buffer.awaitLowWatermark()).isFalse();
    }

    @Test
    void shouldBlockProducerAtCapacityUntilConsumed() throws Exception {
        // Arrange
        buffer.accept(ready(0));
        buffer.accept(ready(1));
        buffer.accept(ready(2));
        CompletableFuture<Void> producer = CompletableFuture.runAsync(() -> {
            try {
                buffer.accept(ready(3));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        // Act
        await().during(Duration.ofMillis(50)).atMost(Duration.ofSeconds(1)).until(() -> !producer.isDone());
        buffer.poll();

        // Assert
        producer.get(2, TimeUnit.SECONDS);
        assertThat(buffer.size()).isEqualTo(3);
    }

    @Test
    void shouldThrowFromBlockedDequeueOnCancellation() {
        // Arrange
        CompletableFuture<Object> consumer = CompletableFuture.supplyAsync(() -> {
            try {
                return buffer.dequeue();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        });

        // Act
        await().during(Duration.ofMillis(50)).atMost(Duration.ofSeconds(1)).until(() -> !consumer.isDone());
        cancellation.cancel();

        // Assert
        assertThatThrownBy(() -> consumer.get(2, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(CancellationException.class);
    }

    @Test
    void shouldDrainEverythingOnStop() throws Exception {
        // Arrange
        buffer.accept(ready(0));
        buffer.accept(ready(1));

        // Act
        List<AudioArtifact> drained = buffer.drainAll();

        // Assert
        assertThat(drained).extracting(AudioArtifact::index).containsExactly(0, 1);
        assertThat(buffer.isEmpty()).isTrue();
    }

    @Test
    void shouldValidateWatermarks() {
        assertThatThrownBy(() -> new PlaybackBuffer(2, 3, occupancy, cancellation))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PlaybackBuffer(0, 1, occupancy, cancellation))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
