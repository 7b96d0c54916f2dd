package com.phillippitts.readaloud.util;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationSignalTest {

    private final CancellationSignal signal = new CancellationSignal();

    @Test
    void shouldRunListenersOnceWhenCancelled() {
        // Arrange
        AtomicInteger calls = new AtomicInteger();
        signal.onCancel(calls::incrementAndGet);

        // Act
        boolean first = signal.cancel();
        boolean second = signal.cancel();

        // Assert
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(calls).hasValue(1);
        assertThat(signal.isCancelled()).isTrue();
    }

    @Test
    void shouldRunLateListenerImmediately() {
        // Arrange
        signal.cancel();
        AtomicInteger calls = new AtomicInteger();

        // Act
        signal.onCancel(calls::incrementAndGet);

        // Assert
        assertThat(calls).hasValue(1);
    }

    @Test
    void shouldKeepRunningListenersAfterOneFails() {
        // Arrange
        AtomicInteger calls = new AtomicInteger();
        signal.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        signal.onCancel(calls::incrementAndGet);

        // Act
        signal.cancel();

        // Assert
        assertThat(calls).hasValue(1);
    }

    @Test
    void shouldThrowOnlyAfterCancellation() {
        assertThatCode(signal::throwIfCancelled).doesNotThrowAnyException();

        signal.cancel();

        assertThatThrownBy(signal::throwIfCancelled).isInstanceOf(CancellationException.class);
    }
}
