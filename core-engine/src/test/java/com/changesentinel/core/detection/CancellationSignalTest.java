package com.changesentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CancellationSignal}.
 */
class CancellationSignalTest {

    @Test
    @DisplayName("Should fire only after cancel()")
    void shouldFireOnCancel() {
        CancellationSignal signal = CancellationSignal.create();
        assertThatCode(() -> signal.throwIfCancelled("work")).doesNotThrowAnyException();

        signal.cancel();

        assertThat(signal.isCancelled()).isTrue();
        assertThatThrownBy(() -> signal.throwIfCancelled("work"))
                .isInstanceOf(CancellationException.class)
                .hasMessageContaining("work cancelled");
    }

    @Test
    @DisplayName("Should fire once the deadline has passed")
    void shouldFireOnDeadline() {
        assertThat(CancellationSignal.withDeadline(Duration.ofMillis(-1)).isCancelled()).isTrue();
        assertThat(CancellationSignal.withDeadline(Duration.ofHours(1)).isCancelled()).isFalse();
    }

    @Test
    @DisplayName("The shared no-op signal should never fire and refuse cancel()")
    void noneShouldNeverFire() {
        assertThat(CancellationSignal.none().isCancelled()).isFalse();
        assertThatThrownBy(() -> CancellationSignal.none().cancel())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
