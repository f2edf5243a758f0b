package io.pagesync.client;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffTest {

    @Test
    void doublesUntilCapAndResets() {
        Backoff backoff = new Backoff();

        assertThat(backoff.next()).isEqualTo(Duration.ofMillis(1000));
        assertThat(backoff.next()).isEqualTo(Duration.ofMillis(2000));
        assertThat(backoff.next()).isEqualTo(Duration.ofMillis(4000));
        assertThat(backoff.next()).isEqualTo(Duration.ofMillis(8000));
        assertThat(backoff.next()).isEqualTo(Duration.ofMillis(16000));
        assertThat(backoff.next()).isEqualTo(Duration.ofMillis(30000));
        assertThat(backoff.next()).isEqualTo(Duration.ofMillis(30000));
        assertThat(backoff.attempts()).isEqualTo(7);

        backoff.reset();

        assertThat(backoff.attempts()).isZero();
        assertThat(backoff.next()).isEqualTo(Duration.ofMillis(1000));
    }

    @Test
    void rejectsNonsenseBounds() {
        assertThatThrownBy(() -> new Backoff(Duration.ZERO, Duration.ofSeconds(1))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Backoff(Duration.ofSeconds(2), Duration.ofSeconds(1))).isInstanceOf(IllegalArgumentException.class);
    }
}
