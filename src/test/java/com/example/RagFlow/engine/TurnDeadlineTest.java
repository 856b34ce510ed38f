package com.example.RagFlow.engine;

import com.example.RagFlow.exception.TurnTimeoutException;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TurnDeadlineTest {

    @Test
    void returnsValueWithinBudget() {
        TurnDeadline deadline = TurnDeadline.after(Duration.ofSeconds(5));

        assertThat(deadline.await("lookup", () -> "done")).isEqualTo("done");
        assertThat(deadline.isExpired()).isFalse();
    }

    @Test
    void slowCallTimesOutNamingTheStage() {
        TurnDeadline deadline = TurnDeadline.after(Duration.ofMillis(50));

        assertThatThrownBy(() -> deadline.await("retrieval", Mono.delay(Duration.ofSeconds(5)).thenReturn("late")))
                .isInstanceOf(TurnTimeoutException.class)
                .hasMessageContaining("retrieval");
    }

    @Test
    void expiredDeadlineFailsBeforeCalling() {
        TurnDeadline deadline = TurnDeadline.after(Duration.ZERO);

        assertThat(deadline.isExpired()).isTrue();
        assertThatThrownBy(() -> deadline.ensureNotExpired("component out"))
                .isInstanceOf(TurnTimeoutException.class)
                .hasMessageContaining("component out");
    }
}
