package com.ryuqq.supervisor.core.outcome;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Outcome sealed interface 테스트.
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
class OutcomeTest {

    @Test
    void ok_IsOk() {
        // When
        Outcome outcome = Ok.of();

        // Then
        assertThat(outcome.isOk()).isTrue();
        assertThat(outcome).isEqualTo(new Ok());
    }

    @Test
    void runnerError_CarriesCauseAndMessage() {
        // Given
        IOException cause = new IOException("disk full");

        // When
        Outcome outcome = RunnerError.of(cause);

        // Then
        assertThat(outcome.isOk()).isFalse();
        assertThat(((RunnerError) outcome).cause()).isSameAs(cause);
        assertThat(outcome.message()).isEqualTo("disk full");
    }

    @Test
    void runnerError_NullMessage_FallsBackToClassName() {
        // When
        Outcome outcome = RunnerError.of(new IllegalStateException());

        // Then
        assertThat(outcome.message()).isEqualTo("java.lang.IllegalStateException");
    }

    @Test
    void runnerError_NullCause_ThrowsException() {
        // When & Then
        assertThatThrownBy(() -> RunnerError.of(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cause cannot be null");
    }

    @Test
    void resultAlreadyGiven_Message() {
        // When
        Outcome outcome = ResultAlreadyGiven.of();

        // Then
        assertThat(outcome.isOk()).isFalse();
        assertThat(outcome.message()).isEqualTo("Already returned result to caller");
    }

    @Test
    void couldNotRecvResult_Message() {
        // When
        Outcome outcome = CouldNotRecvResult.of();

        // Then
        assertThat(outcome.isOk()).isFalse();
        assertThat(outcome.message()).isEqualTo("Could not receive result from thread");
    }
}
