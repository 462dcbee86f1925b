package com.ryuqq.supervisor.core.runner;

import com.ryuqq.supervisor.core.channel.Channel;
import com.ryuqq.supervisor.core.signal.Signal;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * FnRunner 테스트.
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
class FnRunnerTest {

    @Test
    void setupAndRun_InvokesFunctionWithSignals() throws Exception {
        // Given
        Channel<Signal> signals = Channel.bounded(1);
        signals.send(Signal.INT);
        List<Signal> observed = new ArrayList<>();
        Runner runner = FnRunner.of(s -> observed.add(s.recv().orElseThrow()));

        // When
        runner.setup();
        runner.run(signals);

        // Then
        assertThat(observed).containsExactly(Signal.INT);
    }

    @Test
    void run_PropagatesFunctionFailure() {
        // Given
        Runner runner = FnRunner.of(s -> {
            throw new IOException("boom");
        });

        // When & Then
        assertThatThrownBy(() -> runner.run(Channel.rendezvous()))
            .isInstanceOf(IOException.class)
            .hasMessage("boom");
    }

    @Test
    void run_Twice_ThrowsIllegalState() throws Exception {
        // Given
        Runner runner = FnRunner.of(s -> { });
        runner.run(Channel.rendezvous());

        // When & Then
        assertThatThrownBy(() -> runner.run(Channel.rendezvous()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already been run");
    }

    @Test
    void of_NullFunction_ThrowsException() {
        assertThatThrownBy(() -> FnRunner.of(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("function cannot be null");
    }
}
