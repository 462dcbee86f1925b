package com.ryuqq.supervisor.testkit;

import com.ryuqq.supervisor.core.channel.Channel;
import com.ryuqq.supervisor.core.signal.Signal;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link TestRunner} driven directly and through {@link TestProcess}.
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
class TestRunnerTest extends AbstractSupervisionTest {

    @Test
    void testRunnerAndThread_IntSignal_Succeeds() {
        // Given
        TestRunner runner = TestRunner.builder().build();
        TestProcess process = track(new TestProcess(runner));

        // When
        assertOk(process.ready());
        process.signal(Signal.INT);

        // Then
        assertOk(process.waitFor());
        assertEquals(1, runner.setupCount());
        assertEquals(List.of(Signal.INT), runner.observedSignals());
    }

    @Test
    void testSignal_HupSignal_Fails() {
        // Given
        TestRunner runner = TestRunner.builder().build();
        TestProcess process = track(new TestProcess(runner));

        // When
        assertOk(process.ready());
        process.signal(Signal.HUP);

        // Then
        Exception cause = assertRunnerError(process.waitFor());
        assertInstanceOf(TestRunnerException.class, cause);
        assertTrue(cause.getMessage().contains("HUP"));
    }

    @Test
    void run_ReportsThroughRendezvousChannel() throws Exception {
        // Given
        Channel<Boolean> reports = reportChannel();
        TestRunner runner = TestRunner.create(reports);
        TestProcess process = track(new TestProcess(runner));
        assertOk(process.ready());

        // When
        process.signal(Signal.INT);

        // Then
        assertTrue(awaitReport(reports));
        assertOk(process.waitFor());
        assertTrue(runner.isFinished());
    }

    @Test
    void run_IgnoredSignal_KeepsWaiting() throws Exception {
        // Given
        TestRunner runner = TestRunner.builder()
            .succeedOn(Signal.TERM)
            .ignore(Signal.HUP)
            .build();
        runner.setup();
        Channel<Signal> signals = Channel.bounded(4);
        signals.send(Signal.HUP);
        signals.send(Signal.HUP);
        signals.send(Signal.TERM);

        // When
        runner.run(signals);

        // Then
        assertEquals(List.of(Signal.HUP, Signal.HUP, Signal.TERM), runner.observedSignals());
        assertTrue(runner.isFinished());
    }

    @Test
    void run_ClosedStream_Fails() throws Exception {
        // Given
        TestRunner runner = TestRunner.builder().build();
        runner.setup();
        Channel<Signal> signals = Channel.bounded(1);
        signals.close();

        // When & Then
        TestRunnerException exception = assertThrows(TestRunnerException.class, () -> runner.run(signals));
        assertTrue(exception.getMessage().contains("closed"));
        assertTrue(runner.isFinished());
    }

    @Test
    void run_WithoutSetup_FailsWithAssertionError() {
        // Given
        TestRunner runner = TestRunner.builder().build();

        // When & Then
        assertThrows(AssertionError.class, () -> runner.run(Channel.bounded(1)));
        assertTrue(runner.isFinished());
    }

    @Test
    void failSetup_ReadyReportsRunnerError() {
        // Given
        TestRunner runner = TestRunner.builder().failSetup().build();
        TestProcess process = track(new TestProcess(runner));

        // When
        Exception cause = assertRunnerError(process.ready());

        // Then
        assertInstanceOf(TestRunnerException.class, cause);
        assertFalse(runner.isSetUp());
        assertFalse(process.waitFor().isOk());
        assertFalse(runner.isFinished());
    }
}
