package com.ryuqq.supervisor.testkit;

import com.ryuqq.supervisor.core.channel.Channel;
import com.ryuqq.supervisor.core.outcome.CouldNotRecvResult;
import com.ryuqq.supervisor.core.outcome.Ok;
import com.ryuqq.supervisor.core.outcome.Outcome;
import com.ryuqq.supervisor.core.outcome.RunnerError;
import com.ryuqq.supervisor.core.process.Process;
import com.ryuqq.supervisor.core.runner.Runner;
import com.ryuqq.supervisor.core.signal.Signal;

import java.util.Optional;

/**
 * A bare-bones {@link Process} for checking {@link Runner} implementations in isolation.
 *
 * <p>Runs setup then (if setup succeeded) run on one thread and publishes each phase's
 * outcome on an internal channel. It has no one-shot guard: every {@link #ready()} /
 * {@link #waitFor()} call simply consumes the next outcome, so callers must use them in order.</p>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public final class TestProcess implements Process {

    private final Channel<Outcome> phases = Channel.unbounded();
    private final Channel<Signal> signals = Channel.unbounded();
    private final Thread thread;

    public TestProcess(Runner runner) {
        if (runner == null) {
            throw new IllegalArgumentException("runner cannot be null");
        }
        this.thread = new Thread(() -> drive(runner), "test-process");
        this.thread.start();
    }

    private void drive(Runner runner) {
        try {
            Outcome setup = attempt(runner::setup);
            phases.trySend(setup);
            if (setup.isOk()) {
                phases.trySend(attempt(() -> runner.run(signals)));
            }
        } finally {
            phases.close();
        }
    }

    private static Outcome attempt(Phase phase) {
        try {
            phase.run();
            return Ok.of();
        } catch (Exception e) {
            return RunnerError.of(e);
        }
    }

    @Override
    public Outcome ready() {
        return nextPhase();
    }

    @Override
    public Outcome waitFor() {
        return nextPhase();
    }

    private Outcome nextPhase() {
        Optional<Outcome> result;
        try {
            result = phases.recv();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CouldNotRecvResult.of();
        }
        return result.orElse(CouldNotRecvResult.of());
    }

    @Override
    public void signal(Signal signal) {
        signals.trySend(signal);
    }

    @Override
    public void close() {
        try {
            thread.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while joining test-process thread", e);
        }
    }

    @FunctionalInterface
    private interface Phase {
        void run() throws Exception;
    }
}
