package com.ryuqq.supervisor.testkit;

import com.ryuqq.supervisor.core.channel.Receiver;
import com.ryuqq.supervisor.core.channel.Sender;
import com.ryuqq.supervisor.core.runner.Runner;
import com.ryuqq.supervisor.core.signal.Signal;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A scripted {@link Runner} for exercising Composer and Process implementations.
 *
 * <p><strong>Behavior:</strong></p>
 * <ul>
 *   <li>setup: marks the runner as set up (or fails when built with {@link Builder#failSetup()})</li>
 *   <li>run: fails with {@link AssertionError} when setup was skipped</li>
 *   <li>run: reads signals until one decides the result:
 *     <ul>
 *       <li>success signal (default {@code INT}) → report {@code true}, return</li>
 *       <li>ignored signal → keep waiting</li>
 *       <li>any other signal, or a closed stream → report {@code false}, throw {@link TestRunnerException}</li>
 *     </ul>
 *   </li>
 * </ul>
 *
 * <p>Every received signal is recorded, and {@link #isFinished()} flips to {@code true}
 * immediately before {@code run} returns or throws.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * Channel&lt;Boolean&gt; reports = Channel.rendezvous();
 * TestRunner runner = TestRunner.create(reports);
 *
 * TestRunner patient = TestRunner.builder()
 *     .reportTo(reports)
 *     .succeedOn(Signal.TERM)
 *     .ignore(Signal.HUP)
 *     .build();
 * </pre>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public final class TestRunner implements Runner {

    private final Sender<Boolean> reports;
    private final Set<Signal> successSignals;
    private final Set<Signal> ignoredSignals;
    private final boolean failSetup;

    private final AtomicInteger setupCount = new AtomicInteger();
    private final List<Signal> observed = new CopyOnWriteArrayList<>();
    private volatile boolean setUp;
    private volatile boolean finished;

    private TestRunner(Builder builder) {
        this.reports = builder.reports;
        this.successSignals = EnumSet.copyOf(builder.successSignals);
        this.ignoredSignals = builder.ignoredSignals.isEmpty()
            ? EnumSet.noneOf(Signal.class)
            : EnumSet.copyOf(builder.ignoredSignals);
        this.failSetup = builder.failSetup;
    }

    /**
     * Creates a runner that succeeds on {@code INT} and fails on anything else.
     *
     * @param reports channel receiving {@code true} on success and {@code false} on failure
     * @return a new runner
     */
    public static TestRunner create(Sender<Boolean> reports) {
        return builder().reportTo(reports).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void setup() throws TestRunnerException {
        setupCount.incrementAndGet();
        if (failSetup) {
            throw new TestRunnerException("a testing setup error");
        }
        setUp = true;
    }

    @Override
    public void run(Receiver<Signal> signals) throws Exception {
        try {
            if (!setUp) {
                throw new AssertionError("run() called before a successful setup()");
            }
            while (true) {
                Optional<Signal> received = signals.recv();
                if (received.isEmpty()) {
                    report(false);
                    throw new TestRunnerException("signal stream closed");
                }
                Signal signal = received.get();
                observed.add(signal);
                if (successSignals.contains(signal)) {
                    report(true);
                    return;
                }
                if (!ignoredSignals.contains(signal)) {
                    report(false);
                    throw new TestRunnerException("a testing error: " + signal);
                }
            }
        } finally {
            finished = true;
        }
    }

    private void report(boolean success) throws InterruptedException {
        if (reports != null) {
            reports.send(success);
        }
    }

    public boolean isSetUp() {
        return setUp;
    }

    public int setupCount() {
        return setupCount.get();
    }

    public boolean isFinished() {
        return finished;
    }

    /**
     * Signals received by {@code run}, in arrival order.
     *
     * @return snapshot of the observed signals
     */
    public List<Signal> observedSignals() {
        return List.copyOf(observed);
    }

    /**
     * Builder for {@link TestRunner}.
     */
    public static final class Builder {

        private Sender<Boolean> reports;
        private Set<Signal> successSignals = EnumSet.of(Signal.INT);
        private final Set<Signal> ignoredSignals = EnumSet.noneOf(Signal.class);
        private boolean failSetup;

        private Builder() {
        }

        public Builder reportTo(Sender<Boolean> reports) {
            this.reports = reports;
            return this;
        }

        public Builder succeedOn(Signal first, Signal... rest) {
            this.successSignals = EnumSet.of(first, rest);
            return this;
        }

        public Builder ignore(Signal first, Signal... rest) {
            this.ignoredSignals.addAll(EnumSet.of(first, rest));
            return this;
        }

        public Builder failSetup() {
            this.failSetup = true;
            return this;
        }

        public TestRunner build() {
            return new TestRunner(this);
        }
    }
}
