package com.ryuqq.supervisor.runtime.process;

import com.ryuqq.supervisor.core.channel.Channel;
import com.ryuqq.supervisor.core.channel.Receiver;
import com.ryuqq.supervisor.core.channel.Sender;
import com.ryuqq.supervisor.core.outcome.CouldNotRecvResult;
import com.ryuqq.supervisor.core.outcome.Ok;
import com.ryuqq.supervisor.core.outcome.Outcome;
import com.ryuqq.supervisor.core.outcome.ResultAlreadyGiven;
import com.ryuqq.supervisor.core.outcome.RunnerError;
import com.ryuqq.supervisor.core.process.Process;
import com.ryuqq.supervisor.core.runner.Runner;
import com.ryuqq.supervisor.core.runner.RunnerPanicException;
import com.ryuqq.supervisor.core.signal.Signal;
import com.ryuqq.supervisor.core.statemachine.ProcState;
import com.ryuqq.supervisor.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runner 하나를 백그라운드 스레드에서 실행하는 Process.
 *
 * <p>생성 즉시 스레드를 시작합니다. 스레드는 setup을 호출해 결과를 setup 결과 채널에 보내고,
 * setup이 성공한 경우에만 run을 호출해 결과를 run 결과 채널에 보냅니다.
 * 두 결과 채널(용량 1)은 스레드가 끝날 때 항상 닫힙니다.</p>
 *
 * <p><strong>상태 전이 (CAS):</strong></p>
 * <pre>
 * INIT ──ready()──► SETUP_DONE ──waitFor()──► FINISHED
 *   └─────────────waitFor()──────────────────────┘
 * </pre>
 *
 * <p>허용되지 않은 호출은 예외 대신 {@link ResultAlreadyGiven}을 반환합니다.</p>
 *
 * <p><strong>종료:</strong> {@link #close()}는 백그라운드 스레드를 한 번만 join합니다.
 * 스레드가 {@link Error}로 죽은 경우 {@link RunnerPanicException}을 던집니다.
 * try-with-resources로 사용하면 모든 경로에서 join이 보장됩니다.</p>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public final class SupervisedProcess implements Process {

    private static final Logger log = LoggerFactory.getLogger(SupervisedProcess.class);
    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private final Channel<Outcome> setupResult = Channel.bounded(1);
    private final Channel<Outcome> runResult = Channel.bounded(1);
    private final AtomicReference<ProcState> state = new AtomicReference<>(ProcState.INIT);
    private final Sender<Signal> signaler;
    private final Thread thread;
    private volatile Throwable fault;
    private boolean joined;

    /**
     * 생성자 (스레드 즉시 시작).
     *
     * @param runner 실행할 Runner
     * @param signaler Runner에게 Signal을 보내는 송신 핸들
     * @param signals Runner가 읽을 수신 핸들 (signaler와 같은 채널)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public SupervisedProcess(Runner runner, Sender<Signal> signaler, Receiver<Signal> signals) {
        if (runner == null) {
            throw new IllegalArgumentException("runner cannot be null");
        }
        if (signaler == null) {
            throw new IllegalArgumentException("signaler cannot be null");
        }
        if (signals == null) {
            throw new IllegalArgumentException("signals cannot be null");
        }
        this.signaler = signaler;
        this.thread = new Thread(() -> drive(runner, signals), "supervised-process-" + SEQUENCE.incrementAndGet());
        this.thread.start();
    }

    /**
     * 단일 채널로 Process 생성.
     *
     * @param runner 실행할 Runner
     * @param channel 송수신 양쪽으로 사용할 Signal 채널
     * @return 시작된 Process
     */
    public static SupervisedProcess start(Runner runner, Channel<Signal> channel) {
        return new SupervisedProcess(runner, channel, channel);
    }

    @Override
    public Outcome ready() {
        if (!advance(ProcState.SETUP_DONE)) {
            return ResultAlreadyGiven.of();
        }
        return receive(setupResult);
    }

    @Override
    public Outcome waitFor() {
        if (!advance(ProcState.FINISHED)) {
            return ResultAlreadyGiven.of();
        }
        return receive(runResult);
    }

    @Override
    public void signal(Signal signal) {
        if (signal == null) {
            throw new IllegalArgumentException("signal cannot be null");
        }
        if (!signaler.trySend(signal)) {
            log.warn("Signal {} was not delivered to {} (channel full or closed)", signal, thread.getName());
        }
    }

    /**
     * 백그라운드 스레드 join (멱등).
     *
     * @throws RunnerPanicException 스레드가 Error로 종료된 경우
     * @throws IllegalStateException join 중 인터럽트된 경우 (인터럽트 플래그 복원)
     */
    @Override
    public synchronized void close() {
        if (joined) {
            return;
        }
        try {
            thread.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while joining " + thread.getName(), e);
        }
        joined = true;
        log.debug("Joined {}", thread.getName());

        Throwable panic = fault;
        if (panic != null) {
            throw new RunnerPanicException("Runner thread " + thread.getName() + " panicked", panic);
        }
    }

    /**
     * 현재 Process 상태.
     */
    public ProcState state() {
        return state.get();
    }

    public String threadName() {
        return thread.getName();
    }

    private void drive(Runner runner, Receiver<Signal> signals) {
        try {
            Outcome setup = attempt(runner::setup);
            setupResult.trySend(setup);
            if (!setup.isOk()) {
                log.warn("Runner setup failed on {}: {}", thread.getName(), setup.message());
                return;
            }
            Outcome run = attempt(() -> runner.run(signals));
            runResult.trySend(run);
            log.debug("Runner on {} finished: {}", thread.getName(), run.message());
        } catch (Error e) {
            fault = e;
            log.error("Runner thread {} died with a fatal error", thread.getName(), e);
        } finally {
            setupResult.close();
            runResult.close();
        }
    }

    private static Outcome attempt(Step step) {
        try {
            step.execute();
            return Ok.of();
        } catch (Exception e) {
            return RunnerError.of(e);
        }
    }

    private boolean advance(ProcState target) {
        while (true) {
            ProcState current = state.get();
            if (!StateTransition.canTransition(current, target)) {
                return false;
            }
            if (state.compareAndSet(current, target)) {
                return true;
            }
        }
    }

    private static Outcome receive(Receiver<Outcome> results) {
        try {
            Optional<Outcome> outcome = results.recv();
            return outcome.orElseGet(CouldNotRecvResult::of);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CouldNotRecvResult.of();
        }
    }

    @FunctionalInterface
    private interface Step {
        void execute() throws Exception;
    }
}
