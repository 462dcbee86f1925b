package com.ryuqq.supervisor.runtime.composer;

import com.ryuqq.supervisor.core.channel.Channel;
import com.ryuqq.supervisor.core.channel.Receiver;
import com.ryuqq.supervisor.core.runner.Runner;
import com.ryuqq.supervisor.core.signal.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 여러 Runner를 하나의 Runner로 합성.
 *
 * <p>Composer 자신도 {@link Runner}이므로 다른 Composer나 Process 안에 중첩할 수 있습니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>setup: 목록 순서대로 각 Runner의 setup 호출, 첫 실패에서 중단</li>
 *   <li>run: Runner마다 전용 스레드와 Signal 채널(용량 1024)을 두고 동시에 실행</li>
 *   <li>외부 Signal을 fan-out 스레드가 모든 Runner 채널로 같은 순서로 전달</li>
 *   <li>첫 번째 실패만 결과로 집계 ({@link FirstErrorSlot})</li>
 * </ul>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run(signals) 호출
 *   ↓
 * (INIT이면) setup()
 *   ↓
 * fan-out 스레드 1개 + Runner 스레드 N개 시작
 *   ↓
 * 모든 Runner 스레드 join (인터럽트되어도 계속 join)
 *   ↓
 * fan-out 정지 요청 (rendezvous) + join
 *   ↓
 * 치명적 오류(Error)가 있으면 재발생, 아니면 첫 실패를 재발생하거나 정상 반환
 * </pre>
 *
 * <p><strong>실패 전파:</strong> {@link ComposerConfig#errorSignal()}이 설정된 경우, Runner가
 * 실패할 때마다 모든 Runner 채널로 해당 Signal을 브로드캐스트합니다.</p>
 *
 * <p>Composer는 한 번만 실행할 수 있습니다. 두 번째 run은 {@link IllegalStateException}을 던집니다.</p>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public final class Composer implements Runner {

    private static final Logger log = LoggerFactory.getLogger(Composer.class);

    static final int SIGNAL_BUFFER_CAPACITY = 1024;

    private final List<Runner> runners;
    private final ComposerConfig config;
    private final AtomicBoolean consumed = new AtomicBoolean(false);
    private volatile ComposerState state = ComposerState.INIT;

    /**
     * 생성자 (기본 설정 사용).
     *
     * @param runners 합성할 Runner 목록
     * @throws IllegalArgumentException runners가 null이거나 null 원소를 포함하는 경우
     */
    public Composer(List<? extends Runner> runners) {
        this(runners, new ComposerConfig());
    }

    /**
     * 생성자.
     *
     * @param runners 합성할 Runner 목록
     * @param config 설정
     * @throws IllegalArgumentException runners 또는 config가 null이거나 runners가 null 원소를 포함하는 경우
     */
    public Composer(List<? extends Runner> runners, ComposerConfig config) {
        if (runners == null) {
            throw new IllegalArgumentException("runners cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        for (Runner runner : runners) {
            if (runner == null) {
                throw new IllegalArgumentException("runners cannot contain null");
            }
        }
        this.runners = List.copyOf(runners);
        this.config = config;
    }

    /**
     * 모든 Runner setup.
     *
     * <p>목록 순서대로 호출하며 첫 실패를 그대로 던집니다. 이후 Runner의 setup은 호출되지 않고
     * 상태는 INIT으로 남습니다.</p>
     *
     * @throws IllegalStateException 이미 setup이 성공했거나 run이 호출된 경우
     * @throws Exception Runner setup 실패
     */
    @Override
    public void setup() throws Exception {
        if (consumed.get()) {
            throw new IllegalStateException("Composer has already been run");
        }
        setupRunners();
    }

    @Override
    public void run(Receiver<Signal> signals) throws Exception {
        if (signals == null) {
            throw new IllegalArgumentException("signals cannot be null");
        }
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("Composer has already been run");
        }
        if (state == ComposerState.INIT) {
            setupRunners();
        }

        int count = runners.size();
        List<Channel<Signal>> inbounds = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            inbounds.add(Channel.bounded(SIGNAL_BUFFER_CAPACITY));
        }
        Channel<Boolean> stop = Channel.rendezvous();
        Channel<Boolean> failures = Channel.bounded(Math.max(1, count));
        FirstErrorSlot errorSlot = new FirstErrorSlot();

        log.info("Composer started {} runners (error signal: {})", count, config.errorSignal());

        AtomicBoolean interrupted = new AtomicBoolean(false);
        Throwable fault = null;
        ExecutorService threads = Executors.newFixedThreadPool(
            count + 1,
            new RunnerThreadFactory(config.threadNamePrefix())
        );
        try {
            Future<?> fanOut = threads.submit(
                new FanOut(signals, failures, stop, inbounds, config.errorSignal())
            );
            List<Future<?>> workers = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                workers.add(threads.submit(worker(i, runners.get(i), inbounds.get(i), errorSlot, failures)));
            }

            for (Future<?> worker : workers) {
                fault = accumulate(fault, join(worker, interrupted));
            }
            requestStop(stop, interrupted);
            fault = accumulate(fault, join(fanOut, interrupted));
        } finally {
            threads.shutdown();
            failures.close();
            if (interrupted.get()) {
                Thread.currentThread().interrupt();
            }
        }

        if (fault instanceof Error error) {
            throw error;
        }
        if (fault != null) {
            throw new IllegalStateException("Composer thread terminated unexpectedly", fault);
        }

        Optional<Exception> failure = errorSlot.drain();
        if (failure.isPresent()) {
            log.info("Composer finished with failure: {}", failure.get().toString());
            throw failure.get();
        }
        log.info("Composer finished: all {} runners completed", count);
    }

    /**
     * 현재 Composer 상태.
     */
    public ComposerState state() {
        return state;
    }

    public int size() {
        return runners.size();
    }

    private void setupRunners() throws Exception {
        if (state == ComposerState.SETUP_DONE) {
            throw new IllegalStateException("Composer setup has already completed");
        }
        for (int i = 0; i < runners.size(); i++) {
            try {
                runners.get(i).setup();
            } catch (Exception e) {
                log.warn("Runner {} setup failed; remaining runners are not set up", i, e);
                throw e;
            }
        }
        state = ComposerState.SETUP_DONE;
        log.debug("Composer setup completed for {} runners", runners.size());
    }

    private Runnable worker(
        int index,
        Runner runner,
        Channel<Signal> inbound,
        FirstErrorSlot errorSlot,
        Channel<Boolean> failures
    ) {
        return () -> {
            try {
                runner.run(inbound);
                log.debug("Runner {} finished", index);
            } catch (Exception e) {
                if (errorSlot.offer(e)) {
                    log.warn("Runner {} failed", index, e);
                } else {
                    log.warn("Runner {} failed after an earlier failure was captured: {}", index, e.toString());
                }
                if (config.propagatesErrors() && !failures.trySend(Boolean.TRUE)) {
                    log.debug("Failure notification for runner {} was not queued", index);
                }
            } finally {
                inbound.close();
            }
        };
    }

    private static void requestStop(Channel<Boolean> stop, AtomicBoolean interrupted) {
        while (true) {
            try {
                stop.send(Boolean.TRUE);
                return;
            } catch (InterruptedException e) {
                interrupted.set(true);
            }
        }
    }

    private static Throwable join(Future<?> future, AtomicBoolean interrupted) {
        while (true) {
            try {
                future.get();
                return null;
            } catch (InterruptedException e) {
                interrupted.set(true);
            } catch (ExecutionException e) {
                return e.getCause();
            }
        }
    }

    private static Throwable accumulate(Throwable first, Throwable next) {
        if (next == null) {
            return first;
        }
        if (first == null) {
            return next;
        }
        first.addSuppressed(next);
        return first;
    }
}
