package com.ryuqq.supervisor.adapter.os;

import com.ryuqq.supervisor.core.channel.Channel;
import com.ryuqq.supervisor.core.outcome.Outcome;
import com.ryuqq.supervisor.core.process.Process;
import com.ryuqq.supervisor.core.runner.Runner;
import com.ryuqq.supervisor.core.signal.Signal;
import com.ryuqq.supervisor.runtime.process.SupervisedProcess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * OS 시그널을 구독하고 Runner를 Process로 시작.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * launch(runner, signals)
 *   ↓
 * unbounded Signal 채널 생성
 *   ↓
 * subscriber.subscribe(signals, channel)
 *   ↓
 * SupervisedProcess 시작 (같은 채널로 Process.signal과 OS 시그널 수신)
 *   ↓
 * 반환된 Process.close(): Runner 스레드 join → 구독 해제
 * </pre>
 *
 * <p>시그널 핸들러는 프로세스 전역이므로, 다른 스레드를 만들기 전에 launch하는 것을 권장합니다.</p>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public final class Launcher {

    private static final Logger log = LoggerFactory.getLogger(Launcher.class);

    // Utility class - prevent instantiation
    private Launcher() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * JVM 시그널 핸들러로 구독하고 시작.
     *
     * @param runner 실행할 Runner (보통 Composer)
     * @param signals 구독할 OS 시그널
     * @return 시작된 Process
     * @throws IllegalArgumentException 인자가 null이거나 구독할 수 없는 시그널이 포함된 경우
     */
    public static Process launch(Runner runner, List<Signal> signals) {
        return launch(runner, signals, new SunMiscSignalSubscriber());
    }

    /**
     * 주어진 구독자로 구독하고 시작.
     *
     * @param runner 실행할 Runner
     * @param signals 구독할 OS 시그널
     * @param subscriber 시그널 구독자
     * @return 시작된 Process
     * @throws IllegalArgumentException 인자가 null이거나 구독할 수 없는 시그널이 포함된 경우
     */
    public static Process launch(Runner runner, List<Signal> signals, SignalSubscriber subscriber) {
        if (runner == null) {
            throw new IllegalArgumentException("runner cannot be null");
        }
        if (signals == null) {
            throw new IllegalArgumentException("signals cannot be null");
        }
        if (subscriber == null) {
            throw new IllegalArgumentException("subscriber cannot be null");
        }

        Channel<Signal> channel = Channel.unbounded();
        SignalSubscription subscription = subscriber.subscribe(signals, channel);
        try {
            SupervisedProcess process = SupervisedProcess.start(runner, channel);
            log.info("Launched {} listening for {}", process.threadName(), subscription.signals());
            return new LaunchedProcess(process, subscription);
        } catch (RuntimeException | Error e) {
            subscription.close();
            throw e;
        }
    }

    /**
     * 구독 수명을 Process 수명에 묶는 Process.
     */
    private static final class LaunchedProcess implements Process {

        private final SupervisedProcess process;
        private final SignalSubscription subscription;

        private LaunchedProcess(SupervisedProcess process, SignalSubscription subscription) {
            this.process = process;
            this.subscription = subscription;
        }

        @Override
        public Outcome ready() {
            return process.ready();
        }

        @Override
        public Outcome waitFor() {
            return process.waitFor();
        }

        @Override
        public void signal(Signal signal) {
            process.signal(signal);
        }

        @Override
        public void close() {
            try {
                process.close();
            } finally {
                subscription.close();
            }
        }
    }
}
