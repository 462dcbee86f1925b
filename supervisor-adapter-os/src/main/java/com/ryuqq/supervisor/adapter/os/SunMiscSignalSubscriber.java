package com.ryuqq.supervisor.adapter.os;

import com.ryuqq.supervisor.core.channel.Sender;
import com.ryuqq.supervisor.core.signal.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sun.misc.SignalHandler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * sun.misc.Signal 기반 OS 시그널 구독.
 *
 * <p>구독한 시그널마다 JVM 시그널 핸들러를 설치합니다. 핸들러는 sink로
 * {@link Sender#trySend(Object)}만 호출하고, 거부되면 WARN 로그를 남깁니다.</p>
 *
 * <p><strong>제약:</strong></p>
 * <ul>
 *   <li>VM이 사용하는 시그널(KILL, STOP 등)은 구독할 수 없습니다. 이 경우 이미 설치한
 *       핸들러를 복원하고 {@link IllegalArgumentException}을 던집니다.</li>
 *   <li>구독 해제 시 이전 핸들러를 복원합니다.</li>
 *   <li>다른 스레드를 만들기 전에 구독하는 것을 권장합니다.</li>
 * </ul>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public final class SunMiscSignalSubscriber implements SignalSubscriber {

    private static final Logger log = LoggerFactory.getLogger(SunMiscSignalSubscriber.class);

    @Override
    public SignalSubscription subscribe(List<Signal> signals, Sender<Signal> sink) {
        if (signals == null) {
            throw new IllegalArgumentException("signals cannot be null");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }

        Map<sun.misc.Signal, SignalHandler> previous = new LinkedHashMap<>();
        List<Signal> subscribed = new ArrayList<>();
        for (Signal signal : new LinkedHashSet<>(signals)) {
            if (signal == null) {
                restore(previous);
                throw new IllegalArgumentException("signals cannot contain null");
            }
            try {
                sun.misc.Signal osSignal = new sun.misc.Signal(signal.name());
                SignalHandler prior = sun.misc.Signal.handle(osSignal, received -> deliver(signal, sink));
                previous.put(osSignal, prior);
                subscribed.add(signal);
            } catch (IllegalArgumentException e) {
                restore(previous);
                throw new IllegalArgumentException("Cannot subscribe to SIG" + signal.osName() + ": " + e.getMessage(), e);
            }
        }

        log.info("Subscribed to OS signals {}", subscribed);
        return new Subscription(List.copyOf(subscribed), previous);
    }

    private static void deliver(Signal signal, Sender<Signal> sink) {
        if (!sink.trySend(signal)) {
            log.warn("OS signal SIG{} dropped (signal channel full or closed)", signal.osName());
        }
    }

    private static void restore(Map<sun.misc.Signal, SignalHandler> previous) {
        for (Map.Entry<sun.misc.Signal, SignalHandler> entry : previous.entrySet()) {
            sun.misc.Signal.handle(entry.getKey(), entry.getValue());
        }
    }

    private static final class Subscription implements SignalSubscription {

        private final List<Signal> signals;
        private final Map<sun.misc.Signal, SignalHandler> previous;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private Subscription(List<Signal> signals, Map<sun.misc.Signal, SignalHandler> previous) {
            this.signals = signals;
            this.previous = previous;
        }

        @Override
        public List<Signal> signals() {
            return signals;
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            restore(previous);
            log.info("Unsubscribed from OS signals {}", signals);
        }
    }
}
