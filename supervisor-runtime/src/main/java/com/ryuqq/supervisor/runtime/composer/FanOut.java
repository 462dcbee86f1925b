package com.ryuqq.supervisor.runtime.composer;

import com.ryuqq.supervisor.core.channel.Channel;
import com.ryuqq.supervisor.core.channel.Receiver;
import com.ryuqq.supervisor.core.channel.Select;
import com.ryuqq.supervisor.core.channel.Sender;
import com.ryuqq.supervisor.core.signal.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Signal fan-out 작업.
 *
 * <p>외부 Signal 스트림, 실패 알림 채널, 정지 채널 중 하나가 준비될 때까지 대기하고
 * 준비된 입력을 처리합니다.</p>
 *
 * <p><strong>우선순위 (동시에 준비된 경우):</strong></p>
 * <ol>
 *   <li>정지 요청 → 즉시 종료</li>
 *   <li>Runner 실패 알림 → 설정된 errorSignal을 모든 Runner 채널로 브로드캐스트</li>
 *   <li>외부 Signal → 도착 순서대로 모든 Runner 채널로 전달</li>
 * </ol>
 *
 * <p>외부 스트림이 닫히고 비면 대기 목록에서 제외합니다. 이미 끝난 Runner의 채널은
 * 닫혀 있으므로 전송이 버려집니다.</p>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
final class FanOut implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(FanOut.class);

    private final Receiver<Signal> signals;
    private final Receiver<Boolean> failures;
    private final Channel<Boolean> stop;
    private final List<? extends Sender<Signal>> outbounds;
    private final Signal errorSignal;

    /**
     * 생성자.
     *
     * @param signals 외부 Signal 스트림
     * @param failures Runner 실패 알림 채널
     * @param stop 정지 채널 (종료 시 닫힘)
     * @param outbounds Runner별 Signal 채널
     * @param errorSignal 실패 시 브로드캐스트할 Signal (null이면 실패 알림을 대기하지 않음)
     */
    FanOut(
        Receiver<Signal> signals,
        Receiver<Boolean> failures,
        Channel<Boolean> stop,
        List<? extends Sender<Signal>> outbounds,
        Signal errorSignal
    ) {
        this.signals = signals;
        this.failures = failures;
        this.stop = stop;
        this.outbounds = outbounds;
        this.errorSignal = errorSignal;
    }

    @Override
    public void run() {
        List<Receiver<?>> sources = new ArrayList<>(3);
        sources.add(stop);
        if (errorSignal != null) {
            sources.add(failures);
        }
        sources.add(signals);

        try {
            while (true) {
                Receiver<?> source = sources.get(Select.await(sources));

                if (source == stop) {
                    stop.tryRecv();
                    log.debug("Fan-out received stop request");
                    return;
                }

                if (source == failures) {
                    Optional<Boolean> notification = failures.tryRecv();
                    if (notification.isPresent()) {
                        log.debug("Broadcasting error signal {} to {} runners", errorSignal, outbounds.size());
                        broadcast(errorSignal);
                    } else if (failures.isClosed()) {
                        sources.remove(failures);
                    }
                    continue;
                }

                Optional<Signal> signal = signals.tryRecv();
                if (signal.isPresent()) {
                    broadcast(signal.get());
                } else if (signals.isClosed()) {
                    log.debug("External signal stream closed; waiting for stop only");
                    sources.remove(signals);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Fan-out interrupted; signal delivery stopped");
        } finally {
            stop.close();
        }
    }

    private void broadcast(Signal signal) throws InterruptedException {
        for (Sender<Signal> outbound : outbounds) {
            if (!outbound.send(signal)) {
                log.debug("Dropped {} for a finished runner", signal);
            }
        }
    }
}
