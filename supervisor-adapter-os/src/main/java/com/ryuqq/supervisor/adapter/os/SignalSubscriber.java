package com.ryuqq.supervisor.adapter.os;

import com.ryuqq.supervisor.core.channel.Sender;
import com.ryuqq.supervisor.core.signal.Signal;

import java.util.List;

/**
 * OS 시그널 구독 SPI.
 *
 * <p>구독한 시그널이 프로세스에 도착하면 구현체는 대응하는 {@link Signal}을 sink로
 * 논블로킹 전송해야 합니다. 시그널 핸들러 문맥에서 블로킹하면 안 됩니다.</p>
 *
 * <p><strong>구현체:</strong></p>
 * <ul>
 *   <li>{@link SunMiscSignalSubscriber}: JVM 시그널 핸들러 (sun.misc.Signal)</li>
 *   <li>테스트: 람다 또는 Mockito mock으로 시그널 도착을 직접 재현</li>
 * </ul>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SignalSubscriber {

    /**
     * 시그널 구독.
     *
     * @param signals 구독할 시그널 목록
     * @param sink 도착한 시그널을 받을 송신 핸들
     * @return 구독 핸들 (close 시 구독 해제)
     * @throws IllegalArgumentException 구독할 수 없는 시그널이 포함된 경우
     */
    SignalSubscription subscribe(List<Signal> signals, Sender<Signal> sink);
}
