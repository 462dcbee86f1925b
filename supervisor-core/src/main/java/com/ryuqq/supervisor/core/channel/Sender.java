package com.ryuqq.supervisor.core.channel;

/**
 * 채널 송신 핸들.
 *
 * <p>닫힌 채널로의 송신은 예외가 아니라 {@code false} 반환으로 표현합니다.
 * 수신 측이 이미 종료된 경우 송신 측은 값을 버리고 계속 진행할 수 있어야 하기 때문입니다.</p>
 *
 * @param <T> 값 타입
 * @author Supervisor Team
 * @since 1.0.0
 */
public interface Sender<T> {

    /**
     * 값 송신 (블로킹).
     *
     * <p>버퍼가 가득 찬 경우 공간이 생길 때까지 대기합니다.
     * rendezvous 채널은 수신 측이 값을 가져갈 때까지 대기합니다.</p>
     *
     * @param value 송신할 값
     * @return 송신 성공 여부 (채널이 닫혀 있으면 false)
     * @throws IllegalArgumentException value가 null인 경우
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    boolean send(T value) throws InterruptedException;

    /**
     * 값 송신 (비블로킹).
     *
     * @param value 송신할 값
     * @return 송신 성공 여부 (버퍼가 가득 찼거나 채널이 닫혀 있으면 false)
     * @throws IllegalArgumentException value가 null인 경우
     */
    boolean trySend(T value);
}
