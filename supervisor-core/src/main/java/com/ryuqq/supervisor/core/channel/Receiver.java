package com.ryuqq.supervisor.core.channel;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * 채널 수신 핸들.
 *
 * <p>채널이 닫히고 남은 값이 모두 소비되면 {@link Optional#empty()}를 반환합니다.
 * 이는 오류가 아니라 "더 이상 값이 없음"을 뜻하는 정상 조건입니다.</p>
 *
 * @param <T> 값 타입
 * @author Supervisor Team
 * @since 1.0.0
 */
public interface Receiver<T> {

    /**
     * 값 수신 (블로킹).
     *
     * @return 수신한 값, 채널이 닫히고 비어 있으면 empty
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    Optional<T> recv() throws InterruptedException;

    /**
     * 값 수신 (최대 timeout 동안 대기).
     *
     * @param timeout 최대 대기 시간
     * @param unit 시간 단위
     * @return 수신한 값, 시간 초과이거나 채널이 닫히고 비어 있으면 empty
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    Optional<T> poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * 값 수신 (비블로킹).
     *
     * @return 즉시 수신 가능한 값, 없으면 empty
     */
    Optional<T> tryRecv();

    /**
     * 준비 상태 확인.
     *
     * <p>수신 가능한 값이 있거나 채널이 닫혀 있으면 true.
     * {@link Select}가 다중 대기 시 사용합니다.</p>
     *
     * @return 준비 여부
     */
    boolean isReady();

    /**
     * 채널 종료 여부.
     *
     * @return 닫혀 있으면 true (남은 값이 있을 수 있음)
     */
    boolean isClosed();

    /**
     * 준비 상태 변화 감시자 등록.
     *
     * <p>값이 도착하거나 채널이 닫히면 등록된 감시자가 깨어납니다.</p>
     *
     * @param watcher 감시자
     */
    void watch(Select.Watcher watcher);

    /**
     * 감시자 해제.
     *
     * @param watcher 감시자
     */
    void unwatch(Select.Watcher watcher);
}
