package com.ryuqq.supervisor.core.process;

import com.ryuqq.supervisor.core.outcome.Outcome;
import com.ryuqq.supervisor.core.signal.Signal;

/**
 * 실행 중인 작업 단위 핸들.
 *
 * <p>Process는 전용 스레드에서 실행 중인 Runner를 나타냅니다.
 * Signal을 보낼 수 있고, 준비 완료와 종료를 기다릴 수 있습니다.</p>
 *
 * <p><strong>호출 규칙:</strong></p>
 * <ul>
 *   <li>{@link #ready()}: 최대 한 번 결과 반환, 이후 ResultAlreadyGiven</li>
 *   <li>{@link #waitFor()}: 최대 한 번 결과 반환, 이후 ResultAlreadyGiven</li>
 *   <li>{@link #signal(Signal)}: 횟수 제한 없음, ready/waitFor와 동시 호출 가능</li>
 *   <li>{@link #close()}: 실행 스레드 join, 모든 종료 경로에서 호출되어야 함</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (Process process = Launcher.launch(composer, List.of(Signal.INT, Signal.TERM))) {
 *     if (!process.ready().isOk()) {
 *         return;
 *     }
 *     Outcome outcome = process.waitFor();
 * }
 * </pre>
 *
 * <p>{@code wait}라는 이름은 {@link Object#wait()}와 충돌하므로 {@link #waitFor()}를 사용합니다.</p>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public interface Process extends AutoCloseable {

    /**
     * setup 완료 대기.
     *
     * <p>Runner의 setup이 끝날 때까지 블로킹하고 그 결과를 반환합니다.</p>
     *
     * @return setup 결과 (Ok, RunnerError, CouldNotRecvResult), 두 번째 호출부터 ResultAlreadyGiven
     */
    Outcome ready();

    /**
     * 종료 대기.
     *
     * <p>Runner의 run이 끝날 때까지 블로킹하고 그 결과를 반환합니다.
     * ready() 없이 바로 호출할 수 있습니다.</p>
     *
     * @return run 결과 (Ok, RunnerError, CouldNotRecvResult), 두 번째 호출부터 ResultAlreadyGiven
     */
    Outcome waitFor();

    /**
     * 실행 중인 Runner에 Signal 전달 (비블로킹).
     *
     * @param signal 전달할 Signal
     * @throws IllegalArgumentException signal이 null인 경우
     */
    void signal(Signal signal);

    /**
     * 실행 스레드 join (멱등).
     *
     * @throws com.ryuqq.supervisor.core.runner.RunnerPanicException 실행 스레드가 치명적 장애로 종료된 경우
     */
    @Override
    void close();
}
