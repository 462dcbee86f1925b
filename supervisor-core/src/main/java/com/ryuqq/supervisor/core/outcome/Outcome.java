package com.ryuqq.supervisor.core.outcome;

/**
 * Process 결과.
 *
 * <p>Outcome은 네 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공</li>
 *   <li>{@link RunnerError}: Runner의 setup 또는 run 실패</li>
 *   <li>{@link ResultAlreadyGiven}: 결과를 이미 반환함 (호출 순서 오류)</li>
 *   <li>{@link CouldNotRecvResult}: 결과를 받기 전에 실행 스레드가 종료됨</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * <p><strong>분기 예시:</strong></p>
 * <pre>
 * Outcome outcome = process.waitFor();
 * if (outcome instanceof RunnerError error) {
 *     log.error("Runner failed", error.cause());
 * } else if (!outcome.isOk()) {
 *     log.warn("Unexpected outcome: {}", outcome.message());
 * }
 * </pre>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, RunnerError, ResultAlreadyGiven, CouldNotRecvResult {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과 설명 메시지.
     *
     * @return 사람이 읽을 수 있는 메시지
     */
    String message();
}
