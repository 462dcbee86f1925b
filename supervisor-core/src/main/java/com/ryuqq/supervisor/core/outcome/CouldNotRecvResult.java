package com.ryuqq.supervisor.core.outcome;

/**
 * 결과 수신 실패.
 *
 * <p>실행 스레드가 결과를 게시하기 전에 결과 채널이 닫힌 경우입니다.</p>
 *
 * <p><strong>발생 상황:</strong></p>
 * <ul>
 *   <li>실행 스레드가 치명적 장애로 종료됨</li>
 *   <li>setup 실패 후 run 결과를 기다림 (run은 실행되지 않음)</li>
 *   <li>결과 대기 중 호출 스레드가 인터럽트됨</li>
 * </ul>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public record CouldNotRecvResult() implements Outcome {

    private static final CouldNotRecvResult INSTANCE = new CouldNotRecvResult();

    public static CouldNotRecvResult of() {
        return INSTANCE;
    }

    @Override
    public String message() {
        return "Could not receive result from thread";
    }
}
