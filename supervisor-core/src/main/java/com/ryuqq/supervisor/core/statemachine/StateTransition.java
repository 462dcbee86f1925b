package com.ryuqq.supervisor.core.statemachine;

/**
 * ProcState 전이 규칙.
 *
 * <p>허용되지 않은 전이는 예외가 아닌 {@code false}로 거부합니다.
 * Process는 거부된 전이를 {@code ResultAlreadyGiven} 결과로 변환합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>INIT → SETUP_DONE</li>
 *   <li>INIT → FINISHED</li>
 *   <li>SETUP_DONE → FINISHED</li>
 * </ul>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이 허용 여부.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용되는 전이인 경우 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean canTransition(ProcState from, ProcState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        return switch (from) {
            case INIT -> to == ProcState.SETUP_DONE || to == ProcState.FINISHED;
            case SETUP_DONE -> to == ProcState.FINISHED;
            case FINISHED -> false;
        };
    }
}
