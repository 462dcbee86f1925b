package com.ryuqq.supervisor.core.statemachine;

/**
 * Process의 결과 전달 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>INIT → SETUP_DONE (ready)</li>
 *   <li>INIT → FINISHED (wait, ready 생략)</li>
 *   <li>SETUP_DONE → FINISHED (wait)</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * INIT
 *    │
 *    ├─► SETUP_DONE (ready)
 *    │       │
 *    │       ▼ (wait)
 *    └─► FINISHED (wait)
 *
 * 금지된 전이:
 * - SETUP_DONE → SETUP_DONE ❌ (ready 두 번)
 * - FINISHED → * ❌
 * </pre>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public enum ProcState {

    /**
     * 초기 상태 (어떤 결과도 반환하지 않음).
     */
    INIT,

    /**
     * setup 결과 반환됨.
     */
    SETUP_DONE,

    /**
     * run 결과 반환됨.
     */
    FINISHED;

    /**
     * 종료 상태인지 확인.
     *
     * @return FINISHED인 경우 true
     */
    public boolean isTerminal() {
        return this == FINISHED;
    }
}
