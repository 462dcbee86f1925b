package com.ryuqq.supervisor.core.runner;

/**
 * Runner 스레드의 치명적 장애.
 *
 * <p>Runner 실행 스레드가 일반 실패({@link Exception})가 아닌 {@link Error}로 종료된 경우,
 * 스레드를 join하는 시점에 이 예외로 전파됩니다. 결과 값으로 흡수되지 않으며 재시도 대상이 아닙니다.</p>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public class RunnerPanicException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * 생성자.
     *
     * @param message 메시지
     * @param cause 스레드를 종료시킨 장애
     */
    public RunnerPanicException(String message, Throwable cause) {
        super(message, cause);
    }
}
