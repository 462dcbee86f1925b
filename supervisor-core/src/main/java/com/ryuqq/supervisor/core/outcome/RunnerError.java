package com.ryuqq.supervisor.core.outcome;

/**
 * Runner 실패.
 *
 * <p>Runner의 setup() 또는 run()이 던진 예외를 그대로 담습니다.
 * 예외 타입은 Runner마다 다르며, 코어는 그 내용을 해석하지 않습니다.</p>
 *
 * <p>Composer에서 여러 Runner가 실패한 경우에도 처음 기록된 실패 하나만 담깁니다.</p>
 *
 * @param cause Runner가 던진 예외
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public record RunnerError(Exception cause) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public RunnerError {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
    }

    /**
     * RunnerError 생성.
     *
     * @param cause Runner가 던진 예외
     * @return RunnerError 인스턴스
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public static RunnerError of(Exception cause) {
        return new RunnerError(cause);
    }

    @Override
    public String message() {
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getName();
    }
}
