package com.ryuqq.supervisor.core.outcome;

/**
 * 성공 결과.
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public record Ok() implements Outcome {

    private static final Ok INSTANCE = new Ok();

    /**
     * 성공 결과 조회.
     *
     * @return Ok 인스턴스
     */
    public static Ok of() {
        return INSTANCE;
    }

    @Override
    public String message() {
        return "Ok";
    }
}
