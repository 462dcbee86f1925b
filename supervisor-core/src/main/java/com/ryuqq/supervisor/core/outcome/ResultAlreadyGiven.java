package com.ryuqq.supervisor.core.outcome;

/**
 * 결과 중복 요청.
 *
 * <p>ready() 또는 wait 호출이 상태 머신이 허용하는 횟수를 초과한 경우입니다.
 * 런타임 장애가 아닌 호출 측의 프로그래밍 오류를 나타냅니다.</p>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public record ResultAlreadyGiven() implements Outcome {

    private static final ResultAlreadyGiven INSTANCE = new ResultAlreadyGiven();

    public static ResultAlreadyGiven of() {
        return INSTANCE;
    }

    @Override
    public String message() {
        return "Already returned result to caller";
    }
}
