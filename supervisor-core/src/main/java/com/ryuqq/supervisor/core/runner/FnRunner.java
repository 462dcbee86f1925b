package com.ryuqq.supervisor.core.runner;

import com.ryuqq.supervisor.core.channel.Receiver;
import com.ryuqq.supervisor.core.signal.Signal;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 함수 기반 Runner 어댑터.
 *
 * <p>{@link RunFunction} 하나를 감싸 Runner 계약을 만족시킵니다.
 * setup()은 항상 성공하고, run()은 함수를 정확히 한 번 호출합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Runner ticker = FnRunner.of(signals -&gt; {
 *     while (signals.poll(1, TimeUnit.SECONDS).isEmpty()) {
 *         tick();
 *     }
 * });
 * </pre>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public final class FnRunner implements Runner {

    private final AtomicReference<RunFunction> function;

    private FnRunner(RunFunction function) {
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
        this.function = new AtomicReference<>(function);
    }

    /**
     * FnRunner 생성.
     *
     * @param function 실행할 함수
     * @return FnRunner 인스턴스
     * @throws IllegalArgumentException function이 null인 경우
     */
    public static FnRunner of(RunFunction function) {
        return new FnRunner(function);
    }

    @Override
    public void setup() {
        // 준비할 것이 없음
    }

    /**
     * 함수 실행 (1회).
     *
     * @param signals inbound Signal 스트림
     * @throws Exception 함수가 던진 예외
     * @throws IllegalStateException 이미 실행된 경우
     */
    @Override
    public void run(Receiver<Signal> signals) throws Exception {
        RunFunction fn = function.getAndSet(null);
        if (fn == null) {
            throw new IllegalStateException("FnRunner has already been run");
        }
        fn.run(signals);
    }
}
