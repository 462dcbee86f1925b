package com.ryuqq.supervisor.core.runner;

import com.ryuqq.supervisor.core.channel.Receiver;
import com.ryuqq.supervisor.core.signal.Signal;

/**
 * 작업 단위 (Runner).
 *
 * <p>Runner는 임의의 작업을 수행하면서 종료 Signal을 기다립니다.
 * 정의된 종료 Signal을 받으면 유한한 시간 안에 반환해야 합니다.</p>
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * (생성) ──setup()──► (준비 완료) ──run(signals)──► (종료, 재사용 불가)
 * </pre>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>setup()은 유한 시간 안에 완료되어야 하며, 최대 한 번 호출됩니다.</li>
 *   <li>setup()이 실패하면 run()은 호출되지 않습니다.</li>
 *   <li>run()은 Runner를 소비합니다. 두 번 실행할 수 없습니다.</li>
 *   <li>run()이 시작된 후에는 실행 스레드 외의 누구도 Runner에 접근하지 않습니다.</li>
 *   <li>signals가 닫혀 빈 값을 반환하는 것은 오류가 아닙니다.
 *       무시하고 작업을 계속하거나 암묵적 종료로 취급할 수 있습니다.</li>
 * </ul>
 *
 * <p><strong>실패 분류:</strong></p>
 * <ul>
 *   <li>{@link Exception}: 일반 실패. Composer/Process가 결과로 집계합니다.</li>
 *   <li>{@link Error}: 치명적 장애. 결과로 변환되지 않고 join 시점에 전파됩니다.</li>
 * </ul>
 *
 * <p><strong>구현 예시:</strong></p>
 * <pre>
 * public final class HttpServerRunner implements Runner {
 *     public void setup() throws IOException {
 *         server.bind(port);
 *     }
 *
 *     public void run(Receiver&lt;Signal&gt; signals) throws Exception {
 *         server.start();
 *         signals.recv();  // 어떤 Signal이든 종료
 *         server.stop();
 *     }
 * }
 * </pre>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public interface Runner {

    /**
     * 실행 준비.
     *
     * @throws Exception 준비 실패 시 (run은 호출되지 않음)
     */
    void setup() throws Exception;

    /**
     * 작업 실행 (Runner 소비).
     *
     * @param signals inbound Signal 스트림
     * @throws Exception 작업 실패 시
     */
    void run(Receiver<Signal> signals) throws Exception;
}
