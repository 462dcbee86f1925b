/**
 * Runner contract - 작업 단위 생명주기.
 *
 * <p>이 패키지는 Composer와 Process가 실행하는 작업 단위의 계약을 정의합니다.</p>
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.supervisor.core.runner.Runner} - setup/run 생명주기 계약</li>
 *   <li>{@link com.ryuqq.supervisor.core.runner.FnRunner} - 함수를 Runner로 감싸는 어댑터</li>
 *   <li>{@link com.ryuqq.supervisor.core.runner.RunnerPanicException} - 치명적 장애 전파</li>
 * </ul>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
package com.ryuqq.supervisor.core.runner;
