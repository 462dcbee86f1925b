/**
 * Process contract - 실행 중인 Runner 핸들.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.supervisor.core.process.Process} - ready/waitFor/signal/close</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>1회성 결과:</strong> ready와 waitFor는 각각 한 번만 결과를 반환</li>
 *   <li><strong>비블로킹 signal:</strong> 결과 대기와 동시에 Signal 전달 가능</li>
 *   <li><strong>스레드 회수:</strong> close는 실행 스레드를 반드시 join</li>
 * </ul>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
package com.ryuqq.supervisor.core.process;
