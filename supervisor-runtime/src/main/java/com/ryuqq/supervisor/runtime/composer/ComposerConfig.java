package com.ryuqq.supervisor.runtime.composer;

import com.ryuqq.supervisor.core.signal.Signal;

/**
 * Composer 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>errorSignal: 실패 전파 Signal (기본 null = 전파 안 함)</li>
 *   <li>threadNamePrefix: 실행 스레드 이름 접두사 (기본 "composer")</li>
 * </ul>
 *
 * <p><strong>실패 전파 모드:</strong></p>
 * <ul>
 *   <li>errorSignal == null: 첫 실패만 집계하고 다른 Runner에는 알리지 않음</li>
 *   <li>errorSignal != null: Runner가 실패할 때마다 모든 Runner 채널로 errorSignal 브로드캐스트</li>
 * </ul>
 *
 * <p>채널 용량(Runner당 1024, 정지 채널 0)은 내부 상수이며 설정 대상이 아닙니다.</p>
 *
 * @author Supervisor Team
 * @since 1.0.0
 * @param errorSignal 실패 시 브로드캐스트할 Signal (null이면 전파 안 함)
 * @param threadNamePrefix 스레드 이름 접두사 (null/blank 불가)
 */
public record ComposerConfig(
    Signal errorSignal,
    String threadNamePrefix
) {

    private static final String DEFAULT_THREAD_NAME_PREFIX = "composer";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: errorSignal=null (전파 안 함), threadNamePrefix="composer"</p>
     */
    public ComposerConfig() {
        this(null, DEFAULT_THREAD_NAME_PREFIX);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException threadNamePrefix가 null이거나 빈 문자열인 경우
     */
    public ComposerConfig {
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
        // errorSignal은 null 허용
    }

    /**
     * 실패 전파 설정 생성.
     *
     * @param errorSignal 실패 시 브로드캐스트할 Signal
     * @return ComposerConfig 인스턴스
     * @throws IllegalArgumentException errorSignal이 null인 경우
     */
    public static ComposerConfig propagating(Signal errorSignal) {
        if (errorSignal == null) {
            throw new IllegalArgumentException("errorSignal cannot be null");
        }
        return new ComposerConfig(errorSignal, DEFAULT_THREAD_NAME_PREFIX);
    }

    /**
     * 실패 전파 모드 여부.
     *
     * @return errorSignal이 설정된 경우 true
     */
    public boolean propagatesErrors() {
        return errorSignal != null;
    }

    /**
     * errorSignal만 변경한 새 인스턴스 생성.
     */
    public ComposerConfig withErrorSignal(Signal errorSignal) {
        return new ComposerConfig(errorSignal, threadNamePrefix);
    }

    /**
     * threadNamePrefix만 변경한 새 인스턴스 생성.
     */
    public ComposerConfig withThreadNamePrefix(String threadNamePrefix) {
        return new ComposerConfig(errorSignal, threadNamePrefix);
    }
}
