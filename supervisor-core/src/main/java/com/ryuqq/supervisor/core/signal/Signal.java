package com.ryuqq.supervisor.core.signal;

import java.util.Locale;

/**
 * 외부 이벤트 식별자 (OS 시그널).
 *
 * <p>Signal은 Runner에게 전달되는 종료/제어 요청을 나타내는 불변 값입니다.
 * 각 상수는 POSIX 시그널 이름에 대응되며, 동작은 가지지 않습니다.</p>
 *
 * <p><strong>사용처:</strong></p>
 * <ul>
 *   <li>시그널 구독 어댑터가 생성하여 Process의 inbound 채널로 전달</li>
 *   <li>Composer가 각 Runner의 채널로 복제 전달 (fan-out)</li>
 *   <li>Runner가 수신하여 종료 여부를 판단</li>
 * </ul>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public enum Signal {

    /** 터미널 연결 종료 (SIGHUP). */
    HUP,

    /** 인터럽트 (SIGINT, Ctrl+C). */
    INT,

    /** 종료 + 코어 덤프 요청 (SIGQUIT). */
    QUIT,

    ILL,
    TRAP,
    ABRT,
    BUS,
    FPE,
    KILL,
    USR1,
    SEGV,
    USR2,
    PIPE,
    ALRM,

    /** 정상 종료 요청 (SIGTERM). */
    TERM,

    CHLD,
    CONT,
    STOP,
    TSTP,
    TTIN,
    TTOU,
    URG,
    XCPU,
    XFSZ,
    VTALRM,
    PROF,
    WINCH,
    IO,
    SYS;

    private static final String OS_PREFIX = "SIG";

    /**
     * OS 시그널 이름 조회 ({@code SIG} 접두사 제외).
     *
     * @return 시그널 이름 (예: "INT", "HUP")
     */
    public String osName() {
        return name();
    }

    /**
     * OS 시그널 이름으로 Signal 조회.
     *
     * <p>{@code SIG} 접두사 유무와 대소문자를 구분하지 않습니다.
     * (예: "SIGINT", "int", "Int" 모두 {@link #INT})</p>
     *
     * @param osName OS 시그널 이름
     * @return Signal
     * @throws IllegalArgumentException osName이 null/blank이거나 알 수 없는 이름인 경우
     */
    public static Signal fromOsName(String osName) {
        if (osName == null || osName.isBlank()) {
            throw new IllegalArgumentException("osName cannot be null or blank");
        }
        String normalized = osName.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith(OS_PREFIX) && normalized.length() > OS_PREFIX.length()) {
            normalized = normalized.substring(OS_PREFIX.length());
        }
        for (Signal signal : values()) {
            if (signal.name().equals(normalized)) {
                return signal;
            }
        }
        throw new IllegalArgumentException("Unknown signal: " + osName);
    }
}
