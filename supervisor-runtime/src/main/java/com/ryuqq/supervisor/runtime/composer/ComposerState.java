package com.ryuqq.supervisor.runtime.composer;

/**
 * Composer 생명주기 상태.
 *
 * <pre>
 * INIT ──setup() 성공──► SETUP_DONE
 *   │                        │
 *   └──run() (암묵적 setup)──┴──► run 진행 (Composer 소비)
 * </pre>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public enum ComposerState {

    /**
     * setup 전이거나 setup이 실패한 상태.
     */
    INIT,

    /**
     * 모든 Runner의 setup이 성공한 상태.
     */
    SETUP_DONE
}
