package com.ryuqq.supervisor.adapter.os;

import com.ryuqq.supervisor.core.signal.Signal;

import java.util.List;

/**
 * OS 시그널 구독 핸들.
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public interface SignalSubscription extends AutoCloseable {

    /**
     * 구독 중인 시그널 목록.
     */
    List<Signal> signals();

    /**
     * 구독 해제 (멱등).
     */
    @Override
    void close();
}
