package com.ryuqq.supervisor.runtime.composer;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 첫 번째 실패만 기록하는 공유 슬롯.
 *
 * <p>여러 Runner 스레드가 동시에 실패를 기록하려 할 때, lock 안에서 비어 있는지 확인한 뒤
 * 기록합니다. 먼저 기록한 스레드만 성공하고 이후 실패는 버려집니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>최대 하나의 실패만 보관</li>
 *   <li>{@link #drain()}은 정확히 한 번, 모든 기록자가 끝난 뒤 호출</li>
 *   <li>drain 이후 기록 불가</li>
 * </ul>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public final class FirstErrorSlot {

    private final ReentrantLock lock = new ReentrantLock();
    private Exception error;
    private boolean drained;

    /**
     * 실패 기록 시도.
     *
     * @param failure Runner 실패
     * @return 첫 번째 기록이면 true, 이미 기록된 실패가 있으면 false
     * @throws IllegalArgumentException failure가 null인 경우
     * @throws IllegalStateException 이미 drain된 경우
     */
    public boolean offer(Exception failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        lock.lock();
        try {
            if (drained) {
                throw new IllegalStateException("FirstErrorSlot has already been drained");
            }
            if (error != null) {
                return false;
            }
            error = failure;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 기록된 실패 회수 (1회).
     *
     * @return 첫 번째 실패, 없으면 empty
     * @throws IllegalStateException 두 번째 호출인 경우
     */
    public Optional<Exception> drain() {
        lock.lock();
        try {
            if (drained) {
                throw new IllegalStateException("FirstErrorSlot has already been drained");
            }
            drained = true;
            Exception captured = error;
            error = null;
            return Optional.ofNullable(captured);
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        lock.lock();
        try {
            return error == null;
        } finally {
            lock.unlock();
        }
    }
}
