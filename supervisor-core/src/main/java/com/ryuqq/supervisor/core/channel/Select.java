package com.ryuqq.supervisor.core.channel;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 다중 채널 대기 (select).
 *
 * <p>여러 {@link Receiver} 중 하나가 준비될 때까지 블로킹하고, 준비된 수신 핸들의
 * 인덱스를 반환합니다. 준비 상태는 "수신 가능한 값이 있음" 또는 "채널이 닫힘"입니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>목록 순서대로 준비 상태 확인 (앞선 인덱스 우선)</li>
 *   <li>준비된 채널이 없으면 모든 채널에 {@link Watcher} 등록</li>
 *   <li>등록 후 다시 확인 (등록 사이의 wake-up 유실 방지)</li>
 *   <li>Watcher가 깨어날 때까지 대기 후 2번부터 반복</li>
 * </ol>
 *
 * <p>폴링 없이 조건 변수로만 대기합니다. 반환된 인덱스의 채널에서 값을 꺼내는 것은
 * 호출자의 책임이며, 채널당 수신자가 하나일 때 {@link Receiver#tryRecv()}는 값을 보장합니다.</p>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public final class Select {

    // Utility class - prevent instantiation
    private Select() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 준비된 수신 핸들 대기.
     *
     * @param receivers 대기할 수신 핸들 목록 (비어 있으면 안 됨)
     * @return 준비된 수신 핸들의 인덱스
     * @throws IllegalArgumentException receivers가 null이거나 비어 있는 경우
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public static int await(List<? extends Receiver<?>> receivers) throws InterruptedException {
        if (receivers == null || receivers.isEmpty()) {
            throw new IllegalArgumentException("receivers cannot be null or empty");
        }

        int ready = firstReady(receivers);
        if (ready >= 0) {
            return ready;
        }

        Watcher watcher = new Watcher();
        for (Receiver<?> receiver : receivers) {
            receiver.watch(watcher);
        }
        try {
            while (true) {
                ready = firstReady(receivers);
                if (ready >= 0) {
                    return ready;
                }
                watcher.await();
            }
        } finally {
            for (Receiver<?> receiver : receivers) {
                receiver.unwatch(watcher);
            }
        }
    }

    /**
     * 준비된 수신 핸들 대기 (가변 인자).
     *
     * @param receivers 대기할 수신 핸들
     * @return 준비된 수신 핸들의 인덱스
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public static int await(Receiver<?>... receivers) throws InterruptedException {
        if (receivers == null) {
            throw new IllegalArgumentException("receivers cannot be null or empty");
        }
        return await(Arrays.asList(receivers));
    }

    private static int firstReady(List<? extends Receiver<?>> receivers) {
        for (int i = 0; i < receivers.size(); i++) {
            if (receivers.get(i).isReady()) {
                return i;
            }
        }
        return -1;
    }

    /**
     * select 대기자.
     *
     * <p>채널 상태 변화 시 {@link #wake()}가 호출되며, 한 번의 wake는
     * 다음 {@link #await()} 한 번을 해제합니다 (재사용 가능).</p>
     */
    public static final class Watcher {

        private final ReentrantLock lock = new ReentrantLock();
        private final Condition woken = lock.newCondition();
        private boolean signaled;

        Watcher() {
        }

        /**
         * 대기 중인 select 해제.
         *
         * <p>{@link Receiver} 구현체는 값 도착 또는 종료 시 이 메서드를 호출해야 합니다.</p>
         */
        public void wake() {
            lock.lock();
            try {
                signaled = true;
                woken.signal();
            } finally {
                lock.unlock();
            }
        }

        void await() throws InterruptedException {
            lock.lockInterruptibly();
            try {
                while (!signaled) {
                    woken.await();
                }
                signaled = false;
            } finally {
                lock.unlock();
            }
        }
    }
}
