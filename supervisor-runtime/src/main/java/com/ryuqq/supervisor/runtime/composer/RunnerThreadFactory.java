package com.ryuqq.supervisor.runtime.composer;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Composer 실행 스레드 팩토리.
 *
 * <p>Composer는 fan-out 작업을 먼저 제출하고 Runner 작업을 목록 순서대로 제출합니다.
 * 고정 크기 풀은 제출 순서대로 스레드를 하나씩 만들므로, 첫 스레드는
 * {@code <prefix>-fanout}, 이후 스레드는 {@code <prefix>-worker-<i>}가 됩니다.</p>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
final class RunnerThreadFactory implements ThreadFactory {

    private final String prefix;
    private final AtomicInteger created = new AtomicInteger();

    RunnerThreadFactory(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable task) {
        int index = created.getAndIncrement();
        String name = index == 0 ? prefix + "-fanout" : prefix + "-worker-" + (index - 1);
        Thread thread = new Thread(task, name);
        thread.setDaemon(false);
        return thread;
    }
}
