package com.ryuqq.supervisor.core.channel;

import java.util.ArrayDeque;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 스레드 간 값 전달 채널.
 *
 * <p>세 가지 용량 모드를 지원합니다:</p>
 * <ul>
 *   <li><strong>bounded:</strong> 고정 크기 버퍼, 가득 차면 send 대기</li>
 *   <li><strong>rendezvous:</strong> 버퍼 없음 (용량 0), 수신 측이 값을 가져갈 때까지 send 대기</li>
 *   <li><strong>unbounded:</strong> send가 대기하지 않음</li>
 * </ul>
 *
 * <p><strong>종료 규칙:</strong></p>
 * <ul>
 *   <li>{@link #close()}는 멱등이며, 이후 send/trySend는 false 반환</li>
 *   <li>bounded/unbounded 채널은 닫힌 후에도 버퍼에 남은 값을 수신 가능</li>
 *   <li>rendezvous 채널은 닫히는 순간 전달 중인 값을 회수하고 송신 측에 false 반환</li>
 *   <li>닫히고 비어 있으면 recv는 {@link Optional#empty()} 반환</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Channel&lt;Signal&gt; signals = Channel.bounded(1024);
 * signals.send(Signal.INT);
 *
 * Optional&lt;Signal&gt; received = signals.recv();
 * signals.close();
 * </pre>
 *
 * @param <T> 값 타입
 * @author Supervisor Team
 * @since 1.0.0
 */
public final class Channel<T> implements Sender<T>, Receiver<T> {

    private static final int RENDEZVOUS = 0;
    private static final int UNBOUNDED = Integer.MAX_VALUE;

    private final int capacity;
    private final ArrayDeque<T> buffer = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private final Set<Select.Watcher> watchers = new CopyOnWriteArraySet<>();

    private boolean closed;
    private int waitingReceivers;
    private long sentCount;
    private long receivedCount;

    private Channel(int capacity) {
        this.capacity = capacity;
    }

    /**
     * 고정 크기 버퍼 채널 생성.
     *
     * @param capacity 버퍼 크기 (1 이상)
     * @param <T> 값 타입
     * @return Channel 인스턴스
     * @throws IllegalArgumentException capacity가 양수가 아닌 경우
     */
    public static <T> Channel<T> bounded(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        return new Channel<>(capacity);
    }

    /**
     * rendezvous 채널 생성 (용량 0).
     *
     * @param <T> 값 타입
     * @return Channel 인스턴스
     */
    public static <T> Channel<T> rendezvous() {
        return new Channel<>(RENDEZVOUS);
    }

    /**
     * 무제한 버퍼 채널 생성.
     *
     * @param <T> 값 타입
     * @return Channel 인스턴스
     */
    public static <T> Channel<T> unbounded() {
        return new Channel<>(UNBOUNDED);
    }

    /**
     * 채널 용량 조회.
     *
     * @return 버퍼 크기 (rendezvous는 0, unbounded는 {@link Integer#MAX_VALUE})
     */
    public int capacity() {
        return capacity;
    }

    @Override
    public boolean send(T value) throws InterruptedException {
        requireValue(value);
        lock.lockInterruptibly();
        try {
            if (capacity == RENDEZVOUS) {
                return handOff(value);
            }
            while (!closed && buffer.size() >= capacity) {
                notFull.await();
            }
            if (closed) {
                return false;
            }
            enqueue(value);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean trySend(T value) {
        requireValue(value);
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            if (capacity == RENDEZVOUS) {
                // 대기 중인 수신자가 있고 전달 중인 값이 없을 때만 즉시 전달
                if (waitingReceivers == 0 || !buffer.isEmpty()) {
                    return false;
                }
                enqueue(value);
                sentCount++;
                return true;
            }
            if (buffer.size() >= capacity) {
                return false;
            }
            enqueue(value);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<T> recv() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            waitingReceivers++;
            try {
                while (buffer.isEmpty() && !closed) {
                    notEmpty.await();
                }
            } finally {
                waitingReceivers--;
            }
            return take();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<T> poll(long timeout, TimeUnit unit) throws InterruptedException {
        if (unit == null) {
            throw new IllegalArgumentException("unit cannot be null");
        }
        long remainingNanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            waitingReceivers++;
            try {
                while (buffer.isEmpty() && !closed) {
                    if (remainingNanos <= 0) {
                        return Optional.empty();
                    }
                    remainingNanos = notEmpty.awaitNanos(remainingNanos);
                }
            } finally {
                waitingReceivers--;
            }
            return take();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<T> tryRecv() {
        lock.lock();
        try {
            return take();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isReady() {
        lock.lock();
        try {
            return !buffer.isEmpty() || closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 채널 종료 (멱등).
     *
     * <p>대기 중인 송신/수신 스레드와 {@link Select} 감시자를 모두 깨웁니다.</p>
     */
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
        wakeWatchers();
    }

    @Override
    public void watch(Select.Watcher watcher) {
        if (watcher == null) {
            throw new IllegalArgumentException("watcher cannot be null");
        }
        watchers.add(watcher);
    }

    @Override
    public void unwatch(Select.Watcher watcher) {
        watchers.remove(watcher);
    }

    /**
     * rendezvous 전달 (lock 보유 상태에서 호출).
     *
     * <p>전달 중인 값은 최대 1개이며, 수신 측이 가져갈 때까지 대기합니다.
     * 대기 중 채널이 닫히거나 인터럽트되면 값을 회수합니다.</p>
     */
    private boolean handOff(T value) throws InterruptedException {
        while (!closed && !buffer.isEmpty()) {
            notFull.await();
        }
        if (closed) {
            return false;
        }
        enqueue(value);
        long ticket = ++sentCount;
        try {
            while (receivedCount < ticket) {
                if (closed) {
                    withdraw(ticket);
                    return false;
                }
                notFull.await();
            }
            return true;
        } catch (InterruptedException e) {
            withdraw(ticket);
            throw e;
        }
    }

    private void withdraw(long ticket) {
        if (receivedCount < ticket) {
            buffer.pollFirst();
            sentCount--;
            notFull.signalAll();
        }
    }

    private void enqueue(T value) {
        buffer.addLast(value);
        notEmpty.signal();
        wakeWatchers();
    }

    private Optional<T> take() {
        T value = buffer.pollFirst();
        if (value == null) {
            return Optional.empty();
        }
        receivedCount++;
        notFull.signalAll();
        return Optional.of(value);
    }

    private void wakeWatchers() {
        for (Select.Watcher watcher : watchers) {
            watcher.wake();
        }
    }

    private static void requireValue(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    @Override
    public String toString() {
        lock.lock();
        try {
            return "Channel{capacity=" + capacity + ", buffered=" + buffer.size() + ", closed=" + closed + '}';
        } finally {
            lock.unlock();
        }
    }
}
