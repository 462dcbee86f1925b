package com.ryuqq.supervisor.adapter.os;

import com.ryuqq.supervisor.core.channel.Channel;
import com.ryuqq.supervisor.core.signal.Signal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import sun.misc.SignalHandler;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SunMiscSignalSubscriber 테스트.
 *
 * <p>SIGHUP을 실제로 발생시킵니다. 테스트 동안에는 기록용 핸들러를 먼저 설치해 두므로
 * 구독이 해제된 뒤 도착한 시그널도 JVM을 종료시키지 않습니다.</p>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class SunMiscSignalSubscriberTest {

    private static final sun.misc.Signal HUP = new sun.misc.Signal("HUP");

    private final BlockingQueue<String> fallback = new LinkedBlockingQueue<>();
    private final SunMiscSignalSubscriber subscriber = new SunMiscSignalSubscriber();
    private SignalHandler original;

    @BeforeEach
    void installFallbackHandler() {
        original = sun.misc.Signal.handle(HUP, received -> fallback.add(received.getName()));
    }

    @AfterEach
    void restoreOriginalHandler() {
        sun.misc.Signal.handle(HUP, original);
    }

    @Test
    void 구독한_시그널은_채널로_전달() throws Exception {
        // given
        Channel<Signal> channel = Channel.unbounded();

        try (SignalSubscription subscription = subscriber.subscribe(List.of(Signal.HUP), channel)) {
            // when
            sun.misc.Signal.raise(HUP);

            // then
            assertThat(channel.poll(5, TimeUnit.SECONDS)).contains(Signal.HUP);
            assertThat(subscription.signals()).containsExactly(Signal.HUP);
        }
        assertThat(fallback).isEmpty();
    }

    @Test
    void 구독_해제_시_이전_핸들러_복원() throws Exception {
        // given
        Channel<Signal> channel = Channel.unbounded();
        SignalSubscription subscription = subscriber.subscribe(List.of(Signal.HUP), channel);

        // when
        subscription.close();
        subscription.close();
        sun.misc.Signal.raise(HUP);

        // then
        assertThat(fallback.poll(5, TimeUnit.SECONDS)).isEqualTo("HUP");
        assertThat(channel.tryRecv()).isEmpty();
    }

    @Test
    void VM이_사용하는_시그널은_거부하고_설치한_핸들러_복원() throws Exception {
        // given
        Channel<Signal> channel = Channel.unbounded();

        // when & then
        assertThatThrownBy(() -> subscriber.subscribe(List.of(Signal.HUP, Signal.KILL), channel))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("SIGKILL");

        sun.misc.Signal.raise(HUP);
        assertThat(fallback.poll(5, TimeUnit.SECONDS)).isEqualTo("HUP");
        assertThat(channel.tryRecv()).isEmpty();
    }

    @Test
    void 채널이_닫혀_있으면_시그널은_버려짐() throws Exception {
        // given
        Channel<Signal> channel = Channel.unbounded();
        channel.close();

        try (SignalSubscription subscription = subscriber.subscribe(List.of(Signal.HUP), channel)) {
            // when
            sun.misc.Signal.raise(HUP);
            Thread.sleep(200);

            // then
            assertThat(channel.tryRecv()).isEmpty();
            assertThat(fallback).isEmpty();
        }
    }

    @Test
    void 인자_검증() {
        assertThatThrownBy(() -> subscriber.subscribe(null, Channel.unbounded()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> subscriber.subscribe(List.of(Signal.HUP), null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
