package com.ryuqq.supervisor.adapter.os;

import com.ryuqq.supervisor.core.channel.Channel;
import com.ryuqq.supervisor.core.channel.Sender;
import com.ryuqq.supervisor.core.process.Process;
import com.ryuqq.supervisor.core.runner.Runner;
import com.ryuqq.supervisor.core.signal.Signal;
import com.ryuqq.supervisor.runtime.composer.Composer;
import com.ryuqq.supervisor.testkit.AbstractSupervisionTest;
import com.ryuqq.supervisor.testkit.TestRunner;
import com.ryuqq.supervisor.testkit.TestRunnerException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Launcher 테스트.
 *
 * <p>OS 시그널 도착은 Mockito로 캡처한 sink에 직접 전송해 재현합니다.</p>
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@Timeout(10)
class LauncherTest extends AbstractSupervisionTest {

    @Mock
    private SignalSubscriber subscriber;

    @Mock
    private SignalSubscription subscription;

    @Mock
    private Runner runner;

    @Captor
    private ArgumentCaptor<Sender<Signal>> sinkCaptor;

    @Test
    void 구독한_OS_시그널이_Runner에게_전달됨() throws Exception {
        // given
        List<Signal> signals = List.of(Signal.INT, Signal.ALRM);
        when(subscriber.subscribe(eq(signals), sinkCaptor.capture())).thenReturn(subscription);
        TestRunner testRunner = TestRunner.builder().build();
        Process process = track(Launcher.launch(testRunner, signals, subscriber));
        assertOk(process.ready());

        // when
        sinkCaptor.getValue().trySend(Signal.INT);

        // then
        assertOk(process.waitFor());
        assertThat(testRunner.observedSignals()).containsExactly(Signal.INT);
    }

    @Test
    void close는_Runner를_join한_뒤_구독_해제() {
        // given
        when(subscriber.subscribe(any(), any())).thenReturn(subscription);
        TestRunner testRunner = TestRunner.builder().build();
        Process process = Launcher.launch(testRunner, List.of(Signal.INT), subscriber);
        process.signal(Signal.INT);

        // when
        process.close();

        // then
        assertThat(testRunner.isFinished()).isTrue();
        verify(subscription).close();
    }

    @Test
    void 구독_실패_시_Runner는_시작되지_않음() throws Exception {
        // given
        when(subscriber.subscribe(any(), any()))
            .thenThrow(new IllegalArgumentException("Cannot subscribe to SIGKILL"));

        // when & then
        assertThatThrownBy(() -> Launcher.launch(runner, List.of(Signal.KILL), subscriber))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("SIGKILL");
        verify(runner, never()).setup();
    }

    @Test
    void 인자_검증() {
        assertThatThrownBy(() -> Launcher.launch(null, List.of(), subscriber))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("runner cannot be null");
        assertThatThrownBy(() -> Launcher.launch(runner, null, subscriber))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("signals cannot be null");
        assertThatThrownBy(() -> Launcher.launch(runner, List.of(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("subscriber cannot be null");
    }

    // ============================================================
    // 두 Runner 합성 (rendezvous 보고 채널)
    // ============================================================

    @Test
    void 합성된_Process는_INT에_두_Runner_모두_성공_보고() {
        // given
        when(subscriber.subscribe(any(), any())).thenReturn(subscription);
        Channel<Boolean> reports1 = reportChannel();
        Channel<Boolean> reports2 = reportChannel();
        Composer composer = new Composer(List.of(TestRunner.create(reports1), TestRunner.create(reports2)));
        Process process = track(Launcher.launch(composer, List.of(Signal.INT, Signal.ALRM), subscriber));

        // when
        assertOk(process.ready());
        process.signal(Signal.INT);

        // then
        assertThat(awaitReport(reports1)).isTrue();
        assertThat(awaitReport(reports2)).isTrue();
        assertOk(process.waitFor());
    }

    @Test
    void 합성된_Process는_HUP에_RunnerError() {
        // given
        when(subscriber.subscribe(any(), any())).thenReturn(subscription);
        Channel<Boolean> reports1 = reportChannel();
        Channel<Boolean> reports2 = reportChannel();
        Composer composer = new Composer(List.of(TestRunner.create(reports1), TestRunner.create(reports2)));
        Process process = track(Launcher.launch(composer, List.of(Signal.INT, Signal.HUP), subscriber));

        // when
        assertOk(process.ready());
        process.signal(Signal.HUP);

        // then
        assertThat(awaitReport(reports1)).isFalse();
        assertThat(awaitReport(reports2)).isFalse();
        assertThat(assertRunnerError(process.waitFor())).isInstanceOf(TestRunnerException.class);
    }
}
