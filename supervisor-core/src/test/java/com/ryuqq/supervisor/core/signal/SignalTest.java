package com.ryuqq.supervisor.core.signal;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Signal 테스트.
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
class SignalTest {

    @Test
    void osName_ReturnsNameWithoutPrefix() {
        // When & Then
        assertEquals("INT", Signal.INT.osName());
        assertEquals("HUP", Signal.HUP.osName());
    }

    @ParameterizedTest
    @ValueSource(strings = {"INT", "int", "SIGINT", "sigint", " SigInt "})
    void fromOsName_AcceptsPrefixAndAnyCase(String osName) {
        // When
        Signal signal = Signal.fromOsName(osName);

        // Then
        assertEquals(Signal.INT, signal);
    }

    @Test
    void fromOsName_SysWithPrefix_ReturnsSys() {
        // When & Then
        assertEquals(Signal.SYS, Signal.fromOsName("SIGSYS"));
        assertEquals(Signal.SYS, Signal.fromOsName("SYS"));
    }

    @Test
    void fromOsName_UnknownName_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Signal.fromOsName("SIGFOO")
        );
        assertTrue(exception.getMessage().contains("SIGFOO"));
    }

    @Test
    void fromOsName_NullOrBlank_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> Signal.fromOsName(null));
        assertThrows(IllegalArgumentException.class, () -> Signal.fromOsName("  "));
    }

    @Test
    void roundTrip_EverySignal() {
        for (Signal signal : Signal.values()) {
            assertEquals(signal, Signal.fromOsName("SIG" + signal.osName()));
        }
    }
}
