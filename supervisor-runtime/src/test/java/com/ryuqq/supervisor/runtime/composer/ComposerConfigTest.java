package com.ryuqq.supervisor.runtime.composer;

import com.ryuqq.supervisor.core.signal.Signal;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ComposerConfig 테스트.
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
class ComposerConfigTest {

    @Test
    void 기본_설정은_전파하지_않음() {
        ComposerConfig config = new ComposerConfig();

        assertThat(config.errorSignal()).isNull();
        assertThat(config.propagatesErrors()).isFalse();
        assertThat(config.threadNamePrefix()).isEqualTo("composer");
    }

    @Test
    void propagating_팩토리는_errorSignal_설정() {
        ComposerConfig config = ComposerConfig.propagating(Signal.TERM);

        assertThat(config.errorSignal()).isEqualTo(Signal.TERM);
        assertThat(config.propagatesErrors()).isTrue();
    }

    @Test
    void propagating_팩토리에_null_전달_시_예외() {
        assertThatThrownBy(() -> ComposerConfig.propagating(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("errorSignal cannot be null");
    }

    @Test
    void withX_메서드는_해당_값만_변경() {
        // given
        ComposerConfig original = new ComposerConfig();

        // when
        ComposerConfig withSignal = original.withErrorSignal(Signal.USR1);
        ComposerConfig withPrefix = withSignal.withThreadNamePrefix("edge");

        // then
        assertThat(original.errorSignal()).isNull();
        assertThat(withSignal.errorSignal()).isEqualTo(Signal.USR1);
        assertThat(withSignal.threadNamePrefix()).isEqualTo("composer");
        assertThat(withPrefix.errorSignal()).isEqualTo(Signal.USR1);
        assertThat(withPrefix.threadNamePrefix()).isEqualTo("edge");
    }

    @Test
    void threadNamePrefix가_blank면_예외() {
        assertThatThrownBy(() -> new ComposerConfig(null, " "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("threadNamePrefix");
        assertThatThrownBy(() -> new ComposerConfig().withThreadNamePrefix(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
