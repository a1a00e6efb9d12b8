package org.agenticscript.runtime;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class RuntimeOptionsTest {

    @Test
    void defaultsComeFromReferenceConf() {
        RuntimeOptions options = RuntimeOptions.defaults();

        assertThat(options.defaultAskTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(options.historyLimit()).isEqualTo(1000);
        assertThat(options.processingDelay()).isEqualTo(Duration.ZERO);
        assertThat(options.receivedLimit()).isEqualTo(100);
    }

    @Test
    void partialConfigurationKeepsOtherDefaults() {
        RuntimeOptions options = RuntimeOptions.fromConfig(
                ConfigFactory.parseString("agenticscript.ask.default-timeout = 500ms"));

        assertThat(options.defaultAskTimeout()).isEqualTo(Duration.ofMillis(500));
        assertThat(options.historyLimit()).isEqualTo(1000);
    }

    @Test
    void rejectsNonPositiveLimits() {
        assertThatThrownBy(() -> RuntimeOptions.fromConfig(ConfigFactory.parseString("agenticscript.bus.history-limit = 0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be positive");
    }

    @Test
    void rejectsMalformedValues() {
        assertThatThrownBy(() -> RuntimeOptions.fromConfig(ConfigFactory.parseString("agenticscript.ask.default-timeout = soon")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid agenticscript configuration");
    }

    @Test
    void withersReplaceSingleValues() {
        RuntimeOptions options = RuntimeOptions.defaults()
                .withDefaultAskTimeout(Duration.ofSeconds(1))
                .withProcessingDelay(Duration.ofMillis(10));

        assertThat(options.defaultAskTimeout()).isEqualTo(Duration.ofSeconds(1));
        assertThat(options.processingDelay()).isEqualTo(Duration.ofMillis(10));
        assertThat(options.receivedLimit()).isEqualTo(100);
    }
}
