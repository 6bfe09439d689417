package org.edgeweave.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.File;
import java.net.URISyntaxException;
import java.time.Duration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Unit tests for {@link TesterOptions}.
 */
@Tag("unit")
class TesterOptionsTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        ConfigFactory.invalidateCaches();
    }

    @Test
    void defaultsComeFromReferenceConf() {
        TesterOptions options = TesterOptions.defaults();

        assertThat(options.getMainClock()).isEqualTo("clock");
        assertThat(options.getResetPort()).isEqualTo("reset");
        assertThat(options.getDefaultPokePriority()).isZero();
        assertThat(options.getThreadNamePrefix()).isEqualTo("tester-thread");
        assertThat(options.getIdleTimestepLimit()).isEqualTo(10000);
        assertThat(options.getTeardownTimeout()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void partialBlockFallsBackToDefaults() {
        TesterOptions options = TesterOptions.fromConfig(ConfigFactory.parseString(
                "main-clock = sys_clk\ndeadlock.idle-timestep-limit = 4"));

        assertThat(options.getMainClock()).isEqualTo("sys_clk");
        assertThat(options.getIdleTimestepLimit()).isEqualTo(4);
        assertThat(options.getResetPort()).isEqualTo("reset");
    }

    @Test
    void rejectsNegativeIdleLimit() {
        assertThatThrownBy(() -> TesterOptions.fromConfig(
                ConfigFactory.parseString("deadlock.idle-timestep-limit = -1")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("idle-timestep-limit");
    }

    @Test
    void rejectsZeroTeardownTimeout() {
        assertThatThrownBy(() -> TesterOptions.fromConfig(
                ConfigFactory.parseString("teardown.timeout = 0s")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("teardown.timeout");
    }

    @Test
    void rejectsWrongValueType() {
        assertThatThrownBy(() -> TesterOptions.fromConfig(
                ConfigFactory.parseString("default-poke-priority = high")))
            .isInstanceOf(ConfigException.WrongType.class);
    }

    @Test
    void loadsTesterBlockFromFile() throws URISyntaxException {
        File file = new File(getClass().getResource("/org/edgeweave/config/test-config.conf").toURI());

        TesterOptions options = TesterOptions.load(file);

        assertThat(options.getMainClock()).isEqualTo("clk");
        assertThat(options.getResetPort()).isEqualTo("rst");
        assertThat(options.getDefaultPokePriority()).isEqualTo(3);
        assertThat(options.getTeardownTimeout()).isEqualTo(Duration.ofSeconds(5));
    }
}
