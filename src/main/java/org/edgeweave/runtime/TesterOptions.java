package org.edgeweave.runtime;

import java.io.File;
import java.time.Duration;

import org.edgeweave.config.ConfigLoader;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Settings of a {@link ThreadedTester}, bound from the {@code edgeweave.tester} block.
 * <p>
 * Defaults live in {@code reference.conf}. Use {@link #load(File)} to apply the configuration
 * layers of {@link ConfigLoader}, or {@link #fromConfig(Config)} with a block
 * built in code.
 */
public final class TesterOptions {

    /** Path of the tester block in the application configuration. */
    public static final String CONFIG_PATH = "edgeweave.tester";

    private final String mainClock;
    private final String resetPort;
    private final int defaultPokePriority;
    private final String threadNamePrefix;
    private final int idleTimestepLimit;
    private final Duration teardownTimeout;

    private TesterOptions(Config tester) {
        this.mainClock = tester.getString("main-clock");
        this.resetPort = tester.getString("reset-port");
        this.defaultPokePriority = tester.getInt("default-poke-priority");
        this.threadNamePrefix = tester.getString("thread-name-prefix");
        this.idleTimestepLimit = tester.getInt("deadlock.idle-timestep-limit");
        this.teardownTimeout = tester.getDuration("teardown.timeout");
        if (idleTimestepLimit < 0) {
            throw new IllegalArgumentException("deadlock.idle-timestep-limit must be >= 0, got " + idleTimestepLimit);
        }
        if (teardownTimeout.isNegative() || teardownTimeout.isZero()) {
            throw new IllegalArgumentException("teardown.timeout must be positive, got " + teardownTimeout);
        }
    }

    /**
     * Binds options from a tester block. Missing keys fall back to {@code reference.conf}.
     *
     * @param tester The {@code edgeweave.tester} block.
     * @return The options.
     * @throws com.typesafe.config.ConfigException if a value has the wrong type
     * @throws IllegalArgumentException if a value is out of range
     */
    public static TesterOptions fromConfig(Config tester) {
        Config defaults = ConfigFactory.defaultReference().getConfig(CONFIG_PATH);
        return new TesterOptions(tester.withFallback(defaults));
    }

    /**
     * Returns the options defined in {@code reference.conf}.
     *
     * @return The default options.
     */
    public static TesterOptions defaults() {
        return fromConfig(ConfigFactory.empty());
    }

    /**
     * Loads the application configuration with {@link ConfigLoader#load} and binds the
     * tester block.
     *
     * @param explicitConfigFile A configuration file, or {@code null} for auto-discovery.
     * @return The options.
     */
    public static TesterOptions load(File explicitConfigFile) {
        Config config = ConfigLoader.load(explicitConfigFile);
        return fromConfig(config.getConfig(CONFIG_PATH));
    }

    public String getMainClock() {
        return mainClock;
    }

    public String getResetPort() {
        return resetPort;
    }

    public int getDefaultPokePriority() {
        return defaultPokePriority;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public int getIdleTimestepLimit() {
        return idleTimestepLimit;
    }

    public Duration getTeardownTimeout() {
        return teardownTimeout;
    }
}
