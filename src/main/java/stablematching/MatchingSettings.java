package stablematching;

import java.time.Duration;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Typed view of the {@code stable-matching} block of the configuration.
 * Defaults come from reference.conf.
 */
public final class MatchingSettings {
	public static final String ROOT = "stable-matching";

	private final Config config;
	private final Duration runTimeout;
	private final long randomSeed;

	public MatchingSettings(Config config) {
		try {
			this.config = config.getConfig(ROOT);
			this.runTimeout = this.config.getDuration("run-timeout");
			this.randomSeed = this.config.getLong("random-seed");
		} catch (ConfigException e) {
			throw new InvalidConfigurationException("bad " + ROOT + " configuration: " + e.getMessage(), e);
		}
		if (runTimeout.isNegative() || runTimeout.isZero()) {
			throw new InvalidConfigurationException(ROOT + ".run-timeout must be positive, got " + runTimeout);
		}
	}

	/** how long a requester waits for a run to finish */
	public Duration runTimeout() {
		return runTimeout;
	}

	/** seed for shuffled profiles, 0 picks a fresh one every time */
	public long randomSeed() {
		return randomSeed;
	}

	/** the configured preference profile */
	public Preferences preferences() {
		try {
			return Preferences.fromConfig(config.getConfig("preferences"));
		} catch (ConfigException e) {
			throw new InvalidConfigurationException("bad " + ROOT + ".preferences: " + e.getMessage(), e);
		}
	}
}
