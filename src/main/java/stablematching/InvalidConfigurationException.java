package stablematching;

/**
 * Preference data or settings that do not describe a valid run. Raised before
 * any process is created.
 */
public class InvalidConfigurationException extends StableMatchingException {
	private static final long serialVersionUID = 1L;

	public InvalidConfigurationException(String message) {
		super(message);
	}

	public InvalidConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
