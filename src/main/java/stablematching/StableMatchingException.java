package stablematching;

/**
 * Base class of every failure that aborts a matching run. None of these are
 * recoverable locally, a run that throws one reports no matching at all.
 */
public class StableMatchingException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public StableMatchingException(String message) {
		super(message);
	}

	public StableMatchingException(String message, Throwable cause) {
		super(message, cause);
	}
}
