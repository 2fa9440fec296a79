package stablematching;

/**
 * A message could not be delivered, or a peer went away before the run finished.
 * The protocol has no retry story so this is fatal to the run.
 */
public class CommunicationFailureException extends StableMatchingException {
	private static final long serialVersionUID = 1L;

	public CommunicationFailureException(String message) {
		super(message);
	}

	public CommunicationFailureException(String message, Throwable cause) {
		super(message, cause);
	}
}
