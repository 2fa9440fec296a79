package stablematching;

/**
 * Thrown when a process sees something the protocol rules out: a proposer running
 * out of candidates, a message it cannot interpret in its current state, a second
 * engagement notification, or final reports that do not agree with each other.
 */
public class ProtocolViolationException extends StableMatchingException {
	private static final long serialVersionUID = 1L;

	private final ProcessAddress process;

	public ProtocolViolationException(ProcessAddress process, String detail) {
		super(process + ": " + detail);
		this.process = process;
	}

	/** the process that detected the violation */
	public ProcessAddress getProcess() {
		return process;
	}
}
