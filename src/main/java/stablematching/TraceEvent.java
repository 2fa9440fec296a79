package stablematching;

import java.io.Serializable;

/**
 * Published on the actor system's event stream for every protocol message sent,
 * so an observer can follow a run without looking into any process.
 */
public final class TraceEvent implements Serializable {
	private static final long serialVersionUID = 1L;

	public final String run;
	public final MessageType type;
	public final ProcessAddress from;
	public final ProcessAddress to;

	public TraceEvent(String run, MessageType type, ProcessAddress from, ProcessAddress to) {
		this.run = run;
		this.type = type;
		this.from = from;
		this.to = to;
	}

	@Override
	public String toString() {
		return run + ": " + from + " " + type.verb() + " " + to;
	}
}
