package stablematching;

/**
 * Type tag carried by every protocol message. The verb is what the trace prints
 * between sender and receiver; only the first four show up in the trace at INFO.
 */
public enum MessageType {
	PROPOSAL("proposes to", true),
	ACCEPT("ACCEPTS", true),
	REJECT("REJECTS", true),
	BREAKUP("DUMPS", true),
	ENGAGED_NOTIFY("reports first engagement to", false),
	TERMINATE("sends TERMINATE to", false);

	private final String verb;
	private final boolean traced;

	MessageType(String verb, boolean traced) {
		this.verb = verb;
		this.traced = traced;
	}

	public String verb() {
		return verb;
	}

	/** true for the events that make up the human-readable protocol trace */
	public boolean isTraced() {
		return traced;
	}
}
