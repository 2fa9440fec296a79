package stablematching;

/**
 * The three kinds of process taking part in a run.
 */
public enum Role {
	PROPOSER("proposer"),
	ACCEPTOR("acceptor"),
	COORDINATOR("coordinator");

	private final String label;

	Role(String label) {
		this.label = label;
	}

	public String label() {
		return label;
	}
}
