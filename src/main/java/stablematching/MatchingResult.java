package stablematching;

import java.io.Serializable;

/**
 * What a successful run hands back: the matching plus the number of PROPOSAL
 * messages it took.
 */
public final class MatchingResult implements Serializable {
	private static final long serialVersionUID = 1L;

	private final String run;
	private final Matching matching;
	private final int proposals;

	public MatchingResult(String run, Matching matching, int proposals) {
		this.run = run;
		this.matching = matching;
		this.proposals = proposals;
	}

	public String run() {
		return run;
	}

	public Matching matching() {
		return matching;
	}

	public int proposals() {
		return proposals;
	}

	@Override
	public String toString() {
		return run + ": " + matching.size() + " pairs after " + proposals + " proposals";
	}
}
