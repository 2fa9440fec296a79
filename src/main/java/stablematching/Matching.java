package stablematching;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A perfect one-to-one pairing of n proposers with n acceptors. Only built from
 * partner arrays on which both sides agree, so an instance is always a bijection.
 */
public final class Matching implements Serializable {
	private static final long serialVersionUID = 1L;

	private final int[] acceptorOfProposer;
	private final int[] proposerOfAcceptor;

	private Matching(int[] acceptorOfProposer, int[] proposerOfAcceptor) {
		this.acceptorOfProposer = acceptorOfProposer;
		this.proposerOfAcceptor = proposerOfAcceptor;
	}

	/**
	 * Combines both sides' view of the final partners. Every proposer must have an
	 * acceptor, and every acceptor must name the proposer that names her.
	 *
	 * @param proposerPartners proposerPartners[p] = acceptor proposer p ended with, or -1
	 * @param acceptorPartners acceptorPartners[a] = proposer acceptor a ended with, or -1
	 * @throws ProtocolViolationException if the two views are not the same bijection
	 */
	public static Matching fromPartners(int[] proposerPartners, int[] acceptorPartners) {
		int n = proposerPartners.length;
		if (acceptorPartners.length != n) {
			throw new IllegalArgumentException(n + " proposers but " + acceptorPartners.length + " acceptors");
		}
		for (int p = 0; p < n; p++) {
			int a = proposerPartners[p];
			if (a < 0 || a >= n) {
				throw new ProtocolViolationException(ProcessAddress.proposer(p), "ended without a partner");
			}
			if (acceptorPartners[a] != p) {
				throw new ProtocolViolationException(ProcessAddress.proposer(p), "claims acceptor-" + a
						+ " who claims proposer-" + acceptorPartners[a]);
			}
		}
		//every proposer's acceptor points back at him, so the acceptor side is covered as well
		return new Matching(proposerPartners.clone(), acceptorPartners.clone());
	}

	public int size() {
		return acceptorOfProposer.length;
	}

	public int acceptorOf(int proposer) {
		return acceptorOfProposer[proposer];
	}

	public int proposerOf(int acceptor) {
		return proposerOfAcceptor[acceptor];
	}

	public List<Pair> pairs() {
		List<Pair> pairs = new ArrayList<Pair>();
		for (int p = 0; p < acceptorOfProposer.length; p++) {
			pairs.add(new Pair(p, acceptorOfProposer[p]));
		}
		return pairs;
	}

	/**
	 * Finds every blocking pair: a proposer and an acceptor who are not matched with
	 * each other but both rank the other above their own partner.
	 */
	public List<Pair> blockingPairs(Preferences preferences) {
		if (preferences.size() != size()) {
			throw new IllegalArgumentException("preferences for " + preferences.size()
					+ " but matching of " + size());
		}
		List<Pair> blocking = new ArrayList<Pair>();
		for (int p = 0; p < size(); p++) {
			PreferenceTable mine = preferences.proposer(p);
			//everyone he ranks above his own partner
			for (int position = 0; position < mine.rankOf(acceptorOfProposer[p]); position++) {
				int a = mine.candidateAt(position);
				if (preferences.acceptor(a).prefers(p, proposerOfAcceptor[a])) {
					blocking.add(new Pair(p, a));
				}
			}
		}
		return blocking;
	}

	public boolean isStable(Preferences preferences) {
		return blockingPairs(preferences).isEmpty();
	}

	@Override
	public boolean equals(Object other) {
		if (other == this) return true;
		if (!(other instanceof Matching)) return false;
		return Arrays.equals(acceptorOfProposer, ((Matching) other).acceptorOfProposer);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(acceptorOfProposer);
	}

	@Override
	public String toString() {
		StringBuilder b = new StringBuilder();
		for (Pair pair : pairs()) {
			b.append(pair).append('\n');
		}
		return b.toString();
	}

	/**
	 * One (proposer, acceptor) pair.
	 */
	public static final class Pair implements Serializable {
		private static final long serialVersionUID = 1L;
		public final int proposer;
		public final int acceptor;

		public Pair(int proposer, int acceptor) {
			this.proposer = proposer;
			this.acceptor = acceptor;
		}

		@Override
		public boolean equals(Object other) {
			if (other == this) return true;
			if (!(other instanceof Pair)) return false;
			Pair x = (Pair) other;
			return proposer == x.proposer && acceptor == x.acceptor;
		}

		@Override
		public int hashCode() {
			return proposer * 31 + acceptor;
		}

		@Override
		public String toString() {
			return ProcessAddress.proposer(proposer) + " <-> " + ProcessAddress.acceptor(acceptor);
		}
	}
}
