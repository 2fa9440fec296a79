package stablematching;

import java.io.Serializable;
import java.util.Arrays;

/**
 * One process's ranking of the opposite population, most preferred first.
 * The inverse table (candidate to rank) is built once here so that
 * "do I prefer x over y" is two array lookups.
 */
public final class PreferenceTable implements Serializable {
	private static final long serialVersionUID = 1L;

	private final ProcessAddress owner;
	//ranking[position] = candidate, index 0 being most preferred
	private final int[] ranking;
	//rankOf[candidate] = position in ranking
	private final int[] rankOf;

	/**
	 * @param owner process the ranking belongs to
	 * @param ranking permutation of 0..n-1
	 * @throws InvalidConfigurationException if ranking is empty or not a permutation
	 */
	public PreferenceTable(ProcessAddress owner, int[] ranking) {
		if (ranking == null || ranking.length == 0) {
			throw new InvalidConfigurationException(owner + " has an empty preference list");
		}
		this.owner = owner;
		this.ranking = ranking.clone();
		this.rankOf = new int[ranking.length];
		Arrays.fill(this.rankOf, -1);
		for (int position = 0; position < this.ranking.length; position++) {
			int candidate = this.ranking[position];
			if (candidate < 0 || candidate >= this.ranking.length) {
				throw new InvalidConfigurationException(owner + " ranks unknown candidate " + candidate
						+ " in " + Arrays.toString(ranking));
			}
			if (this.rankOf[candidate] != -1) {
				throw new InvalidConfigurationException(owner + " ranks candidate " + candidate
						+ " twice in " + Arrays.toString(ranking));
			}
			this.rankOf[candidate] = position;
		}
	}

	public ProcessAddress owner() {
		return owner;
	}

	/** size of the opposite population */
	public int size() {
		return ranking.length;
	}

	/** the candidate at the given position, 0 being the most preferred */
	public int candidateAt(int position) {
		return ranking[position];
	}

	/** position of the candidate in this ranking, lower is better */
	public int rankOf(int candidate) {
		return rankOf[candidate];
	}

	/** true if a is strictly preferred over b */
	public boolean prefers(int a, int b) {
		return rankOf[a] < rankOf[b];
	}

	public boolean contains(int candidate) {
		return candidate >= 0 && candidate < ranking.length;
	}

	public int[] toArray() {
		return ranking.clone();
	}

	@Override
	public boolean equals(Object other) {
		if (other == this) return true;
		if (!(other instanceof PreferenceTable)) return false;
		PreferenceTable x = (PreferenceTable) other;
		return owner.equals(x.owner) && Arrays.equals(ranking, x.ranking);
	}

	@Override
	public int hashCode() {
		return owner.hashCode() * 31 + Arrays.hashCode(ranking);
	}

	/*
	 * Prints out the preference list in a slightly more readable manner
	 */
	@Override
	public String toString() {
		Role opposite = owner.role() == Role.PROPOSER ? Role.ACCEPTOR : Role.PROPOSER;
		StringBuilder b = new StringBuilder(owner.toString()).append(" preferenceList: ");
		for (int i = 0; i < ranking.length; i++) {
			if (i > 0) {
				b.append(", ");
			}
			b.append(opposite.label()).append('-').append(ranking[i]);
		}
		return b.toString();
	}
}
