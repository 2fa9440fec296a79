package stablematching;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigList;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;

/**
 * Everything a run starts from: the population size n, one preference table per
 * proposer and one per acceptor. Validated as a whole when built, so a bad profile
 * is rejected before any process exists.
 */
public final class Preferences implements Serializable {
	private static final long serialVersionUID = 1L;

	private final PreferenceTable[] proposers;
	private final PreferenceTable[] acceptors;

	private Preferences(PreferenceTable[] proposers, PreferenceTable[] acceptors) {
		this.proposers = proposers;
		this.acceptors = acceptors;
	}

	/**
	 * @param proposerLists proposerLists[p] ranks the acceptors for proposer p
	 * @param acceptorLists acceptorLists[a] ranks the proposers for acceptor a
	 * @throws InvalidConfigurationException if the shapes disagree or a row is not a permutation
	 */
	public static Preferences of(int[][] proposerLists, int[][] acceptorLists) {
		if (proposerLists == null || acceptorLists == null || proposerLists.length == 0) {
			throw new InvalidConfigurationException("preferences need at least one proposer and one acceptor");
		}
		int n = proposerLists.length;
		if (acceptorLists.length != n) {
			throw new InvalidConfigurationException("expected " + n + " acceptor preference lists but got "
					+ acceptorLists.length);
		}
		PreferenceTable[] proposers = new PreferenceTable[n];
		PreferenceTable[] acceptors = new PreferenceTable[n];
		for (int i = 0; i < n; i++) {
			proposers[i] = table(ProcessAddress.proposer(i), proposerLists[i], n);
			acceptors[i] = table(ProcessAddress.acceptor(i), acceptorLists[i], n);
		}
		return new Preferences(proposers, acceptors);
	}

	private static PreferenceTable table(ProcessAddress owner, int[] list, int n) {
		if (list == null || list.length != n) {
			throw new InvalidConfigurationException(owner + " must rank exactly " + n + " candidates but ranks "
					+ (list == null ? 0 : list.length));
		}
		return new PreferenceTable(owner, list);
	}

	/**
	 * Reads a profile from a config block holding two lists of lists:
	 * {@code proposers} and {@code acceptors}.
	 */
	public static Preferences fromConfig(Config config) {
		try {
			return of(readLists(config, "proposers"), readLists(config, "acceptors"));
		} catch (ConfigException e) {
			throw new InvalidConfigurationException("bad preference configuration: " + e.getMessage(), e);
		}
	}

	private static int[][] readLists(Config config, String path) {
		ConfigList rows = config.getList(path);
		int[][] lists = new int[rows.size()][];
		for (int i = 0; i < rows.size(); i++) {
			ConfigValue row = rows.get(i);
			if (row.valueType() != ConfigValueType.LIST) {
				throw new InvalidConfigurationException(path + "[" + i + "] is not a list");
			}
			ConfigList cells = (ConfigList) row;
			lists[i] = new int[cells.size()];
			for (int j = 0; j < cells.size(); j++) {
				Object cell = cells.get(j).unwrapped();
				if (!(cell instanceof Integer)) {
					throw new InvalidConfigurationException(path + "[" + i + "][" + j + "] is not an integer: " + cell);
				}
				lists[i][j] = (Integer) cell;
			}
		}
		return lists;
	}

	/**
	 * Creates a profile where every process ranks the other side in shuffled order.
	 */
	public static Preferences random(int n, Random random) {
		if (n <= 0) {
			throw new InvalidConfigurationException("population size must be positive, got " + n);
		}
		int[][] proposerLists = new int[n][];
		int[][] acceptorLists = new int[n][];
		for (int i = 0; i < n; i++) {
			proposerLists[i] = shuffled(n, random);
			acceptorLists[i] = shuffled(n, random);
		}
		return of(proposerLists, acceptorLists);
	}

	private static int[] shuffled(int n, Random random) {
		List<Integer> list = new ArrayList<Integer>();
		for (int i = 0; i < n; i++) {
			list.add(i);
		}
		Collections.shuffle(list, random);
		int[] result = new int[n];
		for (int i = 0; i < n; i++) {
			result[i] = list.get(i);
		}
		return result;
	}

	/** population size n, the same on both sides */
	public int size() {
		return proposers.length;
	}

	public PreferenceTable proposer(int id) {
		return proposers[id];
	}

	public PreferenceTable acceptor(int id) {
		return acceptors[id];
	}

	@Override
	public String toString() {
		StringBuilder b = new StringBuilder();
		for (PreferenceTable t : proposers) {
			b.append(t).append('\n');
		}
		for (PreferenceTable t : acceptors) {
			b.append(t).append('\n');
		}
		return b.toString();
	}
}
