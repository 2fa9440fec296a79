package stablematching;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Sequential deferred acceptance, used as the reference the actor version is compared
 * against. Produces the proposer-optimal stable matching, which is the same whatever
 * order free proposers are taken in.
 */
public final class GaleShapley {

	private GaleShapley() {
	}

	public static Matching solve(Preferences preferences) {
		int n = preferences.size();
		int[] next = new int[n];
		int[] acceptorOf = new int[n];
		int[] proposerOf = new int[n];
		Arrays.fill(acceptorOf, -1);
		Arrays.fill(proposerOf, -1);

		Deque<Integer> free = new ArrayDeque<Integer>();
		for (int p = 0; p < n; p++) {
			free.add(p);
		}
		while (!free.isEmpty()) {
			int p = free.poll();
			int a = preferences.proposer(p).candidateAt(next[p]++);
			int current = proposerOf[a];
			if (current == -1) {
				proposerOf[a] = p;
				acceptorOf[p] = a;
			} else if (preferences.acceptor(a).prefers(p, current)) {
				proposerOf[a] = p;
				acceptorOf[p] = a;
				acceptorOf[current] = -1;
				free.add(current);
			} else {
				free.add(p);
			}
		}
		return Matching.fromPartners(acceptorOf, proposerOf);
	}
}
