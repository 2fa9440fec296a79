/*
 * Stable Matching - command line
 *
 * Runs one distributed matching and prints it:
 *	no arguments	runs the profile configured under stable-matching.preferences
 *	--random <n>	runs a profile of size n where everyone ranks the other side in shuffled order
 * The protocol trace goes to the log. After the run the matching is printed with each
 * pair's preference lists, then checked for blocking pairs and compared with the
 * sequential Gale-Shapley result, which it must equal.
 */
package stablematching;

import java.util.List;
import java.util.Random;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import akka.actor.ActorSystem;

public class StableMatchingApp {

	public static void main(String[] args) {
		Config config = ConfigFactory.load();
		MatchingSettings settings;
		Preferences preferences;
		try {
			settings = new MatchingSettings(config);
			preferences = readPreferences(args, settings);
		} catch (InvalidConfigurationException e) {
			System.err.println("Invalid configuration: " + e.getMessage());
			System.err.println("usage: StableMatchingApp [--random <n>]");
			System.exit(2);
			return;
		}

		final ActorSystem system = ActorSystem.create("stableMatching", config);
		int exitCode = 0;
		try {
			MatchingResult result = new StableMatching(system, settings).solve(preferences);
			print(result, preferences);
			if (result.matching().isStable(preferences) == false
					|| result.matching().equals(GaleShapley.solve(preferences)) == false) {
				exitCode = 1;
			}
		} catch (StableMatchingException e) {
			System.err.println("Run aborted: " + e.getMessage());
			exitCode = 1;
		} finally {
			//close down the actor system
			system.terminate();
		}
		if (exitCode != 0) {
			System.exit(exitCode);
		}
	}

	static Preferences readPreferences(String[] args, MatchingSettings settings) {
		if (args.length == 0) {
			return settings.preferences();
		}
		if (args.length == 2 && "--random".equals(args[0])) {
			int n;
			try {
				n = Integer.parseInt(args[1]);
			} catch (NumberFormatException e) {
				throw new InvalidConfigurationException("not a population size: " + args[1], e);
			}
			long seed = settings.randomSeed() == 0 ? System.nanoTime() : settings.randomSeed();
			return Preferences.random(n, new Random(seed));
		}
		throw new InvalidConfigurationException("unexpected arguments");
	}

	private static void print(MatchingResult result, Preferences preferences) {
		Matching matching = result.matching();
		System.out.println("----------------------FINAL MATCHING----------------------");
		for (Matching.Pair pair : matching.pairs()) {
			System.out.println(pair);
			System.out.println("\t" + preferences.proposer(pair.proposer));
			System.out.println("\t" + preferences.acceptor(pair.acceptor));
		}
		System.out.println(result);

		System.out.println("----------------CHECK: Blocking Pairs----------------");
		List<Matching.Pair> blocking = matching.blockingPairs(preferences);
		if (blocking.isEmpty()) {
			System.out.println("Stable, no blocking pairs");
		} else {
			System.out.println("UNSTABLE, blocking pairs: " + blocking);
		}

		System.out.println("----------CHECK: Sequential Gale-Shapley----------");
		Matching reference = GaleShapley.solve(preferences);
		if (reference.equals(matching)) {
			System.out.println("Same as the proposer-optimal matching");
		} else {
			System.out.println("DIFFERS from the proposer-optimal matching:");
			System.out.print(reference);
		}
	}
}
