package stablematching;

import java.util.Random;

import org.junit.*;
import static org.junit.Assert.*;

public class GaleShapleyTest {

	@Test
	public void twoPairs() {
		Preferences prefs = Preferences.of(new int[][] {{0, 1}, {0, 1}}, new int[][] {{0, 1}, {1, 0}});
		Matching m = GaleShapley.solve(prefs);
		assertEquals(0, m.acceptorOf(0));
		assertEquals(1, m.acceptorOf(1));
	}

	@Test
	public void reversedPreferences() {
		int[][] men = {{0, 1, 2}, {0, 1, 2}, {0, 1, 2}};
		int[][] women = {{2, 1, 0}, {2, 1, 0}, {2, 1, 0}};
		Matching m = GaleShapley.solve(Preferences.of(men, women));
		assertEquals(2, m.acceptorOf(0));
		assertEquals(1, m.acceptorOf(1));
		assertEquals(0, m.acceptorOf(2));
	}

	@Test
	public void singlePair() {
		Matching m = GaleShapley.solve(Preferences.of(new int[][] {{0}}, new int[][] {{0}}));
		assertEquals(0, m.acceptorOf(0));
	}

	@Test
	public void alwaysStable() {
		Random random = new Random(1234);
		for (int i = 0; i < 50; i++) {
			Preferences prefs = Preferences.random(1 + random.nextInt(12), random);
			assertTrue(GaleShapley.solve(prefs).isStable(prefs));
		}
	}
}
