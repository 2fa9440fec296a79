package stablematching;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import org.junit.*;
import static org.junit.Assert.*;

import com.typesafe.config.ConfigFactory;

import akka.actor.ActorIdentity;
import akka.actor.ActorRef;
import akka.actor.ActorSelection;
import akka.actor.ActorSystem;
import akka.actor.Identify;
import akka.actor.PoisonPill;
import akka.testkit.javadsl.TestKit;
import stablematching.Messages.EngagedNotify;

/**
 * Runs that cannot finish: the requester must get the cause and no matching,
 * and the whole run must be stopped.
 */
public class MatchingSessionFailureTest {
	//each test gets a fresh system, so its only run is matching-1
	private static final String RUN = "/user/matching-1";

	private ActorSystem system;

	@Before
	public void startSystem() {
		system = ActorSystem.create("MatchingSessionFailureTest");
	}

	@After
	public void stopSystem() {
		TestKit.shutdownActorSystem(system);
		system = null;
	}

	/*
	 * Every proposer ranks the acceptors the same way, so the run takes
	 * n(n+1)/2 proposals and is still going when the test interferes
	 */
	private static Preferences slowProfile(int n) {
		int[][] same = new int[n][n];
		for (int i = 0; i < n; i++) {
			for (int j = 0; j < n; j++) {
				same[i][j] = j;
			}
		}
		return Preferences.of(same, same);
	}

	/*
	 * Keeps telling the message to the selected process until the run is over,
	 * the process may not exist yet when the first ones go out
	 */
	private static Throwable keepSendingUntilDone(CompletableFuture<MatchingResult> run, ActorSelection target,
			Object message) throws Exception {
		long deadline = System.currentTimeMillis() + 20000;
		while (!run.isDone() && System.currentTimeMillis() < deadline) {
			target.tell(message, ActorRef.noSender());
			Thread.sleep(1);
		}
		try {
			MatchingResult result = run.get();
			fail("run completed with " + result);
			return null;
		} catch (ExecutionException e) {
			return e.getCause();
		}
	}

	private void assertStopped(String path) throws Exception {
		TestKit asker = new TestKit(system);
		long deadline = System.currentTimeMillis() + 5000;
		while (true) {
			system.actorSelection(path).tell(new Identify(path), asker.getRef());
			ActorIdentity identity = asker.expectMsgClass(ActorIdentity.class);
			if (!identity.getActorRef().isPresent()) {
				return;
			}
			assertTrue(path + " still running", System.currentTimeMillis() < deadline);
			Thread.sleep(50);
		}
	}

	@Test
	public void protocolViolationAbortsTheRun() throws Exception {
		StableMatching stableMatching = new StableMatching(system);
		CompletableFuture<MatchingResult> run = stableMatching.solveAsync(slowProfile(200)).toCompletableFuture();

		Throwable cause = keepSendingUntilDone(run, system.actorSelection(RUN + "/proposer-0"), new EngagedNotify(0));

		assertTrue(String.valueOf(cause), cause instanceof ProtocolViolationException);
		assertEquals(ProcessAddress.proposer(0), ((ProtocolViolationException) cause).getProcess());
		assertTrue(cause.getMessage(), cause.getMessage().contains("ENGAGED_NOTIFY"));
		assertStopped(RUN);
		assertStopped(RUN + "/acceptor-0");
	}

	@Test
	public void solveRethrowsTheViolation() throws Exception {
		StableMatching stableMatching = new StableMatching(system);
		//a second thread interferes while solve blocks
		Thread interferer = new Thread(() -> {
			ActorSelection target = system.actorSelection(RUN + "/acceptor-0");
			for (int i = 0; i < 20000; i++) {
				target.tell(new EngagedNotify(1), ActorRef.noSender());
				try {
					Thread.sleep(1);
				} catch (InterruptedException e) {
					return;
				}
			}
		});
		interferer.start();
		try {
			stableMatching.solve(slowProfile(200));
			fail();
		} catch (ProtocolViolationException e) {
			assertEquals(ProcessAddress.acceptor(0), e.getProcess());
		} finally {
			interferer.interrupt();
			interferer.join();
		}
		assertStopped(RUN);
	}

	@Test
	public void processStoppingBeforeItReportsAbortsTheRun() throws Exception {
		StableMatching stableMatching = new StableMatching(system);
		CompletableFuture<MatchingResult> run = stableMatching.solveAsync(slowProfile(200)).toCompletableFuture();

		Throwable cause = keepSendingUntilDone(run, system.actorSelection(RUN + "/proposer-3"),
				PoisonPill.getInstance());

		assertTrue(String.valueOf(cause), cause instanceof CommunicationFailureException);
		assertTrue(cause.getMessage(), cause.getMessage().contains("proposer-3"));
		assertStopped(RUN);
	}

	@Test
	public void timedOutRunIsStopped() throws Exception {
		MatchingSettings settings = new MatchingSettings(ConfigFactory
				.parseString("stable-matching.run-timeout = 1ms")
				.withFallback(ConfigFactory.load()));
		StableMatching stableMatching = new StableMatching(system, settings);
		try {
			stableMatching.solve(slowProfile(200));
			fail();
		} catch (CommunicationFailureException e) {
			assertTrue(e.getMessage(), e.getMessage().contains("no result within"));
		}
		assertStopped(RUN);
	}
}
