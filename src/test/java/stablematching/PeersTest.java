package stablematching;

import org.junit.*;
import static org.junit.Assert.*;

import akka.actor.ActorRef;
import akka.actor.ActorSystem;
import akka.testkit.javadsl.TestKit;

public class PeersTest {
	private static ActorSystem system;

	private ActorRef[] proposers;
	private ActorRef[] acceptors;
	private ActorRef coordinator;
	private Peers peers;

	@BeforeClass
	public static void startSystem() {
		system = ActorSystem.create("PeersTest");
	}

	@AfterClass
	public static void stopSystem() {
		TestKit.shutdownActorSystem(system);
		system = null;
	}

	@Before
	public void setUp() {
		proposers = new ActorRef[] {new TestKit(system).getRef(), new TestKit(system).getRef()};
		acceptors = new ActorRef[] {new TestKit(system).getRef(), new TestKit(system).getRef()};
		coordinator = new TestKit(system).getRef();
		peers = new Peers("peers-test", proposers, acceptors, coordinator);
	}

	@Test
	public void resolvesEveryProcess() {
		assertEquals(2, peers.size());
		assertEquals("peers-test", peers.run());
		for (int i = 0; i < 2; i++) {
			assertEquals(proposers[i], peers.resolve(ProcessAddress.proposer(i)));
			assertEquals(acceptors[i], peers.resolve(ProcessAddress.acceptor(i)));
		}
		assertEquals(coordinator, peers.resolve(ProcessAddress.COORDINATOR));
	}

	@Test
	public void keepsItsOwnCopyOfTheArrays() {
		proposers[0] = acceptors[0];
		assertNotEquals(acceptors[0], peers.resolve(ProcessAddress.proposer(0)));
	}

	@Test
	public void unknownProposerCannotBeResolved() {
		try {
			peers.resolve(ProcessAddress.proposer(2));
			fail();
		} catch (CommunicationFailureException e) {
			assertTrue(e.getMessage(), e.getMessage().contains("proposer-2"));
		}
	}

	@Test(expected = CommunicationFailureException.class)
	public void negativeAcceptorCannotBeResolved() {
		peers.resolve(ProcessAddress.acceptor(-1));
	}

	@Test(expected = InvalidConfigurationException.class)
	public void populationsMustHaveTheSameSize() {
		new Peers("peers-test", proposers, new ActorRef[] {acceptors[0]}, coordinator);
	}
}
